package com.flamingo.ai.lifedigest.service.vision;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Greedy one-to-one matching of detected-object boxes to segmentation masks by IoU.
 *
 * <p>All (object, mask) pairs at or above the threshold are sorted by IoU descending and assigned
 * greedily, so each object gets at most one mask and each mask at most one object. Ties are broken
 * by object index, then mask index, which keeps the output deterministic.
 */
@Component
@Slf4j
public class MaskMatcher {

  public static final double DEFAULT_MIN_IOU = 0.3;

  /**
   * Matches objects to masks.
   *
   * @param objectBoxes normalized {@code [0, 1]} object boxes; {@code null} entries never match
   * @param maskBoxes pixel-space mask boxes; {@code null} entries never match
   * @param imageWidth image width in pixels
   * @param imageHeight image height in pixels
   * @param minIou minimum IoU for a pair to be considered
   * @return assignments ordered by IoU descending
   */
  public List<MatchedMask> matchObjectsToMasks(
      List<BoundingBox> objectBoxes,
      List<BoundingBox> maskBoxes,
      int imageWidth,
      int imageHeight,
      double minIou) {
    if (objectBoxes.isEmpty() || maskBoxes.isEmpty()) {
      return List.of();
    }

    List<MatchedMask> candidates = new ArrayList<>();
    for (int i = 0; i < objectBoxes.size(); i++) {
      BoundingBox normalized = objectBoxes.get(i);
      if (normalized == null) {
        continue;
      }
      BoundingBox objectBox = normalized.denormalize(imageWidth, imageHeight);
      for (int j = 0; j < maskBoxes.size(); j++) {
        BoundingBox maskBox = maskBoxes.get(j);
        if (maskBox == null) {
          continue;
        }
        double iou = BoundingBox.iou(objectBox, maskBox);
        if (iou >= minIou) {
          candidates.add(new MatchedMask(i, j, iou));
        }
      }
    }

    candidates.sort(
        Comparator.comparingDouble(MatchedMask::iou)
            .reversed()
            .thenComparingInt(MatchedMask::objectIndex)
            .thenComparingInt(MatchedMask::maskIndex));

    boolean[] objectUsed = new boolean[objectBoxes.size()];
    boolean[] maskUsed = new boolean[maskBoxes.size()];
    List<MatchedMask> matches = new ArrayList<>();
    for (MatchedMask candidate : candidates) {
      if (objectUsed[candidate.objectIndex()] || maskUsed[candidate.maskIndex()]) {
        continue;
      }
      objectUsed[candidate.objectIndex()] = true;
      maskUsed[candidate.maskIndex()] = true;
      matches.add(candidate);
    }

    log.debug(
        "Matched {} of {} objects to {} masks (minIou={})",
        matches.size(),
        objectBoxes.size(),
        maskBoxes.size(),
        minIou);
    return matches;
  }

  public List<MatchedMask> matchObjectsToMasks(
      List<BoundingBox> objectBoxes, List<BoundingBox> maskBoxes, int imageWidth, int imageHeight) {
    return matchObjectsToMasks(objectBoxes, maskBoxes, imageWidth, imageHeight, DEFAULT_MIN_IOU);
  }
}
