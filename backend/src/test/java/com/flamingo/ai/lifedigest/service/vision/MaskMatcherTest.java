package com.flamingo.ai.lifedigest.service.vision;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("MaskMatcher Tests")
class MaskMatcherTest {

  private MaskMatcher maskMatcher;

  @BeforeEach
  void setUp() {
    maskMatcher = new MaskMatcher();
  }

  @Nested
  @DisplayName("iou")
  class IouTests {

    @Test
    @DisplayName("should be 1 for identical boxes and 0 for disjoint boxes")
    void shouldHandleIdenticalAndDisjoint() {
      BoundingBox box = new BoundingBox(0, 0, 10, 10);

      assertThat(BoundingBox.iou(box, box)).isEqualTo(1.0);
      assertThat(BoundingBox.iou(box, new BoundingBox(20, 20, 30, 30))).isZero();
      assertThat(BoundingBox.iou(box, new BoundingBox(10, 0, 20, 10))).isZero();
    }

    @Test
    @DisplayName("should compute partial overlap")
    void shouldComputePartialOverlap() {
      double iou =
          BoundingBox.iou(new BoundingBox(0, 0, 50, 50), new BoundingBox(10, 10, 60, 60));

      assertThat(iou).isCloseTo(1600.0 / 3400.0, within(1e-9));
    }

    @Test
    @DisplayName("should reject malformed coordinate lists")
    void shouldRejectMalformedLists() {
      assertThat(BoundingBox.fromList(null)).isNull();
      assertThat(BoundingBox.fromList(List.of(1.0, 2.0, 3.0))).isNull();
      assertThat(BoundingBox.fromList(Arrays.asList(1.0, null, 3.0, 4.0))).isNull();
      assertThat(BoundingBox.fromList(List.of(1, 2, 3, 4)))
          .isEqualTo(new BoundingBox(1, 2, 3, 4));
    }
  }

  @Nested
  @DisplayName("matchObjectsToMasks")
  class MatchTests {

    // on a 100x100 image: A = [0,0,50,50], B = [0,0,55,55]
    private final BoundingBox objectA = new BoundingBox(0, 0, 0.5, 0.5);
    private final BoundingBox objectB = new BoundingBox(0, 0, 0.55, 0.55);
    private final BoundingBox mask1 = new BoundingBox(0, 0, 50, 50);
    private final BoundingBox mask2 = new BoundingBox(10, 10, 60, 60);

    @Test
    @DisplayName("should give the contested mask to the best pair and the next best to the other")
    void shouldAssignGreedilyByIou() {
      List<MatchedMask> matches =
          maskMatcher.matchObjectsToMasks(
              List.of(objectA, objectB), List.of(mask1, mask2), 100, 100, 0.3);

      assertThat(matches).hasSize(2);
      assertThat(matches.get(0).objectIndex()).isZero();
      assertThat(matches.get(0).maskIndex()).isZero();
      assertThat(matches.get(0).iou()).isCloseTo(1.0, within(1e-9));
      assertThat(matches.get(1).objectIndex()).isEqualTo(1);
      assertThat(matches.get(1).maskIndex()).isEqualTo(1);
      assertThat(matches.get(1).iou()).isCloseTo(2025.0 / 3500.0, within(1e-9));
    }

    @Test
    @DisplayName("should leave an object unmatched when its only remaining pair is below threshold")
    void shouldLeaveUnmatched_whenBelowThreshold() {
      List<MatchedMask> matches =
          maskMatcher.matchObjectsToMasks(
              List.of(objectA, objectB), List.of(mask1, mask2), 100, 100, 0.6);

      assertThat(matches).containsExactly(new MatchedMask(0, 0, 1.0));
    }

    @Test
    @DisplayName("should break ties by object index")
    void shouldBreakTiesByObjectIndex() {
      List<MatchedMask> matches =
          maskMatcher.matchObjectsToMasks(
              List.of(objectA, objectA), List.of(mask1), 100, 100, 0.3);

      assertThat(matches).containsExactly(new MatchedMask(0, 0, 1.0));
    }

    @Test
    @DisplayName("should skip missing boxes on either side")
    void shouldSkipNullBoxes() {
      List<MatchedMask> matches =
          maskMatcher.matchObjectsToMasks(
              Arrays.asList(null, objectA), Arrays.asList(null, mask1), 100, 100);

      assertThat(matches).containsExactly(new MatchedMask(1, 1, 1.0));
    }

    @Test
    @DisplayName("should return nothing when either side is empty")
    void shouldReturnEmpty_whenNoCandidates() {
      assertThat(maskMatcher.matchObjectsToMasks(List.of(), List.of(mask1), 100, 100)).isEmpty();
      assertThat(maskMatcher.matchObjectsToMasks(List.of(objectA), List.of(), 100, 100)).isEmpty();
    }
  }
}
