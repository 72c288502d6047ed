package com.flamingo.ai.lifedigest.service.vision;

import java.util.List;

/**
 * Axis-aligned box in {@code [x1, y1, x2, y2]} form, either normalized to {@code [0, 1]} or in
 * pixels depending on where it came from.
 */
public record BoundingBox(double x1, double y1, double x2, double y2) {

  /**
   * Parses a four-element coordinate list.
   *
   * @return the box, or {@code null} when the list is missing or malformed
   */
  public static BoundingBox fromList(List<? extends Number> coordinates) {
    if (coordinates == null || coordinates.size() != 4) {
      return null;
    }
    for (Number n : coordinates) {
      if (n == null) {
        return null;
      }
    }
    return new BoundingBox(
        coordinates.get(0).doubleValue(),
        coordinates.get(1).doubleValue(),
        coordinates.get(2).doubleValue(),
        coordinates.get(3).doubleValue());
  }

  public List<Double> toList() {
    return List.of(x1, y1, x2, y2);
  }

  public double area() {
    return Math.max(0, x2 - x1) * Math.max(0, y2 - y1);
  }

  /** Scales a normalized box to pixel space. */
  public BoundingBox denormalize(int imageWidth, int imageHeight) {
    return new BoundingBox(x1 * imageWidth, y1 * imageHeight, x2 * imageWidth, y2 * imageHeight);
  }

  /**
   * Intersection over union of two boxes in the same coordinate space.
   *
   * @return a value in {@code [0, 1]}; 0 for disjoint boxes or a zero union
   */
  public static double iou(BoundingBox a, BoundingBox b) {
    double ix1 = Math.max(a.x1, b.x1);
    double iy1 = Math.max(a.y1, b.y1);
    double ix2 = Math.min(a.x2, b.x2);
    double iy2 = Math.min(a.y2, b.y2);

    if (ix1 >= ix2 || iy1 >= iy2) {
      return 0.0;
    }

    double intersection = (ix2 - ix1) * (iy2 - iy1);
    double union = a.area() + b.area() - intersection;
    if (union <= 0) {
      return 0.0;
    }
    return Math.min(1.0, intersection / union);
  }
}
