package com.flamingo.pdfstructure.model;

import java.util.List;

/**
 * Axis-aligned rectangle in page coordinates.
 *
 * <p>Coordinates are top-down: {@code y0} is the top edge and {@code y1} the bottom edge, so a
 * larger {@code y} is lower on the page.
 *
 * @param x0 left edge
 * @param y0 top edge
 * @param x1 right edge
 * @param y1 bottom edge
 */
public record BoundingBox(double x0, double y0, double x1, double y1) {

  public static final BoundingBox EMPTY = new BoundingBox(0, 0, 0, 0);

  public double width() {
    return x1 - x0;
  }

  public double height() {
    return y1 - y0;
  }

  public double centerY() {
    return (y0 + y1) / 2.0;
  }

  /** Smallest box covering both this box and {@code other}. */
  public BoundingBox union(BoundingBox other) {
    return new BoundingBox(
        Math.min(x0, other.x0),
        Math.min(y0, other.y0),
        Math.max(x1, other.x1),
        Math.max(y1, other.y1));
  }

  /**
   * Euclidean distance between the closest edges of the two boxes; overlapping boxes are at
   * distance zero.
   */
  public double distanceTo(BoundingBox other) {
    double dx = Math.max(0, Math.max(other.x0 - x1, x0 - other.x1));
    double dy = Math.max(0, Math.max(other.y0 - y1, y0 - other.y1));
    return Math.sqrt(dx * dx + dy * dy);
  }

  public List<Double> toList() {
    return List.of(x0, y0, x1, y1);
  }

  public static BoundingBox covering(List<Span> spans) {
    if (spans.isEmpty()) {
      return EMPTY;
    }
    BoundingBox box = spans.get(0).bbox();
    for (int i = 1; i < spans.size(); i++) {
      box = box.union(spans.get(i).bbox());
    }
    return box;
  }
}
