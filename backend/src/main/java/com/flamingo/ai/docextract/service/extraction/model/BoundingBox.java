package com.flamingo.ai.docextract.service.extraction.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;

/** Block rectangle in page-pixel space, serialized as {@code [x, y, width, height]}. */
public record BoundingBox(double x, double y, double width, double height) {

  /** Placeholder for synthetic whole-page blocks. */
  public static final BoundingBox EMPTY = new BoundingBox(0, 0, 0, 0);

  /** Converts corner coordinates {@code [x1, y1, x2, y2]}. */
  public static BoundingBox fromCorners(double x1, double y1, double x2, double y2) {
    return new BoundingBox(x1, y1, x2 - x1, y2 - y1);
  }

  /** A box with no area cannot be cropped and is never sent for region refinement. */
  public boolean isValidRegion() {
    return width > 0 && height > 0;
  }

  @JsonValue
  public List<Double> toList() {
    return List.of(x, y, width, height);
  }
}
