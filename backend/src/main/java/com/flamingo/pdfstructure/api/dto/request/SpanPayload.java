package com.flamingo.pdfstructure.api.dto.request;

import com.flamingo.pdfstructure.model.BoundingBox;
import com.flamingo.pdfstructure.model.Span;
import com.flamingo.pdfstructure.model.StyleFlags;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One text span as produced by an external extractor. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SpanPayload {

  @NotNull(message = "Text is required")
  private String text;

  /** {@code [x0, y0, x1, y1]} in top-down page coordinates. */
  @NotNull(message = "Bounding box is required")
  @Size(min = 4, max = 4, message = "Bounding box must have four coordinates")
  private List<@NotNull(message = "Coordinates must not be null") Double> bbox;

  private String fontName;
  private double fontSize;
  private boolean bold;
  private boolean italic;
  private boolean monospace;
  private boolean superscript;

  @Min(value = 1, message = "Pages are 1-based")
  private int page;

  @Min(value = 0, message = "Order index must not be negative")
  private int orderIndex;

  public Span toSpan() {
    return new Span(
        text,
        new BoundingBox(bbox.get(0), bbox.get(1), bbox.get(2), bbox.get(3)),
        fontName,
        fontSize,
        new StyleFlags(bold, italic, monospace, superscript),
        page,
        orderIndex);
  }
}
