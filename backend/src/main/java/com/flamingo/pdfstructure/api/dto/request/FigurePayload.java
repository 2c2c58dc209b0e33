package com.flamingo.pdfstructure.api.dto.request;

import com.flamingo.pdfstructure.model.BoundingBox;
import com.flamingo.pdfstructure.model.Figure;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A located image awaiting caption binding. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FigurePayload {

  private String imagePath;
  private String alt;

  @Min(value = 1, message = "Pages are 1-based")
  private int page;

  @NotNull(message = "Bounding box is required")
  @Size(min = 4, max = 4, message = "Bounding box must have four coordinates")
  private List<@NotNull(message = "Coordinates must not be null") Double> bbox;

  public Figure toFigure() {
    return new Figure(
        imagePath,
        null,
        alt,
        page,
        new BoundingBox(bbox.get(0), bbox.get(1), bbox.get(2), bbox.get(3)));
  }
}
