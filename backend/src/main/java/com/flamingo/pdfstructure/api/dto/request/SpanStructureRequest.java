package com.flamingo.pdfstructure.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for structuring pre-extracted spans. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SpanStructureRequest {

  @NotNull(message = "Spans are required")
  @Valid
  private List<SpanPayload> spans;

  @Valid @Builder.Default private List<FigurePayload> figures = new ArrayList<>();

  @Valid @Builder.Default private List<FootnotePayload> footnotes = new ArrayList<>();
}
