package com.flamingo.pdfstructure.api.dto.request;

import com.flamingo.pdfstructure.model.Footnote;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A footnote body found by an external extractor. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FootnotePayload {

  @NotBlank(message = "Marker is required")
  private String marker;

  private String text;

  @Min(value = 1, message = "Pages are 1-based")
  private int page;

  public Footnote toFootnote() {
    return new Footnote(marker, text == null ? "" : text, page);
  }
}
