package com.flamingo.pdfstructure.api.dto.response;

import com.flamingo.pdfstructure.service.StructureResult;
import com.flamingo.pdfstructure.service.diagnostics.DiagnosticEvent;
import com.flamingo.pdfstructure.service.manifest.Manifest;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a structured document. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StructureResponse {

  private Manifest manifest;
  private List<DiagnosticEvent> diagnostics;
  private int frontMatterBlocks;

  public static StructureResponse fromResult(StructureResult result) {
    return StructureResponse.builder()
        .manifest(result.manifest())
        .diagnostics(result.diagnostics())
        .frontMatterBlocks(result.frontMatterBlocks())
        .build();
  }
}
