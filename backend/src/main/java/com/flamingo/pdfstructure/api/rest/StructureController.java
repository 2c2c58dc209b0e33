package com.flamingo.pdfstructure.api.rest;

import com.flamingo.pdfstructure.api.dto.request.FigurePayload;
import com.flamingo.pdfstructure.api.dto.request.FootnotePayload;
import com.flamingo.pdfstructure.api.dto.request.SpanPayload;
import com.flamingo.pdfstructure.api.dto.request.SpanStructureRequest;
import com.flamingo.pdfstructure.api.dto.response.StructureResponse;
import com.flamingo.pdfstructure.exception.DocumentProcessingException;
import com.flamingo.pdfstructure.service.DocumentStructureService;
import com.flamingo.pdfstructure.service.StructureResult;
import jakarta.validation.Valid;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for document structuring. */
@RestController
@RequestMapping("/documents/structure")
@RequiredArgsConstructor
public class StructureController {

  private final DocumentStructureService documentStructureService;

  /** Structures an uploaded PDF. */
  @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<StructureResponse> structurePdf(@RequestParam("file") MultipartFile file) {
    String name = file.getOriginalFilename() != null ? file.getOriginalFilename() : "upload.pdf";
    if (file.isEmpty()) {
      throw new DocumentProcessingException(name, "Uploaded file is empty");
    }
    try (InputStream input = file.getInputStream()) {
      StructureResult result = documentStructureService.convert(input, name);
      return ResponseEntity.ok(StructureResponse.fromResult(result));
    } catch (IOException e) {
      throw new DocumentProcessingException(name, "Failed to read upload: " + e.getMessage(), e);
    }
  }

  /** Structures spans extracted elsewhere. */
  @PostMapping(value = "/spans", consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<StructureResponse> structureSpans(
      @Valid @RequestBody SpanStructureRequest request) {
    StructureResult result =
        documentStructureService.structure(
            request.getSpans().stream().map(SpanPayload::toSpan).toList(),
            orEmpty(request.getFigures()).stream().map(FigurePayload::toFigure).toList(),
            orEmpty(request.getFootnotes()).stream().map(FootnotePayload::toFootnote).toList());
    return ResponseEntity.ok(StructureResponse.fromResult(result));
  }

  private static <T> List<T> orEmpty(List<T> values) {
    return values == null ? List.of() : values;
  }
}
