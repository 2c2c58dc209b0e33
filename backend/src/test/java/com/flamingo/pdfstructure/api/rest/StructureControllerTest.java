package com.flamingo.pdfstructure.api.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.pdfstructure.api.dto.request.SpanPayload;
import com.flamingo.pdfstructure.api.dto.request.SpanStructureRequest;
import com.flamingo.pdfstructure.exception.ApiError;
import com.flamingo.pdfstructure.exception.DocumentProcessingException;
import com.flamingo.pdfstructure.exception.GlobalExceptionHandler;
import com.flamingo.pdfstructure.exception.NumberingViolationException;
import com.flamingo.pdfstructure.model.SectionTree;
import com.flamingo.pdfstructure.service.DocumentStructureService;
import com.flamingo.pdfstructure.service.StructureResult;
import com.flamingo.pdfstructure.service.diagnostics.DiagnosticCategory;
import com.flamingo.pdfstructure.service.diagnostics.DiagnosticEvent;
import com.flamingo.pdfstructure.service.manifest.Manifest;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("StructureController Tests")
class StructureControllerTest {

  private MockMvc mockMvc;
  private ObjectMapper objectMapper;
  private MeterRegistry meterRegistry;

  @Mock private DocumentStructureService documentStructureService;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    mockMvc =
        MockMvcBuilders.standaloneSetup(new StructureController(documentStructureService))
            .setControllerAdvice(new GlobalExceptionHandler(meterRegistry))
            .build();
    objectMapper = new ObjectMapper();
  }

  private static StructureResult emptyResult() {
    Manifest manifest =
        new Manifest(
            Manifest.SCHEMA_VERSION,
            List.of(),
            List.of(),
            List.of(),
            List.of(),
            List.of(),
            "sha256:abc",
            new Manifest.GeneratedWith("pdf-structure", "0.1.0"));
    return new StructureResult(SectionTree.EMPTY, List.of(), manifest, List.of(), 0);
  }

  private static SpanPayload span(String text) {
    return SpanPayload.builder()
        .text(text)
        .bbox(List.of(72.0, 100.0, 200.0, 110.0))
        .fontName("Helvetica-Bold")
        .fontSize(12)
        .bold(true)
        .page(1)
        .orderIndex(0)
        .build();
  }

  @Test
  @DisplayName("should structure posted spans")
  void shouldStructureSpans() throws Exception {
    when(documentStructureService.structure(anyList(), anyList(), anyList()))
        .thenReturn(emptyResult());
    SpanStructureRequest request =
        SpanStructureRequest.builder().spans(List.of(span("Chapter 1 Intro"))).build();

    mockMvc
        .perform(
            post("/documents/structure/spans")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.manifest.schema_version").value("1.0.0"))
        .andExpect(jsonPath("$.manifest.structural_hash").value("sha256:abc"))
        .andExpect(jsonPath("$.manifest.generated_with.tool").value("pdf-structure"))
        .andExpect(jsonPath("$.frontMatterBlocks").value(0));

    verify(documentStructureService).structure(anyList(), eq(List.of()), eq(List.of()));
  }

  @Test
  @DisplayName("should reject a request without spans")
  void shouldRejectMissingSpans() throws Exception {
    mockMvc
        .perform(
            post("/documents/structure/spans")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"figures\":[]}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value(ApiError.VALIDATION_ERROR))
        .andExpect(jsonPath("$.message").value("spans: Spans are required"));

    verifyNoInteractions(documentStructureService);
  }

  @Test
  @DisplayName("should reject a span with a malformed bounding box")
  void shouldRejectMalformedBbox() throws Exception {
    SpanPayload bad = span("text");
    bad.setBbox(List.of(1.0, 2.0));
    SpanStructureRequest request = SpanStructureRequest.builder().spans(List.of(bad)).build();

    mockMvc
        .perform(
            post("/documents/structure/spans")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value(ApiError.VALIDATION_ERROR));
  }

  @Test
  @DisplayName("should reject a bounding box with a null coordinate")
  void shouldRejectNullCoordinate() throws Exception {
    String body =
        "{\"spans\":[{\"text\":\"Intro\",\"bbox\":[72.0,null,200.0,110.0],"
            + "\"fontSize\":10,\"page\":1,\"orderIndex\":0}]}";

    mockMvc
        .perform(
            post("/documents/structure/spans").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value(ApiError.VALIDATION_ERROR))
        .andExpect(jsonPath("$.message").value(containsString("Coordinates must not be null")));

    verifyNoInteractions(documentStructureService);
  }

  @Test
  @DisplayName("should map strict numbering violations to 422 with details")
  void shouldMapNumberingViolation() throws Exception {
    DiagnosticEvent event =
        new DiagnosticEvent(
            DiagnosticCategory.DUPLICATE_CHAPTER_NUMBER,
            "Chapter number 1 appears more than once",
            Map.of("explicit_number", 1));
    when(documentStructureService.structure(anyList(), anyList(), anyList()))
        .thenThrow(new NumberingViolationException(List.of(event)));
    SpanStructureRequest request =
        SpanStructureRequest.builder().spans(List.of(span("Chapter 1 Intro"))).build();

    mockMvc
        .perform(
            post("/documents/structure/spans")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.code").value(ApiError.NUMBERING_VIOLATION))
        .andExpect(jsonPath("$.reason").value("numbering_strict_violation"))
        .andExpect(
            jsonPath("$.details[0]")
                .value("DUPLICATE_CHAPTER_NUMBER: Chapter number 1 appears more than once"));

    assertThat(
            meterRegistry
                .get("api_errors_total")
                .tag("error_type", "numbering_violation")
                .counter()
                .count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("should structure an uploaded PDF")
  void shouldStructureUploadedPdf() throws Exception {
    when(documentStructureService.convert(any(InputStream.class), eq("paper.pdf")))
        .thenReturn(emptyResult());
    MockMultipartFile file =
        new MockMultipartFile(
            "file", "paper.pdf", MediaType.APPLICATION_PDF_VALUE, new byte[] {'%', 'P', 'D', 'F'});

    mockMvc
        .perform(multipart("/documents/structure").file(file))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.manifest.sections").isEmpty());
  }

  @Test
  @DisplayName("should reject an empty upload")
  void shouldRejectEmptyUpload() throws Exception {
    MockMultipartFile file =
        new MockMultipartFile("file", "empty.pdf", MediaType.APPLICATION_PDF_VALUE, new byte[0]);

    mockMvc
        .perform(multipart("/documents/structure").file(file))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.code").value(ApiError.DOCUMENT_UNREADABLE));

    verifyNoInteractions(documentStructureService);
  }

  @Test
  @DisplayName("should report unreadable PDFs")
  void shouldReportUnreadablePdf() throws Exception {
    when(documentStructureService.convert(any(InputStream.class), eq("broken.pdf")))
        .thenThrow(new DocumentProcessingException("broken.pdf", "Failed to read PDF"));
    MockMultipartFile file =
        new MockMultipartFile(
            "file", "broken.pdf", MediaType.APPLICATION_PDF_VALUE, new byte[] {1});

    mockMvc
        .perform(multipart("/documents/structure").file(file))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.code").value(ApiError.DOCUMENT_UNREADABLE))
        .andExpect(jsonPath("$.reason").value("pdf_unreadable"));
  }
}
