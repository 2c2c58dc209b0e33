package com.flamingo.pdfstructure.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.pdfstructure.SpanFixtures;
import com.flamingo.pdfstructure.config.StructureConfig;
import com.flamingo.pdfstructure.exception.DocumentProcessingException;
import com.flamingo.pdfstructure.exception.NumberingViolationException;
import com.flamingo.pdfstructure.model.BoundingBox;
import com.flamingo.pdfstructure.model.Figure;
import com.flamingo.pdfstructure.model.SectionNode;
import com.flamingo.pdfstructure.model.Span;
import com.flamingo.pdfstructure.service.blocks.BlockAssembler;
import com.flamingo.pdfstructure.service.blocks.ListLevelResolver;
import com.flamingo.pdfstructure.service.blocks.TableConfidenceScorer;
import com.flamingo.pdfstructure.service.diagnostics.DiagnosticCategory;
import com.flamingo.pdfstructure.service.diagnostics.DiagnosticEvent;
import com.flamingo.pdfstructure.service.extraction.PdfBoxFigureExtractor;
import com.flamingo.pdfstructure.service.extraction.PdfBoxSpanExtractor;
import com.flamingo.pdfstructure.service.figures.CaptionBinder;
import com.flamingo.pdfstructure.service.headings.HeadingClassifier;
import com.flamingo.pdfstructure.service.layout.LineMerger;
import com.flamingo.pdfstructure.service.manifest.ManifestExporter;
import com.flamingo.pdfstructure.service.manifest.StructuralHasher;
import com.flamingo.pdfstructure.service.tree.TreeBuilder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.List;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("DocumentStructureService Tests")
class DocumentStructureServiceTest {

  @Mock private PdfBoxSpanExtractor spanExtractor;

  @Mock private PdfBoxFigureExtractor figureExtractor;

  private StructureConfig config;
  private SimpleMeterRegistry meterRegistry;
  private DocumentStructureService service;
  private SpanFixtures spans;

  @BeforeEach
  void setUp() {
    config = new StructureConfig();
    meterRegistry = new SimpleMeterRegistry();
    service =
        new DocumentStructureService(
            new BlockAssembler(
                new LineMerger(config),
                new ListLevelResolver(),
                new TableConfidenceScorer(),
                config),
            new TreeBuilder(new HeadingClassifier()),
            new CaptionBinder(config),
            new ManifestExporter(new StructuralHasher(), config),
            spanExtractor,
            figureExtractor,
            config,
            meterRegistry);
    spans = new SpanFixtures();
  }

  private List<Span> chapterWithSection() {
    return List.of(
        spans.bold("Chapter 1 Introduction", 72, 100),
        spans.text("Some body text here.", 72, 130),
        spans.bold("1.1 Scope", 72, 160),
        spans.text("More words follow.", 72, 190),
        spans.text("Figure 1: Layout", 72, 420));
  }

  private List<Span> duplicateChapters() {
    return List.of(
        spans.bold("Chapter 1 Intro", 72, 100),
        spans.text("First body.", 72, 130),
        spans.bold("Chapter 1 Again", 72, 160),
        spans.text("Second body.", 72, 190));
  }

  private static Figure layoutFigure() {
    return new Figure("page-1/im0-0", null, null, 1, new BoundingBox(72, 250, 300, 400));
  }

  private double documentCount(String outcome) {
    return meterRegistry.get("structure_documents_total").tag("outcome", outcome).counter().count();
  }

  @Nested
  @DisplayName("Structuring spans")
  class Structure {

    @Test
    @DisplayName("should build the tree, bind captions and export a manifest")
    void shouldStructureDocument() {
      StructureResult result = service.structure(chapterWithSection(), List.of(layoutFigure()));

      List<SectionNode> sections = result.tree().preOrder();
      assertThat(sections)
          .extracting(SectionNode::slug)
          .containsExactly("00-chapter-1-introduction", "01-1-1-scope");
      assertThat(sections.get(0).children()).containsExactly(sections.get(1));
      assertThat(result.figures()).hasSize(1);
      assertThat(result.figures().get(0).caption()).isEqualTo("Figure 1: Layout");
      assertThat(result.manifest().sections()).hasSize(2);
      assertThat(result.manifest().structuralHash()).startsWith("sha256:");
      assertThat(result.diagnostics()).isEmpty();
      assertThat(documentCount("success")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should not carry slug or numbering state between documents")
    void shouldUseFreshStatePerDocument() {
      StructureResult first = service.structure(chapterWithSection(), List.of());
      StructureResult second = service.structure(chapterWithSection(), List.of());

      assertThat(second.tree().preOrder())
          .extracting(SectionNode::slug)
          .containsExactlyElementsOf(
              first.tree().preOrder().stream().map(SectionNode::slug).toList());
      assertThat(second.manifest().structuralHash())
          .isEqualTo(first.manifest().structuralHash());
    }

    @Test
    @DisplayName("should return an empty tree for no spans")
    void shouldReturnEmptyTree_whenNoSpans() {
      StructureResult result = service.structure(List.of(), List.of());

      assertThat(result.tree().isEmpty()).isTrue();
      assertThat(result.manifest().sections()).isEmpty();
      assertThat(result.frontMatterBlocks()).isZero();
    }

    @Test
    @DisplayName("should report numbering anomalies as diagnostics")
    void shouldReportDiagnostics() {
      StructureResult result = service.structure(duplicateChapters(), List.of());

      assertThat(result.diagnostics())
          .extracting(DiagnosticEvent::category)
          .containsExactly(
              DiagnosticCategory.DUPLICATE_CHAPTER_NUMBER, DiagnosticCategory.CHAPTER_NUMBER_RESET);
      assertThat(
              meterRegistry
                  .get("structure_diagnostics_total")
                  .tag("category", "DUPLICATE_CHAPTER_NUMBER")
                  .counter()
                  .count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should report oversized heading numbers instead of failing")
    void shouldReportOversizedNumbers() {
      List<Span> input =
          List.of(
              spans.bold("Chapter 99999999999 Finale", 72, 100),
              spans.text("Closing words.", 72, 130));

      StructureResult result = service.structure(input, List.of());

      assertThat(result.tree().size()).isEqualTo(1);
      assertThat(result.diagnostics())
          .extracting(DiagnosticEvent::category)
          .containsExactly(DiagnosticCategory.NUMBER_OUT_OF_RANGE);
      assertThat(documentCount("success")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should fail when a strict category is violated")
    void shouldFail_whenStrictCategoryViolated() {
      config.getNumbering().setStrictCategories(
          EnumSet.of(DiagnosticCategory.DUPLICATE_CHAPTER_NUMBER));

      assertThatThrownBy(() -> service.structure(duplicateChapters(), List.of()))
          .isInstanceOfSatisfying(
              NumberingViolationException.class,
              e ->
                  assertThat(e.getViolations())
                      .extracting(DiagnosticEvent::category)
                      .containsExactly(DiagnosticCategory.DUPLICATE_CHAPTER_NUMBER));
      assertThat(documentCount("failed")).isEqualTo(1.0);
    }
  }

  @Nested
  @DisplayName("Converting PDFs")
  class Convert {

    @Test
    @DisplayName("should extract content from a readable PDF")
    void shouldConvertPdf() throws Exception {
      when(spanExtractor.extract(any(PDDocument.class))).thenReturn(chapterWithSection());
      when(figureExtractor.extract(any(PDDocument.class))).thenReturn(List.of(layoutFigure()));

      StructureResult result = service.convert(new ByteArrayInputStream(blankPdf()), "doc.pdf");

      assertThat(result.tree().size()).isEqualTo(2);
      assertThat(result.figures()).hasSize(1);
    }

    @Test
    @DisplayName("should time the structuring step of a PDF conversion")
    void shouldRecordStructureTimer_whenConvertingPdf() throws Exception {
      when(spanExtractor.extract(any(PDDocument.class))).thenReturn(chapterWithSection());
      when(figureExtractor.extract(any(PDDocument.class))).thenReturn(List.of());

      service.convert(new ByteArrayInputStream(blankPdf()), "doc.pdf");

      assertThat(meterRegistry.get("structure.convert").timer().count()).isEqualTo(1L);
    }

    @Test
    @DisplayName("should reject bytes that are not a PDF")
    void shouldThrow_whenPdfUnreadable() {
      byte[] garbage = "not a pdf".getBytes(StandardCharsets.UTF_8);

      assertThatThrownBy(() -> service.convert(new ByteArrayInputStream(garbage), "bad.pdf"))
          .isInstanceOfSatisfying(
              DocumentProcessingException.class,
              e -> assertThat(e.getDocumentName()).isEqualTo("bad.pdf"));
      assertThat(documentCount("unreadable")).isEqualTo(1.0);
      verifyNoInteractions(spanExtractor, figureExtractor);
    }

    private byte[] blankPdf() throws Exception {
      try (PDDocument document = new PDDocument();
          ByteArrayOutputStream out = new ByteArrayOutputStream()) {
        document.addPage(new PDPage());
        document.save(out);
        return out.toByteArray();
      }
    }
  }
}
