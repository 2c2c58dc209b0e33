package com.flamingo.pdfstructure.service;

import com.flamingo.pdfstructure.config.StructureConfig;
import com.flamingo.pdfstructure.exception.DocumentProcessingException;
import com.flamingo.pdfstructure.exception.StructureException;
import com.flamingo.pdfstructure.model.Block;
import com.flamingo.pdfstructure.model.BoundFigure;
import com.flamingo.pdfstructure.model.Figure;
import com.flamingo.pdfstructure.model.Footnote;
import com.flamingo.pdfstructure.model.SectionTree;
import com.flamingo.pdfstructure.model.Span;
import com.flamingo.pdfstructure.service.blocks.BlockAssembler;
import com.flamingo.pdfstructure.service.diagnostics.DiagnosticEvent;
import com.flamingo.pdfstructure.service.diagnostics.Diagnostics;
import com.flamingo.pdfstructure.service.extraction.PdfBoxFigureExtractor;
import com.flamingo.pdfstructure.service.extraction.PdfBoxSpanExtractor;
import com.flamingo.pdfstructure.service.figures.CaptionBinder;
import com.flamingo.pdfstructure.service.manifest.Manifest;
import com.flamingo.pdfstructure.service.manifest.ManifestExporter;
import com.flamingo.pdfstructure.service.tree.TreeBuilder;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.springframework.stereotype.Service;

/**
 * Runs the structural pipeline for one document: spans to blocks, blocks to a numbered and slugged
 * section tree, figures to captions, and everything into a manifest.
 *
 * <p>Each call gets a fresh {@link StructureContext}, so conversions never share numbering or slug
 * state. Numbering anomalies are returned as diagnostics unless their category is configured as
 * strict, in which case the conversion fails with {@code NumberingViolationException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentStructureService {

  /** Covers every structuring run, including the one inside {@link #convert}. */
  static final String STRUCTURE_TIMER = "structure.convert";

  private final BlockAssembler blockAssembler;
  private final TreeBuilder treeBuilder;
  private final CaptionBinder captionBinder;
  private final ManifestExporter manifestExporter;
  private final PdfBoxSpanExtractor spanExtractor;
  private final PdfBoxFigureExtractor figureExtractor;
  private final StructureConfig structureConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Reads a PDF and converts it.
   *
   * @param pdf PDF bytes
   * @param documentName name used in logs and errors
   * @throws DocumentProcessingException when the PDF cannot be read
   */
  @Timed(value = "structure.convert.pdf", description = "Time to extract and structure a PDF")
  public StructureResult convert(InputStream pdf, String documentName) {
    log.info("Structuring document '{}'", documentName);
    List<Span> spans;
    List<Figure> figures;
    try (PDDocument document = Loader.loadPDF(pdf.readAllBytes())) {
      spans = spanExtractor.extract(document);
      figures = figureExtractor.extract(document);
    } catch (IOException e) {
      incrementDocumentCounter("unreadable");
      log.error("Failed to read PDF '{}': {}", documentName, e.getMessage());
      throw new DocumentProcessingException(
          documentName, "Failed to read PDF: " + e.getMessage(), e);
    }
    return structure(spans, figures, List.of());
  }

  public StructureResult structure(List<Span> spans, List<Figure> figures) {
    return structure(spans, figures, List.of());
  }

  /**
   * Converts already extracted content.
   *
   * @param spans spans in document order; an empty list yields an empty tree
   * @param figures figures in their stable order
   * @param footnotes footnote bodies in document order
   */
  public StructureResult structure(
      List<Span> spans, List<Figure> figures, List<Footnote> footnotes) {
    return meterRegistry
        .timer(STRUCTURE_TIMER)
        .record(() -> structureDocument(spans, figures, footnotes));
  }

  private StructureResult structureDocument(
      List<Span> spans, List<Figure> figures, List<Footnote> footnotes) {
    StructureContext context = StructureContext.create(structureConfig);
    Diagnostics diagnostics = context.diagnostics();

    SectionTree tree;
    List<Block> blocks;
    try {
      blocks = blockAssembler.assemble(spans);
      tree = treeBuilder.build(blocks, context);
      diagnostics.failOnStrict(structureConfig.getNumbering().getStrictCategories());
    } catch (StructureException e) {
      countDiagnostics(diagnostics.events());
      incrementDocumentCounter("failed");
      throw e;
    }

    List<BoundFigure> boundFigures = captionBinder.bind(figures, spans);
    Manifest manifest = manifestExporter.export(tree, boundFigures, footnotes);

    List<DiagnosticEvent> events = diagnostics.events();
    countDiagnostics(events);
    incrementDocumentCounter("success");
    log.info(
        "Structured {} spans into {} blocks, {} sections, {} figures ({} diagnostics)",
        spans.size(),
        blocks.size(),
        tree.size(),
        boundFigures.size(),
        events.size());

    return new StructureResult(tree, boundFigures, manifest, events, tree.frontMatterBlocks());
  }

  private void countDiagnostics(List<DiagnosticEvent> events) {
    for (DiagnosticEvent event : events) {
      meterRegistry
          .counter("structure_diagnostics_total", "category", event.category().name())
          .increment();
    }
  }

  private void incrementDocumentCounter(String outcome) {
    meterRegistry.counter("structure_documents_total", "outcome", outcome).increment();
  }
}
