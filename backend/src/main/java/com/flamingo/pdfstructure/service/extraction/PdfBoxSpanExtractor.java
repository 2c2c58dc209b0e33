package com.flamingo.pdfstructure.service.extraction;

import com.flamingo.pdfstructure.config.StructureConfig;
import com.flamingo.pdfstructure.model.BoundingBox;
import com.flamingo.pdfstructure.model.Span;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.springframework.stereotype.Component;

/**
 * Extracts styled text spans from a PDF with Apache PDFBox.
 *
 * <p>Glyphs are appended to the current span until the font name or size changes, the baseline
 * moves, or the horizontal gap to the previous glyph exceeds two glyph widths. Spans carry
 * top-down coordinates, 1-based pages and a document-wide increasing {@code orderIndex}. Pages
 * listed in {@code structure.extraction.exclude-pages} produce no spans.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PdfBoxSpanExtractor {

  private final StructureConfig structureConfig;

  public List<Span> extract(PDDocument document) throws IOException {
    SpanStripper stripper =
        new SpanStripper(new HashSet<>(structureConfig.getExtraction().getExcludePages()));
    stripper.getText(document);
    List<Span> spans = stripper.getSpans();
    log.debug("Extracted {} spans from {} pages", spans.size(), document.getNumberOfPages());
    return spans;
  }

  /** Collects spans while {@link PDFTextStripper} walks the glyphs in reading order. */
  private static final class SpanStripper extends PDFTextStripper {

    private static final float BASELINE_TOLERANCE = 1.0f;
    private static final float GAP_GLYPHS = 2.0f;

    private final Set<Integer> excludedPages;
    private final List<Span> spans = new ArrayList<>();
    private final List<TextPosition> current = new ArrayList<>();
    private final StringBuilder currentText = new StringBuilder();
    private int orderIndex;

    SpanStripper(Set<Integer> excludedPages) throws IOException {
      super();
      this.excludedPages = excludedPages;
      setSortByPosition(true);
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
      if (excludedPages.contains(getCurrentPageNo())) {
        return;
      }
      for (TextPosition position : textPositions) {
        if (!current.isEmpty()) {
          TextPosition previous = current.get(current.size() - 1);
          if (startsNewSpan(previous, position)) {
            flushSpan();
          } else if (position.getXDirAdj() - endX(previous) > spaceWidth(previous) * 0.5f
              && currentText.charAt(currentText.length() - 1) != ' ') {
            currentText.append(' ');
          }
        }
        current.add(position);
        currentText.append(position.getUnicode());
      }
      super.writeString(text, textPositions);
    }

    @Override
    protected void endPage(PDPage page) throws IOException {
      flushSpan();
      super.endPage(page);
    }

    List<Span> getSpans() {
      flushSpan();
      return spans;
    }

    private boolean startsNewSpan(TextPosition previous, TextPosition position) {
      if (!Objects.equals(fontName(previous), fontName(position))) {
        return true;
      }
      if (Math.abs(previous.getFontSizeInPt() - position.getFontSizeInPt()) > 0.01f) {
        return true;
      }
      if (Math.abs(previous.getYDirAdj() - position.getYDirAdj()) > BASELINE_TOLERANCE) {
        return true;
      }
      float gap = position.getXDirAdj() - endX(previous);
      return gap > previous.getWidthDirAdj() * GAP_GLYPHS;
    }

    private void flushSpan() {
      if (current.isEmpty()) {
        return;
      }
      float x0 = Float.MAX_VALUE;
      float y0 = Float.MAX_VALUE;
      float x1 = -Float.MAX_VALUE;
      float y1 = -Float.MAX_VALUE;
      for (TextPosition position : current) {
        float baseline = position.getYDirAdj();
        x0 = Math.min(x0, position.getXDirAdj());
        x1 = Math.max(x1, endX(position));
        y0 = Math.min(y0, baseline - position.getHeightDir());
        y1 = Math.max(y1, baseline);
      }
      TextPosition first = current.get(0);
      String fontName = fontName(first);
      spans.add(
          new Span(
              currentText.toString(),
              new BoundingBox(x0, y0, x1, y1),
              fontName,
              first.getFontSizeInPt(),
              FontStyles.fromFontName(fontName),
              getCurrentPageNo(),
              orderIndex++));
      current.clear();
      currentText.setLength(0);
    }

    private static float endX(TextPosition position) {
      return position.getXDirAdj() + position.getWidthDirAdj();
    }

    private static float spaceWidth(TextPosition position) {
      float width = position.getWidthOfSpace();
      return width > 0 ? width : position.getWidthDirAdj();
    }

    private static String fontName(TextPosition position) {
      return position.getFont() != null ? position.getFont().getName() : "";
    }
  }
}
