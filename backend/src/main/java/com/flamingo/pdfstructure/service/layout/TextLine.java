package com.flamingo.pdfstructure.service.layout;

import com.flamingo.pdfstructure.model.BoundingBox;
import com.flamingo.pdfstructure.model.Span;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One logical line: spans sharing a vertical band, ordered left to right.
 *
 * <p>Keeps the per-span detail that block classification needs (indentation, monospace share,
 * horizontal gaps) next to the merged text.
 */
public final class TextLine {

  private static final Pattern PUNCTUATION_ONLY = Pattern.compile("^[^\\w\\s]+$");
  private static final Pattern MULTI_SPACE = Pattern.compile("\\s{2,}");

  private final List<Span> spans;
  private final String text;

  public TextLine(List<Span> lineSpans) {
    List<Span> sorted = new ArrayList<>(lineSpans);
    sorted.sort(Comparator.comparingDouble(s -> s.bbox().x0()));
    this.spans = List.copyOf(sorted);
    this.text = joinWithSmartSpacing(this.spans);
  }

  /**
   * Joins spans with single spaces, except that punctuation-only spans attach directly to the
   * preceding text.
   */
  static String joinWithSmartSpacing(List<Span> spans) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < spans.size(); i++) {
      String part = spans.get(i).text().strip();
      if (part.isEmpty()) {
        continue;
      }
      if (i == 0 || PUNCTUATION_ONLY.matcher(part).matches()) {
        sb.append(part);
      } else {
        sb.append(' ').append(part);
      }
    }
    return sb.toString().strip();
  }

  public List<Span> spans() {
    return spans;
  }

  public String text() {
    return text;
  }

  public boolean isBlank() {
    return text.isBlank();
  }

  public int page() {
    return spans.isEmpty() ? 0 : spans.get(0).page();
  }

  public double x0() {
    return spans.isEmpty() ? 0 : spans.get(0).bbox().x0();
  }

  public BoundingBox bbox() {
    return BoundingBox.covering(spans);
  }

  /** Whitespace at the start of the leftmost span's raw text. */
  public int leadingSpaces() {
    if (spans.isEmpty()) {
      return 0;
    }
    String raw = spans.get(0).text();
    int count = 0;
    while (count < raw.length() && raw.charAt(count) == ' ') {
      count++;
    }
    return count;
  }

  /** Average font size across the line's spans. */
  public double fontSize() {
    return spans.stream().mapToDouble(Span::fontSize).filter(s -> s > 0).average().orElse(0);
  }

  public boolean isBold() {
    return !spans.isEmpty()
        && spans.stream()
            .filter(s -> !s.text().isBlank())
            .allMatch(s -> s.styleFlags().bold());
  }

  /** Share of non-blank characters set in a monospace face. */
  public double monospaceRatio() {
    int total = 0;
    int mono = 0;
    for (Span span : spans) {
      int count = nonBlankLength(span.text());
      total += count;
      if (span.styleFlags().monospace()) {
        mono += count;
      }
    }
    return total == 0 ? 0 : (double) mono / total;
  }

  /** Largest horizontal gap between neighbouring spans. */
  public double maxHorizontalGap() {
    double max = 0;
    for (int i = 1; i < spans.size(); i++) {
      max = Math.max(max, spans.get(i).bbox().x0() - spans.get(i - 1).bbox().x1());
    }
    return max;
  }

  /**
   * Splits the line into column cells: a new cell starts at every span gap wider than {@code
   * columnGap} and at every run of two or more spaces inside a span.
   */
  public List<Cell> cells(double columnGap) {
    List<Cell> cells = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    double currentX = Double.NaN;
    Span previous = null;
    for (Span span : spans) {
      boolean gapBreak = previous != null && span.bbox().x0() - previous.bbox().x1() > columnGap;
      if (gapBreak && current.length() > 0) {
        cells.add(new Cell(current.toString().strip(), currentX));
        current.setLength(0);
        currentX = Double.NaN;
      }
      String raw = span.text();
      Matcher matcher = MULTI_SPACE.matcher(raw);
      int start = 0;
      while (true) {
        boolean found = matcher.find();
        int end = found ? matcher.start() : raw.length();
        String piece = raw.substring(start, end);
        if (!piece.isBlank()) {
          if (Double.isNaN(currentX)) {
            int lead = piece.length() - piece.stripLeading().length();
            currentX = span.bbox().x0() + (start + lead) * span.charWidth();
          }
          if (current.length() > 0) {
            current.append(' ');
          }
          current.append(piece.strip());
        }
        if (!found) {
          break;
        }
        if (current.length() > 0) {
          cells.add(new Cell(current.toString().strip(), currentX));
          current.setLength(0);
          currentX = Double.NaN;
        }
        start = matcher.end();
      }
      previous = span;
    }
    if (current.length() > 0) {
      cells.add(new Cell(current.toString().strip(), currentX));
    }
    return cells;
  }

  private static int nonBlankLength(String value) {
    int count = 0;
    for (int i = 0; i < value.length(); i++) {
      if (!Character.isWhitespace(value.charAt(i))) {
        count++;
      }
    }
    return count;
  }

  @Override
  public String toString() {
    return "TextLine[" + text + "]";
  }

  /**
   * A table column cell.
   *
   * @param text cell text
   * @param x x-coordinate where the cell starts
   */
  public record Cell(String text, double x) {}
}
