package com.flamingo.pdfstructure;

import com.flamingo.pdfstructure.model.BoundingBox;
import com.flamingo.pdfstructure.model.Span;
import com.flamingo.pdfstructure.model.StyleFlags;

/**
 * Builds spans in reading order for tests. Glyphs are 5 units wide and 10 units high, so a span's
 * width is five times its stripped length.
 */
public class SpanFixtures {

  public static final double GLYPH_WIDTH = 5.0;
  public static final double BODY_SIZE = 10.0;

  private int orderIndex;
  private int page = 1;

  public SpanFixtures page(int number) {
    this.page = number;
    return this;
  }

  public Span text(String text, double x, double y) {
    return span(text, x, y, BODY_SIZE, StyleFlags.NONE);
  }

  public Span bold(String text, double x, double y) {
    return span(text, x, y, BODY_SIZE, StyleFlags.boldFace());
  }

  public Span mono(String text, double x, double y) {
    return span(text, x, y, BODY_SIZE, StyleFlags.monospaced());
  }

  public Span sized(String text, double x, double y, double fontSize) {
    return span(text, x, y, fontSize, StyleFlags.NONE);
  }

  public Span span(String text, double x, double y, double fontSize, StyleFlags flags) {
    double width = Math.max(text.length(), 1) * GLYPH_WIDTH;
    return new Span(
        text,
        new BoundingBox(x, y, x + width, y + BODY_SIZE),
        flags.monospace() ? "Courier" : "Helvetica",
        fontSize,
        flags,
        page,
        orderIndex++);
  }
}
