package com.flamingo.pdfstructure.model;

/**
 * A single styled, positioned run of text as produced by the extraction collaborator.
 *
 * <p>{@code orderIndex} is strictly increasing across the whole document and pages are 1-based.
 * Spans are never mutated once produced.
 *
 * @param text run text, possibly with leading whitespace
 * @param bbox position on the page
 * @param fontName font name as reported by the document
 * @param fontSize font size in points
 * @param styleFlags derived style flags
 * @param page 1-based page number
 * @param orderIndex document-global reading order
 */
public record Span(
    String text,
    BoundingBox bbox,
    String fontName,
    double fontSize,
    StyleFlags styleFlags,
    int page,
    int orderIndex) {

  public Span {
    text = text == null ? "" : text;
    fontName = fontName == null ? "" : fontName;
    styleFlags = styleFlags == null ? StyleFlags.NONE : styleFlags;
  }

  public double centerY() {
    return bbox.centerY();
  }

  /** Average glyph width, used to convert horizontal offsets into character columns. */
  public double charWidth() {
    int length = text.strip().length();
    if (length == 0 || bbox.width() <= 0) {
      return fontSize > 0 ? fontSize * 0.5 : 6.0;
    }
    return bbox.width() / length;
  }
}
