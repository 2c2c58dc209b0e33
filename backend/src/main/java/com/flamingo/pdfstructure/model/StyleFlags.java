package com.flamingo.pdfstructure.model;

/**
 * Typographic flags carried by a {@link Span}.
 *
 * @param bold heavy-weight face
 * @param italic slanted face
 * @param monospace fixed-pitch face
 * @param superscript raised, reduced-size run
 */
public record StyleFlags(boolean bold, boolean italic, boolean monospace, boolean superscript) {

  public static final StyleFlags NONE = new StyleFlags(false, false, false, false);

  public static StyleFlags boldFace() {
    return new StyleFlags(true, false, false, false);
  }

  public static StyleFlags monospaced() {
    return new StyleFlags(false, false, true, false);
  }
}
