package com.flamingo.pdfstructure.service.extraction;

import com.flamingo.pdfstructure.model.StyleFlags;
import java.util.List;
import java.util.Locale;

/** Derives style flags from a font name such as {@code ABCDEF+Courier-BoldOblique}. */
final class FontStyles {

  private static final List<String> BOLD = List.of("bold", "black", "heavy", "thick");
  private static final List<String> ITALIC = List.of("italic", "oblique", "slant");
  private static final List<String> MONOSPACE =
      List.of("mono", "courier", "consol", "menlo", "code");

  private FontStyles() {}

  static StyleFlags fromFontName(String fontName) {
    if (fontName == null || fontName.isBlank()) {
      return StyleFlags.NONE;
    }
    String name = fontName.toLowerCase(Locale.ROOT);
    return new StyleFlags(
        containsAny(name, BOLD), containsAny(name, ITALIC), containsAny(name, MONOSPACE), false);
  }

  private static boolean containsAny(String name, List<String> indicators) {
    for (String indicator : indicators) {
      if (name.contains(indicator)) {
        return true;
      }
    }
    return false;
  }
}
