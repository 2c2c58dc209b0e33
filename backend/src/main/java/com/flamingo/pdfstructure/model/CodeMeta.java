package com.flamingo.pdfstructure.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;

/**
 * Dedented code lines.
 *
 * @param language detected language, {@code null} when unknown
 * @param lines dedented lines, blank lines kept as empty strings
 * @param format how the block was recognised
 */
public record CodeMeta(String language, List<String> lines, Format format) implements BlockMeta {

  /** Origin of a code block. */
  public enum Format {
    INDENTED("indented"),
    MONOSPACE("monospace"),
    FENCED_FALLBACK("fenced_fallback");

    private final String value;

    Format(String value) {
      this.value = value;
    }

    @JsonValue
    public String value() {
      return value;
    }
  }
}
