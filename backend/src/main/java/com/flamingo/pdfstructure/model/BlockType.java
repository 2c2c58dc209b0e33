package com.flamingo.pdfstructure.model;

/** Closed set of block kinds produced by block assembly. */
public enum BlockType {
  PARAGRAPH("Paragraph"),
  LIST("List"),
  LIST_ITEM("ListItem"),
  CODE_BLOCK("CodeBlock"),
  TABLE("Table"),
  EMPTY_LINE("EmptyLine"),
  HEADING_CANDIDATE("HeadingCandidate"),
  FIGURE_PLACEHOLDER("FigurePlaceholder"),
  FOOTNOTE_PLACEHOLDER("FootnotePlaceholder"),
  CALLOUT("Callout"),
  RAW_NOISE("RawNoise");

  private final String displayName;

  BlockType(String displayName) {
    this.displayName = displayName;
  }

  public String getDisplayName() {
    return displayName;
  }
}
