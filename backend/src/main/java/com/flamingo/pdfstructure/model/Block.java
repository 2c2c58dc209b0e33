package com.flamingo.pdfstructure.model;

import java.util.List;
import lombok.Getter;

/**
 * A classified logical unit built from one or more lines.
 *
 * <p>Everything except the numbering facts is fixed at construction. Numbering is attached once,
 * by heading processing, before the section tree is built.
 */
@Getter
public final class Block {

  private final BlockType type;
  private final List<Span> spans;
  private final String text;
  private final BoundingBox bbox;
  private final PageSpan pageSpan;
  private final BlockMeta meta;

  /** Whether this block is the first one assembled on its page. */
  private final boolean pageStart;

  private NumberingInfo numbering;

  public Block(BlockType type, List<Span> spans, String text, BlockMeta meta, boolean pageStart) {
    this.type = type;
    this.spans = List.copyOf(spans);
    this.text = text == null ? "" : text;
    this.bbox = BoundingBox.covering(this.spans);
    this.pageSpan = PageSpan.covering(this.spans);
    this.meta = meta;
    this.pageStart = pageStart;
  }

  public Block(BlockType type, List<Span> spans, String text) {
    this(type, spans, text, null, false);
  }

  /**
   * Attaches numbering facts to a heading block.
   *
   * @throws IllegalStateException if numbering was already attached
   */
  public void attachNumbering(NumberingInfo info) {
    if (numbering != null) {
      throw new IllegalStateException("Numbering already attached to block: " + text);
    }
    this.numbering = info;
  }

  public boolean is(BlockType candidate) {
    return type == candidate;
  }

  @Override
  public String toString() {
    return type.getDisplayName() + "[" + text + "]";
  }
}
