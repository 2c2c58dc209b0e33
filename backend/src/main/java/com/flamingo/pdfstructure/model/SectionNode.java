package com.flamingo.pdfstructure.model;

import java.util.List;

/**
 * Immutable node of the section tree, produced by {@link SectionNodeBuilder#freeze()}.
 *
 * <p>Equality is identity: two sections with the same title and slug are different nodes.
 */
public final class SectionNode {

  private final String title;
  private final int level;
  private final String slug;
  private final List<Block> blocks;
  private final List<SectionNode> children;
  private final PageSpan pages;
  private final NumberingInfo numbering;

  SectionNode(
      String title,
      int level,
      String slug,
      List<Block> blocks,
      List<SectionNode> children,
      PageSpan pages,
      NumberingInfo numbering) {
    this.title = title;
    this.level = level;
    this.slug = slug;
    this.blocks = List.copyOf(blocks);
    this.children = List.copyOf(children);
    this.pages = pages;
    this.numbering = numbering;
  }

  public String title() {
    return title;
  }

  public int level() {
    return level;
  }

  public String slug() {
    return slug;
  }

  /** Content blocks owned by this section, excluding those of sub-sections. */
  public List<Block> blocks() {
    return blocks;
  }

  public List<SectionNode> children() {
    return children;
  }

  public PageSpan pages() {
    return pages;
  }

  public NumberingInfo numbering() {
    return numbering;
  }

  @Override
  public String toString() {
    return "SectionNode[" + level + ", " + title + "]";
  }
}
