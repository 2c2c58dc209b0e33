package com.flamingo.pdfstructure.model;

import com.flamingo.pdfstructure.exception.FrozenSectionException;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable section node used while the tree is assembled.
 *
 * <p>{@link #freeze()} turns this builder and every descendant into immutable {@link SectionNode}
 * values. Freezing is irreversible: afterwards every mutator throws {@link
 * FrozenSectionException}.
 */
public final class SectionNodeBuilder {

  private final String title;
  private final int level;
  private final String slug;
  private final NumberingInfo numbering;
  private final List<Block> blocks = new ArrayList<>();
  private final List<SectionNodeBuilder> children = new ArrayList<>();
  private PageSpan pages;
  private SectionNode frozen;

  public SectionNodeBuilder(
      String title, int level, String slug, PageSpan pages, NumberingInfo numbering) {
    if (level < 1) {
      throw new IllegalArgumentException("Section level must be >= 1, got " + level);
    }
    this.title = title;
    this.level = level;
    this.slug = slug;
    this.pages = pages;
    this.numbering = numbering == null ? NumberingInfo.NONE : numbering;
  }

  public SectionNodeBuilder addChild(SectionNodeBuilder child) {
    ensureMutable("add child");
    if (child.level <= level) {
      throw new IllegalArgumentException(
          "Child level " + child.level + " must be greater than parent level " + level);
    }
    children.add(child);
    return this;
  }

  public SectionNodeBuilder addBlock(Block block) {
    ensureMutable("add block");
    blocks.add(block);
    if (block.getPageSpan().first() > 0) {
      pages = pages == null ? block.getPageSpan() : pages.union(block.getPageSpan());
    }
    return this;
  }

  /** Freezes this node and all descendants; repeated calls return the same node. */
  public SectionNode freeze() {
    if (frozen == null) {
      List<SectionNode> frozenChildren = new ArrayList<>(children.size());
      for (SectionNodeBuilder child : children) {
        frozenChildren.add(child.freeze());
      }
      frozen = new SectionNode(title, level, slug, blocks, frozenChildren, pages, numbering);
    }
    return frozen;
  }

  public boolean isFrozen() {
    return frozen != null;
  }

  public String getTitle() {
    return title;
  }

  public int getLevel() {
    return level;
  }

  public String getSlug() {
    return slug;
  }

  public List<SectionNodeBuilder> getChildren() {
    return List.copyOf(children);
  }

  public List<Block> getBlocks() {
    return List.copyOf(blocks);
  }

  private void ensureMutable(String operation) {
    if (frozen != null) {
      throw new FrozenSectionException(title, operation);
    }
  }
}
