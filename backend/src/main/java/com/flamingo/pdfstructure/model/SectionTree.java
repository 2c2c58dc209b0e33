package com.flamingo.pdfstructure.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Frozen section forest of one document.
 *
 * @param roots top-level sections in document order
 * @param frontMatterBlocks number of blocks preceding the first heading, which the tree drops
 */
public record SectionTree(List<SectionNode> roots, int frontMatterBlocks) {

  public static final SectionTree EMPTY = new SectionTree(List.of(), 0);

  public SectionTree {
    roots = List.copyOf(roots);
  }

  /** All nodes, every parent strictly before its children. */
  public List<SectionNode> preOrder() {
    List<SectionNode> result = new ArrayList<>();
    Deque<SectionNode> stack = new ArrayDeque<>();
    for (int i = roots.size() - 1; i >= 0; i--) {
      stack.push(roots.get(i));
    }
    while (!stack.isEmpty()) {
      SectionNode node = stack.pop();
      result.add(node);
      List<SectionNode> children = node.children();
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(children.get(i));
      }
    }
    return result;
  }

  public int size() {
    return preOrder().size();
  }

  public boolean isEmpty() {
    return roots.isEmpty();
  }
}
