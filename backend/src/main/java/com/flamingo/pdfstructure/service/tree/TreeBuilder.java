package com.flamingo.pdfstructure.service.tree;

import com.flamingo.pdfstructure.model.Block;
import com.flamingo.pdfstructure.model.SectionNode;
import com.flamingo.pdfstructure.model.SectionNodeBuilder;
import com.flamingo.pdfstructure.model.SectionTree;
import com.flamingo.pdfstructure.service.StructureContext;
import com.flamingo.pdfstructure.service.headings.Heading;
import com.flamingo.pdfstructure.service.headings.HeadingClassifier;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Builds the frozen section tree of a document.
 *
 * <p>Headings are placed with an ancestor stack: entries whose level is greater than or equal to
 * the incoming heading's level are popped, the heading becomes a child of the new top (or a root
 * when the stack is empty) and is pushed. Every other block then goes to the most recently seen
 * heading. Blocks before the first heading are not part of the tree; only their count is kept.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TreeBuilder {

  private final HeadingClassifier headingClassifier;

  /**
   * Builds and freezes the tree.
   *
   * @param blocks every block of the document, in order
   * @param context document-scoped numbering, slug and diagnostics state
   */
  public SectionTree build(List<Block> blocks, StructureContext context) {
    if (blocks == null || blocks.isEmpty()) {
      return SectionTree.EMPTY;
    }
    List<Heading> headings = headingClassifier.extractHeadings(blocks, context.numbering());

    Map<Block, SectionNodeBuilder> nodesByBlock = new IdentityHashMap<>();
    List<SectionNodeBuilder> roots = new ArrayList<>();
    Deque<SectionNodeBuilder> ancestors = new ArrayDeque<>();

    for (int i = 0; i < headings.size(); i++) {
      Heading heading = headings.get(i);
      String slug = context.slugs().allocate(heading.title(), i);
      SectionNodeBuilder node =
          new SectionNodeBuilder(
              heading.title(),
              heading.level(),
              slug,
              heading.block().getPageSpan(),
              heading.numbering());

      while (!ancestors.isEmpty() && ancestors.peek().getLevel() >= heading.level()) {
        ancestors.pop();
      }
      if (ancestors.isEmpty()) {
        roots.add(node);
      } else {
        ancestors.peek().addChild(node);
      }
      ancestors.push(node);
      nodesByBlock.put(heading.block(), node);
    }

    int frontMatter = 0;
    SectionNodeBuilder current = null;
    for (Block block : blocks) {
      SectionNodeBuilder headingNode = nodesByBlock.get(block);
      if (headingNode != null) {
        current = headingNode;
      } else if (current != null) {
        current.addBlock(block);
      } else {
        frontMatter++;
      }
    }

    List<SectionNode> frozen = new ArrayList<>(roots.size());
    for (SectionNodeBuilder root : roots) {
      frozen.add(root.freeze());
    }
    if (frontMatter > 0) {
      log.debug("{} blocks precede the first heading and are left out of the tree", frontMatter);
    }
    log.debug("Built section tree: {} headings, {} roots", headings.size(), roots.size());
    return new SectionTree(frozen, frontMatter);
  }
}
