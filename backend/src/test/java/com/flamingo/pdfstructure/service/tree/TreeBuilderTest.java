package com.flamingo.pdfstructure.service.tree;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.pdfstructure.SpanFixtures;
import com.flamingo.pdfstructure.config.StructureConfig;
import com.flamingo.pdfstructure.model.Block;
import com.flamingo.pdfstructure.model.BlockType;
import com.flamingo.pdfstructure.model.PageSpan;
import com.flamingo.pdfstructure.model.SectionNode;
import com.flamingo.pdfstructure.model.SectionTree;
import com.flamingo.pdfstructure.service.StructureContext;
import com.flamingo.pdfstructure.service.headings.HeadingClassifier;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TreeBuilder Tests")
class TreeBuilderTest {

  private TreeBuilder treeBuilder;
  private StructureContext context;
  private SpanFixtures spans;
  private double y;

  @BeforeEach
  void setUp() {
    treeBuilder = new TreeBuilder(new HeadingClassifier());
    context = StructureContext.create(new StructureConfig());
    spans = new SpanFixtures();
    y = 100;
  }

  private Block heading(String text) {
    y += 15;
    return new Block(BlockType.HEADING_CANDIDATE, List.of(spans.bold(text, 72, y)), text);
  }

  private Block paragraph(String text) {
    y += 15;
    return new Block(BlockType.PARAGRAPH, List.of(spans.text(text, 72, y)), text);
  }

  @Test
  @DisplayName("should nest sections by level and keep document order")
  void shouldNestSectionsByLevel() {
    List<Block> blocks =
        List.of(
            heading("Chapter 1 Getting Started"),
            paragraph("Welcome."),
            heading("1.1 Setup"),
            paragraph("Install it."),
            heading("1.2 Usage"),
            heading("Chapter 2 Advanced"),
            paragraph("Deeper."));

    SectionTree tree = treeBuilder.build(blocks, context);

    assertThat(tree.roots()).hasSize(2);
    SectionNode first = tree.roots().get(0);
    assertThat(first.title()).isEqualTo("Chapter 1 Getting Started");
    assertThat(first.children())
        .extracting(SectionNode::title)
        .containsExactly("1.1 Setup", "1.2 Usage");
    assertThat(first.children()).allSatisfy(child -> assertThat(child.level()).isEqualTo(2));
    assertThat(tree.roots().get(1).children()).isEmpty();
  }

  @Test
  @DisplayName("should give each section the blocks up to the next heading")
  void shouldAssignBlocksToMostRecentHeading() {
    Block welcome = paragraph("Welcome.");
    Block install = paragraph("Install it.");
    List<Block> blocks =
        List.of(heading("Chapter 1 Basics"), welcome, heading("1.1 Setup"), install);

    SectionTree tree = treeBuilder.build(blocks, context);

    SectionNode chapter = tree.roots().get(0);
    assertThat(chapter.blocks()).containsExactly(welcome);
    assertThat(chapter.children().get(0).blocks()).containsExactly(install);
  }

  @Test
  @DisplayName("should drop blocks before the first heading but count them")
  void shouldCountFrontMatter() {
    List<Block> blocks =
        List.of(paragraph("Title page"), paragraph("Copyright"), heading("Chapter 1 Start"));

    SectionTree tree = treeBuilder.build(blocks, context);

    assertThat(tree.frontMatterBlocks()).isEqualTo(2);
    assertThat(tree.roots().get(0).blocks()).isEmpty();
  }

  @Test
  @DisplayName("should list every parent before its children with strictly greater child levels")
  void shouldProducePreOrderWithIncreasingLevels() {
    List<Block> blocks =
        List.of(
            heading("Chapter 1 One"),
            heading("1.1.1 Deep"),
            heading("1.2 Shallower"),
            heading("1.2.1 Deep again"),
            heading("Chapter 2 Two"),
            heading("2.1 Child"));

    SectionTree tree = treeBuilder.build(blocks, context);

    List<SectionNode> order = tree.preOrder();
    Map<SectionNode, Integer> position = new IdentityHashMap<>();
    for (int i = 0; i < order.size(); i++) {
      position.put(order.get(i), i);
    }
    for (SectionNode node : order) {
      for (SectionNode child : node.children()) {
        assertThat(position.get(child)).isGreaterThan(position.get(node));
        assertThat(child.level()).isGreaterThan(node.level());
      }
    }
    assertThat(order)
        .extracting(SectionNode::title)
        .containsExactly(
            "Chapter 1 One",
            "1.1.1 Deep",
            "1.2 Shallower",
            "1.2.1 Deep again",
            "Chapter 2 Two",
            "2.1 Child");
  }

  @Test
  @DisplayName("should allocate prefixed slugs in heading order")
  void shouldAllocateSlugsInHeadingOrder() {
    List<Block> blocks = List.of(heading("Chapter 1 Start"), heading("1.1 Overview"));

    SectionTree tree = treeBuilder.build(blocks, context);

    assertThat(tree.preOrder())
        .extracting(SectionNode::slug)
        .containsExactly("00-chapter-1-start", "01-1-1-overview");
  }

  @Test
  @DisplayName("should span the pages of the heading and its blocks")
  void shouldComputePageSpan() {
    Block chapter = heading("Chapter 1 Start");
    Block later =
        new Block(
            BlockType.PARAGRAPH,
            List.of(spans.page(3).text("Much later.", 72, 100)),
            "Much later.");

    SectionTree tree = treeBuilder.build(List.of(chapter, later), context);

    assertThat(tree.roots().get(0).pages()).isEqualTo(new PageSpan(1, 3));
  }

  @Test
  @DisplayName("should return frozen, unmodifiable nodes")
  void shouldFreezeTree() {
    SectionTree tree =
        treeBuilder.build(List.of(heading("Chapter 1 Start"), paragraph("Text.")), context);

    List<Block> blocks = tree.roots().get(0).blocks();
    assertThatThrownBy(() -> blocks.add(paragraph("More.")))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  @DisplayName("should build an empty tree from no blocks")
  void shouldBuildEmptyTree_whenNoBlocks() {
    assertThat(treeBuilder.build(new ArrayList<>(), context).isEmpty()).isTrue();
  }
}
