package com.flamingo.pdfstructure.service.manifest;

import com.flamingo.pdfstructure.config.StructureConfig;
import com.flamingo.pdfstructure.model.BoundFigure;
import com.flamingo.pdfstructure.model.Figure;
import com.flamingo.pdfstructure.model.Footnote;
import com.flamingo.pdfstructure.model.PageSpan;
import com.flamingo.pdfstructure.model.SectionNode;
import com.flamingo.pdfstructure.model.SectionTree;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Projects a frozen section tree and its figures into a {@link Manifest}.
 *
 * <p>Sections are listed in pre-order with ids {@code sec_0000}, {@code sec_0001}, ... Parent ids
 * are resolved by node identity, so sections sharing a title or slug are never confused.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ManifestExporter {

  static final String TOOL_NAME = "pdf-structure";

  private final StructuralHasher structuralHasher;
  private final StructureConfig structureConfig;

  public Manifest export(SectionTree tree, List<BoundFigure> figures) {
    return export(tree, figures, List.of());
  }

  /**
   * Builds the manifest.
   *
   * @param tree frozen section tree
   * @param figures figures after caption binding
   * @param footnotes footnote bodies in document order
   */
  public Manifest export(SectionTree tree, List<BoundFigure> figures, List<Footnote> footnotes) {
    List<SectionProjection> sections = projectSections(tree);
    List<FigureProjection> figureRows = projectFigures(figures);
    List<FootnoteProjection> footnoteRows = projectFootnotes(footnotes);

    String hash = structuralHasher.hash(sections, figureRows, footnoteRows);
    log.debug(
        "Manifest: {} sections, {} figures, {} footnotes, hash {}",
        sections.size(),
        figureRows.size(),
        footnoteRows.size(),
        hash);

    return new Manifest(
        Manifest.SCHEMA_VERSION,
        sections,
        figureRows,
        footnoteRows,
        List.of(),
        List.of(),
        hash,
        new Manifest.GeneratedWith(TOOL_NAME, structureConfig.getToolVersion()));
  }

  List<SectionProjection> projectSections(SectionTree tree) {
    List<SectionNode> nodes = tree.preOrder();
    Map<SectionNode, String> ids = new IdentityHashMap<>();
    for (int i = 0; i < nodes.size(); i++) {
      ids.put(nodes.get(i), sectionId(i));
    }
    Map<SectionNode, String> parents = new IdentityHashMap<>();
    for (SectionNode node : nodes) {
      for (SectionNode child : node.children()) {
        parents.put(child, ids.get(node));
      }
    }

    List<SectionProjection> rows = new ArrayList<>(nodes.size());
    for (int i = 0; i < nodes.size(); i++) {
      SectionNode node = nodes.get(i);
      PageSpan pages = node.pages() == null ? new PageSpan(0, 0) : node.pages();
      rows.add(
          new SectionProjection(
              ids.get(node),
              node.slug() == null ? "" : node.slug(),
              parents.get(node),
              node.level(),
              i + 1,
              node.title(),
              pages.toList()));
    }
    return rows;
  }

  List<FigureProjection> projectFigures(List<BoundFigure> figures) {
    if (figures == null) {
      return List.of();
    }
    List<FigureProjection> rows = new ArrayList<>(figures.size());
    for (BoundFigure bound : figures) {
      Figure figure = bound.figure();
      rows.add(
          new FigureProjection(
              bound.id(),
              bound.filename(),
              figure.caption() == null ? "" : figure.caption(),
              figure.alt() == null ? "" : figure.alt(),
              figure.page(),
              figure.bbox().toList()));
    }
    return rows;
  }

  List<FootnoteProjection> projectFootnotes(List<Footnote> footnotes) {
    if (footnotes == null) {
      return List.of();
    }
    List<FootnoteProjection> rows = new ArrayList<>(footnotes.size());
    for (int i = 0; i < footnotes.size(); i++) {
      Footnote footnote = footnotes.get(i);
      rows.add(
          new FootnoteProjection(
              String.format("fn_%03d", i), footnote.marker(), footnote.text(), footnote.page()));
    }
    return rows;
  }

  static String sectionId(int index) {
    return String.format("sec_%04d", index);
  }
}
