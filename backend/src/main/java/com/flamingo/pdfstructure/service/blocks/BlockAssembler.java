package com.flamingo.pdfstructure.service.blocks;

import com.flamingo.pdfstructure.config.StructureConfig;
import com.flamingo.pdfstructure.model.Block;
import com.flamingo.pdfstructure.model.BlockMeta;
import com.flamingo.pdfstructure.model.BlockType;
import com.flamingo.pdfstructure.model.CodeMeta;
import com.flamingo.pdfstructure.model.ListItem;
import com.flamingo.pdfstructure.model.ListMeta;
import com.flamingo.pdfstructure.model.Span;
import com.flamingo.pdfstructure.model.TableMeta;
import com.flamingo.pdfstructure.service.headings.HeadingClassifier;
import com.flamingo.pdfstructure.service.layout.LineMerger;
import com.flamingo.pdfstructure.service.layout.TextLine;
import com.flamingo.pdfstructure.service.layout.TextLine.Cell;
import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Classifies lines into typed blocks.
 *
 * <p>Each line is classified on its own, in this order:
 *
 * <ul>
 *   <li><strong>Empty</strong>: flushes the open block and yields an {@code EmptyLine} block.
 *   <li><strong>Raw noise</strong>: a bare page number.
 *   <li><strong>Code (monospace)</strong>: at least 60% of the non-blank characters are set in a
 *       monospace face.
 *   <li><strong>List item</strong>: a bullet glyph or an {@code N.}/{@code a)} marker, unless the
 *       line is a short, capitalised, unindented numbered heading such as {@code 1. Introduction}.
 *   <li><strong>Heading candidate</strong>: passes the heading gate and is keyword-numbered, bold,
 *       all-caps or set noticeably larger than the median font size.
 *   <li><strong>Code (indented)</strong>: indentation of at least {@code code-indent-threshold}
 *       columns.
 *   <li><strong>Table candidate</strong>: at least two columns, separated by two or more spaces or
 *       by a span gap wider than {@code table-column-gap}.
 *   <li><strong>Callout</strong>: opens with {@code Note:}, {@code Tip:}, {@code Warning:} ...
 *   <li>otherwise <strong>paragraph</strong>.
 * </ul>
 *
 * <p>Adjacent lines of the same kind merge into one block; headings never merge. Code runs may
 * contain blank lines and must reach {@code code-min-lines} or are demoted to paragraph text.
 * Table runs of two or more lines are scored by {@link TableConfidenceScorer}; a run below {@code
 * table-confidence-min} becomes a fenced code block so no content is lost.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BlockAssembler {

  static final double MONOSPACE_RATIO = 0.6;
  static final int NUMBERED_HEADING_MAX_LENGTH = 60;
  static final int NUMBERED_HEADING_MAX_WORDS = 6;

  private static final Pattern BULLET =
      Pattern.compile("^(?:[•◦▪▫‣∙●○■□]\\s*|[-*–]\\s+)\\S");
  private static final Pattern NUMBERED =
      Pattern.compile("^(?:\\d{1,3}|[a-zA-Z])[.)]\\s+(\\S.*)$");
  private static final Pattern CALLOUT =
      Pattern.compile(
          "^(?:note|tip|warning|important|caution)\\s*:", Pattern.CASE_INSENSITIVE);
  private static final Pattern PAGE_NUMBER =
      Pattern.compile(
          "^(?:\\d{1,4}|(?=[ivxlc]+$)c{0,3}(?:xc|xl|l?x{0,3})(?:ix|iv|v?i{0,3}))$",
          Pattern.CASE_INSENSITIVE);

  /** Words that open numbered headings rather than list items. */
  private static final Set<String> HEADING_WORDS =
      Set.of(
          "abstract",
          "acknowledgements",
          "acknowledgments",
          "analysis",
          "appendix",
          "approach",
          "architecture",
          "background",
          "bibliography",
          "conclusion",
          "conclusions",
          "contents",
          "design",
          "discussion",
          "evaluation",
          "glossary",
          "implementation",
          "introduction",
          "limitations",
          "methodology",
          "methods",
          "motivation",
          "overview",
          "preface",
          "references",
          "requirements",
          "results",
          "scope",
          "summary");

  private final LineMerger lineMerger;
  private final ListLevelResolver listLevelResolver;
  private final TableConfidenceScorer tableConfidenceScorer;
  private final StructureConfig structureConfig;

  /** Line kinds before run merging. */
  enum LineKind {
    EMPTY,
    NOISE,
    LIST_ITEM,
    HEADING,
    CODE,
    TABLE,
    CALLOUT,
    PARAGRAPH
  }

  /**
   * Assembles the blocks of a document.
   *
   * @param spans every span of the document; an empty list yields no blocks
   */
  public List<Block> assemble(List<Span> spans) {
    List<TextLine> lines = lineMerger.groupLines(spans);
    if (lines.isEmpty()) {
      return List.of();
    }
    LayoutMetrics metrics = LayoutMetrics.of(lines);
    List<LineKind> kinds = new ArrayList<>(lines.size());
    for (TextLine line : lines) {
      kinds.add(classify(line, metrics));
    }
    List<Block> blocks = new Assembly(lines, kinds, metrics).run();
    log.debug("Assembled {} blocks from {} lines", blocks.size(), lines.size());
    return blocks;
  }

  LineKind classify(TextLine line, LayoutMetrics metrics) {
    StructureConfig.Blocks settings = structureConfig.getBlocks();
    String text = line.text();
    if (line.isBlank()) {
      return LineKind.EMPTY;
    }
    if (PAGE_NUMBER.matcher(text).matches()) {
      return LineKind.NOISE;
    }
    if (line.monospaceRatio() >= MONOSPACE_RATIO) {
      return LineKind.CODE;
    }
    int indent = metrics.indentColumns(line);
    Matcher numbered = NUMBERED.matcher(text);
    if (numbered.matches()) {
      if (isNumberedHeading(text, numbered.group(1), indent)) {
        return LineKind.HEADING;
      }
      return LineKind.LIST_ITEM;
    }
    if (BULLET.matcher(text).find()) {
      return LineKind.LIST_ITEM;
    }
    if (isHeadingCandidate(line, metrics)) {
      return LineKind.HEADING;
    }
    if (indent >= settings.getCodeIndentThreshold()) {
      return LineKind.CODE;
    }
    if (line.cells(settings.getTableColumnGap()).size() >= 2) {
      return LineKind.TABLE;
    }
    if (CALLOUT.matcher(text).find()) {
      return LineKind.CALLOUT;
    }
    return LineKind.PARAGRAPH;
  }

  private boolean isNumberedHeading(String text, String remainder, int indent) {
    if (indent > 0
        || text.length() > NUMBERED_HEADING_MAX_LENGTH
        || !Character.isUpperCase(remainder.charAt(0))) {
      return false;
    }
    String[] words = remainder.split("\\s+");
    if (words.length > NUMBERED_HEADING_MAX_WORDS) {
      return false;
    }
    String first = words[0].replaceAll("\\W+$", "").toLowerCase(Locale.ROOT);
    return HEADING_WORDS.contains(first);
  }

  private boolean isHeadingCandidate(TextLine line, LayoutMetrics metrics) {
    String text = line.text();
    if (!HeadingClassifier.looksLikeHeading(text)) {
      return false;
    }
    double ratio = structureConfig.getBlocks().getHeadingFontRatio();
    boolean larger = metrics.medianFontSize() > 0
        && line.fontSize() >= metrics.medianFontSize() * ratio;
    return HeadingClassifier.hasKeywordNumbering(text)
        || line.isBold()
        || larger
        || HeadingClassifier.isAllCaps(text);
  }

  /** Reconstructs a code line with its column layout relative to the page's left margin. */
  static String codeText(TextLine line, double margin) {
    StringBuilder sb = new StringBuilder();
    List<Span> spans = line.spans();
    if (spans.isEmpty()) {
      return "";
    }
    double charWidth = spans.get(0).charWidth();
    for (Span span : spans) {
      String raw = span.text();
      if (raw.isBlank()) {
        continue;
      }
      int lead = raw.length() - raw.stripLeading().length();
      int column = (int) Math.round((span.bbox().x0() - margin) / charWidth) + lead;
      if (sb.length() > 0 && column <= sb.length()) {
        if (sb.charAt(sb.length() - 1) != ' ') {
          sb.append(' ');
        }
      } else {
        while (sb.length() < column) {
          sb.append(' ');
        }
      }
      sb.append(raw.strip());
    }
    return sb.toString().stripTrailing();
  }

  /** Removes the smallest common indentation; blank lines become empty strings. */
  @VisibleForTesting
  static List<String> dedent(List<String> lines) {
    int common = Integer.MAX_VALUE;
    for (String line : lines) {
      if (!line.isBlank()) {
        common = Math.min(common, line.length() - line.stripLeading().length());
      }
    }
    List<String> result = new ArrayList<>(lines.size());
    for (String line : lines) {
      result.add(line.isBlank() ? "" : line.substring(common));
    }
    return result;
  }

  /**
   * Document-wide layout measures.
   *
   * @param medianFontSize median font size over non-blank lines
   * @param leftMargins smallest line x0 per page
   */
  record LayoutMetrics(double medianFontSize, Map<Integer, Double> leftMargins) {

    static LayoutMetrics of(List<TextLine> lines) {
      List<Double> sizes = new ArrayList<>();
      Map<Integer, Double> margins = new HashMap<>();
      for (TextLine line : lines) {
        if (line.isBlank()) {
          continue;
        }
        double size = line.fontSize();
        if (size > 0) {
          sizes.add(size);
        }
        margins.merge(line.page(), line.x0(), Math::min);
      }
      sizes.sort(Double::compare);
      double median = 0;
      if (!sizes.isEmpty()) {
        int mid = sizes.size() / 2;
        median =
            sizes.size() % 2 == 0 ? (sizes.get(mid - 1) + sizes.get(mid)) / 2.0 : sizes.get(mid);
      }
      return new LayoutMetrics(median, margins);
    }

    double margin(int page) {
      return leftMargins.getOrDefault(page, 0.0);
    }

    /** Leading indentation in character columns. */
    int indentColumns(TextLine line) {
      if (line.spans().isEmpty()) {
        return 0;
      }
      double offset = line.x0() - margin(line.page());
      double charWidth = line.spans().get(0).charWidth();
      int columns = charWidth > 0 ? (int) Math.round(Math.max(0, offset) / charWidth) : 0;
      return line.leadingSpaces() + columns;
    }
  }

  /** Walks classified lines once and merges them into blocks. */
  private final class Assembly {

    private final List<TextLine> lines;
    private final List<LineKind> kinds;
    private final LayoutMetrics metrics;
    private final List<Block> blocks = new ArrayList<>();
    private final List<TextLine> pendingLines = new ArrayList<>();
    private BlockType pendingType;
    private int lastPage = -1;

    Assembly(List<TextLine> lines, List<LineKind> kinds, LayoutMetrics metrics) {
      this.lines = lines;
      this.kinds = kinds;
      this.metrics = metrics;
    }

    List<Block> run() {
      int i = 0;
      while (i < lines.size()) {
        TextLine line = lines.get(i);
        switch (kinds.get(i)) {
          case EMPTY -> {
            flushText();
            emit(BlockType.EMPTY_LINE, line.spans(), "", null);
            i++;
          }
          case LIST_ITEM -> i = consumeList(i);
          case HEADING -> {
            flushText();
            emit(BlockType.HEADING_CANDIDATE, line.spans(), line.text(), null);
            i++;
          }
          case CODE -> i = consumeCode(i);
          case TABLE -> i = consumeTable(i);
          case CALLOUT -> {
            accumulate(BlockType.CALLOUT, line);
            i++;
          }
          case NOISE -> {
            accumulate(BlockType.RAW_NOISE, line);
            i++;
          }
          default -> {
            accumulate(BlockType.PARAGRAPH, line);
            i++;
          }
        }
      }
      flushText();
      return blocks;
    }

    private int consumeList(int start) {
      flushText();
      int end = start;
      while (end < lines.size() && kinds.get(end) == LineKind.LIST_ITEM) {
        end++;
      }
      List<TextLine> run = lines.subList(start, end);
      List<Double> positions = run.stream().map(TextLine::x0).toList();
      List<Integer> levels =
          listLevelResolver.assignLevels(
              positions, structureConfig.getBlocks().getListIndentTolerance());

      List<ListItem> items = new ArrayList<>(run.size());
      int maxLevel = 0;
      for (int k = 0; k < run.size(); k++) {
        TextLine line = run.get(k);
        int level = levels.get(k);
        maxLevel = Math.max(maxLevel, level);
        items.add(new ListItem(line.text(), line.spans(), positions.get(k), level));
      }
      String text = items.stream().map(ListItem::text).collect(Collectors.joining("\n"));
      emit(BlockType.LIST, spansOf(run), text, new ListMeta(items, maxLevel));
      return end;
    }

    private int consumeCode(int start) {
      int lastCode = start;
      int j = start;
      while (j < lines.size()
          && (kinds.get(j) == LineKind.CODE || kinds.get(j) == LineKind.EMPTY)) {
        if (kinds.get(j) == LineKind.CODE) {
          lastCode = j;
        }
        j++;
      }
      List<TextLine> run = lines.subList(start, lastCode + 1);
      long codeLines = run.stream().filter(l -> !l.isBlank()).count();

      if (codeLines < structureConfig.getBlocks().getCodeMinLines()) {
        for (TextLine line : run) {
          if (line.isBlank()) {
            flushText();
            emit(BlockType.EMPTY_LINE, line.spans(), "", null);
          } else {
            accumulate(BlockType.PARAGRAPH, line);
          }
        }
        return lastCode + 1;
      }

      flushText();
      CodeMeta.Format format =
          run.get(0).monospaceRatio() >= MONOSPACE_RATIO
              ? CodeMeta.Format.MONOSPACE
              : CodeMeta.Format.INDENTED;
      emitCode(run, format);
      return lastCode + 1;
    }

    private int consumeTable(int start) {
      int end = start;
      while (end < lines.size() && kinds.get(end) == LineKind.TABLE) {
        end++;
      }
      if (end - start < 2) {
        accumulate(BlockType.PARAGRAPH, lines.get(start));
        return end;
      }

      flushText();
      StructureConfig.Blocks settings = structureConfig.getBlocks();
      List<TextLine> run = lines.subList(start, end);
      List<List<Cell>> rows = new ArrayList<>(run.size());
      for (TextLine line : run) {
        rows.add(line.cells(settings.getTableColumnGap()));
      }
      double confidence =
          tableConfidenceScorer.score(rows, settings.getTableAlignmentTolerance());

      if (confidence >= settings.getTableConfidenceMin()) {
        List<List<String>> cells =
            rows.stream().map(row -> row.stream().map(Cell::text).toList()).toList();
        String text =
            cells.stream().map(row -> String.join(" | ", row)).collect(Collectors.joining("\n"));
        emit(BlockType.TABLE, spansOf(run), text, new TableMeta(cells, confidence));
      } else {
        log.debug(
            "Table candidate of {} rows scored {} below {}; keeping it as fenced code",
            run.size(),
            confidence,
            settings.getTableConfidenceMin());
        emitCode(run, CodeMeta.Format.FENCED_FALLBACK);
      }
      return end;
    }

    private void emitCode(List<TextLine> run, CodeMeta.Format format) {
      List<String> raw = new ArrayList<>(run.size());
      for (TextLine line : run) {
        raw.add(line.isBlank() ? "" : codeText(line, metrics.margin(line.page())));
      }
      List<String> dedented = dedent(raw);
      emit(
          BlockType.CODE_BLOCK,
          spansOf(run),
          String.join("\n", dedented),
          new CodeMeta(null, dedented, format));
    }

    private void accumulate(BlockType type, TextLine line) {
      if (pendingType != type) {
        flushText();
        pendingType = type;
      }
      pendingLines.add(line);
    }

    private void flushText() {
      if (pendingLines.isEmpty()) {
        return;
      }
      List<String> texts = pendingLines.stream().map(TextLine::text).toList();
      String text = String.join(" ", LineMerger.repairHyphenation(texts));
      emit(pendingType, spansOf(pendingLines), text, null);
      pendingLines.clear();
      pendingType = null;
    }

    private void emit(BlockType type, List<Span> spans, String text, BlockMeta meta) {
      boolean pageStart = false;
      if (type != BlockType.EMPTY_LINE && !spans.isEmpty()) {
        int page = spans.get(0).page();
        pageStart = page != lastPage;
        lastPage = page;
      }
      blocks.add(new Block(type, spans, text, meta, pageStart));
    }

    private List<Span> spansOf(List<TextLine> run) {
      List<Span> spans = new ArrayList<>();
      for (TextLine line : run) {
        spans.addAll(line.spans());
      }
      return spans;
    }
  }
}
