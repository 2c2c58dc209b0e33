package com.flamingo.pdfstructure.service.headings;

import com.flamingo.pdfstructure.config.StructureConfig;
import com.flamingo.pdfstructure.model.Block;
import com.flamingo.pdfstructure.model.NumberingInfo;
import com.flamingo.pdfstructure.service.diagnostics.DiagnosticCategory;
import com.flamingo.pdfstructure.service.diagnostics.Diagnostics;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Validates and normalises chapter, appendix and dotted section numbering.
 *
 * <p>Carries state across the whole document and must see headings strictly in document order.
 * One instance serves exactly one conversion; anomalies go to the supplied {@link Diagnostics}
 * and never abort processing.
 */
@Slf4j
public class NumberingProcessor {

  private static final Pattern CHAPTER =
      Pattern.compile("^chapter\\s+(\\d+)", Pattern.CASE_INSENSITIVE);
  private static final Pattern PART = Pattern.compile("^part\\s+(\\w+)", Pattern.CASE_INSENSITIVE);
  private static final Pattern APPENDIX =
      Pattern.compile("^appendix\\s+([a-zA-Z])\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern DOTTED = Pattern.compile("^(\\d+(?:\\.\\d+)*)\\b");

  private final StructureConfig.Numbering settings;
  private final Diagnostics diagnostics;

  private int globalChapterCounter;
  private boolean chapterSeen;
  private final Set<Integer> seenChapterNumbers = new HashSet<>();
  private final Set<Character> seenAppendixLetters = new LinkedHashSet<>();
  private char lastAppendixLetter;

  /** Highest last segment seen per dotted prefix, e.g. {@code "3" -> 2} after {@code 3.2}. */
  private final Map<String, Integer> highestByPrefix = new HashMap<>();

  public NumberingProcessor(StructureConfig.Numbering settings, Diagnostics diagnostics) {
    this.settings = settings;
    this.diagnostics = diagnostics;
  }

  /**
   * Extracts the numbering facts of one heading.
   *
   * @param block the heading block, used for the appendix page-break rule
   * @param text the heading text
   */
  public NumberingInfo process(Block block, String text) {
    String stripped = text.strip();
    NumberingInfo.NumberingInfoBuilder info = NumberingInfo.builder();

    Matcher chapter = CHAPTER.matcher(stripped);
    if (chapter.find()) {
      parseNumber(chapter.group(1), stripped).ifPresent(n -> processChapter(n, info));
    }

    Matcher part = PART.matcher(stripped);
    if (part.find()) {
      info.partLabel(part.group(1));
    }

    Matcher appendix = APPENDIX.matcher(stripped);
    if (appendix.find()) {
      char letter = Character.toUpperCase(appendix.group(1).charAt(0));
      processAppendix(block, letter, stripped, info);
    }

    Matcher dotted = DOTTED.matcher(stripped);
    if (dotted.find()) {
      processSectionPath(dotted.group(1), stripped, info);
    }

    return info.build();
  }

  public int getGlobalChapterCounter() {
    return globalChapterCounter;
  }

  private void processChapter(int explicitNumber, NumberingInfo.NumberingInfoBuilder info) {
    chapterSeen = true;
    if (!seenChapterNumbers.add(explicitNumber)) {
      diagnostics.record(
          DiagnosticCategory.DUPLICATE_CHAPTER_NUMBER,
          "Chapter number " + explicitNumber + " appears more than once",
          "explicit_number",
          explicitNumber);
    }
    if (!settings.isAllowChapterResets() && explicitNumber <= globalChapterCounter) {
      diagnostics.record(
          DiagnosticCategory.CHAPTER_NUMBER_RESET,
          "Chapter " + explicitNumber + " does not continue from chapter " + globalChapterCounter,
          "explicit_number",
          explicitNumber,
          "global_counter",
          globalChapterCounter);
    }
    globalChapterCounter++;
    info.chapterNumber(globalChapterCounter).explicitChapterNumber(explicitNumber);
  }

  private void processAppendix(
      Block block, char letter, String text, NumberingInfo.NumberingInfoBuilder info) {
    if (!chapterSeen) {
      diagnostics.record(
          DiagnosticCategory.APPENDIX_BEFORE_FIRST_CHAPTER,
          "Appendix " + letter + " precedes the first chapter and is ignored",
          "letter",
          String.valueOf(letter),
          "text",
          text);
      return;
    }
    if (settings.isAppendixRequiresPageBreak() && !block.isPageStart()) {
      diagnostics.record(
          DiagnosticCategory.APPENDIX_MISSING_PAGE_BREAK,
          "Appendix " + letter + " does not start a page",
          "letter",
          String.valueOf(letter),
          "text",
          text);
      return;
    }
    if (seenAppendixLetters.contains(letter)) {
      diagnostics.record(
          DiagnosticCategory.APPENDIX_DUPLICATE_LETTER,
          "Appendix " + letter + " was already used",
          "letter",
          String.valueOf(letter),
          "text",
          text);
      return;
    }
    char expected = (char) (lastAppendixLetter + 1);
    if (!seenAppendixLetters.isEmpty() && letter != expected) {
      diagnostics.record(
          DiagnosticCategory.APPENDIX_OUT_OF_ORDER,
          "Appendix " + letter + " breaks alphabetical order, expected " + expected,
          "letter",
          String.valueOf(letter),
          "expected",
          String.valueOf(expected));
    }
    seenAppendixLetters.add(letter);
    lastAppendixLetter = letter;
    info.appendixLetter(String.valueOf(letter));
    log.debug("Appendix {} detected", letter);
  }

  private void processSectionPath(
      String dottedText, String text, NumberingInfo.NumberingInfoBuilder info) {
    List<Integer> segments = new ArrayList<>();
    for (String part : dottedText.split("\\.")) {
      OptionalInt segment = parseNumber(part, text);
      if (segment.isEmpty()) {
        return;
      }
      segments.add(segment.getAsInt());
    }
    int maxDepth = settings.getMaxDepth();
    if (segments.size() > maxDepth) {
      diagnostics.record(
          DiagnosticCategory.SECTION_PATH_TRUNCATED,
          "Section path " + dottedText + " is deeper than " + maxDepth,
          "section_path",
          dottedText,
          "max_depth",
          maxDepth);
      segments = new ArrayList<>(segments.subList(0, maxDepth));
      info.sectionPathTruncated(true);
    }
    info.sectionPath(segments);

    if (settings.isValidateGaps() && segments.size() >= 2) {
      checkGap(segments);
    }
  }

  private void checkGap(List<Integer> segments) {
    String prefix =
        segments.subList(0, segments.size() - 1).stream()
            .map(String::valueOf)
            .collect(Collectors.joining("."));
    int current = segments.get(segments.size() - 1);
    Integer previous = highestByPrefix.get(prefix);
    if (previous != null && current - previous > 1) {
      diagnostics.record(
          DiagnosticCategory.SECTION_GAP,
          "Section " + prefix + "." + current + " follows " + prefix + "." + previous,
          "section_path",
          prefix + "." + current,
          "previous",
          previous,
          "current",
          current);
    }
    highestByPrefix.merge(prefix, current, Math::max);
  }

  /** Parses a heading number; numbers beyond {@code int} range are reported and skipped. */
  private OptionalInt parseNumber(String digits, String text) {
    try {
      return OptionalInt.of(Integer.parseInt(digits));
    } catch (NumberFormatException e) {
      diagnostics.record(
          DiagnosticCategory.NUMBER_OUT_OF_RANGE,
          "Heading number " + digits + " is out of range and was ignored",
          "number",
          digits,
          "text",
          text);
      return OptionalInt.empty();
    }
  }
}
