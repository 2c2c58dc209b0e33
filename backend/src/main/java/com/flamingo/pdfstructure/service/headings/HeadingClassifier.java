package com.flamingo.pdfstructure.service.headings;

import com.flamingo.pdfstructure.model.Block;
import com.flamingo.pdfstructure.model.BlockType;
import com.flamingo.pdfstructure.model.NumberingInfo;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Decides whether heading-candidate text is a heading and at which level.
 *
 * <p>Patterns are tested in order: {@code Chapter N}, {@code Part X} and {@code Appendix X} are
 * level 1; a dotted number {@code N(.N)*} is level {@code dots + 1}, capped at 6; all-caps text is
 * level 1; anything else that passed the heading gate defaults to level 1.
 */
@Slf4j
@Component
public class HeadingClassifier {

  static final int MAX_TITLE_LENGTH = 180;
  static final int MAX_LEVEL = 6;

  static final Pattern CHAPTER = Pattern.compile("^chapter\\s+\\d+", Pattern.CASE_INSENSITIVE);
  static final Pattern PART = Pattern.compile("^part\\s+\\w+", Pattern.CASE_INSENSITIVE);
  static final Pattern APPENDIX =
      Pattern.compile("^appendix\\s+[a-zA-Z]", Pattern.CASE_INSENSITIVE);
  static final Pattern DOTTED = Pattern.compile("^\\d+(?:\\.\\d+)*\\b");

  private static final Pattern GATE =
      Pattern.compile(
          "^(part\\s+\\w+|chapter\\s+\\d+|appendix\\s+[a-zA-Z]|\\d+(?:\\.\\d+){0,3})\\b",
          Pattern.CASE_INSENSITIVE);

  private static final Pattern KEYWORD =
      Pattern.compile(
          "^(chapter\\s+\\d+|part\\s+\\w+|appendix\\s+[a-zA-Z])\\b", Pattern.CASE_INSENSITIVE);

  /**
   * Heading gate: at most 180 characters, and either a numbering pattern or at least 60% of the
   * words written in capitals (words longer than two characters).
   */
  public static boolean looksLikeHeading(String text) {
    if (text == null || text.isBlank() || text.length() > MAX_TITLE_LENGTH) {
      return false;
    }
    String stripped = text.strip();
    if (GATE.matcher(stripped).find()) {
      return true;
    }
    String[] words = stripped.split("\\s+");
    long upper = 0;
    for (String word : words) {
      if (word.length() > 2 && isUpperCaseWord(word)) {
        upper++;
      }
    }
    return (double) upper / words.length >= 0.6;
  }

  /** Whether the text opens with a {@code Chapter}, {@code Part} or {@code Appendix} label. */
  public static boolean hasKeywordNumbering(String text) {
    return text != null && KEYWORD.matcher(text.strip()).find();
  }

  /** Every word longer than two characters is written in capitals. */
  public static boolean isAllCaps(String text) {
    String[] words = text.strip().split("\\s+");
    if (words.length == 0 || words[0].isEmpty()) {
      return false;
    }
    for (String word : words) {
      if (word.length() <= 2 || !isUpperCaseWord(word)) {
        return false;
      }
    }
    return true;
  }

  /** Level of a heading, or empty when the text does not pass the heading gate. */
  public OptionalInt detectLevel(String text) {
    if (!looksLikeHeading(text)) {
      return OptionalInt.empty();
    }
    String stripped = text.strip();
    if (CHAPTER.matcher(stripped).find()
        || PART.matcher(stripped).find()
        || APPENDIX.matcher(stripped).find()) {
      return OptionalInt.of(1);
    }
    Matcher dotted = DOTTED.matcher(stripped);
    if (dotted.find()) {
      int dots = dotted.group().length() - dotted.group().replace(".", "").length();
      return OptionalInt.of(Math.min(dots + 1, MAX_LEVEL));
    }
    return OptionalInt.of(1);
  }

  /**
   * Extracts headings from the heading-candidate blocks, in document order, attaching numbering
   * facts to each block.
   *
   * @param blocks every block of the document, in order
   * @param numbering document-scoped numbering state
   */
  public List<Heading> extractHeadings(List<Block> blocks, NumberingProcessor numbering) {
    List<Heading> headings = new ArrayList<>();
    for (Block block : blocks) {
      if (!block.is(BlockType.HEADING_CANDIDATE) || block.getSpans().isEmpty()) {
        continue;
      }
      String title = block.getText().strip();
      OptionalInt level = detectLevel(title);
      if (level.isEmpty()) {
        continue;
      }
      NumberingInfo info = numbering.process(block, title);
      block.attachNumbering(info);
      headings.add(new Heading(block, level.getAsInt(), title, info));
    }
    log.debug("Detected {} headings in {} blocks", headings.size(), blocks.size());
    return headings;
  }

  private static boolean isUpperCaseWord(String word) {
    boolean hasLetter = false;
    for (int i = 0; i < word.length(); i++) {
      char c = word.charAt(i);
      if (Character.isLowerCase(c)) {
        return false;
      }
      if (Character.isUpperCase(c)) {
        hasLetter = true;
      }
    }
    return hasLetter;
  }
}
