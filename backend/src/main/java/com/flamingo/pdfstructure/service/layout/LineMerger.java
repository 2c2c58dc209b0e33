package com.flamingo.pdfstructure.service.layout;

import com.flamingo.pdfstructure.config.StructureConfig;
import com.flamingo.pdfstructure.model.Span;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Groups spans into logical lines.
 *
 * <p>Lines follow span reading order ({@code orderIndex}), not geometric row order: a new line
 * starts whenever the vertical centre of the next span moves away from the previous span's centre
 * by more than {@code structure.lines.vertical-tolerance}, or the page changes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LineMerger {

  private static final Pattern TRAILING_HYPHEN = Pattern.compile("[A-Za-z]{3,}-$");

  private final StructureConfig structureConfig;

  /** Groups spans into lines, keeping per-span detail. */
  public List<TextLine> groupLines(List<Span> spans) {
    if (spans == null || spans.isEmpty()) {
      return List.of();
    }
    double tolerance = structureConfig.getLines().getVerticalTolerance();

    List<Span> ordered = new ArrayList<>(spans);
    ordered.sort(Comparator.comparingInt(Span::orderIndex));

    List<TextLine> lines = new ArrayList<>();
    List<Span> current = new ArrayList<>();
    for (Span span : ordered) {
      if (!current.isEmpty()) {
        Span previous = current.get(current.size() - 1);
        boolean sameLine =
            previous.page() == span.page()
                && Math.abs(span.centerY() - previous.centerY()) <= tolerance;
        if (!sameLine) {
          lines.add(new TextLine(current));
          current = new ArrayList<>();
        }
      }
      current.add(span);
    }
    lines.add(new TextLine(current));

    log.debug("Grouped {} spans into {} lines", spans.size(), lines.size());
    return lines;
  }

  /** Merges spans into line texts with hyphenation repaired. Blank lines are dropped. */
  public List<String> mergeLines(List<Span> spans) {
    List<String> texts = new ArrayList<>();
    for (TextLine line : groupLines(spans)) {
      if (!line.isBlank()) {
        texts.add(line.text());
      }
    }
    return repairHyphenation(texts);
  }

  /**
   * Rejoins words hyphenated across line breaks.
   *
   * <p>A line ending in a word of three or more letters followed by a hyphen is joined with the
   * next line: the hyphen is dropped when the next line starts in lower case and kept otherwise.
   * A hyphen still pending at the end loses its hyphen.
   */
  public static List<String> repairHyphenation(List<String> lines) {
    List<String> result = new ArrayList<>();
    String pending = null;
    for (String raw : lines) {
      String line = raw.stripTrailing();
      if (pending != null) {
        if (!line.isEmpty() && Character.isLowerCase(line.charAt(0))) {
          result.add(pending + line);
        } else {
          result.add(pending + "-" + line);
        }
        pending = null;
        continue;
      }
      if (TRAILING_HYPHEN.matcher(line).find()) {
        pending = line.substring(0, line.length() - 1);
      } else {
        result.add(line);
      }
    }
    if (pending != null) {
      result.add(pending);
    }
    return result;
  }
}
