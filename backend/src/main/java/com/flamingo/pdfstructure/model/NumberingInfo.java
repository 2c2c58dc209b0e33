package com.flamingo.pdfstructure.model;

import java.util.List;
import lombok.Builder;

/**
 * Numbering facts detected on a heading block.
 *
 * @param chapterNumber value of the global chapter counter, {@code null} if not a chapter
 * @param explicitChapterNumber number written in the heading text
 * @param partLabel label of a {@code Part X} heading
 * @param appendixLetter upper-case appendix letter, {@code null} when absent or demoted
 * @param sectionPath dotted section path, truncated to the configured maximum depth
 * @param sectionPathTruncated whether the written path was deeper than the maximum depth
 */
@Builder(toBuilder = true)
public record NumberingInfo(
    Integer chapterNumber,
    Integer explicitChapterNumber,
    String partLabel,
    String appendixLetter,
    List<Integer> sectionPath,
    boolean sectionPathTruncated) {

  public static final NumberingInfo NONE = NumberingInfo.builder().build();

  public NumberingInfo {
    sectionPath = sectionPath == null ? List.of() : List.copyOf(sectionPath);
  }

  public boolean isAppendix() {
    return appendixLetter != null;
  }
}
