package com.flamingo.pdfstructure.model;

/**
 * Text near a figure that may be its caption.
 *
 * @param span the candidate text run
 * @param distance edge-to-edge distance to the figure
 * @param below whether the candidate's vertical centre lies below the figure's
 * @param patternMatch whether the text looks like a caption ({@code Figure 3:}, {@code Table 1})
 * @param score weighted score in {@code [0, 1]}
 */
public record CaptionCandidate(
    Span span, double distance, boolean below, boolean patternMatch, double score) {

  public String text() {
    return span.text().strip();
  }
}
