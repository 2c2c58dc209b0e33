package com.flamingo.pdfstructure.model;

/**
 * A footnote body found in the document.
 *
 * @param marker reference marker as printed, e.g. {@code 1} or {@code *}
 * @param text footnote text
 * @param page 1-based page of the footnote body
 */
public record Footnote(String marker, String text, int page) {}
