package com.flamingo.pdfstructure.model;

import java.util.List;

/**
 * One entry of a list block.
 *
 * @param text item text including its marker
 * @param spans contributing spans
 * @param xPosition x-coordinate of the item marker
 * @param level 0-based nesting level derived from marker position
 */
public record ListItem(String text, List<Span> spans, double xPosition, int level) {}
