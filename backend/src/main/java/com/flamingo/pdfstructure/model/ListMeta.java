package com.flamingo.pdfstructure.model;

import java.util.List;

/**
 * Flat list items with their nesting levels; true nesting is left to the renderer.
 *
 * @param items items in document order
 * @param maxLevel deepest level present
 */
public record ListMeta(List<ListItem> items, int maxLevel) implements BlockMeta {}
