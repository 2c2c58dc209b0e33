package com.flamingo.pdfstructure.model;

import java.util.List;

/**
 * Extracted table rows.
 *
 * @param rows cell texts per row
 * @param confidence score in {@code [0, 1]} that the run really is a table
 */
public record TableMeta(List<List<String>> rows, double confidence) implements BlockMeta {}
