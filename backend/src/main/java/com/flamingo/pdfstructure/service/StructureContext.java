package com.flamingo.pdfstructure.service;

import com.flamingo.pdfstructure.config.StructureConfig;
import com.flamingo.pdfstructure.service.diagnostics.Diagnostics;
import com.flamingo.pdfstructure.service.headings.NumberingProcessor;
import com.flamingo.pdfstructure.service.slug.SlugAllocator;

/**
 * Document-scoped mutable state of one conversion.
 *
 * <p>Numbering counters and slug collision counters depend on document order, so every
 * conversion builds a fresh context and threads it through the pipeline. Never share an instance
 * between documents.
 *
 * @param numbering chapter, appendix and section-path state
 * @param slugs slug collision counters
 * @param diagnostics anomalies found so far
 */
public record StructureContext(
    NumberingProcessor numbering, SlugAllocator slugs, Diagnostics diagnostics) {

  public static StructureContext create(StructureConfig config) {
    Diagnostics diagnostics = new Diagnostics();
    return new StructureContext(
        new NumberingProcessor(config.getNumbering(), diagnostics),
        new SlugAllocator(config.getSlugs().getPrefixWidth()),
        diagnostics);
  }
}
