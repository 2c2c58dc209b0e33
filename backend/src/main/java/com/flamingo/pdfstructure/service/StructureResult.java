package com.flamingo.pdfstructure.service;

import com.flamingo.pdfstructure.model.BoundFigure;
import com.flamingo.pdfstructure.model.SectionTree;
import com.flamingo.pdfstructure.service.diagnostics.DiagnosticEvent;
import com.flamingo.pdfstructure.service.manifest.Manifest;
import java.util.List;

/**
 * Outcome of one document conversion.
 *
 * @param tree frozen section tree
 * @param figures figures with bound captions, ids and file names
 * @param manifest manifest including the structural hash
 * @param diagnostics numbering anomalies, in the order they were found
 * @param frontMatterBlocks blocks before the first heading, which the tree leaves out
 */
public record StructureResult(
    SectionTree tree,
    List<BoundFigure> figures,
    Manifest manifest,
    List<DiagnosticEvent> diagnostics,
    int frontMatterBlocks) {}
