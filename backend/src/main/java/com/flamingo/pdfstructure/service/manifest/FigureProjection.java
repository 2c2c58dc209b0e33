package com.flamingo.pdfstructure.service.manifest;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

/** Manifest row of one figure; caption and alt are empty strings when absent. */
@JsonPropertyOrder({"id", "filename", "caption", "alt", "page", "bbox"})
public record FigureProjection(
    String id, String filename, String caption, String alt, int page, List<Double> bbox) {}
