package com.flamingo.pdfstructure.service.manifest;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"id", "marker", "text", "page"})
public record FootnoteProjection(String id, String marker, String text, int page) {}
