package com.flamingo.pdfstructure.service.manifest;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

/** Manifest row of one section. {@code orderIndex} is the 1-based pre-order position. */
@JsonPropertyOrder({"id", "slug", "parent_id", "level", "order_index", "title", "page_span"})
public record SectionProjection(
    String id,
    String slug,
    @JsonProperty("parent_id") String parentId,
    int level,
    @JsonProperty("order_index") int orderIndex,
    String title,
    @JsonProperty("page_span") List<Integer> pageSpan) {}
