package com.flamingo.pdfstructure.model;

import java.util.List;

/**
 * Inclusive range of 1-based page numbers.
 *
 * @param first first page
 * @param last last page
 */
public record PageSpan(int first, int last) {

  public static PageSpan of(int page) {
    return new PageSpan(page, page);
  }

  public PageSpan union(PageSpan other) {
    return new PageSpan(Math.min(first, other.first), Math.max(last, other.last));
  }

  public List<Integer> toList() {
    return List.of(first, last);
  }

  public static PageSpan covering(List<Span> spans) {
    if (spans.isEmpty()) {
      return new PageSpan(0, 0);
    }
    int first = Integer.MAX_VALUE;
    int last = Integer.MIN_VALUE;
    for (Span span : spans) {
      first = Math.min(first, span.page());
      last = Math.max(last, span.page());
    }
    return new PageSpan(first, last);
  }
}
