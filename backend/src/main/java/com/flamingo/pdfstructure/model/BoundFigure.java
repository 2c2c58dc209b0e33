package com.flamingo.pdfstructure.model;

import java.util.List;

/**
 * A figure after caption binding.
 *
 * @param id stable figure id, {@code fig_000}, {@code fig_001}, ...
 * @param filename collision-free output file name
 * @param figure the figure with its bound caption (if any)
 * @param candidates every scored candidate, best first
 */
public record BoundFigure(
    String id, String filename, Figure figure, List<CaptionCandidate> candidates) {

  public String caption() {
    return figure.caption();
  }
}
