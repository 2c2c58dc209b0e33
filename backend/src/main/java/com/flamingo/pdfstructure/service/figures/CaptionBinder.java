package com.flamingo.pdfstructure.service.figures;

import com.flamingo.pdfstructure.config.StructureConfig;
import com.flamingo.pdfstructure.model.BoundFigure;
import com.flamingo.pdfstructure.model.CaptionCandidate;
import com.flamingo.pdfstructure.model.Figure;
import com.flamingo.pdfstructure.model.Span;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Binds each figure to its most likely caption among nearby text spans.
 *
 * <p>A candidate is a non-blank span on the figure's page whose edge-to-edge distance to the
 * figure is at most {@code structure.captions.max-distance}. Its score is the weighted sum of
 *
 * <ul>
 *   <li>distance: {@code max(0, 1 - distance / max-distance)}
 *   <li>position: 1.0 below the figure, 0.5 otherwise
 *   <li>pattern: 1.0 for caption-like text ({@code Fig.}, {@code Figure 2}, {@code Table},
 *       {@code Diagram}), 0.3 otherwise
 * </ul>
 *
 * <p>Ties fall to the candidate below the figure, then the pattern match, then the closer one.
 * Figures are independent of each other; ids follow input order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CaptionBinder {

  static final Pattern CAPTION_PATTERN =
      Pattern.compile(
          "^\\s*(?:fig(?:ure)?\\.?\\s*\\d*|table\\s*\\d*|diagram\\s*\\d*)(?:\\s*[:.]|\\s|$)",
          Pattern.CASE_INSENSITIVE);

  static final double BELOW_SCORE = 1.0;
  static final double ABOVE_SCORE = 0.5;
  static final double PATTERN_SCORE = 1.0;
  static final double NO_PATTERN_SCORE = 0.3;

  /** Best first. */
  static final Comparator<CaptionCandidate> RANKING =
      Comparator.comparingDouble(CaptionCandidate::score)
          .thenComparing(CaptionCandidate::below)
          .thenComparing(CaptionCandidate::patternMatch)
          .thenComparing(Comparator.comparingDouble(CaptionCandidate::distance).reversed())
          .reversed();

  private final StructureConfig structureConfig;

  /**
   * Binds captions and assigns ids and file names.
   *
   * @param figures figures in their stable order
   * @param spans text spans of the document
   */
  public List<BoundFigure> bind(List<Figure> figures, List<Span> spans) {
    if (figures == null || figures.isEmpty()) {
      return List.of();
    }
    FigureFileNamer namer = new FigureFileNamer(structureConfig.getCaptions().getImageFormat());
    List<BoundFigure> bound = new ArrayList<>(figures.size());
    int captioned = 0;
    for (int i = 0; i < figures.size(); i++) {
      Figure figure = figures.get(i);
      List<CaptionCandidate> candidates = rankCandidates(figure, spans);
      Figure result = figure;
      if (!candidates.isEmpty()) {
        result = figure.withCaption(candidates.get(0).text());
        captioned++;
      }
      String id = figureId(i);
      bound.add(new BoundFigure(id, namer.name(id, result.caption()), result, candidates));
    }
    log.debug("Bound captions to {} of {} figures", captioned, figures.size());
    return bound;
  }

  /** Scored candidates for one figure, best first. */
  public List<CaptionCandidate> rankCandidates(Figure figure, List<Span> spans) {
    StructureConfig.Captions settings = structureConfig.getCaptions();
    double maxDistance = settings.getMaxDistance();
    List<CaptionCandidate> candidates = new ArrayList<>();
    for (Span span : spans) {
      if (span.page() != figure.page() || span.text().isBlank()) {
        continue;
      }
      double distance = figure.bbox().distanceTo(span.bbox());
      if (distance > maxDistance) {
        continue;
      }
      boolean below = span.bbox().centerY() > figure.bbox().centerY();
      boolean pattern = CAPTION_PATTERN.matcher(span.text().strip()).find();
      double score =
          settings.getWeightDistance() * Math.max(0.0, 1.0 - distance / maxDistance)
              + settings.getWeightPosition() * (below ? BELOW_SCORE : ABOVE_SCORE)
              + settings.getWeightPattern() * (pattern ? PATTERN_SCORE : NO_PATTERN_SCORE);
      score = Math.min(1.0, Math.max(0.0, score));
      candidates.add(new CaptionCandidate(span, distance, below, pattern, score));
    }
    candidates.sort(RANKING);
    return candidates;
  }

  public static String figureId(int index) {
    return String.format("fig_%03d", index);
  }
}
