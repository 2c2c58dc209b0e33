package com.flamingo.pdfstructure.service.blocks;

import com.flamingo.pdfstructure.service.layout.TextLine.Cell;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Scores how much a run of column-like lines looks like a real table.
 *
 * <p>The confidence is the mean of four factors, each in {@code [0, 1]}:
 *
 * <ul>
 *   <li>column-count consistency: share of rows having the most common column count
 *   <li>column richness: maximum column count, saturating at 4
 *   <li>row richness: row count, saturating at 5
 *   <li>alignment: share of cells starting within the tolerance of a column of the widest row
 * </ul>
 */
@Component
public class TableConfidenceScorer {

  static final int SATURATING_COLUMNS = 4;
  static final int SATURATING_ROWS = 5;

  public double score(List<List<Cell>> rows, double alignmentTolerance) {
    if (rows.isEmpty()) {
      return 0.0;
    }
    return (consistency(rows)
            + columnRichness(rows)
            + rowRichness(rows)
            + alignment(rows, alignmentTolerance))
        / 4.0;
  }

  double consistency(List<List<Cell>> rows) {
    Map<Integer, Integer> frequency = new HashMap<>();
    for (List<Cell> row : rows) {
      frequency.merge(row.size(), 1, Integer::sum);
    }
    int modeCount = frequency.values().stream().mapToInt(Integer::intValue).max().orElse(0);
    return (double) modeCount / rows.size();
  }

  double columnRichness(List<List<Cell>> rows) {
    int maxColumns = rows.stream().mapToInt(List::size).max().orElse(0);
    return Math.min(maxColumns / (double) SATURATING_COLUMNS, 1.0);
  }

  double rowRichness(List<List<Cell>> rows) {
    return Math.min(rows.size() / (double) SATURATING_ROWS, 1.0);
  }

  double alignment(List<List<Cell>> rows, double tolerance) {
    List<Cell> reference = rows.get(0);
    for (List<Cell> row : rows) {
      if (row.size() > reference.size()) {
        reference = row;
      }
    }
    int total = 0;
    int aligned = 0;
    for (List<Cell> row : rows) {
      for (Cell cell : row) {
        total++;
        for (Cell column : reference) {
          if (Math.abs(cell.x() - column.x()) <= tolerance) {
            aligned++;
            break;
          }
        }
      }
    }
    return total == 0 ? 0.0 : (double) aligned / total;
  }
}
