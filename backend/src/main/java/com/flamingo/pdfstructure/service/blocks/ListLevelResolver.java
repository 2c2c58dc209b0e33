package com.flamingo.pdfstructure.service.blocks;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

/**
 * Assigns nesting levels to list items by clustering their marker x-positions.
 *
 * <p>Positions are sorted left to right and a position joins the current cluster while it lies
 * within the tolerance of the previous one. Clusters are numbered in that order, so the leftmost
 * marker column is level 0.
 */
@Component
public class ListLevelResolver {

  /**
   * Returns one level per input position, in input order.
   *
   * @param xPositions marker x-coordinates in document order
   * @param tolerance maximum distance between neighbouring positions of one cluster
   */
  public List<Integer> assignLevels(List<Double> xPositions, double tolerance) {
    TreeSet<Double> sorted = new TreeSet<>(xPositions);
    List<Double> clusterStarts = new ArrayList<>();
    List<Double> clusterEnds = new ArrayList<>();
    for (double x : sorted) {
      int last = clusterEnds.size() - 1;
      if (last >= 0 && x - clusterEnds.get(last) <= tolerance) {
        clusterEnds.set(last, x);
      } else {
        clusterStarts.add(x);
        clusterEnds.add(x);
      }
    }

    List<Integer> levels = new ArrayList<>(xPositions.size());
    for (double x : xPositions) {
      int level = 0;
      for (int i = 0; i < clusterStarts.size(); i++) {
        if (x >= clusterStarts.get(i) && x <= clusterEnds.get(i)) {
          level = i;
          break;
        }
      }
      levels.add(level);
    }
    return levels;
  }
}
