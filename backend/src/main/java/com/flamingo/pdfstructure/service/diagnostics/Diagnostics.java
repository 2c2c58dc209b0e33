package com.flamingo.pdfstructure.service.diagnostics;

import com.flamingo.pdfstructure.exception.NumberingViolationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Collects the anomalies of one document conversion so callers can inspect them as data.
 *
 * <p>Each event is also logged at WARN. Instances are document-scoped and not thread-safe.
 */
@Slf4j
public class Diagnostics {

  private final List<DiagnosticEvent> events = new ArrayList<>();

  /**
   * Records an anomaly.
   *
   * @param category anomaly kind
   * @param message summary
   * @param keyValues alternating detail keys and values
   */
  public DiagnosticEvent record(DiagnosticCategory category, String message, Object... keyValues) {
    if (keyValues.length % 2 != 0) {
      throw new IllegalArgumentException("Details must be key/value pairs");
    }
    Map<String, Object> details = new LinkedHashMap<>();
    for (int i = 0; i < keyValues.length; i += 2) {
      details.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
    }
    DiagnosticEvent event =
        new DiagnosticEvent(category, message, Collections.unmodifiableMap(details));
    events.add(event);
    log.warn("{}: {} {}", category, message, details);
    return event;
  }

  public List<DiagnosticEvent> events() {
    return List.copyOf(events);
  }

  public List<DiagnosticEvent> eventsOf(DiagnosticCategory category) {
    return events.stream().filter(e -> e.category() == category).toList();
  }

  public boolean isEmpty() {
    return events.isEmpty();
  }

  /**
   * Fails when any recorded event belongs to a category promoted to a hard failure.
   *
   * @throws NumberingViolationException listing the offending events
   */
  public void failOnStrict(Set<DiagnosticCategory> strictCategories) {
    if (strictCategories == null || strictCategories.isEmpty()) {
      return;
    }
    List<DiagnosticEvent> violations =
        events.stream().filter(e -> strictCategories.contains(e.category())).toList();
    if (!violations.isEmpty()) {
      throw new NumberingViolationException(violations);
    }
  }
}
