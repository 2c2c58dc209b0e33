package com.flamingo.pdfstructure.exception;

import com.flamingo.pdfstructure.service.diagnostics.DiagnosticEvent;
import java.util.List;

/** Thrown when a numbering anomaly configured as strict is found in a document. */
public class NumberingViolationException extends StructureException {

  private final transient List<DiagnosticEvent> violations;

  public NumberingViolationException(List<DiagnosticEvent> violations) {
    super(
        Category.PARSE,
        "numbering_strict_violation",
        "Strict numbering violations: "
            + violations.stream().map(e -> e.category().name()).distinct().toList());
    this.violations = List.copyOf(violations);
  }

  public List<DiagnosticEvent> getViolations() {
    return violations;
  }
}
