package com.flamingo.pdfstructure.service.diagnostics;

import java.util.Map;

/**
 * A single structured anomaly.
 *
 * @param category what went wrong
 * @param message human-readable summary
 * @param details the explicit values involved, in insertion order
 */
public record DiagnosticEvent(
    DiagnosticCategory category, String message, Map<String, Object> details) {}
