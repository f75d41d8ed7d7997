package com.memo.ontology.exception;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Structured view of a failure as printed by the command line.
 *
 * @param causes "Type: message" of the underlying causes, outermost first
 */
public record ErrorDetails(
    String type,
    MemoErrorCode code,
    String message,
    Map<String, Object> context,
    List<String> causes,
    Instant timestamp) {}
