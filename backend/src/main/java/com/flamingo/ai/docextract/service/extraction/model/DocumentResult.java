package com.flamingo.ai.docextract.service.extraction.model;

import java.util.List;

/**
 * Whole-document extraction output.
 *
 * @param units one result per input unit, in input order
 * @param fullText unit texts joined by {@link #UNIT_SEPARATOR}
 * @param statistics aggregate counters
 * @param scanned true iff no unit was {@link ContentType#NATIVE_TEXT_ONLY} or {@link
 *     ContentType#MIXED}
 * @param hasTextLayer negation of {@code scanned}
 */
public record DocumentResult(
    List<UnitResult> units,
    String fullText,
    ProcessingStatistics statistics,
    boolean scanned,
    boolean hasTextLayer) {

  public static final String UNIT_SEPARATOR = "\n\n";

  public DocumentResult {
    units = List.copyOf(units);
  }
}
