package com.flamingo.ai.docextract.service.extraction.model;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate counters for one processed document.
 *
 * @param contentTypeCounts units per content type (every type present, possibly zero)
 * @param extractionMethodCounts units per extraction method (every method present)
 * @param fusionMethodCounts images per fusion method (every method present)
 * @param totalUnits number of units
 * @param totalImages number of images across all units
 * @param elapsedMillis wall-clock processing time
 */
public record ProcessingStatistics(
    Map<ContentType, Integer> contentTypeCounts,
    Map<ExtractionMethod, Integer> extractionMethodCounts,
    Map<FusionMethod, Integer> fusionMethodCounts,
    int totalUnits,
    int totalImages,
    long elapsedMillis) {

  /** Tallies the given unit results. */
  public static ProcessingStatistics of(List<UnitResult> units, long elapsedMillis) {
    Map<ContentType, Integer> contentTypes = zeroed(ContentType.class);
    Map<ExtractionMethod, Integer> methods = zeroed(ExtractionMethod.class);
    Map<FusionMethod, Integer> fusions = zeroed(FusionMethod.class);
    int images = 0;

    for (UnitResult unit : units) {
      contentTypes.merge(unit.contentType(), 1, Integer::sum);
      methods.merge(unit.extractionMethod(), 1, Integer::sum);
      images += unit.imageCount();
      for (FusionOutcome outcome : unit.imageOutcomes()) {
        fusions.merge(outcome.method(), 1, Integer::sum);
      }
    }

    return new ProcessingStatistics(
        Map.copyOf(contentTypes),
        Map.copyOf(methods),
        Map.copyOf(fusions),
        units.size(),
        images,
        elapsedMillis);
  }

  public int count(ContentType type) {
    return contentTypeCounts.getOrDefault(type, 0);
  }

  public int count(ExtractionMethod method) {
    return extractionMethodCounts.getOrDefault(method, 0);
  }

  public int count(FusionMethod method) {
    return fusionMethodCounts.getOrDefault(method, 0);
  }

  private static <E extends Enum<E>> Map<E, Integer> zeroed(Class<E> type) {
    Map<E, Integer> map = new EnumMap<>(type);
    for (E value : type.getEnumConstants()) {
      map.put(value, 0);
    }
    return map;
  }
}
