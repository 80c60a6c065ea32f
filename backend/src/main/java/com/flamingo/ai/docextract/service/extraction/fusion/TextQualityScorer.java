package com.flamingo.ai.docextract.service.extraction.fusion;

import com.flamingo.ai.docextract.config.ExtractionConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Scores how much a candidate text looks like real, structured document text rather than noise.
 *
 * <p>{@link #quality(String)} is in [0, 1] and blends four capped signals: length, character
 * diversity, share of CJK ideographs, and digit/punctuation density. {@link #score(String,
 * double)} combines that with the engine confidence and a length term into the composite score
 * the fusion policy compares.
 */
@Component
@RequiredArgsConstructor
public class TextQualityScorer {

  private static final String STRUCTURE_PUNCTUATION = ".,;:!?()[]{}";

  private final ExtractionConfig extractionConfig;

  /**
   * Composite score: {@code confidenceWeight * confidence + lengthWeight * min(len / lengthCap,
   * 1) + qualityWeight * quality(text)}.
   */
  public double score(String text, double confidence) {
    ExtractionConfig.Fusion fusion = extractionConfig.getFusion();
    String safe = text == null ? "" : text;
    double lengthTerm = Math.min((double) length(safe) / fusion.getLengthCap(), 1.0);
    return confidence * fusion.getConfidenceWeight()
        + lengthTerm * fusion.getLengthWeight()
        + quality(safe) * fusion.getQualityWeight();
  }

  /** Structural plausibility of a text in [0, 1]; blank text scores 0. */
  public double quality(String text) {
    if (text == null || text.isBlank()) {
      return 0.0;
    }
    ExtractionConfig.Fusion.Quality q = extractionConfig.getFusion().getQuality();

    int length = length(text);
    long unique = text.codePoints().distinct().count();
    long cjk = text.codePoints().filter(TextQualityScorer::isCjkIdeograph).count();
    long structure = text.codePoints().filter(TextQualityScorer::isStructural).count();

    double lengthScore = Math.min((double) length / q.getLengthCap(), 1.0);
    double diversityScore = Math.min((double) unique / q.getDiversityCap(), 1.0);
    double cjkScore = Math.min(((double) cjk / length) * q.getCjkMultiplier(), 1.0);
    double structureScore = Math.min((double) structure / q.getStructureCap(), 1.0);

    double quality =
        lengthScore * q.getLengthWeight()
            + diversityScore * q.getDiversityWeight()
            + cjkScore * q.getCjkWeight()
            + structureScore * q.getStructureWeight();
    return Math.min(quality, 1.0);
  }

  static int length(String text) {
    return text.codePointCount(0, text.length());
  }

  static boolean isCjkIdeograph(int codePoint) {
    return codePoint >= 0x4E00 && codePoint <= 0x9FFF;
  }

  private static boolean isStructural(int codePoint) {
    return Character.isDigit(codePoint) || STRUCTURE_PUNCTUATION.indexOf(codePoint) >= 0;
  }
}
