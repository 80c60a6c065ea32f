package com.flamingo.ai.docextract.service.extraction.fusion;

import com.flamingo.ai.docextract.config.ExtractionConfig;
import com.flamingo.ai.docextract.service.extraction.model.FusionMethod;
import com.flamingo.ai.docextract.service.extraction.model.FusionOutcome;
import com.flamingo.ai.docextract.service.extraction.model.RecognitionResult;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.LinkedHashSet;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Selects, merges or rejects the two recognition candidates of one image.
 *
 * <p>Decision table, first match wins:
 *
 * <ul>
 *   <li>both succeeded: intelligent merge
 *   <li>only OCR succeeded: OCR text verbatim, {@link FusionMethod#OCR_ONLY}
 *   <li>only vision succeeded: vision text verbatim, {@link FusionMethod#VISION_ONLY}
 *   <li>neither: empty text, {@link FusionMethod#BOTH_FAILED}
 * </ul>
 *
 * <p>The intelligent merge compares composite scores from {@link TextQualityScorer}, because the
 * engines' self-reported confidences are not comparable with each other. Scores within the tie
 * band are merged line by line; otherwise the higher-scoring text leads and the other is appended
 * as a marked supplement unless the leader is already much longer.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FusionDecisionEngine {

  public static final String VISION_SUPPLEMENT_MARKER = "[Vision supplement]";
  public static final String OCR_SUPPLEMENT_MARKER = "[OCR supplement]";

  private final TextQualityScorer textQualityScorer;
  private final ExtractionConfig extractionConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Fuses the channel results of one image.
   *
   * @param ocr OCR result, null when not attempted
   * @param vision vision result, null when not attempted
   * @return the fusion outcome, never null
   */
  public FusionOutcome fuse(RecognitionResult ocr, RecognitionResult vision) {
    boolean ocrSuccess = ocr != null && ocr.success();
    boolean visionSuccess = vision != null && vision.success();
    Double ocrConfidence = ocr != null ? ocr.confidence() : null;
    Double visionConfidence = vision != null ? vision.confidence() : null;

    FusionOutcome outcome;
    if (ocrSuccess && visionSuccess) {
      outcome = intelligentMerge(ocr, vision);
    } else if (ocrSuccess) {
      outcome =
          new FusionOutcome(
              ocr.text(), FusionMethod.OCR_ONLY, ocrConfidence, visionConfidence, null, null);
    } else if (visionSuccess) {
      outcome =
          new FusionOutcome(
              vision.text(), FusionMethod.VISION_ONLY, ocrConfidence, visionConfidence, null, null);
    } else {
      log.warn("Both channels failed - OCR: {}, vision: {}", describe(ocr), describe(vision));
      outcome =
          new FusionOutcome(
              "", FusionMethod.BOTH_FAILED, ocrConfidence, visionConfidence, null, null);
    }

    meterRegistry
        .counter("extraction.fusion.outcome", "method", outcome.method().name())
        .increment();
    return outcome;
  }

  private FusionOutcome intelligentMerge(RecognitionResult ocr, RecognitionResult vision) {
    ExtractionConfig.Fusion fusion = extractionConfig.getFusion();
    String ocrText = ocr.text().strip();
    String visionText = vision.text().strip();

    double ocrScore = textQualityScorer.score(ocrText, ocr.confidence());
    double visionScore = textQualityScorer.score(visionText, vision.confidence());
    log.debug(
        "Fusion scores: ocr={} ({} chars), vision={} ({} chars)",
        String.format("%.3f", ocrScore),
        ocrText.length(),
        String.format("%.3f", visionScore),
        visionText.length());

    String text;
    FusionMethod method;
    if (Math.abs(ocrScore - visionScore) < fusion.getTieBand()) {
      text = mergeLines(ocrText, visionText);
      method = FusionMethod.INTELLIGENT_MERGE;
    } else if (ocrScore > visionScore) {
      text = enhance(ocrText, visionText, VISION_SUPPLEMENT_MARKER, fusion.getDominanceRatio());
      method = FusionMethod.OCR_ENHANCED;
    } else {
      text = enhance(visionText, ocrText, OCR_SUPPLEMENT_MARKER, fusion.getDominanceRatio());
      method = FusionMethod.VISION_ENHANCED;
    }
    log.info("Both channels succeeded, fusion chose {}", method);

    return new FusionOutcome(
        text, method, ocr.confidence(), vision.confidence(), ocrScore, visionScore);
  }

  /** Non-empty trimmed lines of both texts, first text first, exact repeats removed. */
  static String mergeLines(String first, String second) {
    Set<String> lines = new LinkedHashSet<>();
    addLines(lines, first);
    addLines(lines, second);
    return String.join("\n", lines);
  }

  /**
   * Returns {@code primary} alone when it is more than {@code dominanceRatio} times longer than
   * {@code secondary} (or the secondary is blank), else the primary followed by the marked
   * secondary.
   */
  static String enhance(String primary, String secondary, String marker, double dominanceRatio) {
    if (secondary.isBlank()
        || TextQualityScorer.length(primary)
            > TextQualityScorer.length(secondary) * dominanceRatio) {
      return primary;
    }
    return primary + "\n\n" + marker + "\n" + secondary;
  }

  private static void addLines(Set<String> lines, String text) {
    for (String line : text.split("\\R")) {
      String trimmed = line.strip();
      if (!trimmed.isEmpty()) {
        lines.add(trimmed);
      }
    }
  }

  private static String describe(RecognitionResult result) {
    return result == null ? "not attempted" : result.error();
  }
}
