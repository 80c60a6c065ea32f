package com.flamingo.ai.docextract.service.extraction.model;

/**
 * Fusion verdict for one image.
 *
 * @param finalText fused text before sanitization
 * @param method how the text was obtained
 * @param ocrConfidence OCR confidence, null when the OCR channel was not attempted
 * @param visionConfidence vision confidence, null when the vision channel was not attempted
 * @param ocrScore composite OCR score, null unless both channels succeeded
 * @param visionScore composite vision score, null unless both channels succeeded
 */
public record FusionOutcome(
    String finalText,
    FusionMethod method,
    Double ocrConfidence,
    Double visionConfidence,
    Double ocrScore,
    Double visionScore) {

  public FusionOutcome {
    finalText = finalText == null ? "" : finalText;
  }

  /** Returns a copy carrying the sanitized text. */
  public FusionOutcome withFinalText(String text) {
    return new FusionOutcome(text, method, ocrConfidence, visionConfidence, ocrScore, visionScore);
  }
}
