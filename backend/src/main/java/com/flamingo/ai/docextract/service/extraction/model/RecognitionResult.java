package com.flamingo.ai.docextract.service.extraction.model;

/**
 * Outcome of a single recognition call.
 *
 * @param engineId opaque engine identifier, used for logging and statistics only
 * @param text recognised text (never null; empty on failure)
 * @param confidence engine-reported confidence in [0, 1]
 * @param success whether the engine produced a usable answer
 * @param error failure description, null on success
 */
public record RecognitionResult(
    String engineId, String text, double confidence, boolean success, String error) {

  public static final String TIMEOUT = "timeout";

  public RecognitionResult {
    text = text == null ? "" : text;
    if (Double.isNaN(confidence)) {
      confidence = 0.0;
    }
    confidence = Math.max(0.0, Math.min(1.0, confidence));
  }

  public static RecognitionResult success(String engineId, String text, double confidence) {
    return new RecognitionResult(engineId, text, confidence, true, null);
  }

  public static RecognitionResult failure(String engineId, String error) {
    return new RecognitionResult(engineId, "", 0.0, false, error);
  }

  public static RecognitionResult timeout(String engineId) {
    return failure(engineId, TIMEOUT);
  }

  public boolean isTimeout() {
    return !success && TIMEOUT.equals(error);
  }
}
