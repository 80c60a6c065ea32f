package com.flamingo.ai.docextract.service.extraction.model;

/**
 * Per-call options passed through to the recognition adapters. Null fields mean "use the
 * adapter's configured default".
 *
 * @param language OCR language hint (e.g. {@code chi_sim+eng} or {@code CHN_ENG})
 * @param visionModel vision model override
 * @param prompt transcription prompt override for the vision model
 */
public record RecognitionOptions(String language, String visionModel, String prompt) {

  private static final RecognitionOptions DEFAULTS = new RecognitionOptions(null, null, null);

  public static RecognitionOptions defaults() {
    return DEFAULTS;
  }
}
