package com.flamingo.ai.docextract.service.extraction.model;

/**
 * Caller choices for one extraction.
 *
 * @param useOcr run the OCR channel on images
 * @param useVision run the vision-model channel on images
 * @param options options passed to the recognition adapters
 */
public record ExtractionRequest(boolean useOcr, boolean useVision, RecognitionOptions options) {

  public ExtractionRequest {
    options = options == null ? RecognitionOptions.defaults() : options;
  }

  public static ExtractionRequest of(boolean useOcr, boolean useVision) {
    return new ExtractionRequest(useOcr, useVision, RecognitionOptions.defaults());
  }
}
