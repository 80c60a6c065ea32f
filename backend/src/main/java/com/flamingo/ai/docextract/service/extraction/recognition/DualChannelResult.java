package com.flamingo.ai.docextract.service.extraction.recognition;

import com.flamingo.ai.docextract.service.extraction.model.RecognitionResult;

/**
 * Results of both recognition channels for one image. A null result means the channel was not
 * attempted, which is distinct from a failed attempt.
 *
 * @param ocr OCR result, or null when not attempted
 * @param vision vision-model result, or null when not attempted
 */
public record DualChannelResult(RecognitionResult ocr, RecognitionResult vision) {

  public static DualChannelResult notAttempted() {
    return new DualChannelResult(null, null);
  }
}
