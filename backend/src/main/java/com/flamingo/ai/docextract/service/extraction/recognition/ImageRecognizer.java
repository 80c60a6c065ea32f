package com.flamingo.ai.docextract.service.extraction.recognition;

import com.flamingo.ai.docextract.service.extraction.model.RecognitionChannel;
import com.flamingo.ai.docextract.service.extraction.model.RecognitionOptions;
import com.flamingo.ai.docextract.service.extraction.model.RecognitionResult;

/**
 * Capability to read the text in an image and report how confident the engine is.
 *
 * <p>Implementations wrap an external engine (local OCR, cloud OCR, vision-language model). They
 * are synchronous and may block on I/O, must be safe for concurrent use, and must never throw:
 * every failure is reported as a result with {@code success=false} and an error message.
 */
public interface ImageRecognizer {

  /** Opaque engine identifier used in logs and statistics. */
  String engineId();

  /** The channel this recognizer serves. */
  RecognitionChannel channel();

  /**
   * Whether the engine is configured well enough to be called (credentials present, model
   * built). Unavailable recognizers are skipped rather than called.
   */
  boolean isAvailable();

  /**
   * Recognises the text in an image.
   *
   * @param image encoded image bytes (PNG, JPEG, ...); must not be modified
   * @param options per-call options
   * @return the recognition result, never null
   */
  RecognitionResult recognize(byte[] image, RecognitionOptions options);
}
