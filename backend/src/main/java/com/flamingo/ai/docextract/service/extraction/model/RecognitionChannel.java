package com.flamingo.ai.docextract.service.extraction.model;

/** The two independent recognition channels run against every image. */
public enum RecognitionChannel {
  OCR,
  VISION
}
