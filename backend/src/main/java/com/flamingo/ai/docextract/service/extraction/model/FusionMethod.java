package com.flamingo.ai.docextract.service.extraction.model;

/** How the final text of one image was obtained from the two recognition channels. */
public enum FusionMethod {
  OCR_ONLY,
  VISION_ONLY,
  INTELLIGENT_MERGE,
  OCR_ENHANCED,
  VISION_ENHANCED,
  BOTH_FAILED
}
