package com.flamingo.ai.docextract.service.extraction.model;

/** How the text of a whole unit was produced. */
public enum ExtractionMethod {
  NATIVE_TEXT,
  NATIVE_TEXT_WITH_RECOGNITION,
  IMAGE_RECOGNITION,
  NONE,
  ERROR
}
