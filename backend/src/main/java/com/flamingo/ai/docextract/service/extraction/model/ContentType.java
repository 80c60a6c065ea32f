package com.flamingo.ai.docextract.service.extraction.model;

/** What a content unit holds, as decided by the classifier. */
public enum ContentType {
  NATIVE_TEXT_ONLY,
  MIXED,
  IMAGE_ONLY,
  EMPTY,

  /** Only carried by unit results whose pipeline failed; never produced by classification. */
  ERROR
}
