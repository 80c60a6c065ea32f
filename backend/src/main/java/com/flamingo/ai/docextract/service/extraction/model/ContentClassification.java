package com.flamingo.ai.docextract.service.extraction.model;

/**
 * Classifier verdict for one content unit. Computed per unit and never persisted.
 *
 * @param hasNativeText trimmed native text is longer than the minimum text length
 * @param hasImages the unit carries at least one image
 * @param nativeTextLength length of the trimmed native text
 * @param imageCount number of images in the unit
 * @param contentType the resulting content type
 */
public record ContentClassification(
    boolean hasNativeText,
    boolean hasImages,
    int nativeTextLength,
    int imageCount,
    ContentType contentType) {

  public static ContentClassification empty() {
    return new ContentClassification(false, false, 0, 0, ContentType.EMPTY);
  }
}
