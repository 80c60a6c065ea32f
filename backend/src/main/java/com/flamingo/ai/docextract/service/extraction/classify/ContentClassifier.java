package com.flamingo.ai.docextract.service.extraction.classify;

import com.flamingo.ai.docextract.config.ExtractionConfig;
import com.flamingo.ai.docextract.service.extraction.model.ContentClassification;
import com.flamingo.ai.docextract.service.extraction.model.ContentType;
import com.flamingo.ai.docextract.service.extraction.model.ContentUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Decides whether a content unit carries a usable text layer, images, both, or nothing.
 *
 * <p>Pure and total: malformed input degrades to {@link ContentType#EMPTY} instead of failing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContentClassifier {

  private final ExtractionConfig extractionConfig;

  public ContentClassification classify(ContentUnit unit) {
    if (unit == null) {
      log.warn("Classification requested for a null unit, treating as empty");
      return ContentClassification.empty();
    }

    try {
      String trimmed = unit.nativeText().strip();
      int textLength = trimmed.codePointCount(0, trimmed.length());
      int imageCount = unit.imageCount();
      boolean hasNativeText = textLength > extractionConfig.getClassifier().getMinTextLength();
      boolean hasImages = imageCount > 0;

      return new ContentClassification(
          hasNativeText,
          hasImages,
          textLength,
          imageCount,
          determineContentType(hasNativeText, hasImages));
    } catch (RuntimeException e) {
      log.warn("Could not classify unit {}, treating as empty: {}", unit.id(), e.getMessage());
      return ContentClassification.empty();
    }
  }

  static ContentType determineContentType(boolean hasNativeText, boolean hasImages) {
    if (hasNativeText && !hasImages) {
      return ContentType.NATIVE_TEXT_ONLY;
    }
    if (hasNativeText) {
      return ContentType.MIXED;
    }
    if (hasImages) {
      return ContentType.IMAGE_ONLY;
    }
    return ContentType.EMPTY;
  }
}
