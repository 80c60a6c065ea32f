package com.flamingo.ai.docextract.service.extraction.model;

import java.util.List;

/**
 * Extraction result for one content unit.
 *
 * @param unitId id of the source unit
 * @param position position of the source unit
 * @param finalText user-facing text (empty when nothing usable was found)
 * @param contentType classification, or {@link ContentType#ERROR}
 * @param extractionMethod how the text was produced
 * @param imageCount number of images in the unit
 * @param imageOutcomes one sanitized fusion outcome per processed image, in image order
 * @param error failure message for {@link ContentType#ERROR} results, otherwise null
 */
public record UnitResult(
    String unitId,
    int position,
    String finalText,
    ContentType contentType,
    ExtractionMethod extractionMethod,
    int imageCount,
    List<FusionOutcome> imageOutcomes,
    String error) {

  public static final String ERROR_TEXT_FORMAT = "[Processing failed: %s]";

  public UnitResult {
    finalText = finalText == null ? "" : finalText;
    imageOutcomes = imageOutcomes == null ? List.of() : List.copyOf(imageOutcomes);
  }

  public static UnitResult error(String unitId, int position, int imageCount, String message) {
    return new UnitResult(
        unitId,
        position,
        String.format(ERROR_TEXT_FORMAT, message),
        ContentType.ERROR,
        ExtractionMethod.ERROR,
        imageCount,
        List.of(),
        message);
  }

  public boolean isError() {
    return contentType == ContentType.ERROR;
  }
}
