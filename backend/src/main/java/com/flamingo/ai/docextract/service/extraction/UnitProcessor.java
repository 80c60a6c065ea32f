package com.flamingo.ai.docextract.service.extraction;

import com.flamingo.ai.docextract.service.extraction.classify.ContentClassifier;
import com.flamingo.ai.docextract.service.extraction.fusion.FusionDecisionEngine;
import com.flamingo.ai.docextract.service.extraction.model.ContentClassification;
import com.flamingo.ai.docextract.service.extraction.model.ContentUnit;
import com.flamingo.ai.docextract.service.extraction.model.ExtractionMethod;
import com.flamingo.ai.docextract.service.extraction.model.ExtractionRequest;
import com.flamingo.ai.docextract.service.extraction.model.FusionOutcome;
import com.flamingo.ai.docextract.service.extraction.model.UnitResult;
import com.flamingo.ai.docextract.service.extraction.recognition.DualChannelRecognizer;
import com.flamingo.ai.docextract.service.extraction.recognition.DualChannelResult;
import com.flamingo.ai.docextract.service.extraction.sanitize.TextSanitizer;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Produces the {@link UnitResult} of one content unit.
 *
 * <p>The unit is classified first. Native text is used verbatim. Every image goes through the
 * dual-channel recognizer, the fusion engine and the sanitizer; an image-only unit's text is the
 * non-empty image texts joined by blank lines, and a mixed unit gets them appended to its native
 * text under {@link #IMAGE_TEXT_HEADER}. Any unexpected exception turns the unit into an ERROR
 * result instead of propagating.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UnitProcessor {

  static final String IMAGE_TEXT_HEADER = "[Image text]";
  static final String IMAGE_SEPARATOR = "\n\n";
  static final String MISSING_UNIT_ID = "unknown";

  private final ContentClassifier contentClassifier;
  private final DualChannelRecognizer dualChannelRecognizer;
  private final FusionDecisionEngine fusionDecisionEngine;
  private final TextSanitizer textSanitizer;
  private final MeterRegistry meterRegistry;

  /**
   * Processes one unit. Never throws.
   *
   * @param unit the unit to process
   * @param request channel choices and adapter options
   * @return the unit result, {@code ERROR}-typed if processing failed
   */
  public UnitResult process(ContentUnit unit, ExtractionRequest request) {
    if (unit == null) {
      log.warn("Processing requested for a null unit");
      meterRegistry.counter("extraction.unit.error").increment();
      return UnitResult.error(MISSING_UNIT_ID, 0, 0, "missing content unit");
    }
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      return doProcess(unit, request);
    } catch (RuntimeException e) {
      log.error("Processing failed for unit {}: {}", unit.id(), e.getMessage(), e);
      meterRegistry.counter("extraction.unit.error").increment();
      return UnitResult.error(unit.id(), unit.position(), unit.imageCount(), errorMessage(e));
    } finally {
      sample.stop(meterRegistry.timer("extraction.unit"));
    }
  }

  private UnitResult doProcess(ContentUnit unit, ExtractionRequest request) {
    ContentClassification classification = contentClassifier.classify(unit);
    log.debug(
        "Unit {} classified as {} ({} chars, {} images)",
        unit.id(),
        classification.contentType(),
        classification.nativeTextLength(),
        classification.imageCount());

    return switch (classification.contentType()) {
      case NATIVE_TEXT_ONLY ->
          result(unit, classification, unit.nativeText(), ExtractionMethod.NATIVE_TEXT, List.of());
      case IMAGE_ONLY -> {
        List<FusionOutcome> outcomes = recognizeImages(unit, request);
        yield result(
            unit,
            classification,
            joinImageTexts(outcomes),
            ExtractionMethod.IMAGE_RECOGNITION,
            outcomes);
      }
      case MIXED -> {
        List<FusionOutcome> outcomes = recognizeImages(unit, request);
        String imageText = joinImageTexts(outcomes);
        String text =
            imageText.isEmpty()
                ? unit.nativeText()
                : unit.nativeText() + "\n\n" + IMAGE_TEXT_HEADER + "\n" + imageText;
        yield result(
            unit, classification, text, ExtractionMethod.NATIVE_TEXT_WITH_RECOGNITION, outcomes);
      }
      case EMPTY, ERROR -> result(unit, classification, "", ExtractionMethod.NONE, List.of());
    };
  }

  private List<FusionOutcome> recognizeImages(ContentUnit unit, ExtractionRequest request) {
    List<FusionOutcome> outcomes = new ArrayList<>(unit.imageCount());
    int index = 0;
    for (byte[] image : unit.images()) {
      DualChannelResult channels =
          dualChannelRecognizer.recognize(
              image, request.useOcr(), request.useVision(), request.options());
      FusionOutcome fused = fusionDecisionEngine.fuse(channels.ocr(), channels.vision());
      FusionOutcome sanitized = fused.withFinalText(textSanitizer.sanitize(fused.finalText()));
      log.debug(
          "Unit {} image {}: {} -> {} chars after sanitizing",
          unit.id(),
          index++,
          sanitized.method(),
          sanitized.finalText().length());
      outcomes.add(sanitized);
    }
    return outcomes;
  }

  private static String joinImageTexts(List<FusionOutcome> outcomes) {
    return outcomes.stream()
        .map(FusionOutcome::finalText)
        .filter(text -> !text.isEmpty())
        .collect(Collectors.joining(IMAGE_SEPARATOR));
  }

  private static UnitResult result(
      ContentUnit unit,
      ContentClassification classification,
      String text,
      ExtractionMethod method,
      List<FusionOutcome> outcomes) {
    return new UnitResult(
        unit.id(),
        unit.position(),
        text,
        classification.contentType(),
        method,
        unit.imageCount(),
        outcomes,
        null);
  }

  static String errorMessage(Throwable e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }
}
