package com.flamingo.ai.docextract.service.extraction.fusion;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.docextract.config.ExtractionConfig;
import com.flamingo.ai.docextract.service.extraction.model.FusionMethod;
import com.flamingo.ai.docextract.service.extraction.model.FusionOutcome;
import com.flamingo.ai.docextract.service.extraction.model.RecognitionResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("FusionDecisionEngine Tests")
class FusionDecisionEngineTest {

  private ExtractionConfig config;
  private SimpleMeterRegistry meterRegistry;
  private FusionDecisionEngine engine;

  @BeforeEach
  void setUp() {
    config = new ExtractionConfig();
    meterRegistry = new SimpleMeterRegistry();
    engine = new FusionDecisionEngine(new TextQualityScorer(config), config, meterRegistry);
  }

  private static RecognitionResult ocr(String text, double confidence) {
    return RecognitionResult.success("tesseract", text, confidence);
  }

  private static RecognitionResult vision(String text, double confidence) {
    return RecognitionResult.success("vision:qwen-vl-plus", text, confidence);
  }

  @Nested
  @DisplayName("Decision table")
  class DecisionTable {

    @Test
    @DisplayName("Should return OCR text verbatim when only OCR succeeded")
    void shouldReturnOcrVerbatim() {
      FusionOutcome outcome =
          engine.fuse(
              ocr("  Invoice 4521 \n", 0.8), RecognitionResult.failure("vision:x", "boom"));

      assertThat(outcome.method()).isEqualTo(FusionMethod.OCR_ONLY);
      assertThat(outcome.finalText()).isEqualTo("  Invoice 4521 \n");
      assertThat(outcome.ocrConfidence()).isEqualTo(0.8);
      assertThat(outcome.visionConfidence()).isZero();
      assertThat(outcome.ocrScore()).isNull();
    }

    @Test
    @DisplayName("Should return vision text verbatim when OCR timed out")
    void shouldReturnVisionVerbatimWhenOcrTimedOut() {
      FusionOutcome outcome =
          engine.fuse(RecognitionResult.timeout("tesseract"), vision("Total Due: 230.00", 0.92));

      assertThat(outcome.method()).isEqualTo(FusionMethod.VISION_ONLY);
      assertThat(outcome.finalText()).isEqualTo("Total Due: 230.00");
      assertThat(outcome.visionConfidence()).isEqualTo(0.92);
    }

    @Test
    @DisplayName("Should treat a channel that was not attempted like a failed one")
    void shouldTreatNotAttemptedAsFailed() {
      FusionOutcome outcome = engine.fuse(null, vision("Receipt", 1.0));

      assertThat(outcome.method()).isEqualTo(FusionMethod.VISION_ONLY);
      assertThat(outcome.ocrConfidence()).isNull();
    }

    @Test
    @DisplayName("Should return empty text when both channels failed")
    void shouldReturnEmptyWhenBothFailed() {
      FusionOutcome outcome =
          engine.fuse(
              RecognitionResult.failure("tesseract", "no text recognised"),
              RecognitionResult.timeout("vision:x"));

      assertThat(outcome.method()).isEqualTo(FusionMethod.BOTH_FAILED);
      assertThat(outcome.finalText()).isEmpty();
    }

    @Test
    @DisplayName("Should return empty text when neither channel was attempted")
    void shouldReturnEmptyWhenNothingAttempted() {
      FusionOutcome outcome = engine.fuse(null, null);

      assertThat(outcome.method()).isEqualTo(FusionMethod.BOTH_FAILED);
      assertThat(outcome.finalText()).isEmpty();
      assertThat(outcome.ocrConfidence()).isNull();
      assertThat(outcome.visionConfidence()).isNull();
    }

    @Test
    @DisplayName("Should count outcomes per fusion method")
    void shouldCountOutcomesPerMethod() {
      engine.fuse(null, null);
      engine.fuse(null, null);
      engine.fuse(ocr("Hello world", 0.9), null);

      assertThat(
              meterRegistry
                  .counter("extraction.fusion.outcome", "method", "BOTH_FAILED")
                  .count())
          .isEqualTo(2.0);
      assertThat(
              meterRegistry.counter("extraction.fusion.outcome", "method", "OCR_ONLY").count())
          .isEqualTo(1.0);
    }
  }

  @Nested
  @DisplayName("Intelligent merge")
  class IntelligentMerge {

    @Test
    @DisplayName("Should merge lines in OCR-then-vision order when scores tie")
    void shouldMergeLinesWhenScoresTie() {
      FusionOutcome outcome =
          engine.fuse(ocr("alpha\nbeta\n", 0.9), vision("beta\n  gamma  ", 0.9));

      assertThat(outcome.method()).isEqualTo(FusionMethod.INTELLIGENT_MERGE);
      assertThat(outcome.finalText()).isEqualTo("alpha\nbeta\ngamma");
      assertThat(outcome.ocrScore()).isNotNull();
      assertThat(outcome.visionScore()).isNotNull();
    }

    @Test
    @DisplayName("Merge should yield the same line set whichever engine is OCR")
    void mergeShouldBeCommutativeOnLineSet() {
      String first = "alpha\nbeta";
      String second = "beta\ngamma";

      FusionOutcome forward = engine.fuse(ocr(first, 0.9), vision(second, 0.9));
      FusionOutcome swapped = engine.fuse(ocr(second, 0.9), vision(first, 0.9));

      assertThat(forward.method()).isEqualTo(FusionMethod.INTELLIGENT_MERGE);
      assertThat(swapped.method()).isEqualTo(FusionMethod.INTELLIGENT_MERGE);
      assertThat(lines(forward.finalText())).isEqualTo(lines(swapped.finalText()));
      assertThat(forward.finalText()).isNotEqualTo(swapped.finalText());
    }

    @Test
    @DisplayName("Should keep OCR alone when vision text is empty")
    void shouldKeepOcrAloneWhenVisionEmpty() {
      FusionOutcome outcome = engine.fuse(ocr("ABC", 0.95), vision("", 0.0));

      assertThat(outcome.method()).isEqualTo(FusionMethod.OCR_ENHANCED);
      assertThat(outcome.finalText()).isEqualTo("ABC");
      assertThat(outcome.ocrScore()).isGreaterThan(outcome.visionScore());
      assertThat(outcome.visionScore()).isZero();
    }

    @Test
    @DisplayName("Should append vision text as a supplement when OCR leads but is not dominant")
    void shouldAppendVisionSupplement() {
      FusionOutcome outcome =
          engine.fuse(ocr("Invoice total 230.00", 0.9), vision("Invoice total due", 0.2));

      assertThat(outcome.method()).isEqualTo(FusionMethod.OCR_ENHANCED);
      assertThat(outcome.finalText())
          .isEqualTo("Invoice total 230.00\n\n[Vision supplement]\nInvoice total due");
    }

    @Test
    @DisplayName("Should drop the supplement when the primary is much longer")
    void shouldDropSupplementWhenPrimaryDominates() {
      FusionOutcome outcome =
          engine.fuse(ocr("Total amount due 230.00 by Friday", 0.9), vision("Total", 0.1));

      assertThat(outcome.method()).isEqualTo(FusionMethod.OCR_ENHANCED);
      assertThat(outcome.finalText()).isEqualTo("Total amount due 230.00 by Friday");
    }

    @Test
    @DisplayName("Should lead with vision text when it scores higher")
    void shouldLeadWithVisionWhenHigher() {
      String visionText = "发票号码 4521\n合计金额 230.00 元\n开票日期 2024-03-01";
      FusionOutcome outcome = engine.fuse(ocr("发票 4521", 0.3), vision(visionText, 1.0));

      assertThat(outcome.method()).isEqualTo(FusionMethod.VISION_ENHANCED);
      assertThat(outcome.finalText()).isEqualTo(visionText);
    }

    @Test
    @DisplayName("Should append OCR text as a supplement when vision leads narrowly in length")
    void shouldAppendOcrSupplement() {
      FusionOutcome outcome =
          engine.fuse(ocr("Invoice total due", 0.2), vision("Invoice total 230.00", 0.9));

      assertThat(outcome.method()).isEqualTo(FusionMethod.VISION_ENHANCED);
      assertThat(outcome.finalText())
          .isEqualTo("Invoice total 230.00\n\n[OCR supplement]\nInvoice total due");
    }

    @Test
    @DisplayName("Should use the configured tie band")
    void shouldUseConfiguredTieBand() {
      config.getFusion().setTieBand(1.0);

      FusionOutcome outcome = engine.fuse(ocr("ABC", 0.95), vision("XYZ", 0.1));

      assertThat(outcome.method()).isEqualTo(FusionMethod.INTELLIGENT_MERGE);
      assertThat(outcome.finalText()).isEqualTo("ABC\nXYZ");
    }
  }

  @Test
  @DisplayName("Enhance should compare code point lengths against the dominance ratio")
  void enhanceShouldUseDominanceRatio() {
    assertThat(FusionDecisionEngine.enhance("abcdefghijk", "abcdefg", "[m]", 1.5))
        .isEqualTo("abcdefghijk");
    assertThat(FusionDecisionEngine.enhance("abcdefghij", "abcdefg", "[m]", 1.5))
        .isEqualTo("abcdefghij\n\n[m]\nabcdefg");
    assertThat(FusionDecisionEngine.enhance("abc", "  ", "[m]", 1.5)).isEqualTo("abc");
  }

  private static Set<String> lines(String text) {
    return new HashSet<>(Arrays.asList(text.split("\n")));
  }
}
