package com.flamingo.ai.docextract.service.extraction.recognition;

import com.flamingo.ai.docextract.service.extraction.model.RecognitionChannel;
import com.flamingo.ai.docextract.service.extraction.model.RecognitionOptions;
import com.flamingo.ai.docextract.service.extraction.model.RecognitionResult;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * OCR channel backed by the Baidu cloud OCR API.
 *
 * <p>Text is the recognised lines joined by newlines; confidence is the mean of the positive
 * per-line probability averages. An answer without any text counts as a failure.
 */
@Service
@ConditionalOnProperty(name = "extraction.ocr.engine", havingValue = "baidu")
@RequiredArgsConstructor
@Slf4j
public class BaiduOcrRecognizer implements ImageRecognizer {

  private final BaiduOcrClient baiduOcrClient;
  private final MeterRegistry meterRegistry;

  @Override
  public String engineId() {
    return BaiduOcrClient.ENGINE_ID;
  }

  @Override
  public RecognitionChannel channel() {
    return RecognitionChannel.OCR;
  }

  @Override
  public boolean isAvailable() {
    return baiduOcrClient.isConfigured();
  }

  @Override
  @Timed(value = "extraction.recognizer.baidu", description = "Time for Baidu cloud OCR")
  public RecognitionResult recognize(byte[] image, RecognitionOptions options) {
    if (!isAvailable()) {
      return RecognitionResult.failure(engineId(), "Baidu OCR credentials not configured");
    }
    if (image == null || image.length == 0) {
      return RecognitionResult.failure(engineId(), "empty image payload");
    }

    try {
      String language = options != null ? options.language() : null;
      RecognitionResult result = toResult(baiduOcrClient.recognize(image, language));
      if (!result.success()) {
        meterRegistry.counter("extraction.recognizer.failure", "engine", engineId()).increment();
      }
      return result;
    } catch (RuntimeException e) {
      log.warn("Baidu OCR failed: {}", e.getMessage());
      meterRegistry.counter("extraction.recognizer.failure", "engine", engineId()).increment();
      return RecognitionResult.failure(engineId(), e.getMessage());
    }
  }

  static RecognitionResult toResult(BaiduOcrClient.OcrResponse response) {
    if (response.errorCode() != null) {
      return RecognitionResult.failure(
          BaiduOcrClient.ENGINE_ID,
          "Baidu OCR error " + response.errorCode() + ": " + response.errorMsg());
    }

    List<BaiduOcrClient.WordsResult> lines =
        response.wordsResult() == null ? List.of() : response.wordsResult();
    String text =
        lines.stream()
            .map(BaiduOcrClient.WordsResult::words)
            .filter(Objects::nonNull)
            .collect(Collectors.joining("\n"));

    double confidence =
        lines.stream()
            .map(BaiduOcrClient.WordsResult::probability)
            .filter(Objects::nonNull)
            .mapToDouble(BaiduOcrClient.Probability::average)
            .filter(p -> p > 0)
            .average()
            .orElse(0.0);

    if (text.isBlank()) {
      return new RecognitionResult(
          BaiduOcrClient.ENGINE_ID, text, confidence, false, "no text recognised");
    }
    return RecognitionResult.success(BaiduOcrClient.ENGINE_ID, text, confidence);
  }
}
