package com.flamingo.ai.docextract.service.extraction.recognition;

import com.flamingo.ai.docextract.config.ExtractionConfig;
import com.flamingo.ai.docextract.service.extraction.model.RecognitionChannel;
import com.flamingo.ai.docextract.service.extraction.model.RecognitionOptions;
import com.flamingo.ai.docextract.service.extraction.model.RecognitionResult;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs the OCR and vision channels against one image at the same time.
 *
 * <p>Both enabled channels are submitted to the shared recognition pool before either is awaited.
 * Each channel has its own deadline measured from submission; a channel that misses it yields a
 * {@code "timeout"} failure and its call is abandoned, not interrupted. A disabled or unavailable
 * channel is not attempted and yields {@code null}. There are no retries at this level.
 */
@Service
@Slf4j
public class DualChannelRecognizer {

  private final ImageRecognizer ocrRecognizer;
  private final ImageRecognizer visionRecognizer;
  private final Executor recognitionExecutor;
  private final ExtractionConfig.Recognition settings;

  @Autowired
  public DualChannelRecognizer(
      List<ImageRecognizer> recognizers,
      @Qualifier("recognitionExecutor") Executor recognitionExecutor,
      ExtractionConfig extractionConfig) {
    this(
        find(recognizers, RecognitionChannel.OCR),
        find(recognizers, RecognitionChannel.VISION),
        recognitionExecutor,
        extractionConfig);
  }

  public DualChannelRecognizer(
      ImageRecognizer ocrRecognizer,
      ImageRecognizer visionRecognizer,
      Executor recognitionExecutor,
      ExtractionConfig extractionConfig) {
    this.ocrRecognizer = ocrRecognizer;
    this.visionRecognizer = visionRecognizer;
    this.recognitionExecutor = recognitionExecutor;
    this.settings = extractionConfig.getRecognition();
    log.info(
        "Dual-channel recognizer ready: ocr={}, vision={}",
        ocrRecognizer != null ? ocrRecognizer.engineId() : "none",
        visionRecognizer != null ? visionRecognizer.engineId() : "none");
  }

  /**
   * Recognises one image on the enabled channels.
   *
   * @param image encoded image bytes, read-only
   * @param useOcr run the OCR channel
   * @param useVision run the vision channel
   * @param options options passed to both adapters
   * @return both channel results; a null entry means the channel was not attempted
   */
  public DualChannelResult recognize(
      byte[] image, boolean useOcr, boolean useVision, RecognitionOptions options) {
    if (!useOcr && !useVision) {
      return DualChannelResult.notAttempted();
    }
    CompletableFuture<RecognitionResult> ocr =
        useOcr ? launch(ocrRecognizer, RecognitionChannel.OCR, image, options) : null;
    CompletableFuture<RecognitionResult> vision =
        useVision ? launch(visionRecognizer, RecognitionChannel.VISION, image, options) : null;

    RecognitionResult ocrResult = ocr != null ? ocr.join() : null;
    RecognitionResult visionResult = vision != null ? vision.join() : null;

    logOutcome(RecognitionChannel.OCR, ocrResult);
    logOutcome(RecognitionChannel.VISION, visionResult);
    return new DualChannelResult(ocrResult, visionResult);
  }

  private CompletableFuture<RecognitionResult> launch(
      ImageRecognizer recognizer,
      RecognitionChannel channel,
      byte[] image,
      RecognitionOptions options) {
    if (recognizer == null) {
      log.warn("{} channel requested but no recognizer is configured", channel);
      return null;
    }
    if (!recognizer.isAvailable()) {
      log.warn("{} channel requested but {} is unavailable", channel, recognizer.engineId());
      return null;
    }

    String engineId = recognizer.engineId();
    Duration timeout =
        channel == RecognitionChannel.OCR ? settings.getOcrTimeout() : settings.getVisionTimeout();
    RecognitionOptions opts = options != null ? options : RecognitionOptions.defaults();

    try {
      return CompletableFuture.supplyAsync(
              () -> recognizer.recognize(image, opts), recognitionExecutor)
          .handle((result, error) -> normalize(engineId, result, error))
          .completeOnTimeout(
              RecognitionResult.timeout(engineId), timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      log.warn("{} channel rejected by recognition pool: {}", channel, e.getMessage());
      return CompletableFuture.completedFuture(
          RecognitionResult.failure(engineId, "rejected: " + e.getMessage()));
    }
  }

  private static RecognitionResult normalize(
      String engineId, RecognitionResult result, Throwable error) {
    if (error != null) {
      Throwable cause =
          error instanceof CompletionException && error.getCause() != null
              ? error.getCause()
              : error;
      log.error("Recognizer {} threw instead of reporting failure: {}", engineId, cause.toString());
      return RecognitionResult.failure(engineId, String.valueOf(cause.getMessage()));
    }
    if (result == null) {
      return RecognitionResult.failure(engineId, "recognizer returned no result");
    }
    return result;
  }

  private static void logOutcome(RecognitionChannel channel, RecognitionResult result) {
    if (result == null) {
      return;
    }
    if (result.isTimeout()) {
      log.warn("{} channel ({}) timed out", channel, result.engineId());
    } else if (!result.success()) {
      log.warn("{} channel ({}) failed: {}", channel, result.engineId(), result.error());
    } else {
      log.debug(
          "{} channel ({}) succeeded: {} chars, confidence {}",
          channel,
          result.engineId(),
          result.text().length(),
          String.format("%.3f", result.confidence()));
    }
  }

  private static ImageRecognizer find(
      List<ImageRecognizer> recognizers, RecognitionChannel channel) {
    return recognizers.stream().filter(r -> r.channel() == channel).findFirst().orElse(null);
  }
}
