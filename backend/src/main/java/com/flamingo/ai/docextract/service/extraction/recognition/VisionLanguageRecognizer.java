package com.flamingo.ai.docextract.service.extraction.recognition;

import com.flamingo.ai.docextract.config.ExtractionConfig;
import com.flamingo.ai.docextract.exception.RecognitionServiceException;
import com.flamingo.ai.docextract.service.extraction.model.RecognitionChannel;
import com.flamingo.ai.docextract.service.extraction.model.RecognitionOptions;
import com.flamingo.ai.docextract.service.extraction.model.RecognitionResult;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ChatRequestParameters;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.Base64;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Vision channel: asks a multimodal chat model to transcribe the visible text of an image.
 *
 * <p>The model reports no confidence, so successful answers carry confidence 1.0. Oversized
 * images are downscaled before upload. Transient model errors are retried and guarded by a
 * circuit breaker whose fallback turns the error into a failed result.
 */
@Service
@ConditionalOnProperty(name = "extraction.vision.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class VisionLanguageRecognizer implements ImageRecognizer {

  private final ChatModel visionChatModel;
  private final ExtractionConfig.Vision settings;
  private final MeterRegistry meterRegistry;
  private final String modelName;
  private final boolean configured;

  public VisionLanguageRecognizer(
      @Qualifier("visionChatModel") ChatModel visionChatModel,
      ExtractionConfig extractionConfig,
      MeterRegistry meterRegistry,
      @Value("${langchain4j.vision.model-name:qwen-vl-plus}") String modelName,
      @Value("${langchain4j.vision.api-key:}") String apiKey) {
    this.visionChatModel = visionChatModel;
    this.settings = extractionConfig.getVision();
    this.meterRegistry = meterRegistry;
    this.modelName = modelName;
    this.configured = apiKey != null && !apiKey.isBlank();
  }

  @Override
  public String engineId() {
    return "vision:" + modelName;
  }

  @Override
  public RecognitionChannel channel() {
    return RecognitionChannel.VISION;
  }

  @Override
  public boolean isAvailable() {
    return configured;
  }

  @Override
  @Timed(value = "extraction.recognizer.vision", description = "Time for vision transcription")
  @CircuitBreaker(name = "vision", fallbackMethod = "recognizeFallback")
  @Retry(name = "vision")
  public RecognitionResult recognize(byte[] image, RecognitionOptions options) {
    if (!configured) {
      return RecognitionResult.failure(engineId(), "vision model not configured");
    }

    String base64;
    try {
      base64 =
          Base64.getEncoder()
              .encodeToString(
                  ImageSupport.toPng(
                      ImageSupport.toRgbWithin(
                          ImageSupport.decode(image), settings.getMaxImageSide())));
    } catch (IOException e) {
      log.warn("Vision channel skipped undecodable image: {}", e.getMessage());
      return RecognitionResult.failure(engineId(), "image decode failed: " + e.getMessage());
    }

    RecognitionOptions opts = options != null ? options : RecognitionOptions.defaults();
    String prompt = opts.prompt() != null ? opts.prompt() : settings.getPrompt();

    UserMessage message =
        UserMessage.from(ImageContent.from(base64, "image/png"), TextContent.from(prompt));
    ChatRequest.Builder request = ChatRequest.builder().messages(message);
    if (opts.visionModel() != null) {
      request.parameters(ChatRequestParameters.builder().modelName(opts.visionModel()).build());
    }

    ChatResponse response;
    try {
      response = visionChatModel.chat(request.build());
    } catch (RuntimeException e) {
      throw new RecognitionServiceException(
          engineId(), "vision model call failed: " + e.getMessage(), e);
    }

    String text =
        response != null && response.aiMessage() != null && response.aiMessage().text() != null
            ? response.aiMessage().text()
            : "";
    meterRegistry.counter("extraction.recognizer.vision.invocations").increment();
    log.debug("Vision model returned {} characters", text.length());
    return RecognitionResult.success(engineId(), text, 1.0);
  }

  /** Fallback when the model keeps failing or the circuit is open. */
  @SuppressWarnings("unused")
  RecognitionResult recognizeFallback(byte[] image, RecognitionOptions options, Throwable t) {
    log.warn("Vision model unavailable, reporting failed recognition: {}", t.getMessage());
    meterRegistry.counter("extraction.recognizer.failure", "engine", engineId()).increment();
    return RecognitionResult.failure(engineId(), t.getMessage());
  }
}
