package com.flamingo.ai.docextract.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the vision-language model used to transcribe images.
 *
 * <p>Any OpenAI-compatible multimodal endpoint works; the default points at the DashScope
 * compatible-mode API serving {@code qwen-vl-plus}.
 */
@Configuration
@ConditionalOnProperty(name = "extraction.vision.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class LangChain4jConfig {

  @Value("${langchain4j.vision.api-key:}")
  private String visionApiKey;

  @Value("${langchain4j.vision.base-url:https://dashscope.aliyuncs.com/compatible-mode/v1}")
  private String visionBaseUrl;

  @Value("${langchain4j.vision.model-name:qwen-vl-plus}")
  private String visionModelName;

  @Value("${langchain4j.vision.max-completion-tokens:2048}")
  private int maxCompletionTokens;

  @Bean
  public ChatModel visionChatModel() {
    if (visionApiKey == null || visionApiKey.isBlank()) {
      // The model is still built so the context starts; the recognizer reports itself
      // unavailable and is never called.
      log.warn("No vision API key configured (VISION_API_KEY); vision channel will be skipped");
    }

    return OpenAiChatModel.builder()
        .apiKey(visionApiKey == null || visionApiKey.isBlank() ? "unset" : visionApiKey)
        .baseUrl(visionBaseUrl)
        .modelName(visionModelName)
        .maxCompletionTokens(maxCompletionTokens)
        .temperature(0.0)
        .timeout(Duration.ofSeconds(60))
        .logRequests(false)
        .logResponses(false)
        .build();
  }
}
