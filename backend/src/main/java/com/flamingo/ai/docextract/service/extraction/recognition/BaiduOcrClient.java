package com.flamingo.ai.docextract.service.extraction.recognition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.docextract.config.ExtractionConfig;
import com.flamingo.ai.docextract.exception.RecognitionServiceException;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * HTTP client for the Baidu cloud OCR REST API. Encapsulates token handling and all WebClient
 * communication.
 *
 * <p>Access tokens are obtained with the OAuth client-credentials grant and cached until shortly
 * before they expire. Calls are rate limited client-side because the API enforces a QPS quota.
 */
@Component
@ConditionalOnProperty(name = "extraction.ocr.engine", havingValue = "baidu")
@Slf4j
public class BaiduOcrClient {

  static final String ENGINE_ID = "baidu";

  /** Error codes meaning the access token is invalid or expired. */
  private static final List<Integer> TOKEN_ERROR_CODES = List.of(110, 111);

  private static final Duration TOKEN_EXPIRY_MARGIN = Duration.ofMinutes(5);

  private final WebClient webClient;
  private final ExtractionConfig.Ocr.Baidu settings;
  private final AtomicReference<CachedToken> token = new AtomicReference<>();

  public BaiduOcrClient(ExtractionConfig extractionConfig) {
    this.settings = extractionConfig.getOcr().getBaidu();
    this.webClient =
        WebClient.builder()
            .baseUrl(settings.getBaseUrl())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
            .build();
    log.info(
        "Baidu OCR client initialized: baseUrl={}, method={}",
        settings.getBaseUrl(),
        settings.getMethod());
  }

  public boolean isConfigured() {
    return !settings.getApiKey().isBlank() && !settings.getSecretKey().isBlank();
  }

  /**
   * Calls the configured recognition endpoint with word probabilities enabled.
   *
   * @param image encoded image bytes
   * @param languageType language hint, null for the configured default
   * @return the raw API response
   * @throws RecognitionServiceException if the call fails or the API reports an error
   */
  @RateLimiter(name = "baidu-ocr")
  public OcrResponse recognize(byte[] image, String languageType) {
    OcrResponse response = call(image, languageType, accessToken());
    if (response != null && response.errorCode() != null) {
      if (TOKEN_ERROR_CODES.contains(response.errorCode())) {
        log.info("Baidu access token rejected (code {}), refreshing", response.errorCode());
        token.set(null);
        response = call(image, languageType, accessToken());
      }
    }
    if (response == null) {
      throw new RecognitionServiceException(ENGINE_ID, "empty response from Baidu OCR");
    }
    return response;
  }

  private OcrResponse call(byte[] image, String languageType, String accessToken) {
    MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("image", Base64.getEncoder().encodeToString(image));
    form.add("probability", "true");
    form.add("language_type", languageType != null ? languageType : settings.getLanguageType());

    try {
      return webClient
          .post()
          .uri(
              uri ->
                  uri.path("/rest/2.0/ocr/v1/{method}")
                      .queryParam("access_token", accessToken)
                      .build(settings.getMethod()))
          .contentType(MediaType.APPLICATION_FORM_URLENCODED)
          .body(BodyInserters.fromFormData(form))
          .retrieve()
          .bodyToMono(OcrResponse.class)
          .timeout(Duration.ofMillis(settings.getReadTimeoutMs()))
          .block();
    } catch (RuntimeException e) {
      throw new RecognitionServiceException(
          ENGINE_ID, "Baidu OCR request failed: " + e.getMessage(), e);
    }
  }

  private String accessToken() {
    CachedToken cached = token.get();
    if (cached != null && cached.isValid()) {
      return cached.value();
    }

    TokenResponse response;
    try {
      response =
          webClient
              .post()
              .uri(
                  uri ->
                      uri.path("/oauth/2.0/token")
                          .queryParam("grant_type", "client_credentials")
                          .queryParam("client_id", settings.getApiKey())
                          .queryParam("client_secret", settings.getSecretKey())
                          .build())
              .retrieve()
              .bodyToMono(TokenResponse.class)
              .timeout(Duration.ofMillis(settings.getReadTimeoutMs()))
              .block();
    } catch (RuntimeException e) {
      throw new RecognitionServiceException(
          ENGINE_ID, "Baidu token request failed: " + e.getMessage(), e);
    }

    if (response == null || response.accessToken() == null) {
      String reason = response != null ? response.errorDescription() : "empty response";
      throw new RecognitionServiceException(ENGINE_ID, "Baidu token request rejected: " + reason);
    }

    Instant expiresAt =
        Instant.now().plusSeconds(response.expiresIn()).minus(TOKEN_EXPIRY_MARGIN);
    token.set(new CachedToken(response.accessToken(), expiresAt));
    log.debug("Obtained Baidu access token valid until {}", expiresAt);
    return response.accessToken();
  }

  private record CachedToken(String value, Instant expiresAt) {
    boolean isValid() {
      return Instant.now().isBefore(expiresAt);
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record TokenResponse(
      @JsonProperty("access_token") String accessToken,
      @JsonProperty("expires_in") long expiresIn,
      @JsonProperty("error_description") String errorDescription) {}

  /** Baidu OCR response body. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record OcrResponse(
      @JsonProperty("words_result") List<WordsResult> wordsResult,
      @JsonProperty("error_code") Integer errorCode,
      @JsonProperty("error_msg") String errorMsg) {}

  /** One recognised line. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record WordsResult(
      @JsonProperty("words") String words, @JsonProperty("probability") Probability probability) {}

  /** Per-line character probability summary. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Probability(@JsonProperty("average") double average) {}
}
