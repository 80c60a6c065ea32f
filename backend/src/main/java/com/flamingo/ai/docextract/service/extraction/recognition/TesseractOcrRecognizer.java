package com.flamingo.ai.docextract.service.extraction.recognition;

import com.flamingo.ai.docextract.config.ExtractionConfig;
import com.flamingo.ai.docextract.service.extraction.model.RecognitionChannel;
import com.flamingo.ai.docextract.service.extraction.model.RecognitionOptions;
import com.flamingo.ai.docextract.service.extraction.model.RecognitionResult;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import net.sourceforge.tess4j.ITessAPI.TessPageIteratorLevel;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.Word;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * OCR channel backed by a local Tesseract installation through Tess4J.
 *
 * <p>Recognition runs at text-line level. Lines at or below the configured confidence floor are
 * dropped; the result confidence is the mean confidence of the kept lines scaled to [0, 1].
 * {@link Tesseract} instances are not thread-safe, so one is created per call.
 */
@Service
@ConditionalOnProperty(name = "extraction.ocr.engine", havingValue = "tesseract", matchIfMissing = true)
@Slf4j
public class TesseractOcrRecognizer implements ImageRecognizer {

  static final String ENGINE_ID = "tesseract";

  private final ExtractionConfig.Ocr.Tesseract settings;
  private final MeterRegistry meterRegistry;
  private final Supplier<Tesseract> tesseractFactory;

  @Autowired
  public TesseractOcrRecognizer(ExtractionConfig extractionConfig, MeterRegistry meterRegistry) {
    this(extractionConfig, meterRegistry, Tesseract::new);
  }

  TesseractOcrRecognizer(
      ExtractionConfig extractionConfig,
      MeterRegistry meterRegistry,
      Supplier<Tesseract> tesseractFactory) {
    this.settings = extractionConfig.getOcr().getTesseract();
    this.meterRegistry = meterRegistry;
    this.tesseractFactory = tesseractFactory;
  }

  @Override
  public String engineId() {
    return ENGINE_ID;
  }

  @Override
  public RecognitionChannel channel() {
    return RecognitionChannel.OCR;
  }

  @Override
  public boolean isAvailable() {
    return true;
  }

  @Override
  @Timed(value = "extraction.recognizer.tesseract", description = "Time for Tesseract OCR")
  public RecognitionResult recognize(byte[] image, RecognitionOptions options) {
    BufferedImage decoded;
    try {
      decoded = ImageSupport.decode(image);
    } catch (IOException e) {
      log.warn("Tesseract skipped undecodable image: {}", e.getMessage());
      return failure("image decode failed: " + e.getMessage());
    }

    try {
      Tesseract tesseract = newTesseract(options);
      List<Word> lines = tesseract.getWords(decoded, TessPageIteratorLevel.RIL_TEXTLINE);
      return toResult(lines, settings.getMinLineConfidence());
    } catch (RuntimeException | LinkageError e) {
      log.error("Tesseract recognition failed: {}", e.getMessage());
      return failure("tesseract failed: " + e.getMessage());
    }
  }

  /** Builds a result from recognised lines, keeping those above {@code minConfidence}. */
  static RecognitionResult toResult(List<Word> lines, float minConfidence) {
    List<Word> kept =
        lines == null
            ? List.of()
            : lines.stream()
                .filter(w -> w.getText() != null && !w.getText().isBlank())
                .filter(w -> w.getConfidence() > minConfidence)
                .toList();

    String text = kept.stream().map(w -> w.getText().strip()).collect(Collectors.joining("\n"));
    if (text.isBlank()) {
      return RecognitionResult.failure(ENGINE_ID, "no text recognised");
    }

    double confidence = kept.stream().mapToDouble(Word::getConfidence).average().orElse(0) / 100.0;
    return RecognitionResult.success(ENGINE_ID, text, confidence);
  }

  private Tesseract newTesseract(RecognitionOptions options) {
    Tesseract tesseract = tesseractFactory.get();
    if (settings.getDataPath() != null && !settings.getDataPath().isBlank()) {
      tesseract.setDatapath(settings.getDataPath());
    }
    String language =
        options != null && options.language() != null ? options.language() : settings.getLanguage();
    tesseract.setLanguage(language);
    tesseract.setOcrEngineMode(settings.getOcrEngineMode());
    tesseract.setPageSegMode(settings.getPageSegMode());
    return tesseract;
  }

  private RecognitionResult failure(String message) {
    meterRegistry.counter("extraction.recognizer.failure", "engine", ENGINE_ID).increment();
    return RecognitionResult.failure(ENGINE_ID, message);
  }
}
