package com.flamingo.ai.docextract.service.extraction.recognition;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.docextract.config.ExtractionConfig;
import com.flamingo.ai.docextract.service.extraction.model.RecognitionChannel;
import com.flamingo.ai.docextract.service.extraction.model.RecognitionOptions;
import com.flamingo.ai.docextract.service.extraction.model.RecognitionResult;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DualChannelRecognizer Tests")
class DualChannelRecognizerTest {

  private static final byte[] IMAGE = {1, 2, 3};

  private ExtractionConfig config;
  private ExecutorService executor;
  private final CountDownLatch release = new CountDownLatch(1);

  @BeforeEach
  void setUp() {
    config = new ExtractionConfig();
    config.getRecognition().setOcrTimeout(Duration.ofSeconds(5));
    config.getRecognition().setVisionTimeout(Duration.ofSeconds(5));
    executor = Executors.newFixedThreadPool(4);
  }

  @AfterEach
  void tearDown() {
    release.countDown();
    executor.shutdownNow();
  }

  @Test
  @DisplayName("Should return both channel results")
  void shouldReturnBothResults() {
    DualChannelRecognizer recognizer =
        new DualChannelRecognizer(
            new StubRecognizer("tesseract", RecognitionChannel.OCR, () -> ok("tesseract", "A")),
            new StubRecognizer("vision:m", RecognitionChannel.VISION, () -> ok("vision:m", "B")),
            executor,
            config);

    DualChannelResult result = recognizer.recognize(IMAGE, true, true, null);

    assertThat(result.ocr().text()).isEqualTo("A");
    assertThat(result.vision().text()).isEqualTo("B");
  }

  @Test
  @DisplayName("Should start both channels before awaiting either")
  void shouldRunChannelsConcurrently() {
    CountDownLatch bothStarted = new CountDownLatch(2);
    Supplier<RecognitionResult> rendezvous =
        () -> {
          bothStarted.countDown();
          try {
            boolean met = bothStarted.await(2, TimeUnit.SECONDS);
            return met ? ok("x", "met") : RecognitionResult.failure("x", "ran alone");
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return RecognitionResult.failure("x", "interrupted");
          }
        };
    DualChannelRecognizer recognizer =
        new DualChannelRecognizer(
            new StubRecognizer("tesseract", RecognitionChannel.OCR, rendezvous),
            new StubRecognizer("vision:m", RecognitionChannel.VISION, rendezvous),
            executor,
            config);

    DualChannelResult result = recognizer.recognize(IMAGE, true, true, null);

    assertThat(result.ocr().success()).isTrue();
    assertThat(result.vision().success()).isTrue();
  }

  @Test
  @DisplayName("Should time out a slow channel without delaying the other")
  void shouldTimeOutSlowChannelIndependently() {
    config.getRecognition().setOcrTimeout(Duration.ofMillis(200));
    DualChannelRecognizer recognizer =
        new DualChannelRecognizer(
            new StubRecognizer("tesseract", RecognitionChannel.OCR, this::blockUntilReleased),
            new StubRecognizer(
                "vision:m", RecognitionChannel.VISION, () -> ok("vision:m", "Total Due: 230.00")),
            executor,
            config);

    long start = System.nanoTime();
    DualChannelResult result = recognizer.recognize(IMAGE, true, true, null);
    long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

    assertThat(result.ocr().success()).isFalse();
    assertThat(result.ocr().error()).isEqualTo("timeout");
    assertThat(result.ocr().isTimeout()).isTrue();
    assertThat(result.ocr().engineId()).isEqualTo("tesseract");
    assertThat(result.vision().success()).isTrue();
    assertThat(elapsedMillis).isLessThan(3000);
  }

  @Test
  @DisplayName("Should not attempt a disabled channel")
  void shouldNotAttemptDisabledChannel() {
    StubRecognizer vision =
        new StubRecognizer("vision:m", RecognitionChannel.VISION, () -> ok("vision:m", "B"));
    DualChannelRecognizer recognizer =
        new DualChannelRecognizer(
            new StubRecognizer("tesseract", RecognitionChannel.OCR, () -> ok("tesseract", "A")),
            vision,
            executor,
            config);

    DualChannelResult result = recognizer.recognize(IMAGE, true, false, null);

    assertThat(result.ocr()).isNotNull();
    assertThat(result.vision()).isNull();
    assertThat(vision.calls.get()).isZero();
  }

  @Test
  @DisplayName("Should not attempt an unavailable or missing recognizer")
  void shouldNotAttemptUnavailableRecognizer() {
    StubRecognizer ocr =
        new StubRecognizer("baidu", RecognitionChannel.OCR, () -> ok("baidu", "A"));
    ocr.available = false;
    DualChannelRecognizer recognizer = new DualChannelRecognizer(ocr, null, executor, config);

    DualChannelResult result = recognizer.recognize(IMAGE, true, true, null);

    assertThat(result.ocr()).isNull();
    assertThat(result.vision()).isNull();
    assertThat(ocr.calls.get()).isZero();
  }

  @Test
  @DisplayName("Should convert a thrown exception into a failed result")
  void shouldConvertExceptionToFailure() {
    DualChannelRecognizer recognizer =
        new DualChannelRecognizer(
            new StubRecognizer(
                "tesseract",
                RecognitionChannel.OCR,
                () -> {
                  throw new IllegalStateException("engine crashed");
                }),
            new StubRecognizer("vision:m", RecognitionChannel.VISION, () -> null),
            executor,
            config);

    DualChannelResult result = recognizer.recognize(IMAGE, true, true, null);

    assertThat(result.ocr().success()).isFalse();
    assertThat(result.ocr().error()).isEqualTo("engine crashed");
    assertThat(result.vision().success()).isFalse();
    assertThat(result.vision().error()).isEqualTo("recognizer returned no result");
  }

  @Test
  @DisplayName("Should report a rejected submission as a failed result")
  void shouldReportRejectedSubmission() {
    DualChannelRecognizer recognizer =
        new DualChannelRecognizer(
            new StubRecognizer("tesseract", RecognitionChannel.OCR, () -> ok("tesseract", "A")),
            null,
            command -> {
              throw new RejectedExecutionException("queue full");
            },
            config);

    DualChannelResult result = recognizer.recognize(IMAGE, true, false, null);

    assertThat(result.ocr().success()).isFalse();
    assertThat(result.ocr().error()).isEqualTo("rejected: queue full");
  }

  @Test
  @DisplayName("Should pick recognizers by channel from the available beans")
  void shouldPickRecognizersByChannel() {
    StubRecognizer vision =
        new StubRecognizer("vision:m", RecognitionChannel.VISION, () -> ok("vision:m", "V"));
    StubRecognizer ocr =
        new StubRecognizer("tesseract", RecognitionChannel.OCR, () -> ok("tesseract", "O"));
    DualChannelRecognizer recognizer =
        new DualChannelRecognizer(List.of(vision, ocr), executor, config);

    DualChannelResult result =
        recognizer.recognize(IMAGE, true, true, RecognitionOptions.defaults());

    assertThat(result.ocr().text()).isEqualTo("O");
    assertThat(result.vision().text()).isEqualTo("V");
  }

  private RecognitionResult blockUntilReleased() {
    try {
      release.await(10, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    return ok("tesseract", "late");
  }

  private static RecognitionResult ok(String engineId, String text) {
    return RecognitionResult.success(engineId, text, 0.9);
  }

  private static final class StubRecognizer implements ImageRecognizer {

    private final String engineId;
    private final RecognitionChannel channel;
    private final Supplier<RecognitionResult> behaviour;
    private final AtomicInteger calls = new AtomicInteger();
    private volatile boolean available = true;

    StubRecognizer(
        String engineId, RecognitionChannel channel, Supplier<RecognitionResult> behaviour) {
      this.engineId = engineId;
      this.channel = channel;
      this.behaviour = behaviour;
    }

    @Override
    public String engineId() {
      return engineId;
    }

    @Override
    public RecognitionChannel channel() {
      return channel;
    }

    @Override
    public boolean isAvailable() {
      return available;
    }

    @Override
    public RecognitionResult recognize(byte[] image, RecognitionOptions options) {
      calls.incrementAndGet();
      return behaviour.get();
    }
  }
}
