package com.flamingo.ai.docextract.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the extraction pipeline. */
@Configuration
@ConfigurationProperties(prefix = "extraction")
@Getter
@Setter
public class ExtractionConfig {

  private Classifier classifier = new Classifier();
  private Recognition recognition = new Recognition();
  private Fusion fusion = new Fusion();
  private Sanitizer sanitizer = new Sanitizer();
  private Executor executor = new Executor();
  private Ocr ocr = new Ocr();
  private Vision vision = new Vision();
  private Parsing parsing = new Parsing();

  @Getter
  @Setter
  public static class Classifier {
    /** Trimmed native text must be strictly longer than this to count as a text layer. */
    private int minTextLength = 10;
  }

  @Getter
  @Setter
  public static class Recognition {
    private Duration ocrTimeout = Duration.ofSeconds(30);

    /** Vision calls are slower and costlier than OCR, hence the longer bound. */
    private Duration visionTimeout = Duration.ofSeconds(60);
  }

  /**
   * Weights and thresholds of the fusion policy.
   *
   * <p>The tie band and the dominance ratio are empirical and have not been calibrated against a
   * labelled dataset.
   */
  @Getter
  @Setter
  public static class Fusion {
    private double confidenceWeight = 0.4;
    private double lengthWeight = 0.3;
    private double qualityWeight = 0.3;

    /** Text length at which the composite length term saturates. */
    private int lengthCap = 100;

    private double tieBand = 0.1;
    private double dominanceRatio = 1.5;

    private Quality quality = new Quality();

    @Getter
    @Setter
    public static class Quality {
      private double lengthWeight = 0.3;
      private double diversityWeight = 0.2;
      private double cjkWeight = 0.3;
      private double structureWeight = 0.2;

      private int lengthCap = 200;
      private int diversityCap = 50;
      private double cjkMultiplier = 2.0;
      private int structureCap = 20;
    }
  }

  @Getter
  @Setter
  public static class Sanitizer {
    private int minLineLength = 3;

    /** A single-token line is dropped when the token repeats more than this many times. */
    private int maxRepeatedTokenRun = 2;

    /** Repetition check only applies to units with more tokens than this. */
    private int repetitionMinTokens = 10;

    private double repetitionMaxShare = 0.3;

    /** Regex patterns; a line containing a match is dropped. Empty uses the built-in list. */
    private List<String> dropPatterns = new ArrayList<>();
  }

  @Getter
  @Setter
  public static class Executor {
    private Pool units = new Pool(4, 8, 500);
    private Pool recognition = new Pool(4, 16, 1000);

    @Getter
    @Setter
    public static class Pool {
      private int corePoolSize;
      private int maxPoolSize;
      private int queueCapacity;

      public Pool() {}

      public Pool(int corePoolSize, int maxPoolSize, int queueCapacity) {
        this.corePoolSize = corePoolSize;
        this.maxPoolSize = maxPoolSize;
        this.queueCapacity = queueCapacity;
      }
    }
  }

  @Getter
  @Setter
  public static class Ocr {
    /** OCR engine: "tesseract" (default) or "baidu". */
    private String engine = "tesseract";

    private Tesseract tesseract = new Tesseract();
    private Baidu baidu = new Baidu();

    @Getter
    @Setter
    public static class Tesseract {
      /** Directory holding the traineddata files; empty uses TESSDATA_PREFIX. */
      private String dataPath = "";

      private String language = "chi_sim+eng";
      private int ocrEngineMode = 3;
      private int pageSegMode = 6;

      /** Lines at or below this confidence (0-100) are discarded. */
      private float minLineConfidence = 20f;
    }

    @Getter
    @Setter
    public static class Baidu {
      private String baseUrl = "https://aip.baidubce.com";
      private String apiKey = "";
      private String secretKey = "";

      /** Recognition endpoint under /rest/2.0/ocr/v1/, e.g. accurate_basic or general_basic. */
      private String method = "accurate_basic";

      private String languageType = "CHN_ENG";
      private int readTimeoutMs = 25000;
    }
  }

  @Getter
  @Setter
  public static class Vision {
    private boolean enabled = true;

    /** Longest image side sent to the model; larger images are downscaled. */
    private int maxImageSide = 2048;

    private String prompt =
        "Carefully read this image and extract all visible text. Organise it into paragraphs"
            + " following reading order, top to bottom and left to right. Render tables as"
            + " Markdown. Be exact with numbers, amounts and dates. Output only the extracted"
            + " text without any explanation.";
  }

  @Getter
  @Setter
  public static class Parsing {
    private long maxImageBytes = 10 * 1024 * 1024L; // 10 MB
  }
}
