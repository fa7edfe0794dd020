package com.flamingo.ai.docextract.config;

import com.flamingo.ai.docextract.domain.enums.ExtractionMethod;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for the extraction pipelines. */
@Configuration
@ConfigurationProperties(prefix = "extraction")
@Validated
@Getter
@Setter
public class ExtractionProperties {

  /** Layout provider used when a request does not name one. */
  @NotNull private ExtractionMethod defaultMethod = ExtractionMethod.DOTS_OCR;

  @Valid private Concurrency concurrency = new Concurrency();
  @Valid private Retry retry = new Retry();
  @Valid private Quality quality = new Quality();
  private Render render = new Render();
  private Upscale upscale = new Upscale();
  private Replicate replicate = new Replicate();
  private Datalab datalab = new Datalab();
  private Storage storage = new Storage();

  /** AIMD limits for block refinement calls. */
  @Getter
  @Setter
  public static class Concurrency {
    @Min(1)
    private int initial = 5;

    @Min(1)
    private int min = 2;

    @Min(1)
    private int max = 10;

    /** Consecutive successes needed before the limit grows by one. */
    @Min(1)
    private int increaseAfterSuccesses = 5;

    /** Factor applied to the limit on a rate-limit signal (result is floored). */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double decreaseFactor = 0.6;
  }

  @Getter
  @Setter
  public static class Retry {
    @Min(0)
    private int maxRetries = 3;

    @Min(0)
    private long baseBackoffMs = 1000;
  }

  /**
   * Thresholds for the low-quality verdict on layout provider output. Any one of the rules firing
   * marks the output as low quality.
   */
  @Getter
  @Setter
  public static class Quality {
    /** Minimum combined block text + markdown characters. */
    private int minTextChars = 30;

    /** Average characters per block below which a sparse page is suspicious. */
    private double minAvgBlockChars = 8;

    /** Empty-block ratio above which output is rejected outright. */
    private double maxEmptyBlockRatio = 0.6;

    /** Empty-block ratio that, combined with a low average, marks output as low quality. */
    private double sparseEmptyBlockRatio = 0.4;
  }

  @Getter
  @Setter
  public static class Render {
    /** Scale factor applied to PDF pages (1.0 = 72 DPI). */
    private float scale = 2.0f;
  }

  @Getter
  @Setter
  public static class Upscale {
    private int scale = 2;
  }

  /** Replicate predictions API, used for dots.ocr layout and Real-ESRGAN upscaling. */
  @Getter
  @Setter
  public static class Replicate {
    private String baseUrl = "https://api.replicate.com/v1";
    private String apiToken = "";
    private String dotsOcrModel = "sljeff/dots.ocr";
    private String realEsrganModel = "nightmareai/real-esrgan";
    private Duration timeout = Duration.ofSeconds(600);
    private Duration startingPollInterval = Duration.ofSeconds(1);
    private Duration processingPollInterval = Duration.ofSeconds(2);
  }

  /** Datalab Marker API. */
  @Getter
  @Setter
  public static class Datalab {
    private String baseUrl = "https://www.datalab.to";
    private String apiKey = "";
    private String mode = "accurate";
    private Duration timeout = Duration.ofSeconds(240);
    private Duration pollInterval = Duration.ofSeconds(5);
    private int maxPolls = 60;
  }

  /** Object storage downloads (source files and upscaled images). */
  @Getter
  @Setter
  public static class Storage {
    private Duration timeout = Duration.ofSeconds(60);
    private int maxInMemorySize = 64 * 1024 * 1024;
  }
}
