package com.docgram.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Application settings, bound once at startup and injected where needed. */
@Configuration
@ConfigurationProperties(prefix = "docgram")
@Getter
@Setter
public class DocgramProperties {

  private Upload upload = new Upload();
  private Storage storage = new Storage();
  private Chunking chunking = new Chunking();
  private Retrieval retrieval = new Retrieval();
  private Jobs jobs = new Jobs();
  private Security security = new Security();
  private Timeouts timeouts = new Timeouts();

  @Getter
  @Setter
  public static class Upload {
    /** Maximum accepted PDF size in bytes. */
    private long maxFileSize = 50L * 1024 * 1024;

    private boolean thumbnailsEnabled = true;
    private float thumbnailDpi = 48f;
  }

  @Getter
  @Setter
  public static class Storage {
    private String basePath = "./data/objects";
  }

  @Getter
  @Setter
  public static class Chunking {
    private int size = 1000;
    private int overlap = 200;
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int topK = 3;
    private int maxContextChars = 4000;
    private int historySize = 6;
    private int embeddingBatchSize = 32;
  }

  @Getter
  @Setter
  public static class Jobs {
    private int maxAttempts = 2;
    private long backoffMs = 500;
  }

  @Getter
  @Setter
  public static class Security {
    private String jwtSecret;

    /** Access token lifetime in days. */
    private int tokenTtlDays = 30;
  }

  @Getter
  @Setter
  public static class Timeouts {
    private int chatSeconds = 30;
    private int embeddingSeconds = 30;
  }
}
