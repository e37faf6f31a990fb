package com.docgram.service.rag;

import com.docgram.config.DocgramProperties;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Service for generating text embeddings.
 *
 * <p>Both methods return an empty list when the provider stays unavailable after retries; callers
 * treat that as "no embedding".
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // text-embedding-3-small accepts 8192 tokens; keep a wide margin for dense scripts
  private static final int MAX_CHARS_PER_EMBEDDING = 5000;

  private final EmbeddingModel embeddingModel;
  private final DocgramProperties properties;
  private final MeterRegistry meterRegistry;

  @CircuitBreaker(name = "openai", fallbackMethod = "embedTextFallback")
  @Retry(name = "openai")
  public List<Float> embedText(String text) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      Response<Embedding> response = embeddingModel.embed(truncate(text));
      meterRegistry.counter("embedding.requests.success").increment();
      return toList(response.content().vector());
    } finally {
      sample.stop(meterRegistry.timer("embedding.duration"));
    }
  }

  /**
   * Embeds texts in provider batches, preserving input order.
   *
   * @param texts texts to embed
   * @return one vector per input text, or an empty list on failure
   */
  @CircuitBreaker(name = "openai", fallbackMethod = "embedTextsFallback")
  @Retry(name = "openai")
  public List<List<Float>> embedTexts(List<String> texts) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      int batchSize = Math.max(1, properties.getRetrieval().getEmbeddingBatchSize());
      List<List<Float>> results = new ArrayList<>(texts.size());
      for (int start = 0; start < texts.size(); start += batchSize) {
        List<TextSegment> batch =
            texts.subList(start, Math.min(start + batchSize, texts.size())).stream()
                .map(text -> TextSegment.from(truncate(text)))
                .toList();
        Response<List<Embedding>> response = embeddingModel.embedAll(batch);
        for (Embedding embedding : response.content()) {
          results.add(toList(embedding.vector()));
        }
        log.debug("Embedded batch starting at {} ({} texts)", start, batch.size());
      }
      meterRegistry.counter("embedding.requests.success").increment();
      return results;
    } finally {
      sample.stop(meterRegistry.timer("embedding.batch.duration"));
    }
  }

  @SuppressWarnings("unused")
  private List<Float> embedTextFallback(String text, Throwable t) {
    log.error("Embedding failed for text, circuit breaker open: {}", t.getMessage());
    meterRegistry.counter("embedding.requests.failure").increment();
    return List.of();
  }

  @SuppressWarnings("unused")
  private List<List<Float>> embedTextsFallback(List<String> texts, Throwable t) {
    log.error("Batch embedding of {} texts failed: {}", texts.size(), t.getMessage());
    meterRegistry.counter("embedding.requests.failure").increment();
    return List.of();
  }

  private String truncate(String text) {
    if (text.length() <= MAX_CHARS_PER_EMBEDDING) {
      return text;
    }
    log.warn(
        "Text too long for embedding, truncating from {} to {} chars",
        text.length(),
        MAX_CHARS_PER_EMBEDDING);
    return text.substring(0, MAX_CHARS_PER_EMBEDDING);
  }

  private static List<Float> toList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }
}
