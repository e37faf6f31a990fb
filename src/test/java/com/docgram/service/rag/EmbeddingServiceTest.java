package com.docgram.service.rag;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.docgram.config.DocgramProperties;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("EmbeddingService Tests")
class EmbeddingServiceTest {

  @Mock private EmbeddingModel embeddingModel;

  private DocgramProperties properties;
  private SimpleMeterRegistry meterRegistry;
  private EmbeddingService embeddingService;

  @BeforeEach
  void setUp() {
    properties = new DocgramProperties();
    meterRegistry = new SimpleMeterRegistry();
    embeddingService = new EmbeddingService(embeddingModel, properties, meterRegistry);

    // each vector encodes the length of the text it was computed from
    when(embeddingModel.embedAll(anyList()))
        .thenAnswer(
            invocation -> {
              List<TextSegment> segments = invocation.getArgument(0);
              return Response.from(
                  segments.stream()
                      .map(s -> Embedding.from(new float[] {s.text().length()}))
                      .toList());
            });
  }

  @Test
  void shouldEmbedSingleText() {
    // Given
    when(embeddingModel.embed(anyString()))
        .thenReturn(Response.from(Embedding.from(new float[] {0.1f, 0.2f, 0.3f})));

    // When
    List<Float> result = embeddingService.embedText("What is in the report?");

    // Then
    assertThat(result).containsExactly(0.1f, 0.2f, 0.3f);
    assertThat(meterRegistry.counter("embedding.requests.success").count()).isEqualTo(1.0);
  }

  @Test
  void shouldTruncateText_whenLongerThanProviderLimit() {
    // Given
    when(embeddingModel.embed(anyString()))
        .thenReturn(Response.from(Embedding.from(new float[] {1f})));
    ArgumentCaptor<String> captor = ArgumentCaptor.forClass(String.class);

    // When
    embeddingService.embedText("x".repeat(8000));

    // Then
    verify(embeddingModel).embed(captor.capture());
    assertThat(captor.getValue()).hasSize(5000);
  }

  @Test
  void shouldEmbedInBatches_preservingOrder() {
    // Given
    properties.getRetrieval().setEmbeddingBatchSize(2);

    // When
    List<List<Float>> result = embeddingService.embedTexts(List.of("a", "bb", "ccc"));

    // Then
    verify(embeddingModel, times(2)).embedAll(anyList());
    assertThat(result).containsExactly(List.of(1f), List.of(2f), List.of(3f));
  }

  @Test
  void shouldReturnEmptyList_whenNoTexts() {
    assertThat(embeddingService.embedTexts(List.of())).isEmpty();
  }
}
