package com.docgram.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import com.google.common.annotations.VisibleForTesting;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch index service for {@link PostChunk} documents.
 *
 * <p>Every query is filtered on {@code postId}: retrieval for one post never sees another post's
 * text.
 */
@Service
@Slf4j
public class PostChunkIndexService extends AbstractElasticsearchIndexService<PostChunk> {

  static final String POST_ID = "postId";

  @Value("${elasticsearch.index-name:docgram-post-chunks}")
  private String indexName;

  @Value("${langchain4j.openai.embedding-model.dimensions:1536}")
  private int vectorDimensions;

  @Autowired
  public PostChunkIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    super(elasticsearchClient, meterRegistry);
  }

  @VisibleForTesting
  PostChunkIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      String indexName,
      int vectorDimensions) {
    super(elasticsearchClient, meterRegistry);
    this.indexName = indexName;
    this.vectorDimensions = vectorDimensions;
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    // postId must be keyword for exact term filtering
    properties.put(POST_ID, Property.of(p -> p.keyword(k -> k)));
    properties.put("title", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("chunkIndex", Property.of(p -> p.integer(i -> i)));
    properties.put("startOffset", Property.of(p -> p.integer(i -> i)));
    properties.put("endOffset", Property.of(p -> p.integer(i -> i)));
    properties.put("content", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put(
        "embedding",
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    return properties;
  }

  @Override
  protected Map<String, Object> convertToDocument(PostChunk chunk) {
    Map<String, Object> document = new HashMap<>();
    document.put(POST_ID, chunk.getPostId().toString());
    document.put("title", chunk.getTitle());
    document.put("chunkIndex", chunk.getChunkIndex());
    document.put("startOffset", chunk.getStartOffset());
    document.put("endOffset", chunk.getEndOffset());
    document.put("content", chunk.getContent());
    document.put("embedding", chunk.getEmbedding());
    return document;
  }

  @Override
  protected PostChunk convertFromDocument(Map<String, Object> source) {
    return PostChunk.builder()
        .id((String) source.get("id"))
        .postId(UUID.fromString((String) source.get(POST_ID)))
        .title((String) source.get("title"))
        .chunkIndex(intValue(source.get("chunkIndex")))
        .startOffset(intValue(source.get("startOffset")))
        .endOffset(intValue(source.get("endOffset")))
        .content((String) source.get("content"))
        .build();
  }

  @Override
  protected String getDocumentId(PostChunk entity) {
    return entity.getId();
  }

  @Override
  protected SearchRequest buildVectorSearchRequest(
      Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK) {
    UUID postId = (UUID) filterCriteria.get(POST_ID);
    if (postId == null) {
      throw new IllegalArgumentException("postId filter is required for vector search");
    }

    return SearchRequest.of(
        s ->
            s.index(indexName)
                .knn(
                    k ->
                        k.field("embedding")
                            .queryVector(queryEmbedding)
                            .k(topK)
                            .numCandidates(Math.max(topK * 10, 50))
                            .filter(f -> f.term(t -> t.field(POST_ID).value(postId.toString()))))
                .source(src -> src.filter(f -> f.excludes("embedding")))
                .size(topK));
  }

  @Override
  protected Query buildDeleteQuery(Map<String, Object> criteria) {
    UUID postId = (UUID) criteria.get(POST_ID);
    if (postId == null) {
      throw new IllegalArgumentException("deleteBy requires postId in criteria");
    }
    return Query.of(q -> q.term(t -> t.field(POST_ID).value(postId.toString())));
  }

  @Override
  protected String getMetricPrefix() {
    return "post_chunk";
  }

  /** Top-K chunks of one post ranked by similarity to the query embedding. */
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "searchPostFallback")
  public List<PostChunk> searchPost(UUID postId, List<Float> queryEmbedding, int topK) {
    Map<String, Object> criteria = new HashMap<>();
    criteria.put(POST_ID, postId);
    return vectorSearch(criteria, queryEmbedding, topK);
  }

  @SuppressWarnings("unused")
  private List<PostChunk> searchPostFallback(
      UUID postId, List<Float> queryEmbedding, int topK, Throwable t) {
    log.warn("Chunk search for post {} degraded to empty context: {}", postId, t.getMessage());
    meterRegistry.counter(getMetricPrefix() + ".vector_search.fallback").increment();
    return List.of();
  }

  /** Removes every chunk of a post. */
  public void deleteByPostId(UUID postId) {
    Map<String, Object> criteria = new HashMap<>();
    criteria.put(POST_ID, postId);
    deleteBy(criteria);
  }

  private static int intValue(Object value) {
    return value instanceof Number n ? n.intValue() : 0;
  }
}
