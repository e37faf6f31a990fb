package com.docgram.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.Conflicts;
import co.elastic.clients.elasticsearch._types.ErrorCause;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.DeleteByQueryRequest;
import co.elastic.clients.elasticsearch.core.DeleteByQueryResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import com.docgram.exception.SearchIndexException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Abstract base class for Elasticsearch index services.
 *
 * <p>Provides common functionality for indexing, vector search, and deletion. Subclasses define
 * the document-specific schema and conversion logic.
 *
 * @param <T> the document type stored in the index
 */
@Slf4j
public abstract class AbstractElasticsearchIndexService<T>
    implements ElasticsearchIndexOperations<T> {

  protected final ElasticsearchClient elasticsearchClient;
  protected final MeterRegistry meterRegistry;

  protected AbstractElasticsearchIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
  }

  protected abstract Map<String, Property> defineIndexProperties();

  protected abstract Map<String, Object> convertToDocument(T entity);

  protected abstract T convertFromDocument(Map<String, Object> source);

  protected abstract String getDocumentId(T entity);

  protected abstract SearchRequest buildVectorSearchRequest(
      Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK);

  protected abstract Query buildDeleteQuery(Map<String, Object> criteria);

  /** Returns the metric prefix for this index (e.g., "post_chunk"). */
  protected abstract String getMetricPrefix();

  @PostConstruct
  @Override
  public void initIndex() {
    boolean exists;
    try {
      exists = elasticsearchClient.indices().exists(e -> e.index(getIndexName())).value();
    } catch (Exception e) {
      // Chat degrades to empty context until the cluster is reachable.
      log.error(
          "Elasticsearch unavailable, skipping initialization of index '{}': {}",
          getIndexName(),
          e.getMessage());
      return;
    }
    if (exists) {
      validateMappings();
      return;
    }
    try {
      createIndex();
      log.info("Created Elasticsearch index: {}", getIndexName());
    } catch (IOException e) {
      throw new IllegalStateException(
          "Failed to create Elasticsearch index '" + getIndexName() + "'", e);
    }
  }

  private void createIndex() throws IOException {
    Map<String, Property> properties = defineIndexProperties();
    // dynamic=false keeps undeclared fields out of the mapping
    CreateIndexRequest request =
        CreateIndexRequest.of(
            c ->
                c.index(getIndexName())
                    .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties)));
    elasticsearchClient.indices().create(request);
  }

  /** Fails fast when an existing field has a different type than the declared schema. */
  private void validateMappings() {
    try {
      var response = elasticsearchClient.indices().getMapping(g -> g.index(getIndexName()));
      var indexMapping = response.get(getIndexName());
      if (indexMapping == null) {
        return;
      }
      Map<String, Property> actual = indexMapping.mappings().properties();
      List<String> mismatches = new ArrayList<>();
      defineIndexProperties()
          .forEach(
              (field, expected) -> {
                Property existing = actual.get(field);
                if (existing != null && existing._kind() != expected._kind()) {
                  mismatches.add(
                      String.format(
                          "field '%s' expected '%s' but found '%s'",
                          field, expected._kind(), existing._kind()));
                }
              });
      if (!mismatches.isEmpty()) {
        throw new IllegalStateException(
            "Index '"
                + getIndexName()
                + "' has incompatible field type(s), delete it and restart: "
                + String.join("; ", mismatches));
      }
      log.debug("Index '{}' mapping verified.", getIndexName());
    } catch (IOException e) {
      log.warn("Could not verify mapping of index '{}': {}", getIndexName(), e.getMessage());
    }
  }

  @Override
  @Timed(value = "elasticsearch.index", description = "Time to index documents")
  public void indexDocuments(List<T> documents) {
    if (documents.isEmpty()) {
      return;
    }

    try {
      BulkRequest.Builder bulkBuilder = new BulkRequest.Builder();
      for (T document : documents) {
        String id = getDocumentId(document);
        Map<String, Object> docMap = convertToDocument(document);
        bulkBuilder.operations(
            op -> op.index(idx -> idx.index(getIndexName()).id(id).document(docMap)));
      }

      BulkResponse response = elasticsearchClient.bulk(bulkBuilder.build());
      if (response.errors()) {
        meterRegistry.counter(getMetricPrefix() + ".index.errors").increment();
        String firstError =
            response.items().stream()
                .filter(item -> item.error() != null)
                .findFirst()
                .map(BulkResponseItem::error)
                .map(ErrorCause::reason)
                .orElse("unknown");
        throw new SearchIndexException(
            "Bulk indexing to " + getIndexName() + " reported errors: " + firstError);
      }
      log.debug("Indexed {} documents to {}", documents.size(), getIndexName());
      meterRegistry.counter(getMetricPrefix() + ".indexed").increment(documents.size());
    } catch (IOException e) {
      log.error("Failed to index documents to {}: {}", getIndexName(), e.getMessage(), e);
      throw new SearchIndexException("Failed to index documents", e);
    }
  }

  @Override
  @Timed(value = "elasticsearch.vector_search", description = "Time for vector search")
  public List<T> vectorSearch(
      Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK) {
    try {
      SearchRequest request = buildVectorSearchRequest(filterCriteria, queryEmbedding, topK);
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      List<T> results = mapHitsToDocuments(response.hits().hits());
      log.debug(
          "[vectorSearch] index={} filter={} returned={}",
          getIndexName(),
          filterCriteria,
          results.size());
      meterRegistry.counter(getMetricPrefix() + ".vector_search").increment();
      return results;
    } catch (IOException e) {
      log.error("Vector search failed for {}: {}", getIndexName(), e.getMessage(), e);
      throw new SearchIndexException("Vector search failed", e);
    }
  }

  @Override
  @Timed(value = "elasticsearch.delete_by", description = "Time to delete documents by criteria")
  public void deleteBy(Map<String, Object> criteria) {
    try {
      Query deleteQuery = buildDeleteQuery(criteria);
      DeleteByQueryRequest request =
          DeleteByQueryRequest.of(
              d ->
                  d.index(getIndexName())
                      .query(deleteQuery)
                      .conflicts(Conflicts.Proceed)
                      .refresh(true));
      DeleteByQueryResponse response = elasticsearchClient.deleteByQuery(request);
      log.info(
          "Deleted {} documents from {} with criteria: {}",
          response.deleted(),
          getIndexName(),
          criteria);
      meterRegistry.counter(getMetricPrefix() + ".deleted").increment();
    } catch (IOException e) {
      log.error(
          "Failed to delete documents from {} with criteria {}: {}",
          getIndexName(),
          criteria,
          e.getMessage(),
          e);
      throw new SearchIndexException("Failed to delete documents", e);
    }
  }

  @SuppressWarnings("unchecked")
  private List<T> mapHitsToDocuments(List<Hit<Map>> hits) {
    List<T> documents = new ArrayList<>();
    for (Hit<Map> hit : hits) {
      Map<String, Object> source = hit.source();
      if (source != null) {
        // _id is metadata and not part of _source
        source.put("id", hit.id());
        documents.add(convertFromDocument(source));
      }
    }
    return documents;
  }
}
