package com.docgram.service.post;

import com.docgram.domain.entity.Post;
import com.docgram.domain.repository.PostRepository;
import com.docgram.elasticsearch.PostChunk;
import com.docgram.elasticsearch.PostChunkIndexService;
import com.docgram.exception.PostProcessingException;
import com.docgram.job.BackgroundJobHandler;
import com.docgram.job.PostProcessingJob;
import com.docgram.service.rag.EmbeddingService;
import com.docgram.service.rag.PdfDocumentReader;
import com.docgram.service.rag.TextChunk;
import com.docgram.service.rag.TextChunker;
import com.docgram.service.support.TransactionRunner;
import com.docgram.storage.ObjectStorageService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns an uploaded PDF into searchable chunks: extract, chunk, embed, index.
 *
 * <p>Chunk ids are derived from the post id and chunk index, and the post's previous chunks are
 * removed before indexing, so running the job again replaces the chunk set instead of growing it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PostProcessingService implements BackgroundJobHandler<PostProcessingJob> {

  private static final int MAX_ERROR_LENGTH = 1000;

  private final PostRepository postRepository;
  private final ObjectStorageService storageService;
  private final PdfDocumentReader pdfReader;
  private final TextChunker textChunker;
  private final EmbeddingService embeddingService;
  private final PostChunkIndexService chunkIndexService;
  private final TransactionRunner transactionRunner;
  private final MeterRegistry meterRegistry;

  @Override
  public Class<PostProcessingJob> jobType() {
    return PostProcessingJob.class;
  }

  @Override
  @Timed(value = "post.process", description = "Time to process an uploaded PDF")
  public void handle(PostProcessingJob job) {
    UUID postId = job.postId();
    Post post = updatePost(postId, Post::startProcessing);
    log.info("Processing post {} ({})", postId, post.getTitle());

    List<String> pages;
    try {
      pages = pdfReader.extractPages(storageService.get(post.getFileKey()));
    } catch (IOException e) {
      throw new PostProcessingException(postId, "Failed to parse PDF: " + e.getMessage(), e);
    }

    List<TextChunk> chunks = textChunker.chunk(String.join("\n\n", pages));
    if (chunks.isEmpty()) {
      // image-only PDFs: nothing to retrieve, chat falls back to its no-context answer
      log.warn("Post {} has no extractable text", postId);
      chunkIndexService.deleteByPostId(postId);
      if (markReady(postId, 0)) {
        meterRegistry.counter("post.processing.success").increment();
      }
      return;
    }

    List<List<Float>> embeddings =
        embeddingService.embedTexts(chunks.stream().map(TextChunk::text).toList());
    if (embeddings.size() != chunks.size()) {
      throw new PostProcessingException(
          postId,
          "Embedding returned " + embeddings.size() + " vectors for " + chunks.size() + " chunks");
    }

    List<PostChunk> documents = new ArrayList<>(chunks.size());
    for (int i = 0; i < chunks.size(); i++) {
      TextChunk chunk = chunks.get(i);
      documents.add(
          PostChunk.builder()
              .id(PostChunk.idFor(postId, chunk.index()))
              .postId(postId)
              .title(post.getTitle())
              .chunkIndex(chunk.index())
              .startOffset(chunk.startOffset())
              .endOffset(chunk.endOffset())
              .content(chunk.text())
              .embedding(embeddings.get(i))
              .build());
    }

    chunkIndexService.deleteByPostId(postId);
    chunkIndexService.indexDocuments(documents);

    if (!markReady(postId, documents.size())) {
      return;
    }
    meterRegistry.counter("post.processing.success").increment();
    log.info(
        "Post {} processed: {} pages, {} chunks indexed", postId, pages.size(), documents.size());
  }

  @Override
  public void onFailure(PostProcessingJob job, Exception cause) {
    meterRegistry.counter("post.processing.failure").increment();
    String message =
        cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    if (message.length() > MAX_ERROR_LENGTH) {
      message = message.substring(0, MAX_ERROR_LENGTH);
    }
    String error = message;
    boolean marked =
        transactionRunner.inNewTransaction(
            "post " + job.postId(),
            () ->
                postRepository
                    .findById(job.postId())
                    .map(
                        post -> {
                          post.markFailed(error);
                          postRepository.saveAndFlush(post);
                          return true;
                        })
                    .orElse(false));
    if (marked) {
      log.error("Post {} marked FAILED: {}", job.postId(), error);
    } else {
      discardChunksOfDeletedPost(job.postId());
    }
  }

  /** Returns false when the post was deleted while its chunks were being built. */
  private boolean markReady(UUID postId, int chunkCount) {
    boolean updated =
        transactionRunner.inNewTransaction(
            "post " + postId,
            () ->
                postRepository
                    .findById(postId)
                    .map(
                        post -> {
                          post.markReady(chunkCount);
                          postRepository.saveAndFlush(post);
                          return true;
                        })
                    .orElse(false));
    if (!updated) {
      discardChunksOfDeletedPost(postId);
    }
    return updated;
  }

  private void discardChunksOfDeletedPost(UUID postId) {
    // the delete may have run before these chunks were indexed
    log.warn("Post {} was deleted during processing, removing its chunks", postId);
    chunkIndexService.deleteByPostId(postId);
  }

  private Post updatePost(UUID postId, Consumer<Post> change) {
    return transactionRunner.inNewTransaction(
        "post " + postId,
        () -> {
          Post post =
              postRepository
                  .findById(postId)
                  .orElseThrow(() -> new PostProcessingException(postId, "Post not found"));
          change.accept(post);
          return postRepository.saveAndFlush(post);
        });
  }
}
