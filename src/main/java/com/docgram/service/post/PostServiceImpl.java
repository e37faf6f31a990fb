package com.docgram.service.post;

import com.docgram.domain.entity.Post;
import com.docgram.domain.entity.User;
import com.docgram.domain.enums.ProcessingStatus;
import com.docgram.domain.repository.BookmarkRepository;
import com.docgram.domain.repository.ChatMessageRepository;
import com.docgram.domain.repository.CommentRepository;
import com.docgram.domain.repository.ConversationRepository;
import com.docgram.domain.repository.OffsetLimitRequest;
import com.docgram.domain.repository.PostLikeRepository;
import com.docgram.domain.repository.PostRepository;
import com.docgram.domain.repository.UserRepository;
import com.docgram.elasticsearch.PostChunkIndexService;
import com.docgram.exception.ForbiddenException;
import com.docgram.exception.InvalidInputException;
import com.docgram.exception.ResourceNotFoundException;
import com.docgram.job.BackgroundJobDispatcher;
import com.docgram.job.PostProcessingJob;
import com.docgram.storage.ObjectStorageService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/** Implementation of the PostService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class PostServiceImpl implements PostService {

  static final int MAX_QUERY_LENGTH = 100;

  private final PostRepository postRepository;
  private final UserRepository userRepository;
  private final CommentRepository commentRepository;
  private final PostLikeRepository postLikeRepository;
  private final BookmarkRepository bookmarkRepository;
  private final ConversationRepository conversationRepository;
  private final ChatMessageRepository chatMessageRepository;
  private final PostChunkIndexService chunkIndexService;
  private final ObjectStorageService storageService;
  private final BackgroundJobDispatcher jobDispatcher;
  private final MeterRegistry meterRegistry;

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "post.list", description = "Time to list public posts")
  public List<Post> listPublicPosts(int offset, int limit) {
    return postRepository.findPublicPosts(OffsetLimitRequest.of(offset, limit));
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "post.feed", description = "Time to build a user feed")
  public List<Post> getFeed(UUID userId, int offset, int limit) {
    return postRepository.findFeed(userId, OffsetLimitRequest.of(offset, limit));
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "post.search", description = "Time to search posts by title")
  public List<Post> searchPosts(String query, int offset, int limit) {
    String trimmed = query == null ? "" : query.trim();
    if (trimmed.isEmpty() || trimmed.length() > MAX_QUERY_LENGTH) {
      throw new InvalidInputException("Search query must be between 1 and 100 characters");
    }
    return postRepository.searchPublicByTitle(trimmed, OffsetLimitRequest.of(offset, limit));
  }

  @Override
  @Transactional(readOnly = true)
  public Post getPost(UUID postId, UUID viewerId) {
    return postRepository
        .findById(postId)
        .filter(post -> post.isVisibleTo(viewerId))
        .orElseThrow(() -> new ResourceNotFoundException("Post", postId));
  }

  @Override
  @Transactional(readOnly = true)
  public PostFile getPostFile(UUID postId, UUID viewerId) {
    Post post = getPost(postId, viewerId);
    byte[] content = storageService.get(post.getFileKey());
    return new PostFile(post.getTitle() + ".pdf", content);
  }

  @Override
  @Transactional(readOnly = true)
  public byte[] getPostThumbnail(UUID postId, UUID viewerId) {
    Post post = getPost(postId, viewerId);
    if (post.getThumbnailKey() == null) {
      throw new ResourceNotFoundException("Thumbnail", postId);
    }
    return storageService.get(post.getThumbnailKey());
  }

  @Override
  @Transactional
  @Timed(value = "post.update", description = "Time to update a post")
  public Post updatePost(
      UUID postId, UUID userId, String title, String description, Boolean isPublic) {
    Post post = getOwnedPost(postId, userId);
    if (title != null) {
      if (title.isBlank()) {
        throw new InvalidInputException("Title must not be blank");
      }
      post.setTitle(title.trim());
    }
    if (description != null) {
      post.setDescription(description);
    }
    if (isPublic != null) {
      post.setPublic(isPublic);
    }
    return postRepository.save(post);
  }

  @Override
  @Transactional
  public Post toggleVisibility(UUID postId, UUID userId) {
    Post post = getOwnedPost(postId, userId);
    post.setPublic(!post.isPublic());
    log.info("Post {} is now {}", postId, post.isPublic() ? "public" : "private");
    return postRepository.save(post);
  }

  @Override
  @Transactional
  @Timed(value = "post.delete", description = "Time to delete a post")
  public void deletePost(UUID postId, UUID userId) {
    Post post = getOwnedPost(postId, userId);

    try {
      chunkIndexService.deleteByPostId(postId);
    } catch (Exception e) {
      // stale chunks are unreachable once the post row is gone
      log.error("Failed to delete indexed chunks of post {}: {}", postId, e.getMessage());
      meterRegistry.counter("post.delete.index_failure").increment();
    }

    int messages = chatMessageRepository.deleteByPostId(postId);
    conversationRepository.deleteByPostId(postId);
    int comments = commentRepository.deleteByPostId(postId);
    int likes = postLikeRepository.deleteByPostId(postId);
    int bookmarks = bookmarkRepository.deleteByPostId(postId);

    User owner = post.getOwner();
    owner.decrementPosts();
    userRepository.save(owner);
    postRepository.delete(post);

    List<String> keys = new ArrayList<>();
    keys.add(post.getFileKey());
    if (post.getThumbnailKey() != null) {
      keys.add(post.getThumbnailKey());
    }
    deleteObjectsAfterCommit(keys);

    meterRegistry.counter("post.deleted").increment();
    log.info(
        "Deleted post {} with {} comments, {} likes, {} bookmarks, {} messages",
        postId,
        comments,
        likes,
        bookmarks,
        messages);
  }

  @Override
  @Transactional
  public Post reprocessPost(UUID postId, UUID userId) {
    Post post = getOwnedPost(postId, userId);
    if (post.getProcessingStatus() == ProcessingStatus.PROCESSING) {
      throw new InvalidInputException("Post is already being processed");
    }
    post.resetForReprocessing();
    Post saved = postRepository.save(post);
    jobDispatcher.dispatch(new PostProcessingJob(postId));
    meterRegistry.counter("post.reprocess").increment();
    log.info("Reprocessing requested for post {}", postId);
    return saved;
  }

  private Post getOwnedPost(UUID postId, UUID userId) {
    Post post =
        postRepository
            .findById(postId)
            .orElseThrow(() -> new ResourceNotFoundException("Post", postId));
    if (!post.isOwnedBy(userId)) {
      throw new ForbiddenException("Not authorized to modify this post");
    }
    return post;
  }

  private void deleteObjectsAfterCommit(List<String> keys) {
    Runnable cleanup =
        () -> {
          for (String key : keys) {
            try {
              storageService.delete(key);
            } catch (RuntimeException e) {
              log.warn("Failed to delete stored object {}: {}", key, e.getMessage());
            }
          }
        };
    if (TransactionSynchronizationManager.isSynchronizationActive()) {
      TransactionSynchronizationManager.registerSynchronization(
          new TransactionSynchronization() {
            @Override
            public void afterCommit() {
              cleanup.run();
            }
          });
    } else {
      cleanup.run();
    }
  }
}
