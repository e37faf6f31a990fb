package com.docgram.service.interaction;

import com.docgram.domain.entity.Bookmark;
import com.docgram.domain.entity.Post;
import com.docgram.domain.entity.PostLike;
import com.docgram.domain.entity.User;
import com.docgram.domain.repository.BookmarkRepository;
import com.docgram.domain.repository.OffsetLimitRequest;
import com.docgram.domain.repository.PostLikeRepository;
import com.docgram.domain.repository.PostRepository;
import com.docgram.domain.repository.UserRepository;
import com.docgram.exception.ResourceNotFoundException;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of the InteractionService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class InteractionServiceImpl implements InteractionService {

  private final PostRepository postRepository;
  private final UserRepository userRepository;
  private final PostLikeRepository postLikeRepository;
  private final BookmarkRepository bookmarkRepository;
  private final MeterRegistry meterRegistry;

  @Override
  @Transactional
  public LikeResult toggleLike(UUID postId, UUID userId) {
    Post post = getVisiblePost(postId, userId);

    Optional<PostLike> existing = postLikeRepository.findByPostIdAndUserId(postId, userId);
    boolean liked;
    if (existing.isPresent()) {
      postLikeRepository.delete(existing.get());
      post.decrementLikes();
      liked = false;
    } else {
      postLikeRepository.save(PostLike.builder().post(post).user(getUser(userId)).build());
      post.incrementLikes();
      liked = true;
    }
    postRepository.save(post);

    meterRegistry.counter("post.like", "action", liked ? "like" : "unlike").increment();
    return new LikeResult(liked, post.getLikesCount());
  }

  @Override
  @Transactional
  public boolean toggleBookmark(UUID postId, UUID userId) {
    Post post = getVisiblePost(postId, userId);

    Optional<Bookmark> existing = bookmarkRepository.findByPostIdAndUserId(postId, userId);
    if (existing.isPresent()) {
      bookmarkRepository.delete(existing.get());
      return false;
    }
    bookmarkRepository.save(Bookmark.builder().post(post).user(getUser(userId)).build());
    return true;
  }

  @Override
  @Transactional(readOnly = true)
  public List<Post> getBookmarks(UUID userId, int offset, int limit) {
    return bookmarkRepository.findBookmarkedPosts(userId, OffsetLimitRequest.of(offset, limit));
  }

  @Override
  @Transactional(readOnly = true)
  public Set<UUID> findLikedPostIds(UUID userId, Collection<UUID> postIds) {
    if (postIds.isEmpty()) {
      return Set.of();
    }
    return new HashSet<>(postLikeRepository.findLikedPostIds(userId, postIds));
  }

  private Post getVisiblePost(UUID postId, UUID userId) {
    return postRepository
        .findById(postId)
        .filter(post -> post.isVisibleTo(userId))
        .orElseThrow(() -> new ResourceNotFoundException("Post", postId));
  }

  private User getUser(UUID userId) {
    return userRepository
        .findById(userId)
        .orElseThrow(() -> new ResourceNotFoundException("User", userId));
  }
}
