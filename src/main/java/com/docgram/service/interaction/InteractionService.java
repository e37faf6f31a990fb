package com.docgram.service.interaction;

import com.docgram.domain.entity.Post;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Likes and bookmarks. Both are toggles: applying one twice restores the original state and
 * counters.
 */
public interface InteractionService {

  LikeResult toggleLike(UUID postId, UUID userId);

  /**
   * Bookmarks the post, or removes the bookmark if present.
   *
   * @return whether the post is bookmarked after the call
   */
  boolean toggleBookmark(UUID postId, UUID userId);

  List<Post> getBookmarks(UUID userId, int offset, int limit);

  /** Returns the subset of {@code postIds} the user has liked. */
  Set<UUID> findLikedPostIds(UUID userId, Collection<UUID> postIds);
}
