package com.docgram.service.interaction;

import com.docgram.domain.entity.Comment;
import java.util.List;
import java.util.UUID;

/** Service interface for post comments. */
public interface CommentService {

  /** Comments of a visible post, oldest first. */
  List<Comment> getComments(UUID postId, UUID viewerId, int offset, int limit);

  /**
   * Adds a comment and bumps the post's comment count.
   *
   * @throws com.docgram.exception.InvalidInputException if the content is blank or too long
   */
  Comment addComment(UUID postId, UUID authorId, String content);
}
