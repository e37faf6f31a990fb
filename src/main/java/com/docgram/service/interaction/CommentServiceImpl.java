package com.docgram.service.interaction;

import com.docgram.domain.entity.Comment;
import com.docgram.domain.entity.Post;
import com.docgram.domain.entity.User;
import com.docgram.domain.repository.CommentRepository;
import com.docgram.domain.repository.OffsetLimitRequest;
import com.docgram.domain.repository.PostRepository;
import com.docgram.domain.repository.UserRepository;
import com.docgram.exception.InvalidInputException;
import com.docgram.exception.ResourceNotFoundException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of the CommentService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class CommentServiceImpl implements CommentService {

  static final int MAX_CONTENT_LENGTH = 1000;

  private final CommentRepository commentRepository;
  private final PostRepository postRepository;
  private final UserRepository userRepository;
  private final MeterRegistry meterRegistry;

  @Override
  @Transactional(readOnly = true)
  public List<Comment> getComments(UUID postId, UUID viewerId, int offset, int limit) {
    getVisiblePost(postId, viewerId);
    return commentRepository.findByPostId(postId, OffsetLimitRequest.of(offset, limit));
  }

  @Override
  @Transactional
  @Timed(value = "comment.add", description = "Time to add a comment")
  public Comment addComment(UUID postId, UUID authorId, String content) {
    String text = content == null ? "" : content.trim();
    if (text.isEmpty() || text.length() > MAX_CONTENT_LENGTH) {
      throw new InvalidInputException("Comment must be between 1 and 1000 characters");
    }
    Post post = getVisiblePost(postId, authorId);
    User author =
        userRepository
            .findById(authorId)
            .orElseThrow(() -> new ResourceNotFoundException("User", authorId));

    Comment saved =
        commentRepository.save(Comment.builder().post(post).author(author).content(text).build());
    post.incrementComments();
    postRepository.save(post);

    meterRegistry.counter("comment.added").increment();
    log.debug("User {} commented on post {}", authorId, postId);
    return saved;
  }

  private Post getVisiblePost(UUID postId, UUID userId) {
    return postRepository
        .findById(postId)
        .filter(post -> post.isVisibleTo(userId))
        .orElseThrow(() -> new ResourceNotFoundException("Post", postId));
  }
}
