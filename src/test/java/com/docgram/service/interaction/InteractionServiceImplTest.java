package com.docgram.service.interaction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.docgram.domain.entity.Bookmark;
import com.docgram.domain.entity.Post;
import com.docgram.domain.entity.PostLike;
import com.docgram.domain.entity.User;
import com.docgram.domain.repository.BookmarkRepository;
import com.docgram.domain.repository.PostLikeRepository;
import com.docgram.domain.repository.PostRepository;
import com.docgram.domain.repository.UserRepository;
import com.docgram.exception.ResourceNotFoundException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.data.domain.Pageable;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("InteractionServiceImpl Tests")
class InteractionServiceImplTest {

  @Mock private PostRepository postRepository;
  @Mock private UserRepository userRepository;
  @Mock private PostLikeRepository postLikeRepository;
  @Mock private BookmarkRepository bookmarkRepository;

  private SimpleMeterRegistry meterRegistry;
  private InteractionServiceImpl interactionService;

  private final UUID userId = UUID.randomUUID();
  private final UUID postId = UUID.randomUUID();
  private User user;
  private Post post;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    interactionService =
        new InteractionServiceImpl(
            postRepository, userRepository, postLikeRepository, bookmarkRepository, meterRegistry);

    user = User.builder().id(userId).username("reader").build();
    User owner = User.builder().id(UUID.randomUUID()).username("author").build();
    post = Post.builder().id(postId).owner(owner).title("Paper").likesCount(4).build();
    when(postRepository.findById(postId)).thenReturn(Optional.of(post));
    when(userRepository.findById(userId)).thenReturn(Optional.of(user));
    when(postLikeRepository.findByPostIdAndUserId(postId, userId)).thenReturn(Optional.empty());
    when(bookmarkRepository.findByPostIdAndUserId(postId, userId)).thenReturn(Optional.empty());
  }

  @Test
  void shouldLikePost_andIncrementCount() {
    // When
    LikeResult result = interactionService.toggleLike(postId, userId);

    // Then
    assertThat(result.liked()).isTrue();
    assertThat(result.likesCount()).isEqualTo(5);
    verify(postLikeRepository).save(any(PostLike.class));
    verify(postRepository).save(post);
    assertThat(meterRegistry.counter("post.like", "action", "like").count()).isEqualTo(1.0);
  }

  @Test
  void shouldUnlikePost_whenAlreadyLiked() {
    // Given
    PostLike like = PostLike.builder().post(post).user(user).build();
    when(postLikeRepository.findByPostIdAndUserId(postId, userId)).thenReturn(Optional.of(like));

    // When
    LikeResult result = interactionService.toggleLike(postId, userId);

    // Then
    assertThat(result.liked()).isFalse();
    assertThat(result.likesCount()).isEqualTo(3);
    verify(postLikeRepository).delete(like);
  }

  @Test
  void shouldNotLetLikeCountGoNegative() {
    // Given
    post.setLikesCount(0);
    when(postLikeRepository.findByPostIdAndUserId(postId, userId))
        .thenReturn(Optional.of(PostLike.builder().build()));

    // When / Then
    assertThat(interactionService.toggleLike(postId, userId).likesCount()).isZero();
  }

  @Test
  void shouldHidePrivatePost_fromLikes() {
    post.setPublic(false);

    assertThatThrownBy(() -> interactionService.toggleLike(postId, userId))
        .isInstanceOf(ResourceNotFoundException.class);
    verify(postLikeRepository, never()).save(any());
  }

  @Test
  void shouldToggleBookmark() {
    // When
    boolean added = interactionService.toggleBookmark(postId, userId);

    // Then
    assertThat(added).isTrue();
    verify(bookmarkRepository).save(any(Bookmark.class));
  }

  @Test
  void shouldRemoveExistingBookmark() {
    // Given
    Bookmark bookmark = Bookmark.builder().post(post).user(user).build();
    when(bookmarkRepository.findByPostIdAndUserId(postId, userId))
        .thenReturn(Optional.of(bookmark));

    // When / Then
    assertThat(interactionService.toggleBookmark(postId, userId)).isFalse();
    verify(bookmarkRepository).delete(bookmark);
  }

  @Test
  void shouldListBookmarkedPosts() {
    when(bookmarkRepository.findBookmarkedPosts(eq(userId), any(Pageable.class)))
        .thenReturn(List.of(post));

    assertThat(interactionService.getBookmarks(userId, 0, 20)).containsExactly(post);
  }

  @Test
  void shouldReturnLikedSubset_ofRequestedPosts() {
    // Given
    UUID otherId = UUID.randomUUID();
    when(postLikeRepository.findLikedPostIds(userId, List.of(postId, otherId)))
        .thenReturn(List.of(postId));

    // When
    Set<UUID> liked = interactionService.findLikedPostIds(userId, List.of(postId, otherId));

    // Then
    assertThat(liked).containsExactly(postId);
  }

  @Test
  void shouldSkipLikeLookup_whenNoPosts() {
    assertThat(interactionService.findLikedPostIds(userId, List.of())).isEmpty();

    verify(postLikeRepository, never()).findLikedPostIds(any(), any());
  }
}
