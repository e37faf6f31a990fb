package com.docgram.service.post;

import com.docgram.domain.entity.Post;
import java.util.List;
import java.util.UUID;

/**
 * Service interface for reading and managing posts.
 *
 * <p>A private post is invisible to everyone but its owner: reads report it as missing.
 */
public interface PostService {

  List<Post> listPublicPosts(int offset, int limit);

  /** Posts of the user and public posts of everyone they follow, newest first. */
  List<Post> getFeed(UUID userId, int offset, int limit);

  /**
   * Case-insensitive title search over public posts.
   *
   * @throws com.docgram.exception.InvalidInputException if the query is blank or too long
   */
  List<Post> searchPosts(String query, int offset, int limit);

  /**
   * Gets a post visible to the viewer.
   *
   * @throws com.docgram.exception.ResourceNotFoundException if missing or private to someone else
   */
  Post getPost(UUID postId, UUID viewerId);

  PostFile getPostFile(UUID postId, UUID viewerId);

  /**
   * Gets the PNG thumbnail of a post's first page, under the same visibility rule as the PDF.
   *
   * @throws com.docgram.exception.ResourceNotFoundException if the post is not visible or has no
   *     thumbnail
   */
  byte[] getPostThumbnail(UUID postId, UUID viewerId);

  /**
   * Applies the non-null fields to the post.
   *
   * @throws com.docgram.exception.ForbiddenException if the user does not own the post
   */
  Post updatePost(UUID postId, UUID userId, String title, String description, Boolean isPublic);

  Post toggleVisibility(UUID postId, UUID userId);

  /**
   * Deletes a post with its comments, likes, bookmarks, conversations, messages and indexed
   * chunks. Stored files are removed after commit.
   */
  void deletePost(UUID postId, UUID userId);

  /** Resets a post to {@code PENDING} and schedules processing again. */
  Post reprocessPost(UUID postId, UUID userId);
}
