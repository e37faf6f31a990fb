package com.docgram.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A registered Docgram account. */
@Entity
@Table(name = "users")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class User {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false, unique = true, length = 30)
  private String username;

  @Column(nullable = false, unique = true)
  private String email;

  @Column(nullable = false)
  private String passwordHash;

  @Column(length = 30)
  private String firstName;

  @Column(length = 30)
  private String lastName;

  @Column(length = 500)
  private String bio;

  private String avatarUrl;

  @Builder.Default private int followersCount = 0;

  @Builder.Default private int followingCount = 0;

  @Builder.Default private int postsCount = 0;

  @Builder.Default
  @Column(nullable = false)
  private boolean active = true;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  private LocalDateTime lastLoginAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
  }

  public void incrementFollowers() {
    followersCount++;
  }

  public void decrementFollowers() {
    followersCount = Math.max(0, followersCount - 1);
  }

  public void incrementFollowing() {
    followingCount++;
  }

  public void decrementFollowing() {
    followingCount = Math.max(0, followingCount - 1);
  }

  public void incrementPosts() {
    postsCount++;
  }

  public void decrementPosts() {
    postsCount = Math.max(0, postsCount - 1);
  }
}
