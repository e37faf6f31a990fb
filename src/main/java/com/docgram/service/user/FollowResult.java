package com.docgram.service.user;

/**
 * Outcome of a follow toggle.
 *
 * @param following whether the caller now follows the target
 * @param followersCount the target's follower count
 * @param followingCount the caller's following count
 */
public record FollowResult(boolean following, int followersCount, int followingCount) {}
