package com.docgram.service.user;

import com.docgram.domain.entity.User;

/** A user as seen by another user. */
public record UserProfile(User user, boolean following) {}
