package com.docgram.service.auth;

import com.docgram.domain.entity.User;

/** A freshly issued access token and the account it belongs to. */
public record AuthResult(String accessToken, User user) {}
