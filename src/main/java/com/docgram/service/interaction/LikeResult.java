package com.docgram.service.interaction;

/** Outcome of a like toggle. */
public record LikeResult(boolean liked, int likesCount) {}
