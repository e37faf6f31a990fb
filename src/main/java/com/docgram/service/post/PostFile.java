package com.docgram.service.post;

/** The stored PDF of a post, ready to be streamed back to a client. */
public record PostFile(String filename, byte[] content) {}
