package com.docgram.service.rag;

/**
 * A contiguous slice of extracted text.
 *
 * @param index position of the chunk in document order, starting at 0
 * @param text the chunk text
 * @param startOffset inclusive start offset in the source text
 * @param endOffset exclusive end offset in the source text
 */
public record TextChunk(int index, String text, int startOffset, int endOffset) {}
