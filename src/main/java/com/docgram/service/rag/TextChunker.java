package com.docgram.service.rag;

import com.docgram.config.DocgramProperties;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Splits text into overlapping chunks at word boundaries.
 *
 * <p>A chunk grows word by word until adding the next word would exceed the size limit; a single
 * word longer than the limit becomes its own chunk. The next chunk starts at the first word that
 * begins within {@code overlap} characters of the previous chunk's end. Output depends only on
 * the input text and settings.
 */
@Component
@RequiredArgsConstructor
public class TextChunker {

  private final DocgramProperties properties;

  public List<TextChunk> chunk(String text) {
    return chunk(
        text, properties.getChunking().getSize(), properties.getChunking().getOverlap());
  }

  public static List<TextChunk> chunk(String text, int size, int overlap) {
    if (size <= 0) {
      throw new IllegalArgumentException("Chunk size must be > 0");
    }
    if (overlap < 0 || overlap >= size) {
      throw new IllegalArgumentException("Chunk overlap must be in [0, size)");
    }
    List<int[]> words = wordSpans(text);
    List<TextChunk> chunks = new ArrayList<>();

    int i = 0;
    while (i < words.size()) {
      int start = words.get(i)[0];
      int end = words.get(i)[1];
      int j = i + 1;
      while (j < words.size() && words.get(j)[1] - start <= size) {
        end = words.get(j)[1];
        j++;
      }
      chunks.add(new TextChunk(chunks.size(), text.substring(start, end), start, end));
      if (j >= words.size()) {
        break;
      }

      int next = j;
      for (int k = i + 1; k < j; k++) {
        if (words.get(k)[0] >= end - overlap) {
          next = k;
          break;
        }
      }
      // an overlapping start that cannot reach past the next word would only repeat this tail
      if (words.get(j)[1] - words.get(next)[0] > size) {
        next = j;
      }
      i = next;
    }
    return chunks;
  }

  private static List<int[]> wordSpans(String text) {
    List<int[]> spans = new ArrayList<>();
    int length = text == null ? 0 : text.length();
    int pos = 0;
    while (pos < length) {
      while (pos < length && Character.isWhitespace(text.charAt(pos))) {
        pos++;
      }
      int wordStart = pos;
      while (pos < length && !Character.isWhitespace(text.charAt(pos))) {
        pos++;
      }
      if (pos > wordStart) {
        spans.add(new int[] {wordStart, pos});
      }
    }
    return spans;
  }
}
