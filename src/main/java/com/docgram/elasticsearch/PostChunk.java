package com.docgram.elasticsearch;

import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A slice of a post's PDF text stored in Elasticsearch with its embedding.
 *
 * <p>The id is {@code <postId>_<chunkIndex>}, so reprocessing a post overwrites its chunks.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostChunk {

  private String id;
  private UUID postId;
  private String title;
  private int chunkIndex;
  private int startOffset;
  private int endOffset;
  private String content;
  private List<Float> embedding;

  public static String idFor(UUID postId, int chunkIndex) {
    return postId + "_" + chunkIndex;
  }
}
