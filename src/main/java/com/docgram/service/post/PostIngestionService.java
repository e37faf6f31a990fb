package com.docgram.service.post;

import com.docgram.domain.entity.Post;
import java.util.UUID;
import org.springframework.web.multipart.MultipartFile;

/** Accepts PDF uploads and turns them into posts awaiting background processing. */
public interface PostIngestionService {

  /**
   * Stores the PDF, creates the post and schedules its processing.
   *
   * <p>Returns as soon as the post row exists; text extraction and embedding happen after commit.
   *
   * @param ownerId the uploading user
   * @param file the uploaded PDF
   * @param title optional title, derived from the filename when blank
   * @param description optional description
   * @param isPublic whether other users can see the post
   * @return the created post, in {@code PENDING} state
   * @throws com.docgram.exception.InvalidInputException if the file is empty, not a PDF or too
   *     large
   */
  Post createPost(
      UUID ownerId, MultipartFile file, String title, String description, boolean isPublic);
}
