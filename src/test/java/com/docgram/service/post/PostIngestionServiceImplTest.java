package com.docgram.service.post;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyFloat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.docgram.config.DocgramProperties;
import com.docgram.domain.entity.Post;
import com.docgram.domain.entity.User;
import com.docgram.domain.enums.ProcessingStatus;
import com.docgram.domain.repository.PostRepository;
import com.docgram.domain.repository.UserRepository;
import com.docgram.exception.InvalidInputException;
import com.docgram.exception.ResourceNotFoundException;
import com.docgram.job.BackgroundJobDispatcher;
import com.docgram.job.PostProcessingJob;
import com.docgram.service.rag.PdfDocumentReader;
import com.docgram.storage.ObjectStorageService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("PostIngestionServiceImpl Tests")
class PostIngestionServiceImplTest {

  @Mock private PostRepository postRepository;
  @Mock private UserRepository userRepository;
  @Mock private ObjectStorageService storageService;
  @Mock private PdfDocumentReader pdfReader;
  @Mock private BackgroundJobDispatcher jobDispatcher;

  private DocgramProperties properties;
  private SimpleMeterRegistry meterRegistry;
  private PostIngestionServiceImpl ingestionService;

  private final UUID ownerId = UUID.randomUUID();
  private User owner;

  @BeforeEach
  void setUp() {
    properties = new DocgramProperties();
    meterRegistry = new SimpleMeterRegistry();
    ingestionService =
        new PostIngestionServiceImpl(
            postRepository,
            userRepository,
            storageService,
            pdfReader,
            jobDispatcher,
            properties,
            meterRegistry);

    owner = User.builder().id(ownerId).username("alice").email("alice@example.com").build();
    when(userRepository.findById(ownerId)).thenReturn(Optional.of(owner));
    when(postRepository.save(any(Post.class))).thenAnswer(inv -> inv.getArgument(0));
    when(pdfReader.countPages(any())).thenReturn(7);
    when(pdfReader.renderThumbnail(any(), anyFloat())).thenReturn(Optional.of(new byte[] {1}));
  }

  @AfterEach
  void tearDown() {
    if (TransactionSynchronizationManager.isSynchronizationActive()) {
      TransactionSynchronizationManager.clearSynchronization();
    }
  }

  @Test
  void shouldStoreFileAndScheduleProcessing() {
    // When
    Post post =
        ingestionService.createPost(ownerId, pdf("report.pdf"), "Q3 Report", "numbers", false);

    // Then
    assertThat(post.getId()).isNotNull();
    assertThat(post.getOwner()).isSameAs(owner);
    assertThat(post.getTitle()).isEqualTo("Q3 Report");
    assertThat(post.getFileKey()).isEqualTo("pdfs/" + post.getId() + ".pdf");
    assertThat(post.getThumbnailKey()).isEqualTo("thumbnails/" + post.getId() + ".png");
    assertThat(post.getPageCount()).isEqualTo(7);
    assertThat(post.isPublic()).isFalse();
    assertThat(post.getProcessingStatus()).isEqualTo(ProcessingStatus.PENDING);
    assertThat(owner.getPostsCount()).isEqualTo(1);

    verify(storageService).put(eq(post.getFileKey()), any(), eq("application/pdf"));
    verify(jobDispatcher).dispatch(new PostProcessingJob(post.getId()));
    assertThat(meterRegistry.counter("post.uploaded").count()).isEqualTo(1.0);
  }

  @Test
  void shouldDeriveTitleFromFilename_whenTitleBlank() {
    Post post =
        ingestionService.createPost(ownerId, pdf("annual_report-2024.pdf"), " ", null, true);

    assertThat(post.getTitle()).isEqualTo("Annual Report 2024");
  }

  @Test
  void shouldStillCreatePost_whenThumbnailCannotBeRendered() {
    // Given
    when(pdfReader.renderThumbnail(any(), anyFloat())).thenReturn(Optional.empty());

    // When
    Post post = ingestionService.createPost(ownerId, pdf("a.pdf"), "A", null, true);

    // Then
    assertThat(post.getThumbnailKey()).isNull();
    verify(storageService, never()).put(anyString(), any(), eq("image/png"));
  }

  @Test
  void shouldSkipThumbnail_whenDisabled() {
    // Given
    properties.getUpload().setThumbnailsEnabled(false);

    // When
    Post post = ingestionService.createPost(ownerId, pdf("a.pdf"), "A", null, true);

    // Then
    assertThat(post.getThumbnailKey()).isNull();
    verify(pdfReader, never()).renderThumbnail(any(), anyFloat());
  }

  @Test
  void shouldIgnoreThumbnailStorageFailure() {
    // Given
    doThrow(new IllegalStateException("disk full"))
        .when(storageService)
        .put(anyString(), any(), eq("image/png"));

    // When
    Post post = ingestionService.createPost(ownerId, pdf("a.pdf"), "A", null, true);

    // Then
    assertThat(post.getThumbnailKey()).isNull();
  }

  @Test
  void shouldRemoveStoredObjects_whenTransactionRollsBack() {
    // Given
    TransactionSynchronizationManager.initSynchronization();

    // When
    Post post = ingestionService.createPost(ownerId, pdf("a.pdf"), "A", null, true);
    TransactionSynchronizationManager.getSynchronizations()
        .forEach(s -> s.afterCompletion(TransactionSynchronization.STATUS_ROLLED_BACK));

    // Then
    verify(storageService).delete("pdfs/" + post.getId() + ".pdf");
    verify(storageService).delete("thumbnails/" + post.getId() + ".png");
  }

  @Test
  void shouldKeepStoredObjects_whenTransactionCommits() {
    // Given
    TransactionSynchronizationManager.initSynchronization();

    // When
    ingestionService.createPost(ownerId, pdf("a.pdf"), "A", null, true);
    TransactionSynchronizationManager.getSynchronizations()
        .forEach(s -> s.afterCompletion(TransactionSynchronization.STATUS_COMMITTED));

    // Then
    verify(storageService, never()).delete(anyString());
  }

  @Test
  void shouldSaveOwnerWithIncrementedCount() {
    ArgumentCaptor<User> captor = ArgumentCaptor.forClass(User.class);

    ingestionService.createPost(ownerId, pdf("a.pdf"), "A", null, true);

    verify(userRepository).save(captor.capture());
    assertThat(captor.getValue().getPostsCount()).isEqualTo(1);
  }

  @Nested
  @DisplayName("upload validation")
  class Validation {

    @Test
    void shouldRejectEmptyFile() {
      MockMultipartFile empty =
          new MockMultipartFile("file", "a.pdf", "application/pdf", new byte[0]);

      assertThatThrownBy(() -> ingestionService.createPost(ownerId, empty, "A", null, true))
          .isInstanceOf(InvalidInputException.class)
          .hasMessage("File is empty");
      verifyNoInteractions(storageService, jobDispatcher);
    }

    @Test
    void shouldRejectNonPdfContentType() {
      MockMultipartFile text =
          new MockMultipartFile("file", "notes.txt", "text/plain", "hello".getBytes());

      assertThatThrownBy(() -> ingestionService.createPost(ownerId, text, "A", null, true))
          .isInstanceOf(InvalidInputException.class)
          .hasMessage("Only PDF files are allowed");
    }

    @Test
    void shouldRejectOversizedFile() {
      properties.getUpload().setMaxFileSize(2L * 1024 * 1024);
      MockMultipartFile big =
          new MockMultipartFile(
              "file", "big.pdf", "application/pdf", new byte[3 * 1024 * 1024]);

      assertThatThrownBy(() -> ingestionService.createPost(ownerId, big, "A", null, true))
          .isInstanceOf(InvalidInputException.class)
          .hasMessage("Maximum file size is 2MB");
      verifyNoInteractions(storageService);
    }

    @Test
    void shouldReturnNotFound_whenOwnerMissing() {
      UUID stranger = UUID.randomUUID();
      when(userRepository.findById(stranger)).thenReturn(Optional.empty());

      assertThatThrownBy(() -> ingestionService.createPost(stranger, pdf("a.pdf"), "A", null, true))
          .isInstanceOf(ResourceNotFoundException.class);
      verifyNoInteractions(storageService);
    }
  }

  @Nested
  @DisplayName("default title")
  class DefaultTitle {

    @Test
    void shouldTitleCaseWordsOfFilename() {
      assertThat(PostIngestionServiceImpl.defaultTitle("quarterly_report-2024.pdf"))
          .isEqualTo("Quarterly Report 2024");
      assertThat(PostIngestionServiceImpl.defaultTitle("MEETING notes.PDF"))
          .isEqualTo("Meeting Notes");
    }

    @Test
    void shouldFallBackToUntitled() {
      assertThat(PostIngestionServiceImpl.defaultTitle(null)).isEqualTo("Untitled");
      assertThat(PostIngestionServiceImpl.defaultTitle("  ")).isEqualTo("Untitled");
      assertThat(PostIngestionServiceImpl.defaultTitle("___.pdf")).isEqualTo("Untitled");
    }
  }

  private static MockMultipartFile pdf(String filename) {
    return new MockMultipartFile("file", filename, "application/pdf", "%PDF-1.7 body".getBytes());
  }
}
