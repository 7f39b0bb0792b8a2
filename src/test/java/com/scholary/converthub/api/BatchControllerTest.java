package com.scholary.converthub.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.converthub.batch.BatchCoordinator;
import com.scholary.converthub.batch.BatchFile;
import com.scholary.converthub.batch.BatchResult;
import com.scholary.converthub.batch.BatchStatus;
import com.scholary.converthub.batch.BatchStatusSnapshot;
import com.scholary.converthub.batch.BatchValidationException;
import com.scholary.converthub.batch.FileDescriptor;
import com.scholary.converthub.converter.ConversionOptions;
import com.scholary.converthub.converter.ConversionResult;
import com.scholary.converthub.converter.ConverterRegistry;
import com.scholary.converthub.converter.FileConverter;
import com.scholary.converthub.converter.UnknownOperationException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(BatchController.class)
class BatchControllerTest {

  private static final Instant CREATED = Instant.parse("2024-05-01T10:00:00Z");

  @Autowired private MockMvc mockMvc;

  @MockBean private BatchCoordinator coordinator;
  @MockBean private ConverterRegistry registry;

  private final FileConverter converter = mock(FileConverter.class);

  @BeforeEach
  void setUp() {
    when(registry.require("image_convert")).thenReturn(converter);
    when(registry.require("pdf_merge")).thenThrow(new UnknownOperationException("pdf_merge"));
  }

  @Test
  void convertBatch_returnsPerFileResultsInSnakeCase() throws Exception {
    when(coordinator.createBatch(anyList(), eq("image_convert"), any())).thenReturn("b1");
    when(coordinator.processBatch(eq("b1"), anyList(), eq(converter)))
        .thenReturn(
            new BatchResult(
                "b1",
                2,
                1,
                1,
                List.of(
                    ConversionResult.success("b1_0", "https://cdn/a.jpg", Map.of(), 12),
                    ConversionResult.error("b1_1", "Input is not a supported image", null, 3)),
                "https://cdn/batch_b1.zip"));

    mockMvc
        .perform(
            multipart("/api/batch/image_convert")
                .file(new MockMultipartFile("files", "a.png", "image/png", new byte[] {1}))
                .file(new MockMultipartFile("files", "b.png", "image/png", new byte[] {2}))
                .param("output_format", "jpg"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.batch_id").value("b1"))
        .andExpect(jsonPath("$.total_files").value(2))
        .andExpect(jsonPath("$.zip_url").value("https://cdn/batch_b1.zip"))
        .andExpect(jsonPath("$.results[0].status").value("success"))
        .andExpect(jsonPath("$.results[0].result_url").value("https://cdn/a.jpg"))
        .andExpect(jsonPath("$.results[1].status").value("error"))
        .andExpect(jsonPath("$.results[1].error_message").value("Input is not a supported image"))
        .andExpect(jsonPath("$.results[1].result_url").doesNotExist());

    @SuppressWarnings("unchecked")
    ArgumentCaptor<List<BatchFile>> files = ArgumentCaptor.forClass(List.class);
    ArgumentCaptor<ConversionOptions> options = ArgumentCaptor.forClass(ConversionOptions.class);
    verify(coordinator).createBatch(files.capture(), eq("image_convert"), options.capture());
    assertThat(files.getValue()).extracting(BatchFile::filename).containsExactly("a.png", "b.png");
    assertThat(options.getValue().asMap()).containsExactly(Map.entry("output_format", "jpg"));
  }

  @Test
  void convertBatch_unknownOperationIsBadRequest() throws Exception {
    mockMvc
        .perform(
            multipart("/api/batch/pdf_merge")
                .file(new MockMultipartFile("files", "a.pdf", "application/pdf", new byte[] {1})))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value("Unsupported operation: pdf_merge"));

    verify(coordinator, never()).createBatch(anyList(), any(), any());
  }

  @Test
  void convertBatch_validationFailureIsBadRequest() throws Exception {
    when(coordinator.createBatch(anyList(), eq("image_convert"), any()))
        .thenThrow(new BatchValidationException("Too many files: 51 (max 50)"));

    mockMvc
        .perform(
            multipart("/api/batch/image_convert")
                .file(new MockMultipartFile("files", "a.png", "image/png", new byte[] {1})))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Validation Failed"))
        .andExpect(jsonPath("$.detail").value("Too many files: 51 (max 50)"));
  }

  @Test
  void submitBatch_acceptsAndPointsAtStatus() throws Exception {
    when(coordinator.submitBatch(anyList(), eq("image_convert"), any(), eq(converter)))
        .thenReturn("b2");

    mockMvc
        .perform(
            multipart("/api/batch/image_convert/async")
                .file(new MockMultipartFile("files", "a.png", "image/png", new byte[] {1})))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.batch_id").value("b2"))
        .andExpect(jsonPath("$.total_files").value(1))
        .andExpect(jsonPath("$.status_url").value("/api/batch/b2/status"));
  }

  @Test
  void getStatus_reportsProgress() throws Exception {
    when(coordinator.getBatchStatus("b1"))
        .thenReturn(Optional.of(snapshot(BatchStatus.PROCESSING, null)));

    mockMvc
        .perform(get("/api/batch/b1/status"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("processing"))
        .andExpect(jsonPath("$.progress_percentage").value(50))
        .andExpect(jsonPath("$.cancel_requested").value(false))
        .andExpect(jsonPath("$.files[0].filename").value("a.png"))
        .andExpect(jsonPath("$.files[0].content_type").value("image/png"))
        .andExpect(jsonPath("$.files[0].sha256").value("ab12"));
  }

  @Test
  void getStatus_unknownBatchIsNotFound() throws Exception {
    when(coordinator.getBatchStatus("nope")).thenReturn(Optional.empty());

    mockMvc.perform(get("/api/batch/nope/status")).andExpect(status().isNotFound());
  }

  @Test
  void getResult_conflictWhileRunning() throws Exception {
    when(coordinator.getBatchStatus("b1"))
        .thenReturn(Optional.of(snapshot(BatchStatus.PROCESSING, null)));
    when(coordinator.getBatchResult("b1")).thenReturn(Optional.empty());

    mockMvc
        .perform(get("/api/batch/b1/result"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.detail").value("Batch b1 is processing (50%)"));
  }

  @Test
  void cancel_runningBatch() throws Exception {
    when(coordinator.getBatchStatus("b1"))
        .thenReturn(Optional.of(snapshot(BatchStatus.PROCESSING, null)));
    when(coordinator.cancelBatch("b1")).thenReturn(true);

    mockMvc
        .perform(delete("/api/batch/b1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.batch_id").value("b1"));
  }

  @Test
  void cancel_completedBatchIsConflict() throws Exception {
    when(coordinator.getBatchStatus("b1"))
        .thenReturn(Optional.of(snapshot(BatchStatus.COMPLETED, "https://cdn/z.zip")));

    mockMvc.perform(delete("/api/batch/b1")).andExpect(status().isConflict());
    verify(coordinator, never()).cancelBatch("b1");
  }

  @Test
  void cancel_unknownBatchIsNotFound() throws Exception {
    when(coordinator.getBatchStatus("nope")).thenReturn(Optional.empty());

    mockMvc.perform(delete("/api/batch/nope")).andExpect(status().isNotFound());
  }

  @Test
  void toOptions_dropsFilePartNames() {
    ConversionOptions options =
        BatchController.toOptions(Map.of("files", "x", "file", "y", "quality", "90"));

    assertThat(options.asMap()).containsExactly(Map.entry("quality", "90"));
  }

  private static BatchStatusSnapshot snapshot(BatchStatus status, String zipUrl) {
    return new BatchStatusSnapshot(
        "b1",
        "image_convert",
        status,
        4,
        1,
        1,
        50,
        false,
        CREATED,
        zipUrl,
        List.of(new FileDescriptor("a.png", 10, "image/png", "ab12")));
  }
}
