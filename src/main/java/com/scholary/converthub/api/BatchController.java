package com.scholary.converthub.api;

import com.scholary.converthub.batch.BatchCoordinator;
import com.scholary.converthub.batch.BatchFile;
import com.scholary.converthub.batch.BatchNotFoundException;
import com.scholary.converthub.batch.BatchResult;
import com.scholary.converthub.batch.BatchStatus;
import com.scholary.converthub.batch.BatchStatusSnapshot;
import com.scholary.converthub.converter.ConversionOptions;
import com.scholary.converthub.converter.ConverterRegistry;
import com.scholary.converthub.converter.FileConverter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * REST API for batch conversions.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Synchronous batch conversion (waits for every file, returns all results)
 *   <li>Async batch submission with status and result polling
 *   <li>Batch cancellation
 * </ul>
 *
 * <p>Every multipart field other than {@code files} becomes a conversion option shared by all
 * files of the batch.
 */
@RestController
@RequestMapping("/api/batch")
@Tag(name = "Batch", description = "Convert many files in one request")
public class BatchController {

  private static final Logger LOGGER = LoggerFactory.getLogger(BatchController.class);

  private final BatchCoordinator coordinator;
  private final ConverterRegistry registry;

  public BatchController(BatchCoordinator coordinator, ConverterRegistry registry) {
    this.coordinator = coordinator;
    this.registry = registry;
  }

  @PostMapping(path = "/{operation}", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(
      summary = "Convert a batch of files",
      description =
          "Converts every uploaded file with the same operation and options. "
              + "Individual failures are reported per file; the archive bundles the successes.")
  public ResponseEntity<BatchResult> convertBatch(
      @PathVariable String operation,
      @RequestParam("files") List<MultipartFile> files,
      @RequestParam Map<String, String> params)
      throws IOException {
    FileConverter converter = registry.require(operation);
    List<BatchFile> batchFiles = toBatchFiles(files);
    String batchId = coordinator.createBatch(batchFiles, operation, toOptions(params));
    LOGGER.info(
        "Batch request: batchId={}, operation={}, files={}", batchId, operation, files.size());
    return ResponseEntity.ok(coordinator.processBatch(batchId, batchFiles, converter));
  }

  @PostMapping(path = "/{operation}/async", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(
      summary = "Submit a batch for background conversion",
      description = "Returns immediately with a batch id. Poll the status and result endpoints.")
  public ResponseEntity<BatchSubmissionResponse> submitBatch(
      @PathVariable String operation,
      @RequestParam("files") List<MultipartFile> files,
      @RequestParam Map<String, String> params)
      throws IOException {
    FileConverter converter = registry.require(operation);
    String batchId =
        coordinator.submitBatch(toBatchFiles(files), operation, toOptions(params), converter);
    LOGGER.info("Async batch submitted: batchId={}, operation={}", batchId, operation);
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(
            new BatchSubmissionResponse(
                batchId, files.size(), "/api/batch/" + batchId + "/status"));
  }

  @GetMapping("/{batchId}/status")
  @Operation(summary = "Get batch progress")
  public ResponseEntity<BatchStatusSnapshot> getStatus(@PathVariable String batchId) {
    return ResponseEntity.ok(
        coordinator
            .getBatchStatus(batchId)
            .orElseThrow(() -> new BatchNotFoundException(batchId)));
  }

  @GetMapping("/{batchId}/result")
  @Operation(
      summary = "Get batch result",
      description = "Available once the batch has completed; 409 while it is still running.")
  public ResponseEntity<BatchResult> getResult(@PathVariable String batchId) {
    BatchStatusSnapshot status =
        coordinator
            .getBatchStatus(batchId)
            .orElseThrow(() -> new BatchNotFoundException(batchId));
    return coordinator
        .getBatchResult(batchId)
        .map(ResponseEntity::ok)
        .orElseThrow(
            () ->
                new ResourceConflictException(
                    String.format(
                        "Batch %s is %s (%d%%)",
                        batchId, status.status().value(), status.progressPercentage())));
  }

  @DeleteMapping("/{batchId}")
  @Operation(
      summary = "Cancel a batch",
      description = "Files not yet finished are reported as cancelled; finished files are kept.")
  public ResponseEntity<BatchCancelResponse> cancel(@PathVariable String batchId) {
    BatchStatusSnapshot status =
        coordinator
            .getBatchStatus(batchId)
            .orElseThrow(() -> new BatchNotFoundException(batchId));
    if (status.status() == BatchStatus.COMPLETED || !coordinator.cancelBatch(batchId)) {
      throw new ResourceConflictException("Batch " + batchId + " has already completed");
    }
    return ResponseEntity.ok(new BatchCancelResponse("Batch cancellation requested", batchId));
  }

  private static List<BatchFile> toBatchFiles(List<MultipartFile> files) throws IOException {
    List<BatchFile> batchFiles = new ArrayList<>(files.size());
    for (int index = 0; index < files.size(); index++) {
      MultipartFile file = files.get(index);
      String filename = file.getOriginalFilename();
      if (filename == null || filename.isBlank()) {
        filename = "file_" + index;
      }
      batchFiles.add(new BatchFile(filename, file.getContentType(), file.getBytes()));
    }
    return batchFiles;
  }

  static ConversionOptions toOptions(Map<String, String> params) {
    Map<String, String> options = new HashMap<>(params);
    options.remove("files");
    options.remove("file");
    return ConversionOptions.of(options);
  }
}
