package com.scholary.converthub.batch;

import com.scholary.converthub.config.BatchProperties;
import com.scholary.converthub.converter.ConversionOptions;
import com.scholary.converthub.converter.ConversionResult;
import com.scholary.converthub.converter.ConvertedFile;
import com.scholary.converthub.converter.FileConverter;
import com.scholary.converthub.logging.StructuredLogger;
import com.scholary.converthub.objectstore.ArtifactStorage;
import com.scholary.converthub.support.Digests;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs many independent file conversions as one batch.
 *
 * <p>Processing flow:
 *
 * <ol>
 *   <li>{@link #createBatch} validates limits and records per-file descriptors
 *   <li>{@link #processBatch} dispatches one unit per file onto the shared conversion pool, at
 *       most {@code batch.concurrency} at a time for this batch
 *   <li>each unit converts, uploads the output and settles into a {@link ConversionResult}; any
 *       failure (converter, storage, timeout, cancellation) becomes an error result for that file
 *       only
 *   <li>once every unit has settled, successful outputs are packaged by the {@link
 *       ArchiveBuilder} and the batch is marked COMPLETED
 * </ol>
 *
 * <p>Results are stored by input index, so completion order never affects {@link
 * BatchResult#results()}. Only broken bookkeeping ({@link BatchStateException}) fails the call.
 */
@Service
public class BatchCoordinator {

  private static final Logger LOGGER = LoggerFactory.getLogger(BatchCoordinator.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final Map<String, Batch> batches = new ConcurrentHashMap<>();
  private final BatchProperties properties;
  private final ArtifactStorage storage;
  private final ArchiveBuilder archiveBuilder;
  private final ExecutorService conversionExecutor;
  private final Executor taskExecutor;
  private final Clock clock;

  public BatchCoordinator(
      BatchProperties properties,
      ArtifactStorage storage,
      ArchiveBuilder archiveBuilder,
      @Qualifier("conversionExecutor") ExecutorService conversionExecutor,
      @Qualifier("taskExecutor") Executor taskExecutor,
      Clock clock) {
    this.properties = properties;
    this.storage = storage;
    this.archiveBuilder = archiveBuilder;
    this.conversionExecutor = conversionExecutor;
    this.taskExecutor = taskExecutor;
    this.clock = clock;
  }

  /**
   * Validate a submission and register it as a QUEUED batch.
   *
   * @return the new batch id
   * @throws BatchValidationException if the batch is empty or exceeds the file count or size limit
   */
  public String createBatch(List<BatchFile> files, String operation, ConversionOptions options) {
    if (files == null || files.isEmpty()) {
      throw new BatchValidationException("Batch must contain at least one file");
    }
    if (files.size() > properties.maxFiles()) {
      throw new BatchValidationException(
          String.format("Maximum %d files allowed per batch", properties.maxFiles()));
    }
    long totalBytes = files.stream().mapToLong(BatchFile::size).sum();
    if (totalBytes > properties.maxTotalBytes()) {
      throw new BatchValidationException(
          String.format(
              "Total batch size %d bytes exceeds the limit of %d bytes",
              totalBytes, properties.maxTotalBytes()));
    }
    if (operation == null || operation.isBlank()) {
      throw new BatchValidationException("Operation is required");
    }

    List<FileDescriptor> descriptors = new ArrayList<>(files.size());
    for (BatchFile file : files) {
      descriptors.add(
          new FileDescriptor(
              file.filename(), file.size(), file.contentType(), Digests.sha256Hex(file.content())));
    }

    String batchId = UUID.randomUUID().toString();
    ConversionOptions snapshot = options != null ? options : ConversionOptions.EMPTY;
    batches.put(batchId, new Batch(batchId, operation, snapshot, descriptors, clock.instant()));
    LOGGER.info(
        "Created batch: batchId={}, operation={}, files={}, totalBytes={}",
        batchId,
        operation,
        files.size(),
        totalBytes);
    return batchId;
  }

  /**
   * Convert every file of a QUEUED batch and wait for all of them to settle.
   *
   * @param files the uploaded files, in the order they were passed to {@link #createBatch}
   * @throws BatchNotFoundException if the batch is unknown
   * @throws BatchStateException if the batch was already processed, the file list does not match
   *     the batch, or bookkeeping breaks while processing
   */
  public BatchResult processBatch(String batchId, List<BatchFile> files, FileConverter converter) {
    Batch batch = batches.get(batchId);
    if (batch == null) {
      throw new BatchNotFoundException(batchId);
    }
    if (files.size() != batch.totalFiles()) {
      throw new BatchStateException(
          String.format(
              "Batch %s was created with %d files but %d were supplied",
              batchId, batch.totalFiles(), files.size()));
    }
    batch.markProcessing(clock.instant());

    StructuredLogger.setBatchContext(batchId);
    try {
      LOGGER.info(
          "Processing batch: batchId={}, operation={}, files={}, concurrency={}",
          batchId,
          batch.operation(),
          batch.totalFiles(),
          properties.concurrency());

      Semaphore permits = new Semaphore(properties.concurrency());
      List<CompletableFuture<Void>> units = new ArrayList<>(files.size());
      for (int index = 0; index < files.size(); index++) {
        units.add(dispatch(batch, index, files.get(index), converter, permits));
      }
      awaitAll(batchId, units);

      String zipUrl = null;
      if (batch.completed() > 0) {
        zipUrl = buildArchive(batch);
      }
      batch.complete(zipUrl, clock.instant());

      BatchResult result = batch.toResult();
      LOGGER.info(
          "Batch completed: batchId={}, completed={}, failed={}, zipUrl={}, took={}ms",
          batchId,
          result.completed(),
          result.failed(),
          zipUrl,
          Duration.between(batch.startedAt(), batch.completedAt()).toMillis());
      return result;
    } finally {
      StructuredLogger.clearBatchContext();
    }
  }

  /**
   * Create a batch and process it in the background.
   *
   * @return the batch id to poll
   */
  public String submitBatch(
      List<BatchFile> files,
      String operation,
      ConversionOptions options,
      FileConverter converter) {
    String batchId = createBatch(files, operation, options);
    try {
      taskExecutor.execute(() -> processInBackground(batchId, files, converter));
    } catch (RejectedExecutionException e) {
      batches.remove(batchId);
      throw e;
    }
    return batchId;
  }

  /**
   * Cancel a batch. Files not yet started and files still running settle as "Batch cancelled"
   * failures; the batch then completes normally with whatever already succeeded.
   *
   * @return false if the batch is unknown or already completed
   */
  public boolean cancelBatch(String batchId) {
    Batch batch = batches.get(batchId);
    if (batch == null) {
      return false;
    }
    boolean cancelled = batch.requestCancel();
    if (cancelled) {
      LOGGER.info("Batch cancellation requested: batchId={}", batchId);
    }
    return cancelled;
  }

  public Optional<BatchStatusSnapshot> getBatchStatus(String batchId) {
    return Optional.ofNullable(batches.get(batchId)).map(Batch::snapshot);
  }

  /** Present once the batch has completed. */
  public Optional<BatchResult> getBatchResult(String batchId) {
    return Optional.ofNullable(batches.get(batchId))
        .filter(batch -> batch.status() == BatchStatus.COMPLETED)
        .map(Batch::toResult);
  }

  /**
   * Purge batches created more than {@code maxAge} ago, whatever their status. Batches still
   * running are cancelled as they are dropped.
   *
   * @return the number of batches removed
   */
  public int cleanupOldBatches(Duration maxAge) {
    Instant cutoff = clock.instant().minus(maxAge);
    int removed = 0;
    for (Map.Entry<String, Batch> entry : batches.entrySet()) {
      Batch batch = entry.getValue();
      if (!batch.createdAt().isBefore(cutoff) || !batches.remove(entry.getKey(), batch)) {
        continue;
      }
      BatchStatus status = batch.status();
      if (status != BatchStatus.COMPLETED) {
        LOGGER.warn(
            "Purging batch that has not completed: batchId={}, status={}, createdAt={}",
            batch.id(),
            status,
            batch.createdAt());
        batch.requestCancel();
      }
      removed++;
    }
    if (removed > 0) {
      LOGGER.info("Cleaned up {} batches older than {}", removed, maxAge);
    }
    return removed;
  }

  public int cleanupOldBatches() {
    return cleanupOldBatches(properties.retention());
  }

  private CompletableFuture<Void> dispatch(
      Batch batch, int index, BatchFile file, FileConverter converter, Semaphore permits) {
    if (batch.isCancelRequested()) {
      settle(batch, index, failure(batch, index, file, Batch.CANCELLED_MESSAGE, 0));
      return CompletableFuture.completedFuture(null);
    }
    try {
      permits.acquire();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      settle(batch, index, failure(batch, index, file, "Batch processing interrupted", 0));
      return CompletableFuture.completedFuture(null);
    }
    if (batch.isCancelRequested()) {
      permits.release();
      settle(batch, index, failure(batch, index, file, Batch.CANCELLED_MESSAGE, 0));
      return CompletableFuture.completedFuture(null);
    }

    long dispatchedAt = System.nanoTime();
    CompletableFuture<ConversionResult> outcome = new CompletableFuture<>();
    Future<?> worker;
    try {
      worker = conversionExecutor.submit(() -> runUnit(batch, index, file, converter, outcome));
    } catch (RejectedExecutionException e) {
      permits.release();
      settle(batch, index, failure(batch, index, file, "Conversion pool unavailable", 0));
      return CompletableFuture.completedFuture(null);
    }
    if (!batch.trackWorker(index, worker, outcome)) {
      worker.cancel(true);
      outcome.completeExceptionally(new CancellationException(Batch.CANCELLED_MESSAGE));
    }

    return outcome.handle(
        (result, error) -> {
          long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - dispatchedAt);
          if (error != null) {
            Throwable cause = unwrap(error);
            if (cause instanceof TimeoutException || cause instanceof CancellationException) {
              // Completed from outside the worker; the converter may still hold the pool thread
              worker.cancel(true);
            }
            result = failure(batch, index, file, describe(cause), elapsedMs);
          }
          batch.untrack(index);
          permits.release();
          settle(batch, index, result);
          return null;
        });
  }

  private void runUnit(
      Batch batch,
      int index,
      BatchFile file,
      FileConverter converter,
      CompletableFuture<ConversionResult> outcome) {
    if (outcome.isDone()) {
      // Cancelled while waiting for a pool thread
      return;
    }
    // The timeout covers only the time this unit holds a pool thread
    outcome.orTimeout(properties.fileTimeout().toMillis(), TimeUnit.MILLISECONDS);
    StructuredLogger.setBatchContext(batch.id());
    long startedAt = System.nanoTime();
    try {
      STRUCTURED_LOGGER.logUnitStarted(batch.id(), index, file.filename());
      ConvertedFile converted = converter.convert(file.content(), batch.options());
      if (outcome.isDone()) {
        // Timed out or cancelled while converting; nobody wants the upload
        return;
      }
      String url =
          storage.upload(
              converted.data(),
              outputName(file.filename(), converted.format()),
              converted.contentType());

      Map<String, Object> metadata = new LinkedHashMap<>(converted.metadata());
      metadata.put(ConversionResult.INPUT_FILENAME, file.filename());
      metadata.put(ConversionResult.OUTPUT_FORMAT, converted.format());
      long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
      outcome.complete(ConversionResult.success(taskId(batch, index), url, metadata, elapsedMs));
    } catch (Exception e) {
      outcome.completeExceptionally(e);
    } finally {
      StructuredLogger.clearBatchContext();
    }
  }

  private void settle(Batch batch, int index, ConversionResult result) {
    StructuredLogger.setBatchContext(batch.id());
    try {
      int[] counters = batch.recordOutcome(index, result);
      FileDescriptor descriptor = batch.files().get(index);
      if (result.isSuccess()) {
        STRUCTURED_LOGGER.logUnitFinished(
            batch.id(), index, descriptor.filename(), result.processingTimeMs());
      } else {
        STRUCTURED_LOGGER.logUnitFailed(
            batch.id(), index, descriptor.filename(), "ConversionError", result.errorMessage());
      }
      STRUCTURED_LOGGER.logBatchProgress(
          batch.id(),
          counters[0],
          counters[1],
          batch.totalFiles(),
          BatchStatusSnapshot.percentSettled(counters[0], counters[1], batch.totalFiles()));
    } finally {
      StructuredLogger.clearBatchContext();
    }
  }

  private void awaitAll(String batchId, List<CompletableFuture<Void>> units) {
    try {
      CompletableFuture.allOf(units.toArray(new CompletableFuture<?>[0])).join();
    } catch (CompletionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      LOGGER.error("Batch bookkeeping failed: batchId={}", batchId, cause);
      if (cause instanceof RuntimeException runtimeException) {
        throw runtimeException;
      }
      throw new BatchStateException("Batch " + batchId + " failed: " + cause.getMessage());
    }
  }

  private String buildArchive(Batch batch) {
    try {
      return archiveBuilder.build(batch.id(), batch.results());
    } catch (RuntimeException e) {
      LOGGER.error("Failed to build archive: batchId={}, error={}", batch.id(), e.getMessage(), e);
      return null;
    }
  }

  private void processInBackground(String batchId, List<BatchFile> files, FileConverter converter) {
    try {
      processBatch(batchId, files, converter);
    } catch (BatchNotFoundException e) {
      LOGGER.warn("Batch purged before processing started: batchId={}", batchId);
    } catch (RuntimeException e) {
      LOGGER.error("Background batch failed: batchId={}", batchId, e);
    }
  }

  private ConversionResult failure(
      Batch batch, int index, BatchFile file, String reason, long elapsedMs) {
    Map<String, Object> metadata = new LinkedHashMap<>();
    if (file.filename() != null) {
      metadata.put(ConversionResult.INPUT_FILENAME, file.filename());
    }
    return ConversionResult.error(taskId(batch, index), reason, metadata, elapsedMs);
  }

  private static Throwable unwrap(Throwable error) {
    return error instanceof CompletionException && error.getCause() != null
        ? error.getCause()
        : error;
  }

  private String describe(Throwable cause) {
    if (cause instanceof TimeoutException) {
      return "Conversion timed out after " + properties.fileTimeout().toMillis() + "ms";
    }
    if (cause instanceof CancellationException) {
      return Batch.CANCELLED_MESSAGE;
    }
    String message = cause.getMessage();
    return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
  }

  private static String taskId(Batch batch, int index) {
    return batch.id() + "_" + index;
  }

  private static String outputName(String filename, String format) {
    String name = filename == null ? "output" : filename;
    int dot = name.lastIndexOf('.');
    return (dot > 0 ? name.substring(0, dot) : name) + "." + format;
  }
}
