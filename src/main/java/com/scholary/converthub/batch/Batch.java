package com.scholary.converthub.batch;

import com.scholary.converthub.converter.ConversionOptions;
import com.scholary.converthub.converter.ConversionResult;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;

/**
 * State of one batch, owned by {@link BatchCoordinator}.
 *
 * <p>Counters, results, status and the in-flight worker table change only under this object's
 * monitor. Invariant: {@code completed + failed <= totalFiles}, with equality exactly when the
 * status is COMPLETED.
 */
class Batch {

  static final String CANCELLED_MESSAGE = "Batch cancelled";

  private final String id;
  private final String operation;
  private final ConversionOptions options;
  private final List<FileDescriptor> files;
  private final Instant createdAt;
  private final ConversionResult[] results;

  private final Map<Integer, Future<?>> workers = new HashMap<>();
  private final Map<Integer, CompletableFuture<ConversionResult>> outcomes = new HashMap<>();

  private BatchStatus status = BatchStatus.QUEUED;
  private int completed;
  private int failed;
  private boolean cancelRequested;
  private String zipUrl;
  private Instant startedAt;
  private Instant completedAt;

  Batch(
      String id,
      String operation,
      ConversionOptions options,
      List<FileDescriptor> files,
      Instant createdAt) {
    this.id = id;
    this.operation = operation;
    this.options = options;
    this.files = List.copyOf(files);
    this.createdAt = createdAt;
    this.results = new ConversionResult[files.size()];
  }

  String id() {
    return id;
  }

  String operation() {
    return operation;
  }

  ConversionOptions options() {
    return options;
  }

  List<FileDescriptor> files() {
    return files;
  }

  int totalFiles() {
    return files.size();
  }

  Instant createdAt() {
    return createdAt;
  }

  synchronized BatchStatus status() {
    return status;
  }

  synchronized int completed() {
    return completed;
  }

  synchronized boolean isCancelRequested() {
    return cancelRequested;
  }

  synchronized void markProcessing(Instant now) {
    if (status != BatchStatus.QUEUED) {
      throw new BatchStateException("Batch " + id + " cannot start processing from " + status);
    }
    status = BatchStatus.PROCESSING;
    startedAt = now;
  }

  /**
   * Register an in-flight unit so {@link #requestCancel()} can reach it.
   *
   * @return false if the batch was cancelled meanwhile; the caller must then stop the unit
   */
  synchronized boolean trackWorker(
      int index, Future<?> worker, CompletableFuture<ConversionResult> outcome) {
    if (cancelRequested) {
      return false;
    }
    workers.put(index, worker);
    outcomes.put(index, outcome);
    return true;
  }

  synchronized void untrack(int index) {
    workers.remove(index);
    outcomes.remove(index);
  }

  /**
   * Settle file {@code index}. Each file settles exactly once.
   *
   * @return the counters after this outcome: {@code [completed, failed]}
   */
  synchronized int[] recordOutcome(int index, ConversionResult result) {
    if (status != BatchStatus.PROCESSING) {
      throw new BatchStateException(
          String.format("Batch %s is %s; cannot settle file %d", id, status, index));
    }
    if (results[index] != null) {
      throw new BatchStateException(String.format("File %d of batch %s settled twice", index, id));
    }
    results[index] = result;
    if (result.isSuccess()) {
      completed++;
    } else {
      failed++;
    }
    if (completed + failed > files.size()) {
      throw new BatchStateException(
          String.format(
              "Batch %s counters overflow: completed=%d, failed=%d, total=%d",
              id, completed, failed, files.size()));
    }
    return new int[] {completed, failed};
  }

  /** Settled results in input order; null slots for files still running. */
  synchronized List<ConversionResult> results() {
    return Arrays.asList(results.clone());
  }

  synchronized void complete(String archiveUrl, Instant now) {
    if (status != BatchStatus.PROCESSING) {
      throw new BatchStateException("Batch " + id + " cannot complete from " + status);
    }
    if (completed + failed != files.size()) {
      throw new BatchStateException(
          String.format(
              "Batch %s completing with %d of %d files settled",
              id, completed + failed, files.size()));
    }
    status = BatchStatus.COMPLETED;
    zipUrl = archiveUrl;
    completedAt = now;
  }

  /**
   * Flag the batch as cancelled and stop its in-flight units.
   *
   * @return false if the batch already completed
   */
  boolean requestCancel() {
    List<Future<?>> runningWorkers;
    List<CompletableFuture<ConversionResult>> pendingOutcomes;
    synchronized (this) {
      if (status == BatchStatus.COMPLETED) {
        return false;
      }
      cancelRequested = true;
      runningWorkers = new ArrayList<>(workers.values());
      pendingOutcomes = new ArrayList<>(outcomes.values());
    }
    // Completing an outcome runs its settle callback on this thread, which re-enters the monitor
    for (CompletableFuture<ConversionResult> outcome : pendingOutcomes) {
      outcome.completeExceptionally(new CancellationException(CANCELLED_MESSAGE));
    }
    for (Future<?> worker : runningWorkers) {
      worker.cancel(true);
    }
    return true;
  }

  synchronized BatchStatusSnapshot snapshot() {
    return new BatchStatusSnapshot(
        id,
        operation,
        status,
        files.size(),
        completed,
        failed,
        BatchStatusSnapshot.percentSettled(completed, failed, files.size()),
        cancelRequested,
        createdAt,
        zipUrl,
        files);
  }

  synchronized BatchResult toResult() {
    return new BatchResult(id, files.size(), completed, failed, Arrays.asList(results), zipUrl);
  }

  synchronized Instant startedAt() {
    return startedAt;
  }

  synchronized Instant completedAt() {
    return completedAt;
  }
}
