package com.scholary.converthub.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each method puts the fields of one named event into MDC, logs a single line and clears the
 * event fields again. The batch and task context ({@code batchId}, {@code taskId}) is set
 * separately and stays in place for the whole unit of work.
 */
public class StructuredLogger {

  public static final String BATCH_ID = "batchId";
  public static final String TASK_ID = "taskId";

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log unit started event. */
  public void logUnitStarted(String batchId, int index, String filename) {
    try {
      MDC.put("event_type", "unit_started");
      MDC.put("fileIndex", String.valueOf(index));
      MDC.put("filename", filename);

      logger.debug("Unit started: batch={}, index={}, file={}", batchId, index, filename);
    } finally {
      clearEventFields();
    }
  }

  /** Log unit finished event. */
  public void logUnitFinished(String batchId, int index, String filename, long processingMs) {
    try {
      MDC.put("event_type", "unit_finished");
      MDC.put("fileIndex", String.valueOf(index));
      MDC.put("filename", filename);
      MDC.put("processingMs", String.valueOf(processingMs));

      logger.info(
          "Unit finished: batch={}, index={}, file={}, took={}ms",
          batchId,
          index,
          filename,
          processingMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log unit failure event. */
  public void logUnitFailed(
      String batchId, int index, String filename, String errorType, String message) {
    try {
      MDC.put("event_type", "unit_failed");
      MDC.put("fileIndex", String.valueOf(index));
      MDC.put("filename", filename);
      MDC.put("errorType", errorType);

      logger.warn(
          "Unit failed: batch={}, index={}, file={}, error={}, message={}",
          batchId,
          index,
          filename,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log batch progress event. */
  public void logBatchProgress(
      String batchId, int completed, int failed, int totalFiles, int percentComplete) {
    try {
      MDC.put("event_type", "batch_progress");
      MDC.put("completed", String.valueOf(completed));
      MDC.put("failed", String.valueOf(failed));
      MDC.put("totalFiles", String.valueOf(totalFiles));
      MDC.put("percentComplete", String.valueOf(percentComplete));

      logger.info(
          "Batch progress: batch={}, completed={}, failed={}, total={}, progress={}%",
          batchId,
          completed,
          failed,
          totalFiles,
          percentComplete);
    } finally {
      clearEventFields();
    }
  }

  /** Log archive entry failure event. */
  public void logArchiveEntryFailed(String batchId, int index, String resultUrl, String message) {
    try {
      MDC.put("event_type", "archive_entry_failed");
      MDC.put("fileIndex", String.valueOf(index));
      MDC.put("resultUrl", resultUrl);

      logger.warn(
          "Archive entry failed: batch={}, index={}, url={}, message={}",
          batchId,
          index,
          resultUrl,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log task eviction event. */
  public void logTaskEvicted(String taskId, String status, long ageSeconds) {
    try {
      MDC.put("event_type", "task_evicted");
      MDC.put("taskStatus", status);
      MDC.put("ageSeconds", String.valueOf(ageSeconds));

      logger.debug("Task evicted: task={}, status={}, age={}s", taskId, status, ageSeconds);
    } finally {
      clearEventFields();
    }
  }

  /** Set batch context in MDC. */
  public static void setBatchContext(String batchId) {
    MDC.put(BATCH_ID, batchId);
  }

  /** Clear batch context from MDC. */
  public static void clearBatchContext() {
    MDC.remove(BATCH_ID);
  }

  /** Set task context in MDC. */
  public static void setTaskContext(String taskId) {
    MDC.put(TASK_ID, taskId);
  }

  /** Clear task context from MDC. */
  public static void clearTaskContext() {
    MDC.remove(TASK_ID);
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("fileIndex");
    MDC.remove("filename");
    MDC.remove("processingMs");
    MDC.remove("errorType");
    MDC.remove("completed");
    MDC.remove("failed");
    MDC.remove("totalFiles");
    MDC.remove("percentComplete");
    MDC.remove("resultUrl");
    MDC.remove("taskStatus");
    MDC.remove("ageSeconds");
  }
}
