package com.scholary.converthub.progress;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mutable state of one tracked task.
 *
 * <p>Every transition runs under the task's monitor, so check-then-set sequences such as
 * cancel-if-not-terminal are atomic. Only {@link ProgressTracker} touches instances; callers get
 * {@link TaskSnapshot}s.
 */
class ProgressTask {

  private final String taskId;
  private final String taskType;
  private final String filename;
  private final int totalSteps;
  private final Instant createdAt;
  private final Map<String, Object> metadata = new LinkedHashMap<>();

  private TaskStatus status = TaskStatus.QUEUED;
  private int currentStep;
  private int progress;
  private String message = "Task queued";
  private String errorMessage;
  private String resultUrl;
  private Instant updatedAt;
  private Instant startedAt;
  private Instant completedAt;

  ProgressTask(
      String taskId,
      String taskType,
      String filename,
      int totalSteps,
      Map<String, Object> metadata,
      Instant now) {
    this.taskId = taskId;
    this.taskType = taskType;
    this.filename = filename;
    this.totalSteps = totalSteps;
    this.createdAt = now;
    this.updatedAt = now;
    mergeMetadata(metadata);
  }

  synchronized boolean update(
      int step, String newMessage, Map<String, Object> extra, Instant now) {
    if (status.isTerminal()) {
      return false;
    }
    if (status == TaskStatus.QUEUED) {
      status = TaskStatus.PROCESSING;
      startedAt = now;
    }
    int clamped = Math.max(0, Math.min(step, totalSteps));
    // Progress only moves forward while the task is running
    if (clamped > currentStep) {
      currentStep = clamped;
      progress = (int) ((long) currentStep * 100 / totalSteps);
    }
    if (newMessage != null) {
      message = newMessage;
    }
    mergeMetadata(extra);
    updatedAt = now;
    return true;
  }

  synchronized boolean complete(String url, Map<String, Object> extra, Instant now) {
    if (status.isTerminal()) {
      return false;
    }
    markStarted(now);
    status = TaskStatus.COMPLETED;
    currentStep = totalSteps;
    progress = 100;
    message = "Task completed";
    resultUrl = url;
    mergeMetadata(extra);
    finish(now);
    return true;
  }

  synchronized boolean fail(String error, Map<String, Object> extra, Instant now) {
    if (status.isTerminal()) {
      return false;
    }
    markStarted(now);
    status = TaskStatus.FAILED;
    errorMessage = error;
    message = "Task failed";
    mergeMetadata(extra);
    finish(now);
    return true;
  }

  synchronized boolean cancel(Instant now) {
    if (status.isTerminal()) {
      return false;
    }
    status = TaskStatus.CANCELLED;
    message = "Task cancelled";
    finish(now);
    return true;
  }

  synchronized boolean isCancelled() {
    return status == TaskStatus.CANCELLED;
  }

  synchronized boolean isActive() {
    return !status.isTerminal();
  }

  /** Terminal and untouched for longer than {@code retention}. */
  synchronized boolean isExpired(Instant now, Duration retention) {
    return status.isTerminal() && Duration.between(updatedAt, now).compareTo(retention) > 0;
  }

  synchronized TaskSnapshot snapshot() {
    return new TaskSnapshot(
        taskId,
        taskType,
        filename,
        status,
        progress,
        currentStep,
        totalSteps,
        message,
        metadata,
        errorMessage,
        resultUrl,
        createdAt,
        updatedAt,
        startedAt,
        completedAt);
  }

  private void markStarted(Instant now) {
    if (startedAt == null) {
      startedAt = now;
    }
  }

  private void finish(Instant now) {
    completedAt = now;
    updatedAt = now;
  }

  private void mergeMetadata(Map<String, Object> extra) {
    if (extra != null) {
      extra.forEach(
          (key, value) -> {
            if (key != null && value != null) {
              metadata.put(key, value);
            }
          });
    }
  }
}
