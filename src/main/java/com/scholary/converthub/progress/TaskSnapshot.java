package com.scholary.converthub.progress;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable copy of a task's state at one point in time.
 *
 * <p>Returned by every {@link ProgressTracker} query; later updates to the task never show up in
 * a snapshot already handed out.
 */
public record TaskSnapshot(
    String taskId,
    String taskType,
    String filename,
    TaskStatus status,
    int progress,
    int currentStep,
    int totalSteps,
    String message,
    Map<String, Object> metadata,
    String errorMessage,
    String resultUrl,
    Instant createdAt,
    Instant updatedAt,
    Instant startedAt,
    Instant completedAt) {

  public TaskSnapshot {
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }
}
