package com.scholary.converthub.api;

import com.scholary.converthub.progress.TaskSnapshot;
import com.scholary.converthub.progress.TaskStatus;
import java.time.Instant;
import java.util.Map;

/**
 * Response for task status query.
 *
 * <p>Shows the current state of a tracked conversion, with the result URL once completed or the
 * error once failed.
 */
public record TaskStatusResponse(
    String taskId,
    String taskType,
    String filename,
    TaskStatus status,
    int progress,
    String message,
    Map<String, Object> metadata,
    String resultUrl,
    String errorMessage,
    Instant createdAt,
    Instant updatedAt,
    Instant startedAt,
    Instant completedAt) {

  public static TaskStatusResponse from(TaskSnapshot task) {
    return new TaskStatusResponse(
        task.taskId(),
        task.taskType(),
        task.filename(),
        task.status(),
        task.progress(),
        task.message(),
        task.metadata(),
        task.resultUrl(),
        task.errorMessage(),
        task.createdAt(),
        task.updatedAt(),
        task.startedAt(),
        task.completedAt());
  }
}
