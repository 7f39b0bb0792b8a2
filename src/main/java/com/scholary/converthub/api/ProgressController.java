package com.scholary.converthub.api;

import com.scholary.converthub.config.ProgressProperties;
import com.scholary.converthub.progress.ProgressTracker;
import com.scholary.converthub.progress.TaskNotFoundException;
import com.scholary.converthub.progress.TaskStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST API over the progress tracker: poll, list and cancel tracked conversions. */
@RestController
@RequestMapping("/api/progress")
@Tag(name = "Progress", description = "Progress of long-running conversions")
public class ProgressController {

  private final ProgressTracker tracker;
  private final ProgressProperties properties;

  public ProgressController(ProgressTracker tracker, ProgressProperties properties) {
    this.tracker = tracker;
    this.properties = properties;
  }

  @GetMapping("/{taskId}")
  @Operation(summary = "Get task progress")
  public ResponseEntity<TaskStatusResponse> getTask(@PathVariable String taskId) {
    return tracker
        .getTaskStatus(taskId)
        .map(TaskStatusResponse::from)
        .map(ResponseEntity::ok)
        .orElseThrow(() -> new TaskNotFoundException(taskId));
  }

  @DeleteMapping("/{taskId}")
  @Operation(
      summary = "Cancel a task",
      description = "404 if the task is unknown or already finished.")
  public ResponseEntity<CancelTaskResponse> cancelTask(@PathVariable String taskId) {
    if (!tracker.cancelTask(taskId)) {
      throw new TaskNotFoundException(taskId);
    }
    return ResponseEntity.ok(new CancelTaskResponse("Task cancelled successfully", taskId));
  }

  @GetMapping
  @Operation(summary = "List recent tasks with a per-status summary")
  public ResponseEntity<TaskListResponse> listTasks(
      @RequestParam(required = false) Integer limit) {
    int pageSize = limit != null ? limit : properties.listLimit();
    if (pageSize < 1) {
      throw new InvalidRequestException("limit must be positive, got " + pageSize);
    }
    List<TaskStatusResponse> tasks =
        tracker.getAllTasks(pageSize).stream()
            .map(TaskStatusResponse::from)
            .collect(Collectors.toList());

    Map<String, Long> summary = new LinkedHashMap<>();
    long total = 0;
    for (Map.Entry<TaskStatus, Long> entry : tracker.getTaskCountByStatus().entrySet()) {
      summary.put(entry.getKey().value(), entry.getValue());
      total += entry.getValue();
    }
    return ResponseEntity.ok(new TaskListResponse(tasks, summary, (int) total));
  }
}
