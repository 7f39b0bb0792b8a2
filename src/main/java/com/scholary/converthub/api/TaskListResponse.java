package com.scholary.converthub.api;

import java.util.List;
import java.util.Map;

/**
 * Response for the task listing.
 *
 * <p>{@code summary} counts every tracked task by status; {@code tasks} is the most recently
 * updated page of them.
 */
public record TaskListResponse(
    List<TaskStatusResponse> tasks, Map<String, Long> summary, int totalTasks) {}
