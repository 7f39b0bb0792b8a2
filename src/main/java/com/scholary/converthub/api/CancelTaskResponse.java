package com.scholary.converthub.api;

/** Confirmation that a task was cancelled. */
public record CancelTaskResponse(String message, String taskId) {}
