package com.scholary.converthub.api;

/**
 * Response for an async single-file conversion.
 *
 * <p>Returns the task id and the URL to poll for progress.
 */
public record AsyncJobResponse(String taskId, String statusUrl) {}
