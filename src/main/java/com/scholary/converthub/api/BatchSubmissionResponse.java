package com.scholary.converthub.api;

/** Response for an async batch submission: the batch id and where to poll it. */
public record BatchSubmissionResponse(String batchId, int totalFiles, String statusUrl) {}
