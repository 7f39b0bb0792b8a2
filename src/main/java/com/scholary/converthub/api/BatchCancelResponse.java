package com.scholary.converthub.api;

/** Confirmation that a batch cancellation was accepted. */
public record BatchCancelResponse(String message, String batchId) {}
