package com.scholary.converthub.api;

/** Number of cached conversions dropped for one input digest. */
public record CacheInvalidationResponse(String sha256, long invalidated) {}
