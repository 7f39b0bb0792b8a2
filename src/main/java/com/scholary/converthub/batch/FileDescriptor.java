package com.scholary.converthub.batch;

/** Metadata captured for each file at submission. {@code sha256} is the hex content digest. */
public record FileDescriptor(String filename, long size, String contentType, String sha256) {}
