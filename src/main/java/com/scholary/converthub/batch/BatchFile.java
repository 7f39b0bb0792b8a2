package com.scholary.converthub.batch;

/**
 * One uploaded file of a batch.
 *
 * <p>The content array is shared, not copied; nothing in the pipeline writes to it.
 */
public record BatchFile(String filename, String contentType, byte[] content) {

  public BatchFile {
    if (content == null) {
      throw new IllegalArgumentException("content is required");
    }
  }

  public long size() {
    return content.length;
  }
}
