package com.scholary.converthub.converter;

import java.util.Map;

/**
 * Output of a converter: the converted bytes, the output format (used as file extension), its
 * MIME type and descriptive metadata (sizes, dimensions, counts).
 */
public record ConvertedFile(
    byte[] data, String format, String contentType, Map<String, Object> metadata) {

  public ConvertedFile {
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }
}
