package com.scholary.converthub.batch;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.converthub.converter.ConversionResult;
import com.scholary.converthub.logging.StructuredLogger;
import com.scholary.converthub.objectstore.ArtifactStorage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Packages the successful outputs of a batch into one ZIP archive.
 *
 * <p>Entries follow input order. Each is named after the input file's stem plus the output
 * format; clashing names get {@code _{index}} before the extension. An artifact that cannot be
 * downloaded is replaced by {@code error_{index}.txt} and the archive is still produced. A
 * {@code manifest.json} entry lists what went where.
 */
@Component
public class ArchiveBuilder {

  private static final Logger LOGGER = LoggerFactory.getLogger(ArchiveBuilder.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  static final String MANIFEST_NAME = "manifest.json";
  static final String ARCHIVE_CONTENT_TYPE = "application/zip";

  private final ArtifactStorage storage;
  private final ObjectMapper objectMapper;

  public ArchiveBuilder(ArtifactStorage storage, ObjectMapper objectMapper) {
    this.storage = storage;
    this.objectMapper = objectMapper;
  }

  /**
   * Build and upload the archive.
   *
   * @param results index-aligned batch results; only successful ones are packaged
   * @return the URL of the uploaded archive
   * @throws com.scholary.converthub.objectstore.ObjectStoreException if the upload fails
   */
  public String build(String batchId, List<ConversionResult> results) {
    Set<String> usedNames = new HashSet<>();
    usedNames.add(MANIFEST_NAME);
    List<ManifestEntry> entries = new ArrayList<>();
    ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    try (ZipOutputStream zip = new ZipOutputStream(buffer)) {
      for (int index = 0; index < results.size(); index++) {
        ConversionResult result = results.get(index);
        if (result == null || !result.isSuccess()) {
          continue;
        }
        String inputFilename = result.inputFilename();
        try {
          byte[] data = storage.download(result.resultUrl());
          String entryName = uniqueName(entryName(result, index), index, usedNames);
          writeEntry(zip, entryName, data);
          entries.add(
              new ManifestEntry(
                  index, inputFilename, entryName, "success", result.resultUrl(), null));
        } catch (RuntimeException e) {
          String entryName = uniqueName("error_" + index + ".txt", index, usedNames);
          String reason =
              String.format(
                  "Failed to retrieve converted file for %s: %s",
                  inputFilename != null ? inputFilename : "file " + index, e.getMessage());
          writeEntry(zip, entryName, reason.getBytes(StandardCharsets.UTF_8));
          entries.add(
              new ManifestEntry(
                  index, inputFilename, entryName, "error", result.resultUrl(), e.getMessage()));
          STRUCTURED_LOGGER.logArchiveEntryFailed(
              batchId, index, result.resultUrl(), e.getMessage());
        }
      }
      writeEntry(
          zip, MANIFEST_NAME, objectMapper.writeValueAsBytes(new Manifest(batchId, entries)));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to assemble archive for batch " + batchId, e);
    }

    byte[] archive = buffer.toByteArray();
    String url = storage.upload(archive, "batch_" + batchId + ".zip", ARCHIVE_CONTENT_TYPE);
    LOGGER.info(
        "Archive stored: batch={}, entries={}, size={} bytes, url={}",
        batchId,
        entries.size(),
        archive.length,
        url);
    return url;
  }

  /** {@code {stem}.{output_format}}, falling back to {@code file_{index}} and {@code bin}. */
  static String entryName(ConversionResult result, int index) {
    String stem = stem(result.inputFilename());
    if (stem.isEmpty()) {
      stem = "file_" + index;
    }
    Object format = result.metadata().get(ConversionResult.OUTPUT_FORMAT);
    String extension = format == null || format.toString().isBlank() ? "bin" : format.toString();
    return stem + "." + extension;
  }

  /** Returns {@code name} if unused, else inserts {@code _{index}} before the extension. */
  static String uniqueName(String name, int index, Set<String> usedNames) {
    if (usedNames.add(name)) {
      return name;
    }
    int dot = name.lastIndexOf('.');
    String base = dot > 0 ? name.substring(0, dot) : name;
    String extension = dot > 0 ? name.substring(dot) : "";
    String candidate = base + "_" + index + extension;
    int attempt = 2;
    while (!usedNames.add(candidate)) {
      candidate = base + "_" + index + "_" + attempt++ + extension;
    }
    return candidate;
  }

  // Drops directories and the last extension; archive entries must stay flat
  private static String stem(String filename) {
    if (filename == null) {
      return "";
    }
    int separator = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
    String name = filename.substring(separator + 1);
    int dot = name.lastIndexOf('.');
    return (dot > 0 ? name.substring(0, dot) : name).strip();
  }

  private static void writeEntry(ZipOutputStream zip, String name, byte[] data)
      throws IOException {
    zip.putNextEntry(new ZipEntry(name));
    zip.write(data);
    zip.closeEntry();
  }

  record Manifest(String batchId, List<ManifestEntry> entries) {}

  @JsonInclude(JsonInclude.Include.NON_NULL)
  record ManifestEntry(
      int index,
      String inputFilename,
      String entryName,
      String status,
      String resultUrl,
      String error) {}
}
