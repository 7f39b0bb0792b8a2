package com.scholary.converthub.batch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.converthub.converter.ConversionResult;
import com.scholary.converthub.objectstore.InMemoryArtifactStorage;
import com.scholary.converthub.objectstore.ObjectStoreException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ArchiveBuilderTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private InMemoryArtifactStorage storage;
  private ArchiveBuilder builder;

  @BeforeEach
  void setUp() {
    storage = new InMemoryArtifactStorage();
    builder = new ArchiveBuilder(storage, objectMapper);
  }

  @Test
  void build_packagesSuccessesInIndexOrderWithManifest() throws IOException {
    List<ConversionResult> results =
        List.of(
            success(0, "photo.jpeg", "png", "first"),
            ConversionResult.error("b_1", "Corrupt", Map.of("input_filename", "bad.jpg"), 3),
            success(2, "scan.bmp", "png", "third"));

    String url = builder.build("b", results);

    InMemoryArtifactStorage.Stored archive = storage.get(url);
    assertThat(archive.name()).isEqualTo("batch_b.zip");
    assertThat(archive.contentType()).isEqualTo("application/zip");

    Map<String, String> entries = unzip(archive.data());
    assertThat(entries.keySet()).containsExactly("photo.png", "scan.png", "manifest.json");
    assertThat(entries.get("photo.png")).isEqualTo("first");
    assertThat(entries.get("scan.png")).isEqualTo("third");

    JsonNode manifest = objectMapper.readTree(entries.get("manifest.json"));
    assertThat(manifest.get("batchId").asText()).isEqualTo("b");
    assertThat(manifest.get("entries")).hasSize(2);
    assertThat(manifest.get("entries").get(1).get("index").asInt()).isEqualTo(2);
    assertThat(manifest.get("entries").get(1).get("entryName").asText()).isEqualTo("scan.png");
  }

  @Test
  void build_disambiguatesCollidingNames() throws IOException {
    List<ConversionResult> results =
        List.of(
            success(0, "report.docx", "pdf", "a"),
            success(1, "report.txt", "pdf", "b"),
            success(2, "nested/report.md", "pdf", "c"));

    Map<String, String> entries = unzip(storage.get(builder.build("b", results)).data());

    assertThat(entries.keySet())
        .containsExactly("report.pdf", "report_1.pdf", "report_2.pdf", "manifest.json");
    assertThat(entries.get("report_1.pdf")).isEqualTo("b");
  }

  @Test
  void build_writesPlaceholderWhenDownloadFails() throws IOException {
    ConversionResult broken = success(1, "b.txt", "txt", "lost");
    storage.breakUrl(broken.resultUrl());
    List<ConversionResult> results = List.of(success(0, "a.txt", "txt", "kept"), broken);

    Map<String, String> entries = unzip(storage.get(builder.build("b", results)).data());

    assertThat(entries.keySet()).containsExactly("a.txt", "error_1.txt", "manifest.json");
    assertThat(entries.get("error_1.txt")).contains("b.txt").contains("Object not found");
    JsonNode failedEntry =
        objectMapper.readTree(entries.get("manifest.json")).get("entries").get(1);
    assertThat(failedEntry.get("status").asText()).isEqualTo("error");
    assertThat(failedEntry.get("error").asText()).contains("Object not found");
  }

  @Test
  void build_propagatesArchiveUploadFailure() {
    List<ConversionResult> results = List.of(success(0, "a.txt", "txt", "x"));
    storage.failUploads(true);

    assertThatThrownBy(() -> builder.build("b", results)).isInstanceOf(ObjectStoreException.class);
  }

  @Test
  void entryName_fallsBackWhenMetadataMissing() {
    ConversionResult bare = ConversionResult.success("b_4", "https://x/y", Map.of(), 1);

    assertThat(ArchiveBuilder.entryName(bare, 4)).isEqualTo("file_4.bin");
  }

  @Test
  void uniqueName_neverReusesManifestName() {
    Set<String> used = new HashSet<>(Arrays.asList(ArchiveBuilder.MANIFEST_NAME));

    assertThat(ArchiveBuilder.uniqueName("manifest.json", 3, used)).isEqualTo("manifest_3.json");
  }

  private ConversionResult success(int index, String inputFilename, String format, String body) {
    String url =
        storage.upload(body.getBytes(StandardCharsets.UTF_8), "out." + format, "text/plain");
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put(ConversionResult.INPUT_FILENAME, inputFilename);
    metadata.put(ConversionResult.OUTPUT_FORMAT, format);
    return ConversionResult.success("b_" + index, url, metadata, 5);
  }

  private static Map<String, String> unzip(byte[] archive) throws IOException {
    Map<String, String> entries = new LinkedHashMap<>();
    try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(archive))) {
      ZipEntry entry;
      while ((entry = zip.getNextEntry()) != null) {
        entries.put(entry.getName(), new String(zip.readAllBytes(), StandardCharsets.UTF_8));
      }
    }
    return entries;
  }
}
