package com.scholary.converthub.objectstore;

import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ArtifactStorage} backed by an {@link ObjectStoreClient}.
 *
 * <p>Keys have the form {@code {keyPrefix}/{uuid}{.ext}}, so two uploads never overwrite each
 * other. URLs are {@code {baseUrl}/{key}}; {@link #download} reverses that mapping and refuses
 * URLs that point anywhere else.
 */
public class ObjectStoreArtifactStorage implements ArtifactStorage {

  private static final Logger LOGGER = LoggerFactory.getLogger(ObjectStoreArtifactStorage.class);

  private static final Pattern SAFE_EXTENSION = Pattern.compile("[a-z0-9]{1,10}");

  private final ObjectStoreClient client;
  private final String bucket;
  private final String keyPrefix;
  private final String baseUrl;

  public ObjectStoreArtifactStorage(ObjectStoreClient client, ObjectStoreProperties properties) {
    this.client = client;
    this.bucket = properties.bucket();
    this.keyPrefix = properties.keyPrefix().replaceAll("^/+|/+$", "");
    this.baseUrl = properties.resolvedBaseUrl();
  }

  @Override
  public String upload(byte[] data, String name, String contentType) {
    String key = keyPrefix + "/" + UUID.randomUUID() + extensionOf(name);
    client.putObject(bucket, key, data, contentType);
    String url = baseUrl + "/" + key;
    LOGGER.debug("Stored artifact: name={}, key={}, size={} bytes", name, key, data.length);
    return url;
  }

  @Override
  public byte[] download(String url) {
    String prefix = baseUrl + "/";
    if (url == null || !url.startsWith(prefix) || url.length() == prefix.length()) {
      throw new ObjectStoreException("URL is not served by this storage: " + url);
    }
    return client.getObject(bucket, url.substring(prefix.length()));
  }

  static String extensionOf(String name) {
    if (name == null) {
      return "";
    }
    int dot = name.lastIndexOf('.');
    if (dot < 0 || dot == name.length() - 1) {
      return "";
    }
    String extension = name.substring(dot + 1).toLowerCase(Locale.ROOT);
    return SAFE_EXTENSION.matcher(extension).matches() ? "." + extension : "";
  }
}
