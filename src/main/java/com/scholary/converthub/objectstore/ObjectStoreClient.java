package com.scholary.converthub.objectstore;

/**
 * Abstraction for object storage operations.
 *
 * <p>Decouples the application from a specific backend (S3, MinIO, R2). Converted artifacts are
 * small enough to be handled as byte arrays; uploads are capped by the batch size limits.
 */
public interface ObjectStoreClient {

  /**
   * Retrieve an object's content.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @return the object bytes
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  byte[] getObject(String bucket, String key);

  /**
   * Store an object.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @param data the object content
   * @param contentType the MIME type of the object
   * @throws ObjectStoreException if the upload fails
   */
  void putObject(String bucket, String key, byte[] data, String contentType);
}
