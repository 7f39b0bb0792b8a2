package com.scholary.converthub.objectstore;

/**
 * URL-addressed storage for converted artifacts.
 *
 * <p>Converters never see storage; the batch coordinator and the single-file conversion service
 * upload outputs here and hand the returned URL to clients. The archive builder reads them back
 * by the same URL. Implementations must tolerate concurrent calls.
 */
public interface ArtifactStorage {

  /**
   * Upload an artifact.
   *
   * @param data the artifact bytes
   * @param name a file name; only its extension is kept in the stored key
   * @param contentType the MIME type
   * @return the public URL of the stored artifact
   * @throws ObjectStoreException if the upload fails
   */
  String upload(byte[] data, String name, String contentType);

  /**
   * Download an artifact previously returned by {@link #upload}.
   *
   * @throws ObjectStoreException if the URL is not served by this storage or retrieval fails
   */
  byte[] download(String url);
}
