package com.scholary.converthub.objectstore;

import java.net.URI;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * S3/MinIO/R2 implementation of ObjectStoreClient.
 *
 * <p>Uses AWS SDK v2, which works with real S3 and with S3-compatible services. The difference is
 * the endpoint and path-style access configuration.
 *
 * <p>The SDK retries transient failures (network errors, 5xx, throttling) on its own. Anything
 * that still fails is wrapped in {@link ObjectStoreException}.
 */
public class S3ObjectStoreClient implements ObjectStoreClient, AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3ObjectStoreClient.class);

  // Artifact keys are unique per upload, so they can be cached aggressively
  private static final String CACHE_CONTROL = "max-age=31536000";

  private final S3Client s3Client;

  public S3ObjectStoreClient(ObjectStoreProperties properties) {
    this(buildClient(properties));
    LOGGER.info(
        "S3 client ready: endpoint={}, bucket={}, pathStyle={}, publicBaseUrl={}",
        properties.endpoint(),
        properties.bucket(),
        properties.pathStyleAccess(),
        properties.resolvedBaseUrl());
  }

  S3ObjectStoreClient(S3Client s3Client) {
    this.s3Client = s3Client;
  }

  private static S3Client buildClient(ObjectStoreProperties properties) {
    String region = properties.region();
    return S3Client.builder()
        .region(region == null || region.isBlank() ? Region.US_EAST_1 : Region.of(region))
        .credentialsProvider(
            StaticCredentialsProvider.create(
                AwsBasicCredentials.create(properties.accessKey(), properties.secretKey())))
        .endpointOverride(URI.create(properties.endpoint()))
        .forcePathStyle(properties.pathStyleAccess())
        .build();
  }

  @Override
  public byte[] getObject(String bucket, String key) {
    byte[] data =
        call(
            "download",
            bucket,
            key,
            () ->
                s3Client
                    .getObjectAsBytes(request -> request.bucket(bucket).key(key))
                    .asByteArray());
    LOGGER.debug("Downloaded {} bytes from {}/{}", data.length, bucket, key);
    return data;
  }

  @Override
  public void putObject(String bucket, String key, byte[] data, String contentType) {
    call(
        "upload",
        bucket,
        key,
        () ->
            s3Client.putObject(
                request ->
                    request
                        .bucket(bucket)
                        .key(key)
                        .contentType(contentType)
                        .contentLength((long) data.length)
                        .cacheControl(CACHE_CONTROL),
                RequestBody.fromBytes(data)));
    LOGGER.debug("Uploaded {} bytes to {}/{} as {}", data.length, bucket, key, contentType);
  }

  private static <T> T call(String action, String bucket, String key, Supplier<T> request) {
    try {
      return request.get();
    } catch (NoSuchKeyException | NoSuchBucketException e) {
      String message =
          String.format("Object not found: bucket=%s, key=%s (%s)", bucket, key, action);
      LOGGER.warn(message);
      throw new ObjectStoreException(message, e);
    } catch (S3Exception e) {
      String message =
          String.format(
              "S3 %s failed: bucket=%s, key=%s, statusCode=%d, errorCode=%s",
              action,
              bucket,
              key,
              e.statusCode(),
              e.awsErrorDetails() != null ? e.awsErrorDetails().errorCode() : "unknown");
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    } catch (SdkException e) {
      String message =
          String.format("S3 %s failed: bucket=%s, key=%s: %s", action, bucket, key, e.getMessage());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  /** Release connections and threads held by the SDK client. */
  @Override
  public void close() {
    LOGGER.info("Closing S3 client");
    s3Client.close();
  }
}
