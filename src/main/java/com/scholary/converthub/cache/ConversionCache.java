package com.scholary.converthub.cache;

import com.scholary.converthub.converter.ConversionOptions;
import com.scholary.converthub.converter.ConversionResult;
import com.scholary.converthub.support.Digests;
import java.time.Duration;
import java.util.Optional;

/**
 * Cache of finished single-file conversions.
 *
 * <p>Identical input bytes converted with the same operation and options produce the same
 * artifact, so a hit lets the caller skip the conversion and reuse the stored URL.
 *
 * <p>Cache keys are based on: content hash + md5 of operation and canonical options
 */
public interface ConversionCache {

  /**
   * Retrieve a cached result.
   *
   * @param cacheKey key from {@link #generateKey}
   * @return the cached result, or empty if absent or expired
   */
  Optional<ConversionResult> get(String cacheKey);

  /**
   * Store a result.
   *
   * @param cacheKey key from {@link #generateKey}
   * @param result a successful conversion result
   * @param ttl how long the entry stays valid
   */
  void put(String cacheKey, ConversionResult result, Duration ttl);

  /**
   * Remove every entry whose key starts with {@code prefix}.
   *
   * @return the number of entries removed
   */
  long invalidate(String prefix);

  /** Snapshot of cache statistics for monitoring. */
  CacheStats stats();

  /**
   * Generate a cache key for a conversion.
   *
   * @param contentSha256 hex SHA-256 of the input bytes
   * @param operation the conversion operation
   * @param options the options applied
   * @return {@code conversion:{sha256}:{md5(operation?options)}}
   */
  static String generateKey(String contentSha256, String operation, ConversionOptions options) {
    String params = operation + "?" + options.canonicalForm();
    return String.format("conversion:%s:%s", contentSha256, Digests.md5Hex(params));
  }

  /** Prefix matching every cached conversion of the same input bytes. */
  static String generateContentPrefix(String contentSha256) {
    return String.format("conversion:%s:", contentSha256);
  }

  record CacheStats(long size, long hitCount, long missCount, double hitRate, long evictionCount) {}
}
