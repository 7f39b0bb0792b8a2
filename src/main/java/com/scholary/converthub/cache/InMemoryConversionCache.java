package com.scholary.converthub.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.scholary.converthub.config.ConversionProperties;
import com.scholary.converthub.converter.ConversionResult;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * In-memory implementation of ConversionCache using Caffeine.
 *
 * <p>Each entry carries its own time-to-live, given on {@link #put}. Size is bounded by {@code
 * conversion.cacheMaxSize}; beyond that Caffeine evicts the least valuable entries.
 */
@Component
public class InMemoryConversionCache implements ConversionCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryConversionCache.class);

  private final Cache<String, Entry> cache;

  @Autowired
  public InMemoryConversionCache(ConversionProperties properties) {
    this(properties.cacheMaxSize(), Ticker.systemTicker());
  }

  InMemoryConversionCache(int maxSize, Ticker ticker) {
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfter(new PerEntryExpiry())
            .ticker(ticker)
            .recordStats()
            .build();

    LOGGER.info("Initialized conversion cache: maxSize={}", maxSize);
  }

  @Override
  public Optional<ConversionResult> get(String cacheKey) {
    Entry entry = cache.getIfPresent(cacheKey);
    if (entry != null) {
      LOGGER.debug("Cache hit: key={}", cacheKey);
      return Optional.of(entry.result());
    } else {
      LOGGER.debug("Cache miss: key={}", cacheKey);
      return Optional.empty();
    }
  }

  @Override
  public void put(String cacheKey, ConversionResult result, Duration ttl) {
    if (ttl.isNegative() || ttl.isZero()) {
      return;
    }
    cache.put(cacheKey, new Entry(result, ttl.toNanos()));
    LOGGER.debug("Cached conversion: key={}, ttl={}", cacheKey, ttl);
  }

  @Override
  public long invalidate(String prefix) {
    List<String> matching =
        cache.asMap().keySet().stream().filter(key -> key.startsWith(prefix)).toList();
    cache.invalidateAll(matching);
    long evicted = matching.size();
    LOGGER.info("Invalidated {} cached conversions: prefix={}", evicted, prefix);
    return evicted;
  }

  @Override
  public CacheStats stats() {
    cache.cleanUp();
    var stats = cache.stats();
    return new CacheStats(
        cache.estimatedSize(),
        stats.hitCount(),
        stats.missCount(),
        stats.hitRate(),
        stats.evictionCount());
  }

  private record Entry(ConversionResult result, long ttlNanos) {}

  private static final class PerEntryExpiry implements Expiry<String, Entry> {

    @Override
    public long expireAfterCreate(String key, Entry value, long currentTime) {
      return value.ttlNanos();
    }

    @Override
    public long expireAfterUpdate(
        String key, Entry value, long currentTime, long currentDuration) {
      return value.ttlNanos();
    }

    @Override
    public long expireAfterRead(String key, Entry value, long currentTime, long currentDuration) {
      return currentDuration;
    }
  }
}
