package com.scholary.converthub.api;

import com.scholary.converthub.cache.ConversionCache;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.Locale;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Monitoring and maintenance of the conversion cache. */
@RestController
@RequestMapping("/api/cache")
@Tag(name = "Cache", description = "Inspect and invalidate cached conversions")
public class CacheController {

  private static final Logger LOGGER = LoggerFactory.getLogger(CacheController.class);
  private static final Pattern SHA256_HEX = Pattern.compile("[0-9a-f]{64}");

  private final ConversionCache cache;

  public CacheController(ConversionCache cache) {
    this.cache = cache;
  }

  @GetMapping("/stats")
  @Operation(summary = "Cache size, hit and miss counts, hit rate and evictions")
  public ResponseEntity<ConversionCache.CacheStats> stats() {
    return ResponseEntity.ok(cache.stats());
  }

  @DeleteMapping("/{sha256}")
  @Operation(
      summary = "Drop every cached conversion of one input",
      description = "The input is identified by the hex SHA-256 of its bytes.")
  public ResponseEntity<CacheInvalidationResponse> invalidate(@PathVariable String sha256) {
    String digest = sha256.toLowerCase(Locale.ROOT);
    if (!SHA256_HEX.matcher(digest).matches()) {
      throw new InvalidRequestException("Not a hex SHA-256 digest: " + sha256);
    }
    long invalidated = cache.invalidate(ConversionCache.generateContentPrefix(digest));
    LOGGER.info("Cache invalidation requested: sha256={}, invalidated={}", digest, invalidated);
    return ResponseEntity.ok(new CacheInvalidationResponse(digest, invalidated));
  }
}
