package com.scholary.converthub.objectstore;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for object storage.
 *
 * <p>These map to the "objectstore.*" keys in application.yml. {@code publicBaseUrl} is the
 * prefix clients download artifacts from (a CDN or R2 domain); when blank, path-style URLs on
 * the endpoint are used.
 */
@ConfigurationProperties(prefix = "objectstore")
@Validated
public record ObjectStoreProperties(
    @NotBlank String endpoint,
    @NotBlank String accessKey,
    @NotBlank String secretKey,
    @NotBlank String bucket,
    String region,
    boolean pathStyleAccess,
    String publicBaseUrl,
    String keyPrefix) {

  public ObjectStoreProperties {
    if (keyPrefix == null || keyPrefix.isBlank()) {
      keyPrefix = "conversions";
    }
  }

  /** Base URL artifacts are served from, without a trailing slash. */
  public String resolvedBaseUrl() {
    String base =
        publicBaseUrl != null && !publicBaseUrl.isBlank()
            ? publicBaseUrl
            : endpoint.replaceAll("/+$", "") + "/" + bucket;
    return base.replaceAll("/+$", "");
  }
}
