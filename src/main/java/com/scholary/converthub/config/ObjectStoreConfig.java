package com.scholary.converthub.config;

import com.scholary.converthub.objectstore.ArtifactStorage;
import com.scholary.converthub.objectstore.ObjectStoreArtifactStorage;
import com.scholary.converthub.objectstore.ObjectStoreClient;
import com.scholary.converthub.objectstore.ObjectStoreProperties;
import com.scholary.converthub.objectstore.S3ObjectStoreClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for object storage.
 *
 * <p>Wires the S3 client from application.yml and puts the URL-level artifact storage on top of
 * it. Everything above this layer only sees {@link ArtifactStorage}.
 */
@Configuration
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean(destroyMethod = "close")
  public S3ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }

  @Bean
  public ArtifactStorage artifactStorage(
      ObjectStoreClient objectStoreClient, ObjectStoreProperties properties) {
    return new ObjectStoreArtifactStorage(objectStoreClient, properties);
  }
}
