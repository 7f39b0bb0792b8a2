package com.scholary.converthub.config;

import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Enables the batch, progress and conversion properties to be loaded from application.yml.
 *
 * <p>Also exposes the clock used for timestamps and retention checks, so tests can substitute a
 * controllable one.
 */
@Configuration
@EnableConfigurationProperties({
  BatchProperties.class,
  ProgressProperties.class,
  ConversionProperties.class
})
public class PropertiesConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
