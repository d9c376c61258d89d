package com.scholary.syncmap.config;

import com.scholary.syncmap.format.SyncMapFormatRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for sync map beans.
 *
 * <p>Enables the SyncMapProperties to be loaded from application.yml and wires up the format
 * registry with the built-in codecs.
 */
@Configuration
@EnableConfigurationProperties(SyncMapProperties.class)
public class SyncMapConfig {

  @Bean
  public SyncMapFormatRegistry syncMapFormatRegistry() {
    return SyncMapFormatRegistry.defaults();
  }
}
