package com.scholary.cog.converter.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.cog.converter.objectstore.ObjectStoreProperties;
import com.scholary.cog.converter.objectstore.S3ObjectStoreClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for object storage.
 *
 * <p>Wires up the S3 client from the "objectstore.*" properties. The client is closed with the
 * application context.
 */
@Configuration
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean(destroyMethod = "close")
  public S3ObjectStoreClient objectStoreClient(
      ObjectStoreProperties properties, ObjectMapper objectMapper) {
    return new S3ObjectStoreClient(properties, objectMapper);
  }
}
