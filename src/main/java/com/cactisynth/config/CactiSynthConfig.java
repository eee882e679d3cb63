package com.cactisynth.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for project and voicebank beans.
 *
 * <p>Enables the CactiSynthProperties to be loaded from application.yml and provides the JSON
 * mapper used for the project container payload.
 */
@Configuration
@EnableConfigurationProperties(CactiSynthProperties.class)
public class CactiSynthConfig {

  @Bean
  public ObjectMapper projectObjectMapper() {
    return projectMapper();
  }

  /** Mapper for the project container payload. */
  public static ObjectMapper projectMapper() {
    return new ObjectMapper().disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
  }
}
