package com.scholary.cog.converter.config;

import com.scholary.cog.converter.scratch.ScratchManager;
import com.scholary.cog.converter.transcode.TranscodeProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for conversion-related beans.
 *
 * <p>Enables the cog and transcode properties and sets up the scratch directory.
 */
@Configuration
@EnableConfigurationProperties({CogProperties.class, TranscodeProperties.class})
public class CogConfig {

  @Bean
  public ScratchManager scratchManager(CogProperties properties) {
    return new ScratchManager(properties.tempDir());
  }
}
