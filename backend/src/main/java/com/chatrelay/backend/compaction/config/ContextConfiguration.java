package com.chatrelay.backend.compaction.config;

import com.chatrelay.backend.compaction.token.DefaultTokenEstimator;
import com.chatrelay.backend.compaction.token.TokenEstimator;
import com.knuddels.jtokkit.Encodings;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ContextProperties.class)
public class ContextConfiguration {

  @Bean
  public TokenEstimator tokenEstimator(ContextProperties properties) {
    return new DefaultTokenEstimator(
        Encodings.newDefaultEncodingRegistry(),
        properties.getTokenizer(),
        properties.isLightweightEstimation());
  }
}
