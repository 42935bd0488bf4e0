package com.chatrelay.backend.upstream.config;

import com.chatrelay.backend.upstream.client.UpstreamClient;
import com.chatrelay.backend.upstream.client.WebClientUpstreamClient;
import com.chatrelay.backend.upstream.event.UpstreamEventParser;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
@EnableConfigurationProperties(UpstreamProperties.class)
public class UpstreamClientConfiguration {

  @Bean
  public WebClient upstreamWebClient(WebClient.Builder builder, UpstreamProperties properties) {
    return builder
        .codecs(
            configurer ->
                configurer.defaultCodecs().maxInMemorySize(properties.getMaxInMemorySize()))
        .build();
  }

  @Bean
  public UpstreamClient upstreamClient(
      WebClient upstreamWebClient, UpstreamEventParser eventParser, UpstreamProperties properties) {
    return new WebClientUpstreamClient(upstreamWebClient, eventParser, properties);
  }
}
