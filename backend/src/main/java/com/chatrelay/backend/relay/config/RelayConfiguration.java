package com.chatrelay.backend.relay.config;

import com.chatrelay.backend.relay.tool.ServerToolProperties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({RelayProperties.class, ServerToolProperties.class})
public class RelayConfiguration {

  @Bean(name = "relaySessionExecutor", destroyMethod = "shutdown")
  public ExecutorService relaySessionExecutor(RelayProperties properties) {
    return Executors.newFixedThreadPool(
        properties.getSessionConcurrency(), namedDaemonFactory("relay-session-"));
  }

  @Bean(name = "relayToolExecutor", destroyMethod = "shutdown")
  public ExecutorService relayToolExecutor(RelayProperties properties) {
    return Executors.newFixedThreadPool(
        properties.getToolConcurrency(), namedDaemonFactory("relay-tool-"));
  }

  @Bean(name = "relayBackgroundExecutor", destroyMethod = "shutdown")
  public ExecutorService relayBackgroundExecutor(RelayProperties properties) {
    return Executors.newFixedThreadPool(
        properties.getBackgroundConcurrency(), namedDaemonFactory("relay-background-"));
  }

  private static ThreadFactory namedDaemonFactory(String prefix) {
    return new ThreadFactory() {
      private final AtomicInteger index = new AtomicInteger();

      @Override
      public Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable);
        thread.setName(prefix + index.incrementAndGet());
        thread.setDaemon(true);
        return thread;
      }
    };
  }
}
