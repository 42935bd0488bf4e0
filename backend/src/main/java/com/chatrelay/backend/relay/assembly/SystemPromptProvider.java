package com.chatrelay.backend.relay.assembly;

import com.chatrelay.backend.relay.config.RelayProperties;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/** Loads the system prompt once; falls back to a short built-in prompt if it cannot be read. */
@Component
public class SystemPromptProvider {

  private static final Logger log = LoggerFactory.getLogger(SystemPromptProvider.class);

  private final ResourceLoader resourceLoader;
  private final RelayProperties properties;
  private final Clock clock;
  private volatile String cached;

  public SystemPromptProvider(
      ResourceLoader resourceLoader, RelayProperties properties, Clock clock) {
    this.resourceLoader = resourceLoader;
    this.properties = properties;
    this.clock = clock;
  }

  public String systemPrompt() {
    String prompt = cached;
    if (prompt == null) {
      synchronized (this) {
        if (cached == null) {
          cached = load();
        }
        prompt = cached;
      }
    }
    return prompt;
  }

  private String load() {
    String location = properties.getSystemPromptLocation();
    Resource resource = resourceLoader.getResource(location);
    try (InputStream input = resource.getInputStream()) {
      String content = new String(input.readAllBytes(), StandardCharsets.UTF_8);
      if (StringUtils.hasText(content)) {
        log.info("Loaded system prompt from {} ({} chars)", location, content.length());
        return content;
      }
      log.warn("System prompt at {} is empty, using the built-in default", location);
    } catch (IOException ex) {
      log.warn("Failed to load system prompt from {}: {}", location, ex.getMessage());
    }
    return defaultPrompt();
  }

  String defaultPrompt() {
    return "The assistant is Claude, created by Anthropic.\n\nThe current date is "
        + LocalDate.now(clock)
        + ".";
  }
}
