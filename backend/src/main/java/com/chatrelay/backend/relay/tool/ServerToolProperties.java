package com.chatrelay.backend.relay.tool;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Upstream-executed tools (e.g. web search), passed through to the request verbatim. */
@ConfigurationProperties(prefix = "app.relay.server-tools")
public class ServerToolProperties {

  private List<Map<String, Object>> definitions = new ArrayList<>();

  public List<Map<String, Object>> getDefinitions() {
    return definitions;
  }

  public void setDefinitions(List<Map<String, Object>> definitions) {
    this.definitions = definitions;
  }
}
