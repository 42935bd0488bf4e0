package com.chatrelay.backend.relay.tool;

import static org.assertj.core.api.Assertions.assertThat;

import com.chatrelay.backend.relay.config.RelayProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConcurrentToolDispatcherTest {

  private static final ToolContext CONTEXT = new ToolContext(UUID.randomUUID(), UUID.randomUUID());

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final CountDownLatch release = new CountDownLatch(1);
  private ExecutorService executor;
  private SimpleMeterRegistry meterRegistry;
  private RelayProperties properties;
  private ConcurrentToolDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    executor = Executors.newFixedThreadPool(4);
    meterRegistry = new SimpleMeterRegistry();
    properties = new RelayProperties();
    properties.setToolTimeout(Duration.ofMillis(300));
    ToolRegistry registry =
        new ToolRegistry(
            List.of(
                tool("echo", input -> ToolOutput.text("echo " + input.path("v").asText())),
                tool(
                    "fail",
                    input -> {
                      throw new IllegalArgumentException("bad input");
                    }),
                tool(
                    "hang",
                    input -> {
                      release.await(5, TimeUnit.SECONDS);
                      return ToolOutput.text("late");
                    })),
            new ServerToolProperties(),
            objectMapper);
    dispatcher = new ConcurrentToolDispatcher(registry, executor, properties, meterRegistry);
  }

  @AfterEach
  void tearDown() {
    release.countDown();
    executor.shutdownNow();
  }

  @Test
  void everyCallGetsAResultInCallOrder() {
    List<ToolResult> results =
        dispatcher.dispatch(
            List.of(
                call("t1", "echo", "a"),
                call("t2", "missing", "b"),
                call("t3", "fail", "c"),
                call("t4", "echo", "d")),
            CONTEXT);

    assertThat(results).extracting(ToolResult::toolUseId).containsExactly("t1", "t2", "t3", "t4");
    assertThat(results.get(0).content()).isEqualTo("echo a");
    assertThat(results.get(0).error()).isFalse();
    assertThat(results.get(1).error()).isTrue();
    assertThat(results.get(1).content()).isEqualTo("Tool \"missing\" is not registered");
    assertThat(results.get(2).error()).isTrue();
    assertThat(results.get(2).content()).startsWith("Tool execution failed: bad input.");
    assertThat(results.get(3).content()).isEqualTo("echo d");
    assertThat(meterRegistry.counter("relay.tools.executions", "result", "success").count())
        .isEqualTo(2.0);
    assertThat(meterRegistry.counter("relay.tools.executions", "result", "unknown").count())
        .isEqualTo(1.0);
    assertThat(meterRegistry.counter("relay.tools.executions", "result", "error").count())
        .isEqualTo(1.0);
  }

  @Test
  void slowToolTimesOutWithoutHoldingBackTheOthers() {
    long started = System.nanoTime();

    List<ToolResult> results =
        dispatcher.dispatch(List.of(call("t1", "hang", "x"), call("t2", "echo", "y")), CONTEXT);

    long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
    assertThat(elapsedMillis).isLessThan(3_000);
    assertThat(results.get(0).error()).isTrue();
    assertThat(results.get(0).content()).isEqualTo("Tool \"hang\" timed out after 300 ms");
    assertThat(results.get(1).content()).isEqualTo("echo y");
    assertThat(meterRegistry.counter("relay.tools.executions", "result", "timeout").count())
        .isEqualTo(1.0);
  }

  private ToolCall call(String id, String name, String value) {
    return new ToolCall(id, name, objectMapper.createObjectNode().put("v", value));
  }

  private ChatTool tool(String name, ToolBody body) {
    return new ChatTool() {
      @Override
      public String name() {
        return name;
      }

      @Override
      public String description() {
        return name + " tool";
      }

      @Override
      public JsonNode inputSchema() {
        return objectMapper.createObjectNode().put("type", "object");
      }

      @Override
      public ToolOutput execute(JsonNode input, ToolContext context) throws Exception {
        return body.apply(input);
      }
    };
  }

  @FunctionalInterface
  private interface ToolBody {
    ToolOutput apply(JsonNode input) throws Exception;
  }
}
