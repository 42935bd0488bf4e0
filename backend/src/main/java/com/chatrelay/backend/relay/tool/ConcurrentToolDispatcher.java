package com.chatrelay.backend.relay.tool;

import com.chatrelay.backend.relay.config.RelayProperties;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs the tool calls of one round in parallel. Every call yields a result: unknown tools,
 * failures and timeouts become error results the model can react to.
 */
@Component
public class ConcurrentToolDispatcher {

  private static final Logger log = LoggerFactory.getLogger(ConcurrentToolDispatcher.class);

  private final ToolRegistry toolRegistry;
  private final ExecutorService executor;
  private final RelayProperties properties;
  private final MeterRegistry meterRegistry;

  public ConcurrentToolDispatcher(
      ToolRegistry toolRegistry,
      @Qualifier("relayToolExecutor") ExecutorService executor,
      RelayProperties properties,
      MeterRegistry meterRegistry) {
    this.toolRegistry = toolRegistry;
    this.executor = executor;
    this.properties = properties;
    this.meterRegistry = meterRegistry;
  }

  /** @return one result per call, in call order */
  public List<ToolResult> dispatch(List<ToolCall> calls, ToolContext context) {
    long timeoutNanos = properties.getToolTimeout().toNanos();
    long deadline = System.nanoTime() + timeoutNanos;

    List<Future<ToolOutput>> futures = new ArrayList<>(calls.size());
    for (ToolCall call : calls) {
      Optional<ChatTool> tool = toolRegistry.find(call.name());
      futures.add(
          tool.map(found -> executor.submit(() -> found.execute(call.input(), context)))
              .orElse(null));
    }

    List<ToolResult> results = new ArrayList<>(calls.size());
    for (int i = 0; i < calls.size(); i++) {
      results.add(await(calls.get(i), futures.get(i), deadline));
    }
    return results;
  }

  private ToolResult await(ToolCall call, Future<ToolOutput> future, long deadline) {
    if (future == null) {
      log.warn("Model requested unknown tool '{}'", call.name());
      count("unknown");
      return ToolResult.failure(call, "Tool \"" + call.name() + "\" is not registered");
    }
    try {
      long remaining = Math.max(0, deadline - System.nanoTime());
      ToolOutput output = future.get(remaining, TimeUnit.NANOSECONDS);
      count("success");
      return ToolResult.success(call, output != null ? output : ToolOutput.text(""));
    } catch (TimeoutException ex) {
      future.cancel(true);
      log.warn(
          "Tool '{}' timed out after {} ms", call.name(), properties.getToolTimeout().toMillis());
      count("timeout");
      return ToolResult.failure(
          call,
          "Tool \""
              + call.name()
              + "\" timed out after "
              + properties.getToolTimeout().toMillis()
              + " ms");
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
      log.warn("Tool '{}' failed: {}", call.name(), cause.getMessage());
      count("error");
      return ToolResult.failure(
          call,
          "Tool execution failed: "
              + (cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName())
              + ". Tell the user the tool could not complete and why.");
    } catch (InterruptedException ex) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      count("interrupted");
      return ToolResult.failure(call, "Tool \"" + call.name() + "\" was interrupted");
    }
  }

  private void count(String result) {
    meterRegistry.counter("relay.tools.executions", "result", result).increment();
  }
}
