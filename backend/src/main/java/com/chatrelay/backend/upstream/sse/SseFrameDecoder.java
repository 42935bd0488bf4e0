package com.chatrelay.backend.upstream.sse;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Incremental decoder for {@code text/event-stream} bodies.
 *
 * <p>Bytes may arrive split at any position, including inside a multi-byte UTF-8 character; lines
 * are only decoded once their terminating {@code \n} has been seen. {@code \r\n} endings are
 * accepted. Comment lines and the {@code id}/{@code retry} fields are ignored. Instances are not
 * thread-safe; use one per stream.
 */
public final class SseFrameDecoder {

  public static final int DEFAULT_MAX_LINE_BYTES = 8 * 1024 * 1024;

  private final int maxLineBytes;
  private final ByteArrayOutputStream line = new ByteArrayOutputStream(256);
  private final StringBuilder data = new StringBuilder();
  private String eventName;
  private boolean hasData;

  public SseFrameDecoder() {
    this(DEFAULT_MAX_LINE_BYTES);
  }

  public SseFrameDecoder(int maxLineBytes) {
    this.maxLineBytes = maxLineBytes;
  }

  public List<SseFrame> feed(byte[] chunk) {
    List<SseFrame> frames = new ArrayList<>();
    if (chunk == null) {
      return frames;
    }
    for (byte b : chunk) {
      if (b == '\n') {
        processLine(frames);
      } else {
        if (line.size() >= maxLineBytes) {
          throw new SseDecodingException("SSE line exceeds " + maxLineBytes + " bytes");
        }
        line.write(b);
      }
    }
    return frames;
  }

  /** Flushes a trailing unterminated line and any frame not closed by a blank line. */
  public List<SseFrame> finish() {
    List<SseFrame> frames = new ArrayList<>();
    if (line.size() > 0) {
      processLine(frames);
    }
    dispatch(frames);
    return frames;
  }

  private void processLine(List<SseFrame> frames) {
    byte[] bytes = line.toByteArray();
    line.reset();
    int length = bytes.length;
    if (length > 0 && bytes[length - 1] == '\r') {
      length--;
    }
    String text = new String(bytes, 0, length, StandardCharsets.UTF_8);
    if (text.isEmpty()) {
      dispatch(frames);
      return;
    }
    if (text.charAt(0) == ':') {
      return;
    }
    int colon = text.indexOf(':');
    String field = colon >= 0 ? text.substring(0, colon) : text;
    String value = colon >= 0 ? text.substring(colon + 1) : "";
    if (value.startsWith(" ")) {
      value = value.substring(1);
    }
    switch (field) {
      case "event" -> eventName = value;
      case "data" -> {
        if (hasData) {
          data.append('\n');
        }
        data.append(value);
        hasData = true;
      }
      default -> {
        // id, retry and unknown fields carry nothing the relay uses
      }
    }
  }

  private void dispatch(List<SseFrame> frames) {
    if (hasData) {
      frames.add(new SseFrame(eventName, data.toString()));
    }
    data.setLength(0);
    hasData = false;
    eventName = null;
  }
}
