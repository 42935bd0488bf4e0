package com.chatrelay.backend.upstream.sse;

/** One dispatched server-sent event. {@code event} is {@code null} when the frame had no name. */
public record SseFrame(String event, String data) {}
