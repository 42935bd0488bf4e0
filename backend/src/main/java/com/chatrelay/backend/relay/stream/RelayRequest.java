package com.chatrelay.backend.relay.stream;

import com.fasterxml.jackson.databind.node.ArrayNode;

/**
 * Assembled input of a relay session.
 *
 * @param messages upstream-shaped history ending with the new user message
 */
public record RelayRequest(
    String model, String systemPrompt, boolean thinking, ArrayNode messages) {}
