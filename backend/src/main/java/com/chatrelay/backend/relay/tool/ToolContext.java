package com.chatrelay.backend.relay.tool;

import java.util.UUID;

public record ToolContext(UUID tenantId, UUID conversationId) {}
