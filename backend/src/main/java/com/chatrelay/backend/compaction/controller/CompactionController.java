package com.chatrelay.backend.compaction.controller;

import com.chatrelay.backend.chat.service.ConversationService;
import com.chatrelay.backend.common.web.TenantHeaders;
import com.chatrelay.backend.compaction.service.CompactionResult;
import com.chatrelay.backend.compaction.service.ContextCompactor;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import java.util.UUID;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/chat/conversations")
@Validated
public class CompactionController {

  private final ConversationService conversationService;
  private final ContextCompactor contextCompactor;

  public CompactionController(
      ConversationService conversationService, ContextCompactor contextCompactor) {
    this.conversationService = conversationService;
    this.contextCompactor = contextCompactor;
  }

  @PostMapping("/{conversationId}/compact")
  @Operation(summary = "Summarise older messages of a conversation now")
  public CompactionResult compact(
      @RequestHeader(TenantHeaders.TENANT_ID) UUID tenantId,
      @PathVariable UUID conversationId,
      @RequestBody(required = false) @Valid ManualCompactionRequest request) {
    conversationService.requireConversation(tenantId, conversationId);
    return contextCompactor.manualCompact(
        conversationId, request != null ? request.instruction() : null);
  }

  public record ManualCompactionRequest(@Size(max = 2000) String instruction) {}
}
