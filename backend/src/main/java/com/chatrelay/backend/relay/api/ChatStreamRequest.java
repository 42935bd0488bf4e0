package com.chatrelay.backend.relay.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(
    description = "Payload for sending a message and streaming the assistant's reply.",
    example =
        """
        {
          "conversationId": "5b6f2f4e-7a55-4d0c-9a0e-2f7f4a3f6c11",
          "message": "Summarise the attached report.",
          "attachmentIds": ["a3c1f0de-95a2-4bb0-8d7e-0f5b3f0b9e21"],
          "thinking": true
        }
        """)
public record ChatStreamRequest(
    @Schema(
            description = "Conversation the message belongs to.",
            requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull
        UUID conversationId,
    @Schema(description = "User message text.", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank
        @Size(max = 200_000)
        String message,
    @Schema(description = "Previously uploaded attachments to bind to this message.")
        @Size(max = 20)
        List<UUID> attachmentIds,
    @Schema(description = "Upstream model; defaults to the configured model.") String model,
    @Schema(description = "Enables extended thinking; defaults to the configured setting.")
        Boolean thinking) {

  public ChatStreamRequest {
    attachmentIds = attachmentIds != null ? List.copyOf(attachmentIds) : List.of();
  }
}
