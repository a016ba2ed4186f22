package com.careerpilot.backend.chat.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import java.util.List;

@Schema(
    description = "One user turn for the job-search assistant.",
    example =
        """
        {
          "message": "Find me backend jobs in Berlin",
          "user_id": "7f8d3c1e",
          "thread_id": "thread-1"
        }
        """)
public record ChatTurnRequest(
    @Schema(
            description = "New user message.",
            example = "Find me backend jobs in Berlin",
            requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank
        String message,
    @Schema(description = "Owner of the conversation; enables persistence.")
        @JsonProperty("user_id")
        String userId,
    @Schema(description = "Conversation thread of the user.") @JsonProperty("thread_id")
        String threadId,
    @Schema(description = "Earlier messages known to the client.") List<InboundMessage> messages) {}
