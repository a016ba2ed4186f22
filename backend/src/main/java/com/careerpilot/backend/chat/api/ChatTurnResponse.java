package com.careerpilot.backend.chat.api;

import com.careerpilot.backend.chat.domain.UiPayload;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.UUID;

@Schema(description = "Assistant answer of a turn with an optional jobs table.")
public record ChatTurnResponse(
    @Schema(description = "Assistant message.") Message message,
    @Schema(description = "Jobs table correlated with the message, null when absent.")
        UiPayload ui) {

  public record Message(UUID id, String role, String content) {}
}
