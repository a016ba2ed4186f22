package com.careerpilot.backend.chat.api;

import io.swagger.v3.oas.annotations.media.Schema;
import java.util.Map;

@Schema(description = "Prior conversation message sent by the client.")
public record InboundMessage(
    @Schema(description = "Message role: user, assistant or tool.", example = "user") String role,
    @Schema(description = "Message text.") String content,
    @Schema(description = "Optional string attributes, e.g. user_id and thread_id.")
        Map<String, String> metadata) {}
