package com.careerpilot.backend.chat.capability;

import com.careerpilot.backend.chat.domain.ConversationMessage;
import java.util.ArrayList;
import java.util.List;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.util.StringUtils;

/** Converts conversation entries into Spring AI prompt messages. */
public final class PromptMessages {

  private PromptMessages() {}

  public static List<Message> toPromptMessages(List<ConversationMessage> messages) {
    List<Message> result = new ArrayList<>();
    if (messages == null) {
      return result;
    }
    for (ConversationMessage message : messages) {
      if (message == null || !StringUtils.hasText(message.content())) {
        continue;
      }
      switch (message.role()) {
        case USER -> result.add(new UserMessage(message.content()));
        case ASSISTANT -> result.add(new AssistantMessage(message.content()));
        case TOOL -> result.add(new AssistantMessage(toolTranscript(message)));
      }
    }
    return result;
  }

  private static String toolTranscript(ConversationMessage message) {
    String source = StringUtils.hasText(message.capability()) ? message.capability() : "tool";
    return "[" + source + "] " + message.content();
  }
}
