package com.careerpilot.backend.chat.supervisor;

import com.careerpilot.backend.chat.capability.CapabilityName;
import com.careerpilot.backend.chat.capability.PromptMessages;
import com.careerpilot.backend.chat.config.ChatAgentProperties;
import com.careerpilot.backend.chat.domain.ConversationMessage;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.stereotype.Component;

/** Planner that asks the chat model for a {@link RoutingDecision} through structured output. */
@Component
public class ChatClientSupervisorPlanner implements SupervisorPlanner {

  private static final Logger log = LoggerFactory.getLogger(ChatClientSupervisorPlanner.class);

  private final ChatClient chatClient;
  private final ChatAgentProperties properties;

  public ChatClientSupervisorPlanner(ChatClient chatClient, ChatAgentProperties properties) {
    this.chatClient = chatClient;
    this.properties = properties;
  }

  @Override
  public RoutingDecision plan(
      List<ConversationMessage> conversation, String userContext, Set<CapabilityName> available) {
    String agents =
        available.stream().map(CapabilityName::code).sorted().collect(Collectors.joining(", "));
    RoutingDecision decision =
        chatClient
            .prompt()
            .system(
                properties.getSupervisorPrompt()
                    + "\n\nAvailable agents: "
                    + agents
                    + "\nUser context: "
                    + userContext)
            .messages(PromptMessages.toPromptMessages(conversation))
            .call()
            .entity(RoutingDecision.class);
    if (decision == null || decision.action() == null) {
      log.debug("Planner returned no usable decision; answering directly");
      return RoutingDecision.respond(null);
    }
    return decision;
  }
}
