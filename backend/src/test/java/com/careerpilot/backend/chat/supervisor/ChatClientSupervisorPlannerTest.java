package com.careerpilot.backend.chat.supervisor;

import static org.assertj.core.api.Assertions.assertThat;

import com.careerpilot.backend.chat.capability.CapabilityName;
import com.careerpilot.backend.chat.config.ChatAgentProperties;
import com.careerpilot.backend.chat.domain.ConversationMessage;
import com.careerpilot.backend.chat.support.ScriptedChatModel;
import java.util.EnumSet;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.MessageType;

class ChatClientSupervisorPlannerTest {

  private ScriptedChatModel model;
  private ChatClientSupervisorPlanner planner;

  @BeforeEach
  void setUp() {
    model = new ScriptedChatModel();
    planner = new ChatClientSupervisorPlanner(ChatClient.builder(model).build(), properties());
  }

  @Test
  void parsesDelegation() {
    model.reply(
        "{\"action\":\"DELEGATE\",\"capability\":\"job_matcher\","
            + "\"instructions\":\"Find Java roles in Berlin\"}");

    RoutingDecision decision =
        planner.plan(
            List.of(ConversationMessage.user("Find me jobs")),
            "Name: Ada.",
            EnumSet.of(CapabilityName.JOB_MATCHER, CapabilityName.RESEARCHER));

    assertThat(decision.isDelegate()).isTrue();
    assertThat(decision.capability()).isEqualTo("job_matcher");
    assertThat(decision.instructions()).isEqualTo("Find Java roles in Berlin");
  }

  @Test
  void systemPromptListsAgentsAndUserContext() {
    model.reply("{\"action\":\"RESPOND\",\"response\":\"Hello!\"}");

    RoutingDecision decision =
        planner.plan(
            List.of(ConversationMessage.user("hi")),
            "Name: Ada.",
            EnumSet.of(CapabilityName.RESEARCHER, CapabilityName.JOB_MATCHER));

    assertThat(decision.isDelegate()).isFalse();
    assertThat(decision.response()).isEqualTo("Hello!");
    Message system = model.lastPrompt().getInstructions().get(0);
    assertThat(system.getMessageType()).isEqualTo(MessageType.SYSTEM);
    assertThat(system.getText())
        .startsWith("You coordinate career agents.")
        .contains("Available agents: job_matcher, researcher")
        .contains("User context: Name: Ada.");
  }

  @Test
  void emptyDecisionAnswersDirectly() {
    model.reply("{}");

    RoutingDecision decision =
        planner.plan(
            List.of(ConversationMessage.user("hi")), "", EnumSet.of(CapabilityName.RESEARCHER));

    assertThat(decision.isDelegate()).isFalse();
    assertThat(decision.response()).isNull();
  }

  private static ChatAgentProperties properties() {
    ChatAgentProperties properties = new ChatAgentProperties();
    properties.setSupervisorPrompt("You coordinate career agents.");
    return properties;
  }
}
