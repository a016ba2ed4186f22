package com.careerpilot.backend.chat.context;

import static org.assertj.core.api.Assertions.assertThat;

import com.careerpilot.backend.chat.domain.ChatRole;
import com.careerpilot.backend.chat.domain.ConversationMessage;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ContextWindowTrimmerTest {

  private static final int TOKENS_PER_MESSAGE = 10;

  private final TokenEstimator estimator = message -> TOKENS_PER_MESSAGE;
  private final ContextWindowTrimmer trimmer = new ContextWindowTrimmer(estimator);

  @Test
  void keepsNewestWholeTurnsThatFitTheBudget() {
    List<ConversationMessage> history = threeTurns();

    List<ConversationMessage> trimmed = trimmer.trim(history, 45);

    assertThat(trimmed)
        .extracting(ConversationMessage::content)
        .containsExactly("u2", "a2", "u3", "a3");
    assertThat(trimmed.get(0).isUser()).isTrue();
  }

  @Test
  void keepsEverythingWhenBudgetIsLarge() {
    List<ConversationMessage> history = threeTurns();

    assertThat(trimmer.trim(history, 1_000)).containsExactlyElementsOf(history);
  }

  @Test
  void returnsNewestTurnWholeWhenItAloneExceedsBudget() {
    List<ConversationMessage> history = threeTurns();

    List<ConversationMessage> trimmed = trimmer.trim(history, 5);

    assertThat(trimmed).extracting(ConversationMessage::content).containsExactly("u3", "a3");
  }

  @Test
  void dropsMessagesBeforeFirstUserMessage() {
    List<ConversationMessage> history =
        List.of(
            ConversationMessage.assistant("greeting"),
            ConversationMessage.user("u1"),
            ConversationMessage.assistant("a1"));

    assertThat(trimmer.trim(history, 1_000))
        .extracting(ConversationMessage::content)
        .containsExactly("u1", "a1");
  }

  @Test
  void returnsEmptyViewWithoutUserMessages() {
    List<ConversationMessage> history =
        List.of(ConversationMessage.assistant("a"), ConversationMessage.tool("researcher", "t"));

    assertThat(trimmer.trim(history, 1_000)).isEmpty();
    assertThat(trimmer.trim(List.of(), 1_000)).isEmpty();
    assertThat(trimmer.trim(null, 1_000)).isEmpty();
  }

  @Test
  void dropsTrailingAssistantMessageWaitingForToolResult() {
    ConversationMessage pending =
        new ConversationMessage(
            null,
            ChatRole.ASSISTANT,
            "calling exa_search",
            null,
            Map.of(ConversationMessage.METADATA_TOOL_CALL_PENDING, "true"));
    List<ConversationMessage> history =
        List.of(
            ConversationMessage.user("u1"),
            ConversationMessage.assistant("a1"),
            ConversationMessage.user("u2"),
            pending);

    List<ConversationMessage> trimmed = trimmer.trim(history, 1_000);

    assertThat(trimmed).extracting(ConversationMessage::content).containsExactly("u1", "a1", "u2");
  }

  @Test
  void doesNotModifyInput() {
    List<ConversationMessage> history = new ArrayList<>(threeTurns());
    List<ConversationMessage> snapshot = List.copyOf(history);

    trimmer.trim(history, 15);

    assertThat(history).containsExactlyElementsOf(snapshot);
  }

  @Test
  void viewFitsBudgetUnlessNewestTurnAloneIsTooLarge() {
    List<ConversationMessage> history = new ArrayList<>(threeTurns());
    history.add(ConversationMessage.tool("job_matcher", "t3"));
    List<ConversationMessage> newestTurn = history.subList(4, history.size());

    for (int budget = 0; budget <= 100; budget++) {
      List<ConversationMessage> trimmed = trimmer.trim(history, budget);
      int used = estimator.estimate(trimmed);
      if (used > budget) {
        assertThat(trimmed).containsExactlyElementsOf(newestTurn);
      } else {
        assertThat(trimmed).isNotEmpty();
        assertThat(trimmed.get(0).isUser()).isTrue();
      }
    }
  }

  private static List<ConversationMessage> threeTurns() {
    return List.of(
        ConversationMessage.user("u1"),
        ConversationMessage.assistant("a1"),
        ConversationMessage.user("u2"),
        ConversationMessage.assistant("a2"),
        ConversationMessage.user("u3"),
        ConversationMessage.assistant("a3"));
  }
}
