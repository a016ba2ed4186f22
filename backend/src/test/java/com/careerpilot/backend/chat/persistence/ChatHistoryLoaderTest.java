package com.careerpilot.backend.chat.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.careerpilot.backend.chat.domain.ChatRole;
import com.careerpilot.backend.chat.domain.ConversationMessage;
import com.careerpilot.backend.chat.domain.ThreadIdentity;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ChatHistoryLoaderTest {

  @Mock private ChatHistoryRepository repository;

  @Test
  void restoresIdAndCapabilityFromMetadata() {
    UUID messageId = UUID.randomUUID();
    ChatHistoryEntry tool =
        new ChatHistoryEntry(
            "user-1",
            "thread-1",
            ChatRole.TOOL,
            "[]",
            Map.of(
                "message_id", messageId.toString(),
                "capability", "job_matcher",
                "source", "web"));
    ChatHistoryEntry user =
        new ChatHistoryEntry("user-1", "thread-1", ChatRole.USER, "jobs?", null);
    when(repository.findByUserIdAndThreadIdOrderByCreatedAtAsc("user-1", "thread-1"))
        .thenReturn(List.of(user, tool));

    List<ConversationMessage> messages =
        new ChatHistoryLoader(repository).load(new ThreadIdentity("user-1", "thread-1"));

    assertThat(messages)
        .extracting(ConversationMessage::role)
        .containsExactly(ChatRole.USER, ChatRole.TOOL);
    ConversationMessage restored = messages.get(1);
    assertThat(restored.id()).isEqualTo(messageId);
    assertThat(restored.capability()).isEqualTo("job_matcher");
    assertThat(restored.metadata()).containsOnlyKeys("source");
  }

  @Test
  void malformedMessageIdStillYieldsMessage() {
    ChatHistoryEntry entry =
        new ChatHistoryEntry(
            "user-1", "thread-1", ChatRole.ASSISTANT, "hi", Map.of("message_id", "not-a-uuid"));

    ConversationMessage message = ChatHistoryLoader.toMessage(entry);

    assertThat(message.id()).isNotNull();
    assertThat(message.content()).isEqualTo("hi");
    assertThat(message.capability()).isNull();
    assertThat(message.metadata()).isEmpty();
  }
}
