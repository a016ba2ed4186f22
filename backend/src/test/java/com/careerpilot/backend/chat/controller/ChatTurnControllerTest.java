package com.careerpilot.backend.chat.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.careerpilot.backend.chat.domain.ChatRole;
import com.careerpilot.backend.chat.domain.ConversationMessage;
import com.careerpilot.backend.chat.domain.JobRecord;
import com.careerpilot.backend.chat.domain.UiPayload;
import com.careerpilot.backend.chat.supervisor.TurnRequest;
import com.careerpilot.backend.chat.supervisor.TurnResult;
import com.careerpilot.backend.chat.supervisor.TurnSupervisor;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest({ChatTurnController.class, HealthController.class})
@AutoConfigureMockMvc(addFilters = false)
class ChatTurnControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockBean private TurnSupervisor turnSupervisor;

  @Test
  void returnsAssistantMessageAndJobsTable() throws Exception {
    UUID messageId = UUID.randomUUID();
    ConversationMessage answer =
        new ConversationMessage(messageId, ChatRole.ASSISTANT, "Here is a match.", null, null);
    JobRecord job = new JobRecord("Backend Engineer", "Acme", "Berlin", 4, "https://acme.example");
    when(turnSupervisor.handle(any(TurnRequest.class)))
        .thenReturn(new TurnResult(answer, UiPayload.jobsTable(List.of(job), messageId), false));

    mockMvc
        .perform(
            post("/api/chat/turns")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {
                      "message": "Find me backend jobs",
                      "user_id": "user-1",
                      "thread_id": "thread-1",
                      "messages": [
                        {"role": "human", "content": "hi", "metadata": {"source": "web"}},
                        {"role": "ai", "content": "Hello! How can I help?"}
                      ]
                    }
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.message.id").value(messageId.toString()))
        .andExpect(jsonPath("$.message.role").value("assistant"))
        .andExpect(jsonPath("$.message.content").value("Here is a match."))
        .andExpect(jsonPath("$.ui.type").value("jobs_table"))
        .andExpect(jsonPath("$.ui.correlated_message_id").value(messageId.toString()))
        .andExpect(jsonPath("$.ui.data.jobs[0].job_title").value("Backend Engineer"))
        .andExpect(jsonPath("$.ui.data.jobs[0].match_rating").value(4));

    ArgumentCaptor<TurnRequest> captor = ArgumentCaptor.forClass(TurnRequest.class);
    verify(turnSupervisor).handle(captor.capture());
    TurnRequest request = captor.getValue();
    assertThat(request.userId()).isEqualTo("user-1");
    assertThat(request.inboundMessages())
        .extracting(ConversationMessage::role)
        .containsExactly(ChatRole.USER, ChatRole.ASSISTANT);
  }

  @Test
  void returnsNullUiWhenTurnIsNotAnnotated() throws Exception {
    when(turnSupervisor.handle(any(TurnRequest.class)))
        .thenReturn(
            new TurnResult(ConversationMessage.assistant("Acme builds robots."), null, false));

    mockMvc
        .perform(
            post("/api/chat/turns")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"message\": \"Tell me about Acme\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.message.content").value("Acme builds robots."))
        .andExpect(jsonPath("$.ui").doesNotExist());
  }

  @Test
  void rejectsBlankMessage() throws Exception {
    mockMvc
        .perform(
            post("/api/chat/turns")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"message\": \"   \", \"user_id\": \"user-1\"}"))
        .andExpect(status().isBadRequest());

    verify(turnSupervisor, never()).handle(any(TurnRequest.class));
  }

  @Test
  void rejectsUnknownMessageRole() throws Exception {
    mockMvc
        .perform(
            post("/api/chat/turns")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"message": "hi", "messages": [{"role": "robot", "content": "x"}]}
                    """))
        .andExpect(status().isBadRequest());
  }

  @Test
  void healthEndpointReportsRunning() throws Exception {
    mockMvc
        .perform(get("/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("healthy"))
        .andExpect(jsonPath("$.message").value("API is running"));
  }
}
