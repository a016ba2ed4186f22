package com.careerpilot.backend.chat.controller;

import com.careerpilot.backend.chat.api.ChatTurnRequest;
import com.careerpilot.backend.chat.api.ChatTurnResponse;
import com.careerpilot.backend.chat.api.InboundMessage;
import com.careerpilot.backend.chat.domain.ChatRole;
import com.careerpilot.backend.chat.domain.ConversationMessage;
import com.careerpilot.backend.chat.supervisor.TurnRequest;
import com.careerpilot.backend.chat.supervisor.TurnResult;
import com.careerpilot.backend.chat.supervisor.TurnSupervisor;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@Validated
@RestController
@RequestMapping("/api/chat/turns")
public class ChatTurnController {

  private final TurnSupervisor turnSupervisor;

  public ChatTurnController(TurnSupervisor turnSupervisor) {
    this.turnSupervisor = turnSupervisor;
  }

  @PostMapping(
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ChatTurnResponse turn(@RequestBody @Valid ChatTurnRequest request) {
    if (!StringUtils.hasText(request.message())) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "message must not be blank");
    }
    List<ConversationMessage> history;
    try {
      history = toConversation(request.messages());
    } catch (IllegalArgumentException ex) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unsupported message role", ex);
    }
    TurnResult result =
        turnSupervisor.handle(
            new TurnRequest(
                request.message(), request.userId(), request.threadId(), null, history));
    ConversationMessage message = result.message();
    return new ChatTurnResponse(
        new ChatTurnResponse.Message(message.id(), message.role().wireName(), message.content()),
        result.uiPayload());
  }

  private List<ConversationMessage> toConversation(List<InboundMessage> messages) {
    if (messages == null) {
      return List.of();
    }
    return messages.stream()
        .filter(message -> message != null && message.content() != null)
        .map(
            message ->
                new ConversationMessage(
                    null,
                    ChatRole.from(message.role()),
                    message.content(),
                    null,
                    message.metadata()))
        .toList();
  }
}
