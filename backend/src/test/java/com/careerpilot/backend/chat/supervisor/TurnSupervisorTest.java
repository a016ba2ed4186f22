package com.careerpilot.backend.chat.supervisor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.careerpilot.backend.chat.config.ChatAgentProperties;
import com.careerpilot.backend.chat.context.ContextWindowTrimmer;
import com.careerpilot.backend.chat.domain.ChatRole;
import com.careerpilot.backend.chat.domain.ConversationMessage;
import com.careerpilot.backend.chat.domain.ConversationState;
import com.careerpilot.backend.chat.domain.JobRecord;
import com.careerpilot.backend.chat.domain.ThreadIdentity;
import com.careerpilot.backend.chat.extraction.JobRecordExtractor;
import com.careerpilot.backend.chat.persistence.TurnPersistenceService;
import com.careerpilot.backend.chat.routing.UiRouter;
import com.careerpilot.backend.chat.state.InMemoryConversationStateStore;
import com.careerpilot.backend.profile.service.UserContextProvider;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class TurnSupervisorTest {

  private static final String JOBS_JSON =
      """
      [{"job_title":"Backend Engineer","company":"Acme","location":"Berlin",\
      "match_rating":4,"link":"https://acme.example/jobs/1"}]
      """;

  @Mock private UserContextProvider userContextProvider;
  @Mock private TurnPersistenceService persistenceService;

  private final AtomicReference<DelegationBoundary> boundary = new AtomicReference<>();
  private InMemoryConversationStateStore stateStore;
  private ChatAgentProperties properties;
  private ExecutorService executor;
  private SimpleMeterRegistry meterRegistry;
  private TurnSupervisor supervisor;

  @BeforeEach
  void setUp() {
    when(userContextProvider.fetchUserContext(anyString())).thenReturn("Name: Ada.");
    stateStore =
        new InMemoryConversationStateStore(identity -> List.of(), new ChatAgentProperties());
    properties = new ChatAgentProperties();
    properties.setStepLimit(5);
    properties.setDelegationTimeout(Duration.ofSeconds(5));
    executor = Executors.newFixedThreadPool(2);
    meterRegistry = new SimpleMeterRegistry();
    supervisor =
        new TurnSupervisor(
            new IdentityResolver(),
            stateStore,
            userContextProvider,
            new ContextWindowTrimmer(message -> 1),
            (history, context, budget) -> boundary.get().delegate(history, context, budget),
            new UiRouter(new JobRecordExtractor(new ObjectMapper())),
            persistenceService,
            properties,
            executor,
            meterRegistry);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void annotatesJobsAndPersistsThemBeforeReturning() {
    boundary.set(
        (history, context, budget) -> {
          budget.consumeStep();
          return new DelegationResult(
              "Here is a role that fits you.",
              null,
              List.of(ConversationMessage.tool("job_matcher", JOBS_JSON)),
              false);
        });

    TurnResult result = supervisor.handle(TurnRequest.of("Find me jobs", "user-1", "thread-1"));

    assertThat(result.fallback()).isFalse();
    assertThat(result.message().role()).isEqualTo(ChatRole.ASSISTANT);
    assertThat(result.message().content()).isEqualTo("Here is a role that fits you.");
    assertThat(result.uiPayload()).isNotNull();
    assertThat(result.uiPayload().type()).isEqualTo("jobs_table");
    assertThat(result.uiPayload().correlatedMessageId()).isEqualTo(result.message().id());
    assertThat(result.uiPayload().data().jobs())
        .extracting(JobRecord::company)
        .containsExactly("Acme");

    ThreadIdentity identity = new ThreadIdentity("user-1", "thread-1");
    verify(persistenceService).submitMessage(eq(identity), any(ConversationMessage.class));
    verify(persistenceService).saveJobs(eq("user-1"), anyList());
    verify(persistenceService).submitMessagesAfter(any(), eq(identity), anyList());

    ConversationState state = stateStore.find(identity).orElseThrow();
    assertThat(state.messages())
        .extracting(ConversationMessage::role)
        .containsExactly(ChatRole.USER, ChatRole.TOOL, ChatRole.ASSISTANT);
    assertThat(state.uiPayloads()).hasSize(1);
  }

  @Test
  void answersWithoutPayloadWhenNoJobsAreFound() {
    boundary.set(
        (history, context, budget) ->
            new DelegationResult("Acme builds logistics software.", null, List.of(), false));

    TurnResult result = supervisor.handle(TurnRequest.of("Tell me about Acme", "u", "t"));

    assertThat(result.uiPayload()).isNull();
    verify(persistenceService, never()).saveJobs(anyString(), anyList());
  }

  @Test
  void passesTrimmedHistoryAndUserContextToDelegation() {
    AtomicReference<List<ConversationMessage>> seenHistory = new AtomicReference<>();
    AtomicReference<DelegationContext> seenContext = new AtomicReference<>();
    boundary.set(
        (history, context, budget) -> {
          seenHistory.set(history);
          seenContext.set(context);
          return new DelegationResult("ok", null, List.of(), false);
        });

    supervisor.handle(TurnRequest.of("first", "user-1", "thread-1"));
    supervisor.handle(TurnRequest.of("second", "user-1", "thread-1"));

    assertThat(seenHistory.get())
        .extracting(ConversationMessage::content)
        .containsExactly("first", "ok", "second");
    assertThat(seenContext.get().userContext()).isEqualTo("Name: Ada.");
    assertThat(seenContext.get().userId()).contains("user-1");
  }

  @Test
  void fallsBackWhenDelegationThrows() {
    boundary.set(
        (history, context, budget) -> {
          throw new IllegalStateException("model unavailable");
        });

    TurnResult result = supervisor.handle(TurnRequest.of("hello", "user-1", "thread-1"));

    assertThat(result.fallback()).isTrue();
    assertThat(result.message().content())
        .isEqualTo("I'm sorry, I couldn't complete that request. Please try again.");
    assertThat(result.uiPayload()).isNull();
    assertThat(meterRegistry.counter("chat.turns", "outcome", "fallback").count()).isEqualTo(1.0);
  }

  @Test
  void fallsBackOnBlankOrMissingResult() {
    boundary.set((history, context, budget) -> new DelegationResult("  ", null, List.of(), false));
    assertThat(supervisor.handle(TurnRequest.of("a", "u", "t")).fallback()).isTrue();

    boundary.set((history, context, budget) -> null);
    assertThat(supervisor.handle(TurnRequest.of("b", "u", "t")).fallback()).isTrue();
  }

  @Test
  void endlessDelegationStopsAtStepLimitWithPartialAnswer() {
    AtomicInteger steps = new AtomicInteger();
    boundary.set(
        (history, context, budget) -> {
          while (true) {
            budget.consumeStep();
            steps.incrementAndGet();
            budget.recordPartial("Partial research on Acme");
          }
        });

    TurnResult result = supervisor.handle(TurnRequest.of("research Acme", "u", "t"));

    assertThat(steps.get()).isEqualTo(5);
    assertThat(result.fallback()).isFalse();
    assertThat(result.message().content()).isEqualTo("Partial research on Acme");
    assertThat(meterRegistry.counter("chat.turns", "outcome", "partial").count()).isEqualTo(1.0);
  }

  @Test
  void stoppedDelegationKeepsCapabilityOutputs() {
    boundary.set(
        (history, context, budget) -> {
          budget.consumeStep();
          budget.recordEmitted(ConversationMessage.tool("job_matcher", JOBS_JSON));
          budget.recordPartial("I found one role so far.");
          while (true) {
            budget.consumeStep();
          }
        });

    TurnResult result = supervisor.handle(TurnRequest.of("Find me jobs", "user-1", "thread-1"));

    assertThat(result.fallback()).isFalse();
    assertThat(result.message().content()).isEqualTo("I found one role so far.");
    assertThat(result.uiPayload()).isNotNull();
    assertThat(result.uiPayload().data().jobs())
        .extracting(JobRecord::jobTitle)
        .containsExactly("Backend Engineer");

    ThreadIdentity identity = new ThreadIdentity("user-1", "thread-1");
    assertThat(stateStore.find(identity).orElseThrow().messages())
        .extracting(ConversationMessage::role)
        .containsExactly(ChatRole.USER, ChatRole.TOOL, ChatRole.ASSISTANT);
    @SuppressWarnings("unchecked")
    ArgumentCaptor<List<ConversationMessage>> written = ArgumentCaptor.forClass(List.class);
    verify(persistenceService).submitMessagesAfter(any(), eq(identity), written.capture());
    assertThat(written.getValue())
        .extracting(ConversationMessage::role)
        .containsExactly(ChatRole.TOOL, ChatRole.ASSISTANT);
  }

  @Test
  void turnMessagesAreWrittenAfterTheUserMessage() {
    CompletableFuture<Optional<UUID>> userWrite = new CompletableFuture<>();
    when(persistenceService.submitMessage(any(), any())).thenReturn(userWrite);
    boundary.set((history, context, budget) -> new DelegationResult("ok", null, List.of(), false));

    supervisor.handle(TurnRequest.of("hello", "user-1", "thread-1"));

    verify(persistenceService)
        .submitMessagesAfter(
            same(userWrite), eq(new ThreadIdentity("user-1", "thread-1")), anyList());
  }

  @Test
  void endlessDelegationWithoutPartialAnswerFallsBack() {
    boundary.set(
        (history, context, budget) -> {
          while (true) {
            budget.consumeStep();
          }
        });

    TurnResult result = supervisor.handle(TurnRequest.of("loop", "u", "t"));

    assertThat(result.fallback()).isTrue();
  }

  @Test
  void timesOutSlowDelegation() {
    properties.setDelegationTimeout(Duration.ofMillis(200));
    CountDownLatch never = new CountDownLatch(1);
    boundary.set(
        (history, context, budget) -> {
          try {
            never.await(2, TimeUnit.SECONDS);
          } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
          }
          return new DelegationResult("too late", null, List.of(), false);
        });

    long start = System.nanoTime();
    TurnResult result = supervisor.handle(TurnRequest.of("slow", "u", "t"));

    assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(2));
    assertThat(result.fallback()).isTrue();
  }

  @Test
  void usesSentinelWhenUserContextFails() {
    when(userContextProvider.fetchUserContext("user-1"))
        .thenThrow(new IllegalStateException("db down"));
    AtomicReference<DelegationContext> seen = new AtomicReference<>();
    boundary.set(
        (history, context, budget) -> {
          seen.set(context);
          return new DelegationResult("ok", null, List.of(), false);
        });

    supervisor.handle(TurnRequest.of("hello", "user-1", "thread-1"));

    assertThat(seen.get().userContext()).isEqualTo(UserContextProvider.NO_CONTEXT);
  }

  @Test
  void anonymousTurnSkipsPersistenceAndUserContext() {
    boundary.set(
        (history, context, budget) -> new DelegationResult(JOBS_JSON, null, List.of(), false));

    TurnResult result = supervisor.handle(TurnRequest.of("jobs please", null, null));

    assertThat(result.uiPayload()).isNotNull();
    verifyNoInteractions(persistenceService);
    verify(userContextProvider, never()).fetchUserContext(anyString());
  }

  @Test
  void resolvesIdentityFromInboundMetadata() {
    boundary.set((history, context, budget) -> new DelegationResult("ok", null, List.of(), false));
    ConversationMessage earlier =
        ConversationMessage.user("hi", Map.of("user_id", "user-9", "thread_id", "thread-9"));

    supervisor.handle(new TurnRequest("again", null, null, null, List.of(earlier)));

    ArgumentCaptor<ThreadIdentity> captor = ArgumentCaptor.forClass(ThreadIdentity.class);
    verify(persistenceService).submitMessage(captor.capture(), any(ConversationMessage.class));
    assertThat(captor.getValue()).isEqualTo(new ThreadIdentity("user-9", "thread-9"));
  }

  @Test
  void rejectsBlankMessage() {
    assertThatThrownBy(() -> supervisor.handle(TurnRequest.of("  ", "u", "t")))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
