package com.careerpilot.backend.chat.supervisor;

import com.careerpilot.backend.chat.config.ChatAgentProperties;
import com.careerpilot.backend.chat.context.ContextWindowTrimmer;
import com.careerpilot.backend.chat.domain.ConversationMessage;
import com.careerpilot.backend.chat.domain.ConversationState;
import com.careerpilot.backend.chat.domain.ThreadIdentity;
import com.careerpilot.backend.chat.domain.UiPayload;
import com.careerpilot.backend.chat.persistence.TurnPersistenceService;
import com.careerpilot.backend.chat.routing.RoutingOutcome;
import com.careerpilot.backend.chat.routing.UiRouter;
import com.careerpilot.backend.chat.state.ConversationStateStore;
import com.careerpilot.backend.profile.service.UserContextProvider;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Runs one conversation turn: RECEIVE, LOAD_CONTEXT, INVOKE, ROUTE, optionally ANNOTATE, END.
 *
 * <p>Every turn ends with an assistant message. Delegation failures, malformed results and
 * timeouts are replaced by the configured fallback text; a delegation stopped by its step budget
 * answers with the best partial text it produced and keeps the capability outputs gathered so far.
 * Persistence problems are logged and never change the answer. Extracted jobs are written before
 * the turn returns; message writes are not awaited but land in turn order.
 */
@Service
public class TurnSupervisor {

  private static final Logger log = LoggerFactory.getLogger(TurnSupervisor.class);

  private final IdentityResolver identityResolver;
  private final ConversationStateStore stateStore;
  private final UserContextProvider userContextProvider;
  private final ContextWindowTrimmer trimmer;
  private final DelegationBoundary delegationBoundary;
  private final UiRouter uiRouter;
  private final TurnPersistenceService persistenceService;
  private final ChatAgentProperties properties;
  private final ExecutorService delegationExecutor;
  private final MeterRegistry meterRegistry;

  public TurnSupervisor(
      IdentityResolver identityResolver,
      ConversationStateStore stateStore,
      UserContextProvider userContextProvider,
      ContextWindowTrimmer trimmer,
      DelegationBoundary delegationBoundary,
      UiRouter uiRouter,
      TurnPersistenceService persistenceService,
      ChatAgentProperties properties,
      @Qualifier("delegationExecutor") ExecutorService delegationExecutor,
      MeterRegistry meterRegistry) {
    this.identityResolver = identityResolver;
    this.stateStore = stateStore;
    this.userContextProvider = userContextProvider;
    this.trimmer = trimmer;
    this.delegationBoundary = delegationBoundary;
    this.uiRouter = uiRouter;
    this.persistenceService = persistenceService;
    this.properties = properties;
    this.delegationExecutor = delegationExecutor;
    this.meterRegistry = meterRegistry;
  }

  public TurnResult handle(TurnRequest request) {
    UUID turnId = UUID.randomUUID();

    transition(turnId, SupervisorState.RECEIVE);
    if (request == null || !StringUtils.hasText(request.message())) {
      throw new IllegalArgumentException("Turn message must not be blank");
    }
    ConversationMessage userMessage =
        ConversationMessage.user(request.message().trim(), request.metadata());

    transition(turnId, SupervisorState.LOAD_CONTEXT);
    Optional<ThreadIdentity> identity =
        identityResolver.resolve(request.userId(), request.threadId(), request.inboundMessages());
    if (identity.isEmpty()) {
      log.warn("Turn {} has no user/thread identity; persistence is skipped", turnId);
    }
    ConversationState state =
        identity.map(stateStore::getOrCreate).orElseGet(ConversationState::anonymous);
    seedFromClient(state, request.inboundMessages());
    state.append(userMessage);
    CompletableFuture<?> userWrite =
        identity.map(owner -> persistenceService.submitMessage(owner, userMessage)).orElse(null);
    String userContext = loadUserContext(turnId, identity);

    transition(turnId, SupervisorState.INVOKE);
    List<ConversationMessage> history =
        trimmer.trim(state.messages(), properties.getContextMaxTokens());
    DelegationOutcome outcome =
        invoke(turnId, history, new DelegationContext(identity.orElse(null), userContext));

    ConversationMessage assistantMessage = ConversationMessage.assistant(outcome.text());
    List<ConversationMessage> turnMessages = new ArrayList<>(outcome.result().emittedMessages());
    turnMessages.add(assistantMessage);
    state.appendAll(turnMessages);

    transition(turnId, SupervisorState.ROUTE);
    RoutingOutcome routing =
        outcome.fallback()
            ? RoutingOutcome.terminate()
            : uiRouter.route(turnMessages, outcome.result().asCapabilityResult());

    UiPayload payload = null;
    if (routing.shouldAnnotate()) {
      transition(turnId, SupervisorState.ANNOTATE);
      payload = UiPayload.jobsTable(routing.jobs(), assistantMessage.id());
      state.attach(payload);
      identity.ifPresent(owner -> persistenceService.saveJobs(owner.userId(), routing.jobs()));
    }

    identity.ifPresent(
        owner -> persistenceService.submitMessagesAfter(userWrite, owner, turnMessages));
    transition(turnId, SupervisorState.END);
    meterRegistry.counter("chat.turns", "outcome", outcome.label()).increment();
    return new TurnResult(assistantMessage, payload, outcome.fallback());
  }

  private void seedFromClient(ConversationState state, List<ConversationMessage> inbound) {
    if (!inbound.isEmpty() && state.messages().isEmpty()) {
      state.appendAll(inbound);
    }
  }

  private String loadUserContext(UUID turnId, Optional<ThreadIdentity> identity) {
    if (identity.isEmpty()) {
      return UserContextProvider.NO_CONTEXT;
    }
    try {
      String context = userContextProvider.fetchUserContext(identity.get().userId());
      return StringUtils.hasText(context) ? context : UserContextProvider.NO_CONTEXT;
    } catch (RuntimeException ex) {
      log.warn("Turn {} could not load user context: {}", turnId, ex.getMessage());
      return UserContextProvider.NO_CONTEXT;
    }
  }

  private DelegationOutcome invoke(
      UUID turnId, List<ConversationMessage> history, DelegationContext context) {
    DelegationBudget budget = new DelegationBudget(properties.getStepLimit());
    Duration timeout = properties.getDelegationTimeout();
    CompletableFuture<DelegationResult> future;
    try {
      future =
          CompletableFuture.supplyAsync(
              () -> delegationBoundary.delegate(history, context, budget), delegationExecutor);
    } catch (RuntimeException rejected) {
      log.warn("Turn {} could not schedule delegation: {}", turnId, rejected.getMessage());
      return fallback();
    }

    try {
      DelegationResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (result == null || !result.hasText()) {
        log.warn("Turn {} delegation returned no text", turnId);
        return fallback();
      }
      return new DelegationOutcome(result, false);
    } catch (TimeoutException ex) {
      budget.cancel();
      future.cancel(true);
      log.warn("Turn {} delegation timed out after {}", turnId, timeout);
      return partialOrFallback(budget.partialText(), budget.emittedMessages());
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
      if (cause instanceof DelegationBudgetExceededException exceeded) {
        log.warn("Turn {} stopped delegation: {}", turnId, exceeded.getMessage());
        return partialOrFallback(exceeded.getPartialText(), exceeded.getEmittedMessages());
      }
      log.warn("Turn {} delegation failed: {}", turnId, cause.getMessage(), cause);
      return fallback();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      budget.cancel();
      future.cancel(true);
      log.warn("Turn {} interrupted while waiting for delegation", turnId);
      return fallback();
    }
  }

  private DelegationOutcome partialOrFallback(
      String partialText, List<ConversationMessage> emittedMessages) {
    if (!StringUtils.hasText(partialText)) {
      return fallback();
    }
    return new DelegationOutcome(DelegationResult.exhausted(partialText, emittedMessages), false);
  }

  private DelegationOutcome fallback() {
    return new DelegationOutcome(
        new DelegationResult(properties.getFallbackMessage(), null, List.of(), false), true);
  }

  private void transition(UUID turnId, SupervisorState state) {
    log.debug("Turn {} -> {}", turnId, state);
  }

  private record DelegationOutcome(DelegationResult result, boolean fallback) {

    String text() {
      return result.text();
    }

    String label() {
      if (fallback) {
        return "fallback";
      }
      return result.budgetExhausted() ? "partial" : "completed";
    }
  }
}
