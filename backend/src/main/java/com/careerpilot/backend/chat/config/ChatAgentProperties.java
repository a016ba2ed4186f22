package com.careerpilot.backend.chat.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

@ConfigurationProperties(prefix = "app.chat.agent")
public class ChatAgentProperties {

  public static final String DEFAULT_FALLBACK_MESSAGE =
      "I'm sorry, I couldn't complete that request. Please try again.";

  /**
   * Token budget of the history view handed to the supervisor on each turn. Older turns are dropped
   * first.
   */
  private int contextMaxTokens = 6000;

  /** Tokenizer used to estimate message sizes; any jtokkit encoding or model name. */
  private String tokenizer = "cl100k_base";

  /** Fixed number of tokens charged per message on top of its content (role markers etc.). */
  private int messageOverheadTokens = 4;

  /**
   * Hard upper bound on supervisor steps (planning calls plus capability calls) in a single turn.
   * Reaching it stops delegation and returns the best partial answer.
   */
  private int stepLimit = 25;

  /** Wall-clock limit for one delegation call. */
  private Duration delegationTimeout = Duration.ofMinutes(2);

  /** Text returned when delegation fails without producing any answer. */
  private String fallbackMessage = DEFAULT_FALLBACK_MESSAGE;

  /** Number of worker threads used for concurrent persistence writes. */
  private int persistenceConcurrency = 4;

  /** Number of worker threads running delegation calls. */
  private int delegationConcurrency = 8;

  /** Upper bound on threads whose conversation is kept in memory. */
  private long stateCacheMaximumSize = 10_000;

  /** Threads idle for longer than this are dropped from memory and reloaded on their next turn. */
  private Duration stateIdleTimeout = Duration.ofHours(2);

  private String supervisorPrompt =
      """
      You are a supervisor for a job-search assistant. Given the conversation and the user context \
      you decide which specialised agent should work next, one agent at a time:
      - researcher: researches a company
      - tailor: tailors the user's resume to a job description
      - job_matcher: finds the most relevant jobs for the user
      Answer the user directly once the agents have produced what the user asked for.
      """;

  public int getContextMaxTokens() {
    return contextMaxTokens;
  }

  public void setContextMaxTokens(int contextMaxTokens) {
    this.contextMaxTokens = contextMaxTokens;
  }

  public String getTokenizer() {
    return tokenizer;
  }

  public void setTokenizer(String tokenizer) {
    this.tokenizer = tokenizer;
  }

  public int getMessageOverheadTokens() {
    return messageOverheadTokens;
  }

  public void setMessageOverheadTokens(int messageOverheadTokens) {
    this.messageOverheadTokens = messageOverheadTokens;
  }

  public int getStepLimit() {
    return stepLimit;
  }

  public void setStepLimit(int stepLimit) {
    this.stepLimit = stepLimit;
  }

  public Duration getDelegationTimeout() {
    return delegationTimeout;
  }

  public void setDelegationTimeout(Duration delegationTimeout) {
    this.delegationTimeout = delegationTimeout;
  }

  public String getFallbackMessage() {
    return fallbackMessage;
  }

  public void setFallbackMessage(String fallbackMessage) {
    if (StringUtils.hasText(fallbackMessage)) {
      this.fallbackMessage = fallbackMessage;
    }
  }

  public int getPersistenceConcurrency() {
    return persistenceConcurrency;
  }

  public void setPersistenceConcurrency(int persistenceConcurrency) {
    this.persistenceConcurrency = persistenceConcurrency;
  }

  public int getDelegationConcurrency() {
    return delegationConcurrency;
  }

  public void setDelegationConcurrency(int delegationConcurrency) {
    this.delegationConcurrency = delegationConcurrency;
  }

  public long getStateCacheMaximumSize() {
    return stateCacheMaximumSize;
  }

  public void setStateCacheMaximumSize(long stateCacheMaximumSize) {
    this.stateCacheMaximumSize = stateCacheMaximumSize;
  }

  public Duration getStateIdleTimeout() {
    return stateIdleTimeout;
  }

  public void setStateIdleTimeout(Duration stateIdleTimeout) {
    this.stateIdleTimeout = stateIdleTimeout;
  }

  public String getSupervisorPrompt() {
    return supervisorPrompt;
  }

  public void setSupervisorPrompt(String supervisorPrompt) {
    if (StringUtils.hasText(supervisorPrompt)) {
      this.supervisorPrompt = supervisorPrompt;
    }
  }
}
