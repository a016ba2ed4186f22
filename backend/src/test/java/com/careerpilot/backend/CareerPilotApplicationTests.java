package com.careerpilot.backend;

import static org.assertj.core.api.Assertions.assertThat;

import com.careerpilot.backend.chat.ratelimit.SlidingWindowRateLimiter;
import com.careerpilot.backend.chat.state.ConversationStateStore;
import com.careerpilot.backend.chat.state.InMemoryConversationStateStore;
import com.careerpilot.backend.chat.supervisor.TurnSupervisor;
import com.careerpilot.backend.support.PostgresTestContainer;
import java.util.concurrent.ExecutorService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.web.reactive.function.client.WebClient;

@SpringBootTest
class CareerPilotApplicationTests extends PostgresTestContainer {

  @Autowired
  @Qualifier("persistenceExecutor")
  private ExecutorService persistenceExecutor;

  @Autowired
  @Qualifier("delegationExecutor")
  private ExecutorService delegationExecutor;

  @Autowired
  @Qualifier("exaWebClient")
  private WebClient exaWebClient;

  @Autowired
  @Qualifier("scraperWebClient")
  private WebClient scraperWebClient;

  @Autowired
  @Qualifier("exaRateLimiter")
  private SlidingWindowRateLimiter exaRateLimiter;

  @Autowired
  @Qualifier("scraperRateLimiter")
  private SlidingWindowRateLimiter scraperRateLimiter;

  @Autowired private ConversationStateStore stateStore;

  @Autowired private TurnSupervisor turnSupervisor;

  @Test
  void contextLoads() {
    assertThat(turnSupervisor).isNotNull();
    assertThat(stateStore).isInstanceOf(InMemoryConversationStateStore.class);
  }

  @Test
  void qualifiedBeansAreDistinct() {
    assertThat(persistenceExecutor).isNotSameAs(delegationExecutor);
    assertThat(persistenceExecutor.isShutdown()).isFalse();
    assertThat(exaWebClient).isNotSameAs(scraperWebClient);
    assertThat(exaRateLimiter).isNotSameAs(scraperRateLimiter);
    assertThat(exaRateLimiter.maxCalls()).isEqualTo(5);
    assertThat(scraperRateLimiter.maxCalls()).isEqualTo(5);
  }
}
