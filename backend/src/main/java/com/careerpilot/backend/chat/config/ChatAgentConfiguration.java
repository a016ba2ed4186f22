package com.careerpilot.backend.chat.config;

import com.careerpilot.backend.chat.context.ContextWindowTrimmer;
import com.careerpilot.backend.chat.context.EncodingTokenEstimator;
import com.careerpilot.backend.chat.context.TokenEstimator;
import com.careerpilot.backend.chat.extraction.JobRecordExtractor;
import com.careerpilot.backend.chat.routing.UiRouter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.EncodingRegistry;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({ChatAgentProperties.class, CapabilityProperties.class})
public class ChatAgentConfiguration {

  @Bean
  public ChatClient careerChatClient(ChatClient.Builder chatClientBuilder) {
    return chatClientBuilder.build();
  }

  @Bean
  public EncodingRegistry encodingRegistry() {
    return Encodings.newDefaultEncodingRegistry();
  }

  @Bean
  public TokenEstimator tokenEstimator(
      EncodingRegistry encodingRegistry, ChatAgentProperties properties) {
    return new EncodingTokenEstimator(
        encodingRegistry, properties.getTokenizer(), properties.getMessageOverheadTokens());
  }

  @Bean
  public ContextWindowTrimmer contextWindowTrimmer(TokenEstimator tokenEstimator) {
    return new ContextWindowTrimmer(tokenEstimator);
  }

  @Bean
  public JobRecordExtractor jobRecordExtractor(ObjectMapper objectMapper) {
    return new JobRecordExtractor(objectMapper);
  }

  @Bean
  public UiRouter uiRouter(JobRecordExtractor jobRecordExtractor) {
    return new UiRouter(jobRecordExtractor);
  }

  @Bean(name = "persistenceExecutor", destroyMethod = "shutdown")
  public ExecutorService persistenceExecutor(ChatAgentProperties properties) {
    int concurrency = Math.max(1, properties.getPersistenceConcurrency());
    return Executors.newFixedThreadPool(concurrency, namedDaemonThreads("persistence-writer-"));
  }

  @Bean(name = "delegationExecutor", destroyMethod = "shutdown")
  public ExecutorService delegationExecutor(ChatAgentProperties properties) {
    int concurrency = Math.max(1, properties.getDelegationConcurrency());
    return Executors.newFixedThreadPool(concurrency, namedDaemonThreads("delegation-worker-"));
  }

  private static ThreadFactory namedDaemonThreads(String prefix) {
    return new ThreadFactory() {
      private final AtomicInteger index = new AtomicInteger();

      @Override
      public Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable);
        thread.setName(prefix + index.incrementAndGet());
        thread.setDaemon(true);
        return thread;
      }
    };
  }
}
