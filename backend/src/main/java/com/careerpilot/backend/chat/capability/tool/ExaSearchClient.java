package com.careerpilot.backend.chat.capability.tool;

import com.careerpilot.backend.chat.config.SearchProperties;
import com.careerpilot.backend.chat.ratelimit.SlidingWindowRateLimiter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.retry.support.RetryTemplateBuilder;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Client of the Exa search API. Every HTTP attempt, retries included, first takes a slot from the
 * shared Exa rate limiter.
 */
@Component
public class ExaSearchClient {

  private static final Logger log = LoggerFactory.getLogger(ExaSearchClient.class);
  private static final long MAX_BACKOFF_MS = 5_000L;

  private final WebClient webClient;
  private final ObjectMapper objectMapper;
  private final SlidingWindowRateLimiter rateLimiter;
  private final SearchProperties.Exa properties;
  private final RetryTemplate retryTemplate;

  public ExaSearchClient(
      @Qualifier("exaWebClient") WebClient webClient,
      ObjectMapper objectMapper,
      @Qualifier("exaRateLimiter") SlidingWindowRateLimiter rateLimiter,
      SearchProperties searchProperties) {
    this.webClient = webClient;
    this.objectMapper = objectMapper;
    this.rateLimiter = rateLimiter;
    this.properties = searchProperties.getExa();
    this.retryTemplate = buildRetryTemplate(properties.getRetry());
  }

  public List<ExaSearchResult> search(String query) {
    if (!StringUtils.hasText(query)) {
      throw new IllegalArgumentException("Search query must not be blank");
    }
    ObjectNode body = objectMapper.createObjectNode();
    body.put("query", query.trim());
    body.put("numResults", properties.getNumResults());
    body.putObject("contents").put("highlights", true);

    JsonNode response =
        retryTemplate.execute(
            context -> {
              if (context.getRetryCount() > 0) {
                log.debug("Retrying Exa search (attempt {})", context.getRetryCount() + 1);
              }
              rateLimiter.acquire();
              return webClient
                  .post()
                  .uri("/search")
                  .contentType(MediaType.APPLICATION_JSON)
                  .bodyValue(body)
                  .retrieve()
                  .bodyToMono(JsonNode.class)
                  .block(properties.getTimeout());
            });
    return toResults(response);
  }

  private List<ExaSearchResult> toResults(JsonNode response) {
    if (response == null || !response.path("results").isArray()) {
      return List.of();
    }
    List<ExaSearchResult> results = new ArrayList<>();
    for (JsonNode item : response.path("results")) {
      List<String> highlights = new ArrayList<>();
      for (JsonNode highlight : item.path("highlights")) {
        if (highlight.isTextual()) {
          highlights.add(highlight.asText());
        }
      }
      results.add(
          new ExaSearchResult(
              item.path("title").asText(null), item.path("url").asText(null), highlights));
    }
    return results;
  }

  private RetryTemplate buildRetryTemplate(SearchProperties.Retry retryConfig) {
    int attempts = Math.max(1, retryConfig.getAttempts());
    long initialInterval =
        retryConfig.getInitialDelay() != null
            ? Math.max(1L, retryConfig.getInitialDelay().toMillis())
            : 250L;
    Double configuredMultiplier = retryConfig.getMultiplier();
    boolean useExponential = configuredMultiplier != null && configuredMultiplier > 1.0;

    Set<Integer> retryableStatuses =
        retryConfig.getRetryableStatuses() != null
            ? Set.copyOf(retryConfig.getRetryableStatuses())
            : Set.of(429, 500, 502, 503, 504);

    RetryTemplateBuilder builder = RetryTemplate.builder().maxAttempts(attempts);
    if (useExponential) {
      builder = builder.exponentialBackoff(initialInterval, configuredMultiplier, MAX_BACKOFF_MS);
    } else {
      builder = builder.fixedBackoff(initialInterval);
    }
    return builder.retryOn(throwable -> isRetryable(throwable, retryableStatuses)).build();
  }

  private boolean isRetryable(Throwable throwable, Set<Integer> retryableStatuses) {
    if (throwable instanceof WebClientRequestException) {
      return true;
    }
    if (throwable instanceof WebClientResponseException responseException) {
      return retryableStatuses.contains(responseException.getStatusCode().value());
    }
    return false;
  }
}
