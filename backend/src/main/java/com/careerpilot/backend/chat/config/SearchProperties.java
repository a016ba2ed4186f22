package com.careerpilot.backend.chat.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.search")
public class SearchProperties {

  private Exa exa = new Exa();
  private Scraper scraper = new Scraper();

  public Exa getExa() {
    return exa;
  }

  public void setExa(Exa exa) {
    this.exa = exa;
  }

  public Scraper getScraper() {
    return scraper;
  }

  public void setScraper(Scraper scraper) {
    this.scraper = scraper;
  }

  public static class Exa {

    private String baseUrl = "https://api.exa.ai";

    private String apiKey;

    /** Number of results requested per search, highlights included. */
    private int numResults = 3;

    private Duration timeout = Duration.ofSeconds(20);

    private RateLimit rateLimit = new RateLimit();

    private Retry retry = new Retry();

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public String getApiKey() {
      return apiKey;
    }

    public void setApiKey(String apiKey) {
      this.apiKey = apiKey;
    }

    public int getNumResults() {
      return numResults;
    }

    public void setNumResults(int numResults) {
      this.numResults = numResults;
    }

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(Duration timeout) {
      this.timeout = timeout;
    }

    public RateLimit getRateLimit() {
      return rateLimit;
    }

    public void setRateLimit(RateLimit rateLimit) {
      this.rateLimit = rateLimit;
    }

    public Retry getRetry() {
      return retry;
    }

    public void setRetry(Retry retry) {
      this.retry = retry;
    }
  }

  public static class Scraper {

    /** Characters of page text handed back to the model. */
    private int maxContentLength = 8000;

    private Duration timeout = Duration.ofSeconds(20);

    private RateLimit rateLimit = new RateLimit();

    public int getMaxContentLength() {
      return maxContentLength;
    }

    public void setMaxContentLength(int maxContentLength) {
      this.maxContentLength = maxContentLength;
    }

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(Duration timeout) {
      this.timeout = timeout;
    }

    public RateLimit getRateLimit() {
      return rateLimit;
    }

    public void setRateLimit(RateLimit rateLimit) {
      this.rateLimit = rateLimit;
    }
  }

  public static class RateLimit {

    /** Calls allowed per window. */
    private int maxCalls = 5;

    private Duration window = Duration.ofSeconds(1);

    public int getMaxCalls() {
      return maxCalls;
    }

    public void setMaxCalls(int maxCalls) {
      this.maxCalls = maxCalls;
    }

    public Duration getWindow() {
      return window;
    }

    public void setWindow(Duration window) {
      this.window = window;
    }
  }

  public static class Retry {

    private int attempts = 3;

    private Duration initialDelay = Duration.ofMillis(250);

    private Double multiplier = 2.0;

    private List<Integer> retryableStatuses = List.of(429, 500, 502, 503, 504);

    public int getAttempts() {
      return attempts;
    }

    public void setAttempts(int attempts) {
      this.attempts = attempts;
    }

    public Duration getInitialDelay() {
      return initialDelay;
    }

    public void setInitialDelay(Duration initialDelay) {
      this.initialDelay = initialDelay;
    }

    public Double getMultiplier() {
      return multiplier;
    }

    public void setMultiplier(Double multiplier) {
      this.multiplier = multiplier;
    }

    public List<Integer> getRetryableStatuses() {
      return retryableStatuses;
    }

    public void setRetryableStatuses(List<Integer> retryableStatuses) {
      this.retryableStatuses = retryableStatuses;
    }
  }
}
