package com.careerpilot.backend.chat.config;

import com.careerpilot.backend.chat.ratelimit.SlidingWindowRateLimiter;
import io.netty.channel.ChannelOption;
import java.time.Duration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ClientHttpConnector;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/** Outbound HTTP clients of the search tools and the rate limiters guarding them. */
@Configuration
@EnableConfigurationProperties(SearchProperties.class)
public class SearchClientConfiguration {

  private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

  @Bean
  public SlidingWindowRateLimiter exaRateLimiter(SearchProperties properties) {
    SearchProperties.RateLimit limit = properties.getExa().getRateLimit();
    return new SlidingWindowRateLimiter("exa", limit.getMaxCalls(), limit.getWindow());
  }

  @Bean
  public SlidingWindowRateLimiter scraperRateLimiter(SearchProperties properties) {
    SearchProperties.RateLimit limit = properties.getScraper().getRateLimit();
    return new SlidingWindowRateLimiter("scraper", limit.getMaxCalls(), limit.getWindow());
  }

  @Bean
  public WebClient exaWebClient(SearchProperties properties) {
    SearchProperties.Exa exa = properties.getExa();
    WebClient.Builder builder =
        WebClient.builder()
            .baseUrl(exa.getBaseUrl())
            .defaultHeader(HttpHeaders.ACCEPT, "application/json")
            .defaultHeader(HttpHeaders.CONTENT_TYPE, "application/json")
            .clientConnector(connector(exa.getTimeout()));
    if (StringUtils.hasText(exa.getApiKey())) {
      builder.defaultHeader("x-api-key", exa.getApiKey().trim());
    }
    return builder.build();
  }

  @Bean
  public WebClient scraperWebClient(SearchProperties properties) {
    SearchProperties.Scraper scraper = properties.getScraper();
    int maxInMemory = Math.max(256 * 1024, scraper.getMaxContentLength() * 64);
    return WebClient.builder()
        .defaultHeader(HttpHeaders.USER_AGENT, "CareerPilot/1.0")
        .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(maxInMemory))
        .clientConnector(connector(scraper.getTimeout()))
        .build();
  }

  private static ClientHttpConnector connector(Duration readTimeout) {
    HttpClient client =
        HttpClient.create()
            .responseTimeout(readTimeout != null ? readTimeout : Duration.ofSeconds(30))
            .proxyWithSystemProperties()
            .compress(true)
            .followRedirect(true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) CONNECT_TIMEOUT.toMillis());
    return new ReactorClientHttpConnector(client);
  }
}
