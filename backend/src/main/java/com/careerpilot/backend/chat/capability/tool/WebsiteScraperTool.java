package com.careerpilot.backend.chat.capability.tool;

import com.careerpilot.backend.chat.config.SearchProperties;
import com.careerpilot.backend.chat.ratelimit.SlidingWindowRateLimiter;
import java.net.URI;
import java.util.Locale;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

/** Fetches a public web page and returns its visible text, truncated to a configured length. */
@Component
public class WebsiteScraperTool {

  private static final Logger log = LoggerFactory.getLogger(WebsiteScraperTool.class);

  private static final Pattern SCRIPT_OR_STYLE =
      Pattern.compile("(?is)<(script|style|noscript)[^>]*>.*?</\\1>");
  private static final Pattern TAG = Pattern.compile("(?s)<[^>]+>");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final WebClient webClient;
  private final SlidingWindowRateLimiter rateLimiter;
  private final SearchProperties.Scraper properties;

  public WebsiteScraperTool(
      @Qualifier("scraperWebClient") WebClient webClient,
      @Qualifier("scraperRateLimiter") SlidingWindowRateLimiter rateLimiter,
      SearchProperties searchProperties) {
    this.webClient = webClient;
    this.rateLimiter = rateLimiter;
    this.properties = searchProperties.getScraper();
  }

  @Tool(
      name = "website_scraper",
      description = "Reads a web page (company site, job posting) and returns its text content.")
  public String scrape(@ToolParam(description = "Absolute http(s) URL of the page.") String url) {
    URI uri = parseUri(url);
    rateLimiter.acquire();
    String html;
    try {
      html =
          webClient
              .get()
              .uri(uri)
              .accept(MediaType.TEXT_HTML, MediaType.TEXT_PLAIN)
              .retrieve()
              .bodyToMono(String.class)
              .block(properties.getTimeout());
    } catch (WebClientException exception) {
      log.warn("Failed to scrape {}: {}", uri, exception.getMessage());
      return "Could not read " + uri + ": " + exception.getMessage();
    }
    String text = toText(html);
    return text.isEmpty() ? "The page at " + uri + " has no readable text." : text;
  }

  String toText(String html) {
    if (!StringUtils.hasText(html)) {
      return "";
    }
    String withoutScripts = SCRIPT_OR_STYLE.matcher(html).replaceAll(" ");
    String withoutTags = TAG.matcher(withoutScripts).replaceAll(" ");
    String text =
        WHITESPACE
            .matcher(
                withoutTags
                    .replace("&nbsp;", " ")
                    .replace("&amp;", "&")
                    .replace("&lt;", "<")
                    .replace("&gt;", ">")
                    .replace("&quot;", "\""))
            .replaceAll(" ")
            .strip();
    int limit = Math.max(0, properties.getMaxContentLength());
    return text.length() > limit ? text.substring(0, limit) : text;
  }

  private static URI parseUri(String url) {
    if (!StringUtils.hasText(url)) {
      throw new IllegalArgumentException("url must not be blank");
    }
    URI uri = URI.create(url.trim());
    String scheme = uri.getScheme() != null ? uri.getScheme().toLowerCase(Locale.ROOT) : "";
    if (!scheme.equals("http") && !scheme.equals("https")) {
      throw new IllegalArgumentException("Only http and https URLs are supported: " + url);
    }
    return uri;
  }
}
