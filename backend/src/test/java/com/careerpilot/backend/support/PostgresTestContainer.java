package com.careerpilot.backend.support;

import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Base for tests that boot the application against a shared PostgreSQL container. Skipped when no
 * Docker daemon is available.
 */
@Testcontainers(disabledWithoutDocker = true)
public abstract class PostgresTestContainer {

  private static String jdbcUrlWithSslDisabled() {
    String url = SingletonPostgresContainer.getInstance().getJdbcUrl();
    if (url.contains("sslmode=")) {
      return url;
    }
    String separator = url.contains("?") ? "&" : "?";
    return url + separator + "sslmode=disable";
  }

  @DynamicPropertySource
  static void configure(DynamicPropertyRegistry registry) {
    registry.add("spring.datasource.url", PostgresTestContainer::jdbcUrlWithSslDisabled);
    registry.add(
        "spring.datasource.username", () -> SingletonPostgresContainer.getInstance().getUsername());
    registry.add(
        "spring.datasource.password", () -> SingletonPostgresContainer.getInstance().getPassword());
    registry.add("spring.sql.init.mode", () -> "always");
    registry.add("spring.jpa.hibernate.ddl-auto", () -> "validate");
    registry.add("spring.ai.openai.api-key", () -> "test-key");
    registry.add("spring.ai.openai.base-url", () -> "https://example.invalid");
    registry.add("spring.ai.openai.chat.options.model", () -> "gpt-4o-mini");
    registry.add("spring.datasource.hikari.maximum-pool-size", () -> "4");
    registry.add("spring.datasource.hikari.minimum-idle", () -> "1");
  }
}
