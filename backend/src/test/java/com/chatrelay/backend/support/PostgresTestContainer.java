package com.chatrelay.backend.support;

import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

/**
 * Points the datasource and Liquibase at a shared PostgreSQL container. Subclasses carry
 * {@code @Testcontainers(disabledWithoutDocker = true)} so they are skipped without Docker.
 */
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
    registry.add("spring.datasource.hikari.maximum-pool-size", () -> "12");
    registry.add("app.pool.load-on-startup", () -> "false");
  }
}
