package org.budgetanalyzer.oauth2interceptor;

import org.junit.jupiter.api.Test;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.TestPropertySource;
import org.testcontainers.junit.jupiter.Testcontainers;

import org.budgetanalyzer.oauth2interceptor.base.AbstractIntegrationTest;
import org.budgetanalyzer.oauth2interceptor.config.TestContainersConfig;

/** Runs the login flow with sessions persisted in a Redis container. */
@Testcontainers(disabledWithoutDocker = true)
@Import(TestContainersConfig.class)
@TestPropertySource(
    properties = {
      "oauth2.interceptor.session.redis-enabled=true",
      "management.health.redis.enabled=true"
    })
class RedisSessionIntegrationTests extends AbstractIntegrationTest {

  @Test
  void sessionSurvivesRoundTripThroughRedis() {
    String session = login("/reports", "sesame");
    stubValidToken("sesame");

    webTestClient
        .get()
        .uri("/user")
        .cookie(SESSION_COOKIE, session)
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$.name")
        .isEqualTo("Test User");
  }

  @Test
  void healthIncludesRedis() {
    webTestClient
        .get()
        .uri("/actuator/health")
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$.status")
        .isEqualTo("UP");
  }
}
