package org.budgetanalyzer.oauth2interceptor.config;

import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.session.ReactiveMapSessionRepository;
import org.springframework.session.config.annotation.web.server.EnableSpringWebSession;
import org.springframework.session.data.redis.config.annotation.web.server.EnableRedisWebSession;
import org.springframework.web.server.session.CookieWebSessionIdResolver;
import org.springframework.web.server.session.WebSessionIdResolver;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectMapper.DefaultTyping;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Session management configuration.
 *
 * <p>Sessions live in Redis unless {@code oauth2.interceptor.session.redis-enabled} is {@code
 * false}, in which case an in-memory repository is used. Either way the session cookie is
 * HttpOnly with SameSite=Lax so the authorization server's redirect back still carries it.
 */
@Configuration
public class SessionConfig {

  private static final Logger log = LoggerFactory.getLogger(SessionConfig.class);

  /**
   * Configures the session cookie.
   *
   * @param properties interceptor settings
   * @return session ID resolver
   */
  @Bean
  public WebSessionIdResolver webSessionIdResolver(OAuth2InterceptorProperties properties) {
    var session = properties.getSession();
    var resolver = new CookieWebSessionIdResolver();

    resolver.setCookieName(session.getCookieName());
    resolver.addCookieInitializer(
        builder -> {
          builder.httpOnly(true);
          builder.secure(session.isSecureCookie());
          builder.sameSite("Lax");
          builder.path("/");
          builder.maxAge(-1);
        });

    return resolver;
  }

  /** Redis-backed sessions, 30 minutes idle timeout. */
  @Configuration
  @ConditionalOnProperty(
      name = "oauth2.interceptor.session.redis-enabled",
      havingValue = "true",
      matchIfMissing = true)
  @EnableRedisWebSession(maxInactiveIntervalInSeconds = 1800)
  static class RedisSessionConfig {

    /**
     * Configures the Redis serializer for session attributes.
     *
     * <p>OAuth2 data is stored as nested maps and lists; default typing keeps their concrete
     * collection types across a round trip.
     *
     * @return Redis serializer
     */
    @Bean
    public RedisSerializer<Object> springSessionDefaultRedisSerializer() {
      var mapper = new ObjectMapper();
      mapper.registerModule(new JavaTimeModule());
      mapper.activateDefaultTyping(
          mapper.getPolymorphicTypeValidator(), DefaultTyping.NON_FINAL, JsonTypeInfo.As.PROPERTY);

      log.info("Using Redis-backed web sessions");
      return new GenericJackson2JsonRedisSerializer(mapper);
    }
  }

  /** In-memory sessions for single-instance deployments and tests. */
  @Configuration
  @ConditionalOnProperty(name = "oauth2.interceptor.session.redis-enabled", havingValue = "false")
  @EnableSpringWebSession
  static class InMemorySessionConfig {

    @Bean
    public ReactiveMapSessionRepository reactiveSessionRepository() {
      log.info("Using in-memory web sessions");
      return new ReactiveMapSessionRepository(new ConcurrentHashMap<>());
    }
  }
}
