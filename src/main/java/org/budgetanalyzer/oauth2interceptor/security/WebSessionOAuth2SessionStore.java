package org.budgetanalyzer.oauth2interceptor.security;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebSession;

import reactor.core.publisher.Mono;

import org.budgetanalyzer.oauth2interceptor.model.OAuth2Data;

/**
 * {@link OAuth2SessionStore} backed by the exchange's {@link WebSession}.
 *
 * <p>Uses three session attributes:
 *
 * <ul>
 *   <li>{@value #STATE_KEY}: CSRF state of the pending authorization request
 *   <li>{@value #TARGET_KEY}: path and query the user asked for before being sent to login
 *   <li>{@value #OAUTH2_KEY}: token data as a plain map
 * </ul>
 *
 * <p>Token data is written as nested {@link LinkedHashMap}s and {@link ArrayList}s only, so the
 * Redis session serializer can round-trip it without type information for JDK wrapper classes.
 */
// CHECKSTYLE.SUPPRESS: AbbreviationAsWordInName
public class WebSessionOAuth2SessionStore implements OAuth2SessionStore {

  private static final Logger log = LoggerFactory.getLogger(WebSessionOAuth2SessionStore.class);

  public static final String STATE_KEY = "state";
  public static final String TARGET_KEY = "target";
  public static final String OAUTH2_KEY = "oauth2";

  @Override
  public Mono<String> getState(ServerWebExchange exchange) {
    return exchange.getSession().mapNotNull(session -> stringAttribute(session, STATE_KEY));
  }

  @Override
  public Mono<Void> putState(ServerWebExchange exchange, String state) {
    return exchange
        .getSession()
        .doOnNext(session -> session.getAttributes().put(STATE_KEY, state))
        .then();
  }

  @Override
  public Mono<String> getTarget(ServerWebExchange exchange) {
    return exchange.getSession().mapNotNull(session -> stringAttribute(session, TARGET_KEY));
  }

  @Override
  public Mono<Void> putTarget(ServerWebExchange exchange, String target) {
    return exchange
        .getSession()
        .doOnNext(
            session -> {
              log.debug("Saving login target to session: {}", target);
              session.getAttributes().put(TARGET_KEY, target);
            })
        .then();
  }

  @Override
  public Mono<Void> removeTarget(ServerWebExchange exchange) {
    return exchange
        .getSession()
        .doOnNext(session -> session.getAttributes().remove(TARGET_KEY))
        .then();
  }

  @Override
  public Mono<OAuth2Data> getOAuth2Data(ServerWebExchange exchange) {
    return exchange
        .getSession()
        .mapNotNull(
            session -> {
              Object value = session.getAttributes().get(OAUTH2_KEY);
              if (value == null) {
                return null;
              }
              if (value instanceof OAuth2Data data) {
                return data;
              }
              if (value instanceof Map<?, ?> map) {
                return OAuth2Data.of(stringKeyed(map));
              }
              log.warn(
                  "Ignoring session attribute '{}' of unexpected type {}",
                  OAUTH2_KEY,
                  value.getClass().getName());
              return null;
            });
  }

  @Override
  public Mono<Void> putOAuth2Data(ServerWebExchange exchange, OAuth2Data data) {
    return exchange
        .getSession()
        .doOnNext(session -> session.getAttributes().put(OAUTH2_KEY, sessionCopy(data.asMap())))
        .then();
  }

  @Override
  public Mono<Void> rotateSessionId(ServerWebExchange exchange) {
    return exchange
        .getSession()
        .flatMap(WebSession::changeSessionId)
        .doOnSuccess(done -> log.debug("Rotated session id after login"));
  }

  @Override
  public Mono<Void> clearOAuth2Data(ServerWebExchange exchange) {
    return exchange
        .getSession()
        .doOnNext(
            session -> {
              if (session.getAttributes().remove(OAUTH2_KEY) != null) {
                log.debug("Cleared OAuth2 data from session: {}", session.getId());
              }
            })
        .then();
  }

  private static String stringAttribute(WebSession session, String key) {
    Object value = session.getAttributes().get(key);
    return value != null ? value.toString() : null;
  }

  private static Map<String, Object> stringKeyed(Map<?, ?> map) {
    Map<String, Object> result = new LinkedHashMap<>();
    map.forEach((key, value) -> result.put(String.valueOf(key), value));
    return result;
  }

  private static Map<String, Object> sessionCopy(Map<?, ?> source) {
    Map<String, Object> copy = new LinkedHashMap<>();
    source.forEach((key, value) -> copy.put(String.valueOf(key), sessionValue(value)));
    return copy;
  }

  private static Object sessionValue(Object value) {
    if (value instanceof Map<?, ?> map) {
      return sessionCopy(map);
    }
    if (value instanceof List<?> list) {
      List<Object> copy = new ArrayList<>(list.size());
      list.forEach(element -> copy.add(sessionValue(element)));
      return copy;
    }
    return value;
  }
}
