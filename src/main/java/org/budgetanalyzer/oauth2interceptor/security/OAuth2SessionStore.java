package org.budgetanalyzer.oauth2interceptor.security;

import org.springframework.web.server.ServerWebExchange;

import reactor.core.publisher.Mono;

import org.budgetanalyzer.oauth2interceptor.model.OAuth2Data;

/**
 * Reads and writes the interceptor's per-user state: the CSRF state of a pending authorization,
 * the target URI to return to after login and the token data of an authenticated user.
 *
 * <p>The pipeline touches the session exclusively through this interface, so the backend can be
 * replaced (a server-side cache keyed by session id, an encrypted cookie) by declaring a
 * different bean. Implementations must only add, replace or remove their own slots and leave
 * every other session entry untouched.
 */
// CHECKSTYLE.SUPPRESS: AbbreviationAsWordInName
public interface OAuth2SessionStore {

  Mono<String> getState(ServerWebExchange exchange);

  Mono<Void> putState(ServerWebExchange exchange, String state);

  Mono<String> getTarget(ServerWebExchange exchange);

  Mono<Void> putTarget(ServerWebExchange exchange, String target);

  /**
   * Removes the stored target so that a later callback cannot reuse it.
   *
   * @param exchange the current exchange
   * @return completion signal
   */
  Mono<Void> removeTarget(ServerWebExchange exchange);

  /**
   * Loads the token data of the current user.
   *
   * @param exchange the current exchange
   * @return the token data, or empty when the user has not authenticated
   */
  Mono<OAuth2Data> getOAuth2Data(ServerWebExchange exchange);

  Mono<Void> putOAuth2Data(ServerWebExchange exchange, OAuth2Data data);

  /**
   * Gives the session a new identifier while keeping its contents. Called once a login
   * completes so that a session id known before authentication cannot be reused after it.
   *
   * @param exchange the current exchange
   * @return completion signal
   */
  Mono<Void> rotateSessionId(ServerWebExchange exchange);

  /**
   * Removes the token data only. State, target and unrelated session entries are preserved.
   *
   * @param exchange the current exchange
   * @return completion signal
   */
  Mono<Void> clearOAuth2Data(ServerWebExchange exchange);
}
