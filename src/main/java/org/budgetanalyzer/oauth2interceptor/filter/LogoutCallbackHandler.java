package org.budgetanalyzer.oauth2interceptor.filter;

import org.springframework.web.server.ServerWebExchange;

import reactor.core.publisher.Mono;

/** Answers the request the authorization server sends the user back with after logout. */
@FunctionalInterface
public interface LogoutCallbackHandler {

  Mono<Void> handle(ServerWebExchange exchange);
}
