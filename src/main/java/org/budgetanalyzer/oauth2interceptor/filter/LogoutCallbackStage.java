package org.budgetanalyzer.oauth2interceptor.filter;

import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilterChain;

import reactor.core.publisher.Mono;

import org.budgetanalyzer.oauth2interceptor.model.OAuth2Params;

public class LogoutCallbackStage implements OAuth2InterceptorStage {

  public static final String NAME = "logout-callback";

  private final OAuth2Params params;
  private final LogoutCallbackHandler handler;

  public LogoutCallbackStage(OAuth2Params params, LogoutCallbackHandler handler) {
    this.params = params;
    this.handler = handler;
  }

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public boolean matches(ServerWebExchange exchange) {
    return params.getLogoutCallbackUri() != null
        && params.getLogoutCallbackUri().equals(exchange.getRequest().getPath().value());
  }

  @Override
  public Mono<Void> handle(ServerWebExchange exchange, WebFilterChain next) {
    return handler.handle(exchange);
  }
}
