package org.budgetanalyzer.oauth2interceptor.filter;

import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilterChain;

import reactor.core.publisher.Mono;

import org.budgetanalyzer.oauth2interceptor.security.AuthorizationRedirector;

/**
 * Starts the login for browser requests that reach it without OAuth2 data. Other clients fall
 * through to the downstream handler, which answers them on its own terms (401 from {@code /user}).
 */
public class RedirectUnauthenticatedStage implements OAuth2InterceptorStage {

  public static final String NAME = "redirect-unauthenticated";

  private final AuthorizationRedirector redirector;

  public RedirectUnauthenticatedStage(AuthorizationRedirector redirector) {
    this.redirector = redirector;
  }

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public boolean matches(ServerWebExchange exchange) {
    return OAuth2ExchangeAttributes.getOAuth2Data(exchange) == null
        && AuthorizationRedirector.acceptsHtml(exchange.getRequest());
  }

  @Override
  public Mono<Void> handle(ServerWebExchange exchange, WebFilterChain next) {
    return redirector.redirect(exchange);
  }
}
