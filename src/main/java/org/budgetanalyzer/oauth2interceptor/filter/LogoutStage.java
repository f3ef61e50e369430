package org.budgetanalyzer.oauth2interceptor.filter;

import java.net.URI;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilterChain;

import reactor.core.publisher.Mono;

import org.budgetanalyzer.oauth2interceptor.model.OAuth2Params;

/**
 * Sends the user agent to the authorization server's logout endpoint.
 *
 * <p>The session is left alone here; local token data is dropped by the logout callback once the
 * authorization server has ended its own session.
 */
public class LogoutStage implements OAuth2InterceptorStage {

  public static final String NAME = "logout";

  private static final Logger log = LoggerFactory.getLogger(LogoutStage.class);

  private final OAuth2Params params;

  public LogoutStage(OAuth2Params params) {
    this.params = params;
  }

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public boolean matches(ServerWebExchange exchange) {
    return params.getLogoutUriClient() != null
        && params.getLogoutUriClient().equals(exchange.getRequest().getPath().value());
  }

  @Override
  public Mono<Void> handle(ServerWebExchange exchange, WebFilterChain next) {
    log.info("Logout requested, redirecting to authorization server");
    var response = exchange.getResponse();
    response.setStatusCode(HttpStatus.FOUND);
    response.getHeaders().setLocation(URI.create(params.getLogoutUri()));
    return response.setComplete();
  }
}
