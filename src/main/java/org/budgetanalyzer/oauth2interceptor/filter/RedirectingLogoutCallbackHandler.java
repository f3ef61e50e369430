package org.budgetanalyzer.oauth2interceptor.filter;

import java.net.URI;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ServerWebExchange;

import reactor.core.publisher.Mono;

import org.budgetanalyzer.oauth2interceptor.security.OAuth2SessionStore;

/**
 * Drops the session's OAuth2 data and redirects to a fixed location. Other session attributes
 * are kept.
 */
public class RedirectingLogoutCallbackHandler implements LogoutCallbackHandler {

  private static final Logger log = LoggerFactory.getLogger(RedirectingLogoutCallbackHandler.class);

  private final OAuth2SessionStore sessionStore;
  private final String location;

  public RedirectingLogoutCallbackHandler(OAuth2SessionStore sessionStore, String location) {
    this.sessionStore = sessionStore;
    this.location = location;
  }

  @Override
  public Mono<Void> handle(ServerWebExchange exchange) {
    return sessionStore
        .clearOAuth2Data(exchange)
        .then(
            Mono.defer(
                () -> {
                  log.info("Logout completed, redirecting to {}", location);
                  var response = exchange.getResponse();
                  response.setStatusCode(HttpStatus.FOUND);
                  response.getHeaders().setLocation(URI.create(location));
                  return response.setComplete();
                }));
  }
}
