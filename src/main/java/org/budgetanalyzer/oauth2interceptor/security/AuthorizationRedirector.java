package org.budgetanalyzer.oauth2interceptor.security;

import java.net.URI;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.security.crypto.keygen.StringKeyGenerator;
import org.springframework.web.server.ServerWebExchange;

import reactor.core.publisher.Mono;

import org.budgetanalyzer.oauth2interceptor.client.AuthorizationServerClient;
import org.budgetanalyzer.oauth2interceptor.model.OAuth2Params;

/**
 * Sends the user agent to the authorization server's authorize endpoint.
 *
 * <p>The CSRF state already held by the session is reused so that several tabs redirected at the
 * same time all complete against the same state. The requested path and query are remembered as
 * the post-login target. Both are written to the session before the redirect is committed.
 */
public class AuthorizationRedirector {

  private static final Logger log = LoggerFactory.getLogger(AuthorizationRedirector.class);

  private final OAuth2Params params;
  private final OAuth2SessionStore sessionStore;
  private final AuthorizationServerClient authorizationServerClient;
  private final StringKeyGenerator stateGenerator;

  public AuthorizationRedirector(
      OAuth2Params params,
      OAuth2SessionStore sessionStore,
      AuthorizationServerClient authorizationServerClient,
      StringKeyGenerator stateGenerator) {
    this.params = params;
    this.sessionStore = sessionStore;
    this.authorizationServerClient = authorizationServerClient;
    this.stateGenerator = stateGenerator;
  }

  /**
   * Answers the exchange with a 302 to the authorization endpoint.
   *
   * @param exchange the current exchange
   * @return completion of the redirect response
   */
  public Mono<Void> redirect(ServerWebExchange exchange) {
    var target = targetOf(exchange.getRequest());

    return sessionStore
        .getState(exchange)
        .switchIfEmpty(Mono.fromSupplier(stateGenerator::generateKey))
        .flatMap(
            state -> {
              var authorizationRequest =
                  authorizationServerClient.buildAuthorizationRequest(params, state);
              return sessionStore
                  .putState(exchange, state)
                  .then(sessionStore.putTarget(exchange, target))
                  .then(
                      Mono.defer(
                          () -> {
                            log.debug("Redirecting {} to authorization endpoint", target);
                            var response = exchange.getResponse();
                            response.setStatusCode(HttpStatus.FOUND);
                            response
                                .getHeaders()
                                .setLocation(URI.create(authorizationRequest.uri()));
                            return response.setComplete();
                          }));
            });
  }

  /**
   * Returns whether the request comes from a browser, that is its {@code Accept} header names
   * {@code text/html}, compared case-insensitively. A wildcard type alone does not count, so API
   * clients that accept anything get status codes instead of login redirects.
   *
   * @param request the current request
   * @return {@code true} for requests that can follow a login redirect
   */
  public static boolean acceptsHtml(ServerHttpRequest request) {
    try {
      return request.getHeaders().getAccept().stream()
          .anyMatch(type -> !type.isWildcardType() && MediaType.TEXT_HTML.isCompatibleWith(type));
    } catch (InvalidMediaTypeException e) {
      log.debug("Ignoring malformed Accept header: {}", e.getMessage());
      return false;
    }
  }

  static String targetOf(ServerHttpRequest request) {
    var uri = request.getURI();
    var path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
    var query = uri.getRawQuery();
    return query == null ? path : path + "?" + query;
  }
}
