package org.budgetanalyzer.oauth2interceptor.filter;

import java.net.URI;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilterChain;

import reactor.core.publisher.Mono;

import org.budgetanalyzer.oauth2interceptor.client.AuthorizationServerClient;
import org.budgetanalyzer.oauth2interceptor.model.OAuth2Data;
import org.budgetanalyzer.oauth2interceptor.model.OAuth2Params;
import org.budgetanalyzer.oauth2interceptor.security.OAuth2SessionStore;
import org.budgetanalyzer.oauth2interceptor.security.RedirectUrlValidator;

/**
 * Completes the login when the authorization server redirects back to the redirect URI.
 *
 * <p>The authorization response is checked against the state held by the session, the code is
 * exchanged for tokens and the result is stored before the user agent is sent to the target it
 * originally asked for. Failures propagate as errors and leave the session unchanged.
 */
public class AuthorizationCallbackStage implements OAuth2InterceptorStage {

  public static final String NAME = "authorization-callback";

  private static final Logger log = LoggerFactory.getLogger(AuthorizationCallbackStage.class);

  private static final String DEFAULT_TARGET = "/";

  private final OAuth2Params params;
  private final OAuth2SessionStore sessionStore;
  private final AuthorizationServerClient authorizationServerClient;

  public AuthorizationCallbackStage(
      OAuth2Params params,
      OAuth2SessionStore sessionStore,
      AuthorizationServerClient authorizationServerClient) {
    this.params = params;
    this.sessionStore = sessionStore;
    this.authorizationServerClient = authorizationServerClient;
  }

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public boolean matches(ServerWebExchange exchange) {
    return params.getRedirectPath().equals(exchange.getRequest().getPath().value());
  }

  @Override
  public Mono<Void> handle(ServerWebExchange exchange, WebFilterChain next) {
    var callbackParams = exchange.getRequest().getQueryParams();

    return sessionStore
        .getState(exchange)
        .map(Optional::of)
        .defaultIfEmpty(Optional.empty())
        .flatMap(
            storedState ->
                authorizationServerClient.exchangeCodeForToken(
                    params,
                    callbackParams,
                    storedState
                        .map(
                            state ->
                                authorizationServerClient.buildAuthorizationRequest(
                                    params, state))
                        .orElse(null)))
        .flatMap(data -> authorizationServerClient.fetchUserinfo(data, params))
        .flatMap(data -> complete(exchange, data))
        .doOnError(
            e ->
                log.error(
                    "Authorization callback failed: {}: {}",
                    e.getClass().getSimpleName(),
                    e.getMessage()));
  }

  private Mono<Void> complete(ServerWebExchange exchange, OAuth2Data data) {
    return sessionStore
        .rotateSessionId(exchange)
        .then(sessionStore.putOAuth2Data(exchange, data))
        .then(sessionStore.getTarget(exchange))
        .defaultIfEmpty(DEFAULT_TARGET)
        .flatMap(
            target ->
                sessionStore
                    .removeTarget(exchange)
                    .then(
                        Mono.defer(
                            () -> {
                              var location =
                                  RedirectUrlValidator.targetOrDefault(target, DEFAULT_TARGET);
                              log.info("Login completed, redirecting to {}", location);
                              var response = exchange.getResponse();
                              response.setStatusCode(HttpStatus.FOUND);
                              response.getHeaders().setLocation(URI.create(location));
                              return response.setComplete();
                            })));
  }
}
