package org.budgetanalyzer.oauth2interceptor.filter;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilterChain;

import reactor.core.publisher.Mono;

import org.budgetanalyzer.oauth2interceptor.client.AuthorizationServerClient;
import org.budgetanalyzer.oauth2interceptor.model.OAuth2Data;
import org.budgetanalyzer.oauth2interceptor.model.OAuth2Params;
import org.budgetanalyzer.oauth2interceptor.security.AuthorizationRedirector;

/**
 * Checks the injected access token with the token info endpoint and refreshes it when the
 * authorization server no longer accepts it.
 *
 * <p>There is no local expiry bookkeeping: every request carrying OAuth2 data is introspected.
 * When no token info endpoint is configured the token is trusted as is.
 *
 * <p>A failed refresh ends the exchange. Browsers (an {@code Accept} header containing {@code
 * text/html}) are sent through the login again; every other client gets a 400 with a JSON body
 * it can act on.
 */
public class TokenValidationStage implements OAuth2InterceptorStage {

  public static final String NAME = "token-validation";

  private static final Logger log = LoggerFactory.getLogger(TokenValidationStage.class);

  private final OAuth2Params params;
  private final AuthorizationServerClient authorizationServerClient;
  private final AuthorizationRedirector redirector;
  private final JsonResponseWriter responseWriter;

  public TokenValidationStage(
      OAuth2Params params,
      AuthorizationServerClient authorizationServerClient,
      AuthorizationRedirector redirector,
      JsonResponseWriter responseWriter) {
    this.params = params;
    this.authorizationServerClient = authorizationServerClient;
    this.redirector = redirector;
    this.responseWriter = responseWriter;
  }

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public boolean matches(ServerWebExchange exchange) {
    return OAuth2ExchangeAttributes.getOAuth2Data(exchange) != null;
  }

  @Override
  public Mono<Void> handle(ServerWebExchange exchange, WebFilterChain next) {
    if (params.getTokenInfoUri() == null) {
      return next.filter(exchange);
    }

    var data = OAuth2ExchangeAttributes.getOAuth2Data(exchange);
    var valid =
        data.getAccessToken() == null
            ? Mono.just(false)
            : authorizationServerClient.introspectToken(
                params.getTokenInfoUri(), data.getAccessToken());

    return valid.flatMap(
        isValid -> {
          if (isValid) {
            return next.filter(exchange);
          }
          log.debug("Access token rejected by token info endpoint, refreshing");
          return refresh(exchange, data, next);
        });
  }

  private Mono<Void> refresh(ServerWebExchange exchange, OAuth2Data data, WebFilterChain next) {
    return authorizationServerClient
        .refreshAccessToken(data.getRefreshToken(), params)
        .flatMap(
            result -> {
              if (result.succeeded()) {
                log.info("Access token refreshed");
                var attributes = exchange.getAttributes();
                attributes.put(
                    OAuth2ExchangeAttributes.OAUTH2_DATA, data.withRefreshedTokens(result.body()));
                attributes.put(OAuth2ExchangeAttributes.REFRESHED, Boolean.TRUE);
                return next.filter(exchange);
              }
              log.warn("Access token refresh failed: {}", result.body().get("error"));
              return refreshFailed(exchange);
            });
  }

  private Mono<Void> refreshFailed(ServerWebExchange exchange) {
    if (AuthorizationRedirector.acceptsHtml(exchange.getRequest())) {
      return redirector.redirect(exchange);
    }

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", "Refresh token failed");
    body.put("errorcode", "refresh-token-failed");
    return responseWriter.write(exchange, HttpStatus.BAD_REQUEST, body);
  }
}
