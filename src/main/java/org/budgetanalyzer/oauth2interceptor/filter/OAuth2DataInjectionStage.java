package org.budgetanalyzer.oauth2interceptor.filter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilterChain;

import reactor.core.publisher.Mono;

import org.budgetanalyzer.oauth2interceptor.security.OAuth2SessionStore;

/**
 * Exposes the session's OAuth2 data as the {@link OAuth2ExchangeAttributes#OAUTH2_DATA} exchange
 * attribute and persists it again when an inner stage replaced it.
 *
 * <p>The write-back happens before the downstream handler runs: a session changed after the
 * response was committed is not reliably saved.
 */
// CHECKSTYLE.SUPPRESS: AbbreviationAsWordInName
public class OAuth2DataInjectionStage implements OAuth2InterceptorStage {

  public static final String NAME = "oauth2-data-injection";

  private static final Logger log = LoggerFactory.getLogger(OAuth2DataInjectionStage.class);

  private final OAuth2SessionStore sessionStore;

  public OAuth2DataInjectionStage(OAuth2SessionStore sessionStore) {
    this.sessionStore = sessionStore;
  }

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public boolean matches(ServerWebExchange exchange) {
    return true;
  }

  @Override
  public Mono<Void> handle(ServerWebExchange exchange, WebFilterChain next) {
    return sessionStore
        .getOAuth2Data(exchange)
        .doOnNext(data -> exchange.getAttributes().put(OAuth2ExchangeAttributes.OAUTH2_DATA, data))
        .then(Mono.defer(() -> next.filter(exchange)));
  }

  @Override
  public Mono<Void> beforeDownstream(ServerWebExchange exchange) {
    var current = OAuth2ExchangeAttributes.getOAuth2Data(exchange);
    if (current == null) {
      return Mono.empty();
    }

    return sessionStore
        .getOAuth2Data(exchange)
        .map(stored -> !stored.equals(current))
        .defaultIfEmpty(true)
        .flatMap(
            changed -> {
              if (!changed) {
                return Mono.empty();
              }
              log.debug("Writing updated OAuth2 data back to the session");
              return sessionStore.putOAuth2Data(exchange, current);
            });
  }
}
