package org.budgetanalyzer.oauth2interceptor.filter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cloud.gateway.filter.GatewayFilterChain;
import org.springframework.cloud.gateway.filter.GlobalFilter;
import org.springframework.core.Ordered;
import org.springframework.web.server.ServerWebExchange;

import reactor.core.publisher.Mono;

/**
 * Global filter that forwards the session's access token to proxied services.
 *
 * <p>The token comes from the {@link OAuth2ExchangeAttributes#OAUTH2_DATA} attribute, so a token
 * refreshed earlier in the same exchange is the one relayed. Requests without OAuth2 data are
 * routed unchanged.
 *
 * <p>Runs after the security filters but before the routing filter.
 */
// CHECKSTYLE.SUPPRESS: AbbreviationAsWordInName
public class OAuth2TokenRelayGlobalFilter implements GlobalFilter, Ordered {

  private static final Logger log = LoggerFactory.getLogger(OAuth2TokenRelayGlobalFilter.class);

  @Override
  public Mono<Void> filter(ServerWebExchange exchange, GatewayFilterChain chain) {
    var data = OAuth2ExchangeAttributes.getOAuth2Data(exchange);
    if (data == null || data.getAccessToken() == null) {
      return chain.filter(exchange);
    }

    log.debug(
        "Relaying access token [length={}] to {}",
        data.getAccessToken().length(),
        exchange.getRequest().getPath().value());
    var request =
        exchange
            .getRequest()
            .mutate()
            .headers(headers -> headers.setBearerAuth(data.getAccessToken()))
            .build();
    return chain.filter(exchange.mutate().request(request).build());
  }

  @Override
  public int getOrder() {
    return Ordered.HIGHEST_PRECEDENCE + 100;
  }
}
