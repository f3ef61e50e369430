package org.budgetanalyzer.oauth2interceptor.filter;

import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilterChain;

import reactor.core.publisher.Mono;

/**
 * One named step of the {@link OAuth2InterceptorPipeline}.
 *
 * <p>A stage whose {@link #matches} returns {@code true} is handed the exchange together with the
 * rest of the pipeline. Short-circuiting stages answer the exchange themselves and never call
 * {@code next}; pass-through stages enrich the exchange and call {@code next} exactly once.
 */
// CHECKSTYLE.SUPPRESS: AbbreviationAsWordInName
public interface OAuth2InterceptorStage {

  String getName();

  boolean matches(ServerWebExchange exchange);

  Mono<Void> handle(ServerWebExchange exchange, WebFilterChain next);

  /**
   * Runs once the exchange has passed every stage, right before the downstream handler is
   * invoked. Only stages that handled the exchange are called.
   *
   * @param exchange the current exchange
   * @return completion signal
   */
  default Mono<Void> beforeDownstream(ServerWebExchange exchange) {
    return Mono.empty();
  }
}
