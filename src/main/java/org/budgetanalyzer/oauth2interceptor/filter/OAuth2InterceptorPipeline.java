package org.budgetanalyzer.oauth2interceptor.filter;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilterChain;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import org.budgetanalyzer.oauth2interceptor.exception.OAuth2ConfigurationException;
import org.budgetanalyzer.oauth2interceptor.model.OAuth2Params;

/**
 * Runs the OAuth2 stages in front of a downstream handler.
 *
 * <p>Stages are applied in list order, outermost first. Excluded paths skip every stage. The
 * first short-circuiting stage that matches owns the response; otherwise the exchange reaches the
 * downstream chain after each stage that handled it got its {@link
 * OAuth2InterceptorStage#beforeDownstream} call.
 *
 * <p>Not a {@code WebFilter} bean itself: it is installed into the security filter chain, and
 * registering it as a bean as well would run it twice.
 */
// CHECKSTYLE.SUPPRESS: AbbreviationAsWordInName
public class OAuth2InterceptorPipeline {

  private static final Logger log = LoggerFactory.getLogger(OAuth2InterceptorPipeline.class);

  private final OAuth2Params params;
  private final List<OAuth2InterceptorStage> stages;

  public OAuth2InterceptorPipeline(OAuth2Params params, List<OAuth2InterceptorStage> stages) {
    this.params = params;
    this.stages = List.copyOf(stages);

    var names = new HashSet<String>();
    for (var stage : this.stages) {
      if (!names.add(stage.getName())) {
        throw new OAuth2ConfigurationException("Duplicate pipeline stage: " + stage.getName());
      }
    }
    log.info(
        "OAuth2 interceptor pipeline: {}",
        this.stages.stream().map(OAuth2InterceptorStage::getName).toList());
  }

  public List<String> getStageNames() {
    return stages.stream().map(OAuth2InterceptorStage::getName).toList();
  }

  public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
    return invoke(0, exchange, new ArrayList<>(), chain);
  }

  private Mono<Void> invoke(
      int index,
      ServerWebExchange exchange,
      List<OAuth2InterceptorStage> entered,
      WebFilterChain downstream) {
    if (index == stages.size()) {
      return Flux.fromIterable(entered)
          .concatMap(stage -> stage.beforeDownstream(exchange))
          .then(Mono.defer(() -> downstream.filter(exchange)));
    }

    var stage = stages.get(index);
    var path = exchange.getRequest().getPath().value();
    if (params.isExcluded(path) || !stage.matches(exchange)) {
      return invoke(index + 1, exchange, entered, downstream);
    }

    log.debug("Stage {} handles {}", stage.getName(), path);
    entered.add(stage);
    return stage.handle(exchange, next -> invoke(index + 1, next, entered, downstream));
  }
}
