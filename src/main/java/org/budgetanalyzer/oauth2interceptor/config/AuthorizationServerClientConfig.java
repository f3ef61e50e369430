package org.budgetanalyzer.oauth2interceptor.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;

import io.netty.channel.ChannelOption;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.budgetanalyzer.oauth2interceptor.client.AuthorizationServerClient;
import org.budgetanalyzer.oauth2interceptor.client.WebClientAuthorizationServerClient;

/** HTTP client used to talk to the authorization server. */
@Configuration
public class AuthorizationServerClientConfig {

  private static final Logger log = LoggerFactory.getLogger(AuthorizationServerClientConfig.class);

  /**
   * Creates the WebClient for token, token info and user info calls.
   *
   * <p>Built from Boot's {@link WebClient.Builder} so the shared codecs apply, with its own
   * Reactor Netty connector carrying the configured timeouts.
   *
   * @param builder Boot-provided builder
   * @param properties interceptor settings
   * @return the WebClient
   */
  @Bean
  public WebClient authorizationServerWebClient(
      WebClient.Builder builder, OAuth2InterceptorProperties properties) {
    var http = properties.getHttp();
    var httpClient =
        HttpClient.create()
            .option(
                ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) http.getConnectTimeout().toMillis())
            .responseTimeout(http.getResponseTimeout());

    return builder
        .clientConnector(new ReactorClientHttpConnector(httpClient))
        .filter(logRequest())
        .filter(logResponse())
        .build();
  }

  @Bean
  public AuthorizationServerClient authorizationServerClient(
      WebClient authorizationServerWebClient, ObjectMapper objectMapper) {
    return new WebClientAuthorizationServerClient(authorizationServerWebClient, objectMapper);
  }

  private ExchangeFilterFunction logRequest() {
    return (request, next) -> {
      log.debug("Authorization server request: {} {}", request.method(), request.url());
      return next.exchange(request);
    };
  }

  private ExchangeFilterFunction logResponse() {
    return ExchangeFilterFunction.ofResponseProcessor(
        response -> {
          log.debug("Authorization server response: {}", response.statusCode());
          return Mono.just(response);
        });
  }
}
