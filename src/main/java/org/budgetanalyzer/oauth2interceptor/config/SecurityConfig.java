package org.budgetanalyzer.oauth2interceptor.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.reactive.EnableWebFluxSecurity;
import org.springframework.security.config.web.server.SecurityWebFiltersOrder;
import org.springframework.security.config.web.server.ServerHttpSecurity;
import org.springframework.security.web.server.SecurityWebFilterChain;

import org.budgetanalyzer.oauth2interceptor.filter.OAuth2InterceptorPipeline;

/**
 * Security configuration.
 *
 * <p>Spring Security provides the filter chain and its response headers; authentication is owned
 * by the {@link OAuth2InterceptorPipeline}, installed at the authentication position. Every
 * exchange is permitted at the authorization level: requests that need a login are redirected
 * (or rejected) by the pipeline before they reach a handler.
 *
 * <ul>
 *   <li>CSRF disabled: the OAuth2 state parameter protects the login round trip and the session
 *       cookie is SameSite=Lax
 *   <li>HTTP Basic, form login and Spring Security's own logout disabled: login and logout are
 *       pipeline stages
 * </ul>
 */
@Configuration
@EnableWebFluxSecurity
public class SecurityConfig {

  private static final Logger logger = LoggerFactory.getLogger(SecurityConfig.class);

  @Bean
  public SecurityWebFilterChain securityWebFilterChain(
      ServerHttpSecurity http, OAuth2InterceptorPipeline pipeline) {
    logger.info("Creating security web filter chain");

    return http.authorizeExchange(exchanges -> exchanges.anyExchange().permitAll())
        .csrf(ServerHttpSecurity.CsrfSpec::disable)
        .httpBasic(ServerHttpSecurity.HttpBasicSpec::disable)
        .formLogin(ServerHttpSecurity.FormLoginSpec::disable)
        .logout(ServerHttpSecurity.LogoutSpec::disable)
        .addFilterAt(pipeline::filter, SecurityWebFiltersOrder.AUTHENTICATION)
        .build();
  }
}
