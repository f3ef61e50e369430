package org.budgetanalyzer.oauth2interceptor.config;

import org.springframework.cloud.gateway.filter.GlobalFilter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import org.budgetanalyzer.oauth2interceptor.filter.OAuth2TokenRelayGlobalFilter;

/**
 * Registers the global filter that forwards the session's access token to services behind
 * gateway routes.
 */
@Configuration
// CHECKSTYLE.SUPPRESS: AbbreviationAsWordInName
public class OAuth2TokenRelayFilterConfig {

  @Bean
  public GlobalFilter oauth2TokenRelayGlobalFilter() {
    return new OAuth2TokenRelayGlobalFilter();
  }
}
