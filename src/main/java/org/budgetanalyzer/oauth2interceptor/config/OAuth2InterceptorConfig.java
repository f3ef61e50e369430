package org.budgetanalyzer.oauth2interceptor.config;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.keygen.StringKeyGenerator;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.budgetanalyzer.oauth2interceptor.client.AuthorizationServerClient;
import org.budgetanalyzer.oauth2interceptor.filter.AuthorizationCallbackStage;
import org.budgetanalyzer.oauth2interceptor.filter.JsonResponseWriter;
import org.budgetanalyzer.oauth2interceptor.filter.LogoutCallbackHandler;
import org.budgetanalyzer.oauth2interceptor.filter.LogoutCallbackStage;
import org.budgetanalyzer.oauth2interceptor.filter.LogoutStage;
import org.budgetanalyzer.oauth2interceptor.filter.OAuth2DataInjectionStage;
import org.budgetanalyzer.oauth2interceptor.filter.OAuth2ErrorWebExceptionHandler;
import org.budgetanalyzer.oauth2interceptor.filter.OAuth2InterceptorPipeline;
import org.budgetanalyzer.oauth2interceptor.filter.OAuth2InterceptorStage;
import org.budgetanalyzer.oauth2interceptor.filter.RedirectUnauthenticatedStage;
import org.budgetanalyzer.oauth2interceptor.filter.RedirectingLogoutCallbackHandler;
import org.budgetanalyzer.oauth2interceptor.filter.TokenValidationStage;
import org.budgetanalyzer.oauth2interceptor.model.OAuth2Params;
import org.budgetanalyzer.oauth2interceptor.security.AlphanumericStateKeyGenerator;
import org.budgetanalyzer.oauth2interceptor.security.AuthorizationRedirector;
import org.budgetanalyzer.oauth2interceptor.security.OAuth2SessionStore;
import org.budgetanalyzer.oauth2interceptor.security.WebSessionOAuth2SessionStore;

/**
 * Wires the OAuth2 interceptor pipeline.
 *
 * <p>The session store, state generator and logout callback handler back off when the
 * application declares its own bean of the same type.
 */
@Configuration
@EnableConfigurationProperties(OAuth2InterceptorProperties.class)
// CHECKSTYLE.SUPPRESS: AbbreviationAsWordInName
public class OAuth2InterceptorConfig {

  private static final Logger log = LoggerFactory.getLogger(OAuth2InterceptorConfig.class);

  @Bean
  public OAuth2Params oauth2Params(OAuth2InterceptorProperties properties) {
    var params = properties.toParams();
    log.info("OAuth2 interceptor configuration: {}", params);
    return params;
  }

  @Bean
  @ConditionalOnMissingBean
  public OAuth2SessionStore oauth2SessionStore() {
    return new WebSessionOAuth2SessionStore();
  }

  @Bean
  @ConditionalOnMissingBean
  public StringKeyGenerator oauth2StateGenerator(OAuth2InterceptorProperties properties) {
    return new AlphanumericStateKeyGenerator(
        new SecureRandom(), properties.getStateLength());
  }

  @Bean
  @ConditionalOnMissingBean
  public LogoutCallbackHandler logoutCallbackHandler(
      OAuth2Params params, OAuth2SessionStore sessionStore) {
    return new RedirectingLogoutCallbackHandler(sessionStore, params.getLogoutCallbackRedirect());
  }

  @Bean
  public JsonResponseWriter jsonResponseWriter(ObjectMapper objectMapper) {
    return new JsonResponseWriter(objectMapper);
  }

  @Bean
  public AuthorizationRedirector authorizationRedirector(
      OAuth2Params params,
      OAuth2SessionStore sessionStore,
      AuthorizationServerClient authorizationServerClient,
      StringKeyGenerator oauth2StateGenerator) {
    return new AuthorizationRedirector(
        params, sessionStore, authorizationServerClient, oauth2StateGenerator);
  }

  /**
   * Creates the pipeline with its stages, outermost first.
   *
   * @return the pipeline installed into the security filter chain
   */
  @Bean
  public OAuth2InterceptorPipeline oauth2InterceptorPipeline(
      OAuth2Params params,
      OAuth2SessionStore sessionStore,
      AuthorizationServerClient authorizationServerClient,
      AuthorizationRedirector authorizationRedirector,
      LogoutCallbackHandler logoutCallbackHandler,
      JsonResponseWriter jsonResponseWriter) {
    List<OAuth2InterceptorStage> stages = new ArrayList<>();
    stages.add(new LogoutStage(params));
    stages.add(new LogoutCallbackStage(params, logoutCallbackHandler));
    stages.add(new AuthorizationCallbackStage(params, sessionStore, authorizationServerClient));
    stages.add(new OAuth2DataInjectionStage(sessionStore));
    if (params.isRedirectUnauthenticated()) {
      stages.add(new RedirectUnauthenticatedStage(authorizationRedirector));
    }
    stages.add(
        new TokenValidationStage(
            params, authorizationServerClient, authorizationRedirector, jsonResponseWriter));
    return new OAuth2InterceptorPipeline(params, stages);
  }

  @Bean
  public OAuth2ErrorWebExceptionHandler oauth2ErrorWebExceptionHandler(
      JsonResponseWriter jsonResponseWriter) {
    return new OAuth2ErrorWebExceptionHandler(jsonResponseWriter);
  }
}
