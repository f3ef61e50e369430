package org.budgetanalyzer.oauth2interceptor.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.springframework.boot.context.properties.ConfigurationProperties;

import org.budgetanalyzer.oauth2interceptor.exception.OAuth2ConfigurationException;
import org.budgetanalyzer.oauth2interceptor.model.OAuth2Params;
import org.budgetanalyzer.oauth2interceptor.security.AlphanumericStateKeyGenerator;
import org.budgetanalyzer.oauth2interceptor.security.ExclusionSpec;

/**
 * Externalized settings under {@code oauth2.interceptor}.
 *
 * <p>Bound leniently by Spring Boot and checked once in {@link #toParams()}.
 */
// CHECKSTYLE.SUPPRESS: AbbreviationAsWordInName
@ConfigurationProperties("oauth2.interceptor")
public class OAuth2InterceptorProperties {

  private String clientId;
  private String clientSecret;
  private List<String> scope = new ArrayList<>();
  private String authorizationUri;
  private String accessTokenUri;
  private String redirectUri;
  private String tokenInfoUri;
  private String userinfoUri;
  private String logoutUri;
  private String logoutUriClient;
  private String logoutCallbackUri;
  private String logoutCallbackRedirect = "/";

  /** Paths that bypass OAuth2 processing. */
  private List<String> exclude = new ArrayList<>();

  /** Regular expression; paths matching it in full bypass OAuth2 processing. */
  private String excludePattern;

  /** Send client credentials with HTTP Basic instead of in the form body. */
  private boolean authorizationHeader;

  /** Start the login for every non-excluded request without OAuth2 data. */
  private boolean redirectUnauthenticated;

  private int stateLength = AlphanumericStateKeyGenerator.MIN_LENGTH;

  private final Session session = new Session();
  private final Http http = new Http();

  /**
   * Validates the bound values and converts them into the pipeline configuration.
   *
   * @return the immutable configuration
   * @throws OAuth2ConfigurationException if the settings are incomplete or inconsistent
   */
  public OAuth2Params toParams() {
    return OAuth2Params.builder()
        .clientId(clientId)
        .clientSecret(clientSecret)
        .scope(scope)
        .authorizationUri(authorizationUri)
        .accessTokenUri(accessTokenUri)
        .redirectUri(redirectUri)
        .tokenInfoUri(tokenInfoUri)
        .userinfoUri(userinfoUri)
        .logoutUri(logoutUri)
        .logoutUriClient(logoutUriClient)
        .logoutCallbackUri(logoutCallbackUri)
        .logoutCallbackRedirect(logoutCallbackRedirect)
        .exclude(exclusionSpec())
        .authorizationHeader(authorizationHeader)
        .redirectUnauthenticated(redirectUnauthenticated)
        .build();
  }

  ExclusionSpec exclusionSpec() {
    var spec = exclude.isEmpty() ? ExclusionSpec.none() : ExclusionSpec.from(exclude);
    if (excludePattern != null && !excludePattern.isBlank()) {
      try {
        spec = spec.or(ExclusionSpec.pattern(Pattern.compile(excludePattern)));
      } catch (PatternSyntaxException e) {
        throw new OAuth2ConfigurationException(
            "exclude-pattern is not a valid regular expression: " + excludePattern);
      }
    }
    return spec;
  }

  public String getClientId() {
    return clientId;
  }

  public void setClientId(String clientId) {
    this.clientId = clientId;
  }

  public String getClientSecret() {
    return clientSecret;
  }

  public void setClientSecret(String clientSecret) {
    this.clientSecret = clientSecret;
  }

  public List<String> getScope() {
    return scope;
  }

  public void setScope(List<String> scope) {
    this.scope = scope;
  }

  public String getAuthorizationUri() {
    return authorizationUri;
  }

  public void setAuthorizationUri(String authorizationUri) {
    this.authorizationUri = authorizationUri;
  }

  public String getAccessTokenUri() {
    return accessTokenUri;
  }

  public void setAccessTokenUri(String accessTokenUri) {
    this.accessTokenUri = accessTokenUri;
  }

  public String getRedirectUri() {
    return redirectUri;
  }

  public void setRedirectUri(String redirectUri) {
    this.redirectUri = redirectUri;
  }

  public String getTokenInfoUri() {
    return tokenInfoUri;
  }

  public void setTokenInfoUri(String tokenInfoUri) {
    this.tokenInfoUri = tokenInfoUri;
  }

  public String getUserinfoUri() {
    return userinfoUri;
  }

  public void setUserinfoUri(String userinfoUri) {
    this.userinfoUri = userinfoUri;
  }

  public String getLogoutUri() {
    return logoutUri;
  }

  public void setLogoutUri(String logoutUri) {
    this.logoutUri = logoutUri;
  }

  public String getLogoutUriClient() {
    return logoutUriClient;
  }

  public void setLogoutUriClient(String logoutUriClient) {
    this.logoutUriClient = logoutUriClient;
  }

  public String getLogoutCallbackUri() {
    return logoutCallbackUri;
  }

  public void setLogoutCallbackUri(String logoutCallbackUri) {
    this.logoutCallbackUri = logoutCallbackUri;
  }

  public String getLogoutCallbackRedirect() {
    return logoutCallbackRedirect;
  }

  public void setLogoutCallbackRedirect(String logoutCallbackRedirect) {
    this.logoutCallbackRedirect = logoutCallbackRedirect;
  }

  public List<String> getExclude() {
    return exclude;
  }

  public void setExclude(List<String> exclude) {
    this.exclude = exclude;
  }

  public String getExcludePattern() {
    return excludePattern;
  }

  public void setExcludePattern(String excludePattern) {
    this.excludePattern = excludePattern;
  }

  public boolean isAuthorizationHeader() {
    return authorizationHeader;
  }

  public void setAuthorizationHeader(boolean authorizationHeader) {
    this.authorizationHeader = authorizationHeader;
  }

  public boolean isRedirectUnauthenticated() {
    return redirectUnauthenticated;
  }

  public void setRedirectUnauthenticated(boolean redirectUnauthenticated) {
    this.redirectUnauthenticated = redirectUnauthenticated;
  }

  public int getStateLength() {
    return stateLength;
  }

  public void setStateLength(int stateLength) {
    this.stateLength = stateLength;
  }

  public Session getSession() {
    return session;
  }

  public Http getHttp() {
    return http;
  }

  /** Session backend settings. */
  public static class Session {

    /** Keep sessions in Redis; when off, the in-memory WebFlux session store is used. */
    private boolean redisEnabled = true;

    private String cookieName = "SESSION";

    private boolean secureCookie;

    public boolean isRedisEnabled() {
      return redisEnabled;
    }

    public void setRedisEnabled(boolean redisEnabled) {
      this.redisEnabled = redisEnabled;
    }

    public String getCookieName() {
      return cookieName;
    }

    public void setCookieName(String cookieName) {
      this.cookieName = cookieName;
    }

    public boolean isSecureCookie() {
      return secureCookie;
    }

    public void setSecureCookie(boolean secureCookie) {
      this.secureCookie = secureCookie;
    }
  }

  /** Timeouts for calls to the authorization server. */
  public static class Http {

    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration responseTimeout = Duration.ofSeconds(10);

    public Duration getConnectTimeout() {
      return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
    }

    public Duration getResponseTimeout() {
      return responseTimeout;
    }

    public void setResponseTimeout(Duration responseTimeout) {
      this.responseTimeout = responseTimeout;
    }
  }
}
