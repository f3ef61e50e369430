package org.budgetanalyzer.oauth2interceptor.model;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

import org.budgetanalyzer.oauth2interceptor.exception.OAuth2ConfigurationException;
import org.budgetanalyzer.oauth2interceptor.security.ExclusionSpec;

/**
 * Immutable client configuration shared by every stage of the interceptor pipeline.
 *
 * <p>Built once at startup through {@link #builder()}; {@link Builder#build()} rejects incomplete
 * or contradictory settings with an {@link OAuth2ConfigurationException} so that a misconfigured
 * interceptor never serves a request.
 */
// CHECKSTYLE.SUPPRESS: AbbreviationAsWordInName
public final class OAuth2Params {

  private final String clientId;
  private final String clientSecret;
  private final List<String> scope;
  private final String authorizationUri;
  private final String accessTokenUri;
  private final String redirectUri;
  private final String redirectPath;
  private final String tokenInfoUri;
  private final String userinfoUri;
  private final String logoutUri;
  private final String logoutUriClient;
  private final String logoutCallbackUri;
  private final String logoutCallbackRedirect;
  private final ExclusionSpec exclude;
  private final boolean authorizationHeader;
  private final boolean redirectUnauthenticated;

  private OAuth2Params(Builder builder) {
    this.clientId = builder.clientId;
    this.clientSecret = builder.clientSecret;
    this.scope = List.copyOf(new LinkedHashSet<>(builder.scope));
    this.authorizationUri = builder.authorizationUri;
    this.accessTokenUri = builder.accessTokenUri;
    this.redirectUri = builder.redirectUri;
    this.redirectPath = pathOf(builder.redirectUri);
    this.tokenInfoUri = blankToNull(builder.tokenInfoUri);
    this.userinfoUri = blankToNull(builder.userinfoUri);
    this.logoutUri = blankToNull(builder.logoutUri);
    this.logoutUriClient = blankToNull(pathOf(builder.logoutUriClient));
    this.logoutCallbackUri = blankToNull(pathOf(builder.logoutCallbackUri));
    this.logoutCallbackRedirect =
        builder.logoutCallbackRedirect == null || builder.logoutCallbackRedirect.isBlank()
            ? "/"
            : builder.logoutCallbackRedirect;
    this.exclude = builder.exclude != null ? builder.exclude : ExclusionSpec.none();
    this.authorizationHeader = builder.authorizationHeader;
    this.redirectUnauthenticated = builder.redirectUnauthenticated;
  }

  public static Builder builder() {
    return new Builder();
  }

  public String getClientId() {
    return clientId;
  }

  public String getClientSecret() {
    return clientSecret;
  }

  public List<String> getScope() {
    return scope;
  }

  public String getAuthorizationUri() {
    return authorizationUri;
  }

  public String getAccessTokenUri() {
    return accessTokenUri;
  }

  public String getRedirectUri() {
    return redirectUri;
  }

  /**
   * Path component of the redirect URI. The authorization callback is recognised by comparing
   * request paths with this value; scheme, host and port are ignored.
   *
   * @return the callback path
   */
  public String getRedirectPath() {
    return redirectPath;
  }

  /** Introspection endpoint, or {@code null} when tokens are trusted without introspection. */
  public String getTokenInfoUri() {
    return tokenInfoUri;
  }

  public String getUserinfoUri() {
    return userinfoUri;
  }

  public String getLogoutUri() {
    return logoutUri;
  }

  public String getLogoutUriClient() {
    return logoutUriClient;
  }

  public String getLogoutCallbackUri() {
    return logoutCallbackUri;
  }

  public String getLogoutCallbackRedirect() {
    return logoutCallbackRedirect;
  }

  public ExclusionSpec getExclude() {
    return exclude;
  }

  /** Whether client credentials are sent as HTTP Basic instead of form parameters. */
  public boolean isAuthorizationHeader() {
    return authorizationHeader;
  }

  public boolean isRedirectUnauthenticated() {
    return redirectUnauthenticated;
  }

  public boolean isExcluded(String path) {
    return exclude.isExcluded(path);
  }

  @Override
  public String toString() {
    return "OAuth2Params{clientId="
        + clientId
        + ", clientSecret="
        + (clientSecret != null ? "[PROTECTED]" : "NOT SET")
        + ", scope="
        + scope
        + ", authorizationUri="
        + authorizationUri
        + ", accessTokenUri="
        + accessTokenUri
        + ", redirectUri="
        + redirectUri
        + ", tokenInfoUri="
        + tokenInfoUri
        + ", userinfoUri="
        + userinfoUri
        + ", logoutUri="
        + logoutUri
        + ", logoutUriClient="
        + logoutUriClient
        + ", logoutCallbackUri="
        + logoutCallbackUri
        + ", exclude="
        + exclude
        + "}";
  }

  private static String pathOf(String uri) {
    if (uri == null || uri.isBlank()) {
      return uri;
    }
    try {
      String path = URI.create(uri.trim()).getPath();
      return path == null || path.isEmpty() ? "/" : path;
    } catch (IllegalArgumentException e) {
      throw new OAuth2ConfigurationException("Malformed URI in configuration: " + uri);
    }
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }

  /** Builder for {@link OAuth2Params}. */
  public static final class Builder {

    private String clientId;
    private String clientSecret;
    private final List<String> scope = new ArrayList<>();
    private String authorizationUri;
    private String accessTokenUri;
    private String redirectUri;
    private String tokenInfoUri;
    private String userinfoUri;
    private String logoutUri;
    private String logoutUriClient;
    private String logoutCallbackUri;
    private String logoutCallbackRedirect;
    private ExclusionSpec exclude;
    private boolean authorizationHeader;
    private boolean redirectUnauthenticated;

    private Builder() {}

    public Builder clientId(String clientId) {
      this.clientId = clientId;
      return this;
    }

    public Builder clientSecret(String clientSecret) {
      this.clientSecret = clientSecret;
      return this;
    }

    public Builder scope(List<String> scope) {
      this.scope.clear();
      if (scope != null) {
        this.scope.addAll(scope);
      }
      return this;
    }

    public Builder scope(String... scope) {
      return scope(List.of(scope));
    }

    public Builder authorizationUri(String authorizationUri) {
      this.authorizationUri = authorizationUri;
      return this;
    }

    public Builder accessTokenUri(String accessTokenUri) {
      this.accessTokenUri = accessTokenUri;
      return this;
    }

    public Builder redirectUri(String redirectUri) {
      this.redirectUri = redirectUri;
      return this;
    }

    public Builder tokenInfoUri(String tokenInfoUri) {
      this.tokenInfoUri = tokenInfoUri;
      return this;
    }

    public Builder userinfoUri(String userinfoUri) {
      this.userinfoUri = userinfoUri;
      return this;
    }

    public Builder logoutUri(String logoutUri) {
      this.logoutUri = logoutUri;
      return this;
    }

    public Builder logoutUriClient(String logoutUriClient) {
      this.logoutUriClient = logoutUriClient;
      return this;
    }

    public Builder logoutCallbackUri(String logoutCallbackUri) {
      this.logoutCallbackUri = logoutCallbackUri;
      return this;
    }

    public Builder logoutCallbackRedirect(String logoutCallbackRedirect) {
      this.logoutCallbackRedirect = logoutCallbackRedirect;
      return this;
    }

    public Builder exclude(ExclusionSpec exclude) {
      this.exclude = exclude;
      return this;
    }

    public Builder authorizationHeader(boolean authorizationHeader) {
      this.authorizationHeader = authorizationHeader;
      return this;
    }

    public Builder redirectUnauthenticated(boolean redirectUnauthenticated) {
      this.redirectUnauthenticated = redirectUnauthenticated;
      return this;
    }

    /**
     * Validates the settings and creates the configuration.
     *
     * @return the immutable configuration
     * @throws OAuth2ConfigurationException if a required value is missing, a URI is malformed or
     *     the callback path collides with a logout path
     */
    public OAuth2Params build() {
      require(clientId, "client-id");
      require(authorizationUri, "authorization-uri");
      require(accessTokenUri, "access-token-uri");
      require(redirectUri, "redirect-uri");
      requireAbsolute(authorizationUri, "authorization-uri");
      requireAbsolute(accessTokenUri, "access-token-uri");
      if (logoutUriClient != null && !logoutUriClient.isBlank()) {
        require(logoutUri, "logout-uri");
      }

      OAuth2Params params = new OAuth2Params(this);

      if (Objects.equals(params.redirectPath, params.logoutUriClient)
          || Objects.equals(params.redirectPath, params.logoutCallbackUri)) {
        throw new OAuth2ConfigurationException(
            "redirect-uri path "
                + params.redirectPath
                + " must differ from logout-uri-client and logout-callback-uri");
      }
      return params;
    }

    private static void require(String value, String name) {
      if (value == null || value.isBlank()) {
        throw new OAuth2ConfigurationException("Missing required OAuth2 setting: " + name);
      }
    }

    private static void requireAbsolute(String value, String name) {
      try {
        if (!URI.create(value).isAbsolute()) {
          throw new OAuth2ConfigurationException(name + " must be an absolute URI: " + value);
        }
      } catch (IllegalArgumentException e) {
        throw new OAuth2ConfigurationException(name + " is not a valid URI: " + value);
      }
    }
  }
}
