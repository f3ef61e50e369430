package org.budgetanalyzer.oauth2interceptor.filter;

import org.springframework.web.server.ServerWebExchange;

import org.budgetanalyzer.oauth2interceptor.model.OAuth2Data;

/** Exchange attributes through which the pipeline hands OAuth2 data to downstream handlers. */
// CHECKSTYLE.SUPPRESS: AbbreviationAsWordInName
public final class OAuth2ExchangeAttributes {

  /** The session's OAuth2 data, possibly refreshed, for the current exchange. */
  public static final String OAUTH2_DATA =
      OAuth2ExchangeAttributes.class.getName() + ".OAUTH2_DATA";

  /** Set when the access token was refreshed while handling the current exchange. */
  public static final String REFRESHED = OAuth2ExchangeAttributes.class.getName() + ".REFRESHED";

  private OAuth2ExchangeAttributes() {}

  /**
   * Returns the injected OAuth2 data.
   *
   * @param exchange the current exchange
   * @return the data, or {@code null} when the session holds none
   */
  public static OAuth2Data getOAuth2Data(ServerWebExchange exchange) {
    return exchange.getAttribute(OAUTH2_DATA);
  }

  public static boolean isRefreshed(ServerWebExchange exchange) {
    return Boolean.TRUE.equals(exchange.getAttribute(REFRESHED));
  }
}
