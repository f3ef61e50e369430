package org.budgetanalyzer.oauth2interceptor.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Token data held for an authenticated session.
 *
 * <p>Backed by a plain map using the session slot layout ({@code access-token}, {@code
 * token-type}, {@code expires-in}, {@code refresh-token}, {@code params}, {@code userinfo}) so
 * that it can be written to any session backend without a dedicated serializer. Entries this
 * class does not know about survive a read/write cycle untouched.
 *
 * <p>{@code expires-in} is advisory only. Tokens are introspected on every request regardless of
 * it.
 */
// CHECKSTYLE.SUPPRESS: AbbreviationAsWordInName
public final class OAuth2Data {

  public static final String ACCESS_TOKEN = "access-token";
  public static final String TOKEN_TYPE = "token-type";
  public static final String EXPIRES_IN = "expires-in";
  public static final String REFRESH_TOKEN = "refresh-token";
  public static final String PARAMS = "params";
  public static final String USERINFO = "userinfo";

  private final Map<String, Object> values;

  private OAuth2Data(Map<String, Object> values) {
    this.values = Collections.unmodifiableMap(values);
  }

  /**
   * Wraps data previously read from a session slot.
   *
   * @param values the slot contents
   * @return the wrapped data
   */
  public static OAuth2Data of(Map<String, ?> values) {
    Objects.requireNonNull(values, "values");
    return new OAuth2Data(copyWithoutNulls(values));
  }

  /**
   * Builds token data from a token endpoint response (authorization code or password grant).
   *
   * <p>Standard provider fields are remapped to the session layout; every field except {@code
   * access_token} is also kept under {@code params}.
   *
   * @param response the decoded token response
   * @return the token data
   */
  public static OAuth2Data fromTokenResponse(Map<String, ?> response) {
    Map<String, Object> values = new LinkedHashMap<>();
    putIfPresent(values, ACCESS_TOKEN, response.get("access_token"));
    putIfPresent(values, TOKEN_TYPE, response.get("token_type"));
    putIfPresent(values, EXPIRES_IN, toSeconds(response.get("expires_in")));
    putIfPresent(values, REFRESH_TOKEN, response.get("refresh_token"));
    values.put(PARAMS, paramsOf(response));
    return new OAuth2Data(values);
  }

  /**
   * Merges a refresh response into this data.
   *
   * <p>{@code access_token} and {@code refresh_token} replace the current tokens (the current
   * refresh token is kept when the provider does not rotate it) and {@code params} is replaced by
   * every returned field except {@code access_token}.
   *
   * @param response the decoded refresh response
   * @return the refreshed data
   */
  public OAuth2Data withRefreshedTokens(Map<String, ?> response) {
    Map<String, Object> refreshed = new LinkedHashMap<>(values);
    putIfPresent(refreshed, ACCESS_TOKEN, response.get("access_token"));
    putIfPresent(refreshed, REFRESH_TOKEN, response.get("refresh_token"));
    refreshed.put(PARAMS, paramsOf(response));
    return new OAuth2Data(refreshed);
  }

  public OAuth2Data withUserinfo(Map<String, ?> userinfo) {
    Map<String, Object> merged = new LinkedHashMap<>(values);
    merged.put(USERINFO, Collections.unmodifiableMap(copyWithoutNulls(userinfo)));
    return new OAuth2Data(merged);
  }

  public String getAccessToken() {
    return stringValue(ACCESS_TOKEN);
  }

  public String getTokenType() {
    return stringValue(TOKEN_TYPE);
  }

  public Long getExpiresIn() {
    return toSeconds(values.get(EXPIRES_IN));
  }

  public String getRefreshToken() {
    return stringValue(REFRESH_TOKEN);
  }

  public Map<String, Object> getParams() {
    return mapValue(PARAMS);
  }

  public Map<String, Object> getUserinfo() {
    return mapValue(USERINFO);
  }

  /**
   * Returns the session slot representation.
   *
   * @return an unmodifiable view of the data
   */
  public Map<String, Object> asMap() {
    return values;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof OAuth2Data other)) {
      return false;
    }
    return values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return "OAuth2Data{accessToken="
        + (getAccessToken() != null ? "present" : "missing")
        + ", refreshToken="
        + (getRefreshToken() != null ? "present" : "missing")
        + ", keys="
        + values.keySet()
        + "}";
  }

  private String stringValue(String key) {
    Object value = values.get(key);
    return value != null ? value.toString() : null;
  }

  @SuppressWarnings("unchecked")
  private Map<String, Object> mapValue(String key) {
    Object value = values.get(key);
    if (value instanceof Map<?, ?> map) {
      return Collections.unmodifiableMap((Map<String, Object>) map);
    }
    return Map.of();
  }

  private static Map<String, Object> paramsOf(Map<String, ?> response) {
    Map<String, Object> params = copyWithoutNulls(response);
    params.remove("access_token");
    return Collections.unmodifiableMap(params);
  }

  private static Map<String, Object> copyWithoutNulls(Map<String, ?> source) {
    Map<String, Object> copy = new LinkedHashMap<>();
    source.forEach((key, value) -> putIfPresent(copy, key, value));
    return copy;
  }

  private static void putIfPresent(Map<String, Object> target, String key, Object value) {
    if (value != null) {
      target.put(key, value);
    }
  }

  private static Long toSeconds(Object value) {
    if (value instanceof Number number) {
      return number.longValue();
    }
    if (value instanceof String text && !text.isBlank()) {
      try {
        return Long.parseLong(text.trim());
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }
}
