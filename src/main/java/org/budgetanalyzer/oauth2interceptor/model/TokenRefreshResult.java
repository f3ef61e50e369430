package org.budgetanalyzer.oauth2interceptor.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a refresh token grant.
 *
 * <p>A rejection by the authorization server is a normal outcome here, not an exception: the
 * caller decides whether to send the user back to the login page or answer with an error.
 *
 * @param succeeded whether the server issued a new access token
 * @param body the decoded token response, or the error response on rejection
 */
public record TokenRefreshResult(boolean succeeded, Map<String, Object> body) {

  public TokenRefreshResult {
    Map<String, Object> copy = new LinkedHashMap<>();
    if (body != null) {
      body.forEach(
          (key, value) -> {
            if (value != null) {
              copy.put(key, value);
            }
          });
    }
    body = Collections.unmodifiableMap(copy);
  }

  public static TokenRefreshResult success(Map<String, Object> body) {
    return new TokenRefreshResult(true, body);
  }

  public static TokenRefreshResult failure(Map<String, Object> body) {
    return new TokenRefreshResult(false, body);
  }
}
