package org.budgetanalyzer.oauth2interceptor.model;

import java.util.List;

/**
 * An authorization request ready to be sent to the user agent.
 *
 * @param uri the authorize endpoint URI including {@code response_type}, {@code client_id},
 *     {@code redirect_uri}, {@code scope} and {@code state}
 * @param scope the requested scopes, in configuration order
 * @param state the CSRF state round-tripped through the authorization server
 */
public record AuthorizationRequest(String uri, List<String> scope, String state) {

  public AuthorizationRequest {
    scope = List.copyOf(scope);
  }
}
