package org.budgetanalyzer.oauth2interceptor.client;

import org.springframework.util.MultiValueMap;

import reactor.core.publisher.Mono;

import org.budgetanalyzer.oauth2interceptor.model.AuthorizationRequest;
import org.budgetanalyzer.oauth2interceptor.model.OAuth2Data;
import org.budgetanalyzer.oauth2interceptor.model.OAuth2Params;
import org.budgetanalyzer.oauth2interceptor.model.ResourceOwnerCredentials;
import org.budgetanalyzer.oauth2interceptor.model.TokenRefreshResult;

/**
 * Network-facing operations against the OAuth2 authorization server.
 *
 * <p>Every method that talks to the server signals transport failures with {@link
 * org.budgetanalyzer.oauth2interceptor.exception.AuthorizationServerException}; OAuth2 error
 * responses on the code and password grants are signalled with {@link
 * org.budgetanalyzer.oauth2interceptor.exception.OAuth2ProtocolException}.
 */
public interface AuthorizationServerClient {

  /**
   * Builds the authorization code request the user agent is redirected to. Does not perform any
   * I/O.
   *
   * @param params client configuration
   * @param state CSRF state to round-trip
   * @return the authorization request
   */
  AuthorizationRequest buildAuthorizationRequest(OAuth2Params params, String state);

  /**
   * Completes the authorization code grant.
   *
   * @param params client configuration
   * @param callbackParams query parameters of the callback request
   * @param authorizationRequest the request that was sent, carrying the expected state
   * @return the issued token data
   */
  Mono<OAuth2Data> exchangeCodeForToken(
      OAuth2Params params,
      MultiValueMap<String, String> callbackParams,
      AuthorizationRequest authorizationRequest);

  /**
   * Obtains a token with the resource owner password grant.
   *
   * @param params client configuration
   * @param credentials the resource owner's credentials
   * @return the issued token data
   */
  Mono<OAuth2Data> requestPasswordToken(
      OAuth2Params params, ResourceOwnerCredentials credentials);

  /**
   * Runs the refresh token grant. A rejection (a 4xx answer) is reported as a failed result, not
   * as an error; a token endpoint that fails to answer signals an {@link
   * org.budgetanalyzer.oauth2interceptor.exception.AuthorizationServerException}.
   *
   * @param refreshToken the refresh token, may be {@code null}
   * @param params client configuration
   * @return the refresh outcome
   */
  Mono<TokenRefreshResult> refreshAccessToken(String refreshToken, OAuth2Params params);

  /**
   * Asks the token info endpoint whether the access token is currently valid.
   *
   * @param tokenInfoUri the token info endpoint
   * @param accessToken the token to check
   * @return {@code true} if valid, {@code false} if the server rejects the token
   */
  Mono<Boolean> introspectToken(String tokenInfoUri, String accessToken);

  /**
   * Fetches the user info of the token's owner and merges it into the data.
   *
   * @param data the token data
   * @param params client configuration; nothing is fetched without a user info URI
   * @return the data including user info
   */
  Mono<OAuth2Data> fetchUserinfo(OAuth2Data data, OAuth2Params params);
}
