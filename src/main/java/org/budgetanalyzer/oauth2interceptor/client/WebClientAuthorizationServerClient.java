package org.budgetanalyzer.oauth2interceptor.client;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.security.oauth2.core.endpoint.OAuth2AuthorizationRequest;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;

import reactor.core.publisher.Mono;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.budgetanalyzer.oauth2interceptor.exception.AuthorizationServerException;
import org.budgetanalyzer.oauth2interceptor.exception.OAuth2ProtocolException;
import org.budgetanalyzer.oauth2interceptor.exception.OAuth2StateMismatchException;
import org.budgetanalyzer.oauth2interceptor.model.AuthorizationRequest;
import org.budgetanalyzer.oauth2interceptor.model.OAuth2Data;
import org.budgetanalyzer.oauth2interceptor.model.OAuth2Params;
import org.budgetanalyzer.oauth2interceptor.model.ResourceOwnerCredentials;
import org.budgetanalyzer.oauth2interceptor.model.TokenRefreshResult;

/**
 * {@link AuthorizationServerClient} on top of a reactive {@link WebClient}.
 *
 * <p>Client credentials go into the form body unless {@link OAuth2Params#isAuthorizationHeader()}
 * is set, in which case they are sent with HTTP Basic. Token responses are accepted as JSON or as
 * {@code application/x-www-form-urlencoded}; some providers answer with the latter regardless of
 * the {@code Accept} header.
 */
// CHECKSTYLE.SUPPRESS: AbbreviationAsWordInName
public class WebClientAuthorizationServerClient implements AuthorizationServerClient {

  private static final Logger log =
      LoggerFactory.getLogger(WebClientAuthorizationServerClient.class);

  private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE =
      new TypeReference<>() {};

  private static final ParameterizedTypeReference<MultiValueMap<String, String>> FORM_TYPE =
      new ParameterizedTypeReference<>() {};

  private final WebClient webClient;
  private final ObjectMapper objectMapper;

  public WebClientAuthorizationServerClient(WebClient webClient, ObjectMapper objectMapper) {
    this.webClient = webClient;
    this.objectMapper = objectMapper;
  }

  @Override
  public AuthorizationRequest buildAuthorizationRequest(OAuth2Params params, String state) {
    var request =
        OAuth2AuthorizationRequest.authorizationCode()
            .authorizationUri(params.getAuthorizationUri())
            .clientId(params.getClientId())
            .redirectUri(params.getRedirectUri())
            .scopes(new LinkedHashSet<>(params.getScope()))
            .state(state)
            .build();

    return new AuthorizationRequest(
        request.getAuthorizationRequestUri(), params.getScope(), state);
  }

  @Override
  public Mono<OAuth2Data> exchangeCodeForToken(
      OAuth2Params params,
      MultiValueMap<String, String> callbackParams,
      AuthorizationRequest authorizationRequest) {
    var error = callbackParams.getFirst("error");
    if (error != null) {
      return Mono.error(
          new OAuth2ProtocolException(error, callbackParams.getFirst("error_description")));
    }

    var expectedState = authorizationRequest == null ? null : authorizationRequest.state();
    var returnedState = callbackParams.getFirst("state");
    if (expectedState == null || !expectedState.equals(returnedState)) {
      return Mono.error(
          new OAuth2StateMismatchException(
              "State parameter of the authorization response does not match the request"));
    }

    var code = callbackParams.getFirst("code");
    if (code == null || code.isEmpty()) {
      return Mono.error(
          new OAuth2ProtocolException(
              "invalid_request", "Authorization response is missing the code parameter"));
    }

    MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("grant_type", "authorization_code");
    form.add("code", code);
    form.add("redirect_uri", params.getRedirectUri());

    log.debug("Exchanging authorization code at {}", params.getAccessTokenUri());
    return postTokenRequest(params, form).map(this::toTokenData);
  }

  @Override
  public Mono<OAuth2Data> requestPasswordToken(
      OAuth2Params params, ResourceOwnerCredentials credentials) {
    MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("grant_type", "password");
    form.add("username", credentials.username());
    form.add("password", credentials.password());
    if (!params.getScope().isEmpty()) {
      form.add("scope", String.join(" ", params.getScope()));
    }

    log.debug("Requesting password grant token at {}", params.getAccessTokenUri());
    return postTokenRequest(params, form).map(this::toTokenData);
  }

  @Override
  public Mono<TokenRefreshResult> refreshAccessToken(String refreshToken, OAuth2Params params) {
    if (refreshToken == null || refreshToken.isEmpty()) {
      Map<String, Object> body = new LinkedHashMap<>();
      body.put("error", "invalid_grant");
      body.put("error_description", "No refresh token available");
      return Mono.just(TokenRefreshResult.failure(body));
    }

    MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("grant_type", "refresh_token");
    form.add("refresh_token", refreshToken);

    log.debug("Refreshing access token at {}", params.getAccessTokenUri());
    return postTokenRequest(params, form)
        .map(
            response -> {
              if (response.status().is2xxSuccessful()
                  && response.body().get("access_token") != null) {
                return TokenRefreshResult.success(response.body());
              }
              log.info("Token refresh rejected with status {}", response.status().value());
              return TokenRefreshResult.failure(response.body());
            });
  }

  @Override
  public Mono<Boolean> introspectToken(String tokenInfoUri, String accessToken) {
    return webClient
        .get()
        .uri(
            tokenInfoUri,
            builder -> builder.queryParam("access_token", "{token}").build(accessToken))
        .accept(MediaType.APPLICATION_JSON)
        .exchangeToMono(
            response -> {
              var status = response.statusCode();
              if (status.is2xxSuccessful()) {
                return response.releaseBody().thenReturn(true);
              }
              if (status.is4xxClientError()) {
                log.debug("Token info endpoint rejected token with status {}", status.value());
                return response.releaseBody().thenReturn(false);
              }
              return response
                  .releaseBody()
                  .then(
                      Mono.error(
                          new AuthorizationServerException(
                              "Token info endpoint returned status " + status.value())));
            })
        .onErrorMap(WebClientRequestException.class, this::unreachable);
  }

  @Override
  public Mono<OAuth2Data> fetchUserinfo(OAuth2Data data, OAuth2Params params) {
    if (params.getUserinfoUri() == null) {
      return Mono.just(data);
    }

    return webClient
        .get()
        .uri(params.getUserinfoUri())
        .headers(headers -> headers.setBearerAuth(data.getAccessToken()))
        .accept(MediaType.APPLICATION_JSON)
        .exchangeToMono(this::readResponse)
        .onErrorMap(WebClientRequestException.class, this::unreachable)
        .flatMap(
            response -> {
              if (!response.status().is2xxSuccessful()) {
                return Mono.error(
                    new AuthorizationServerException(
                        "Userinfo endpoint returned status " + response.status().value()));
              }
              return Mono.just(data.withUserinfo(response.body()));
            });
  }

  private Mono<EndpointResponse> postTokenRequest(
      OAuth2Params params, MultiValueMap<String, String> form) {
    if (!params.isAuthorizationHeader()) {
      form.add("client_id", params.getClientId());
      if (params.getClientSecret() != null) {
        form.add("client_secret", params.getClientSecret());
      }
    }

    return webClient
        .post()
        .uri(params.getAccessTokenUri())
        .headers(
            headers -> {
              if (params.isAuthorizationHeader()) {
                headers.setBasicAuth(
                    params.getClientId(),
                    params.getClientSecret() == null ? "" : params.getClientSecret(),
                    StandardCharsets.UTF_8);
              }
              headers.setAccept(
                  List.of(MediaType.APPLICATION_JSON, MediaType.APPLICATION_FORM_URLENCODED));
            })
        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
        .body(BodyInserters.fromFormData(form))
        .exchangeToMono(this::readResponse)
        .onErrorMap(WebClientRequestException.class, this::unreachable)
        .flatMap(this::requireAnswer);
  }

  private Mono<EndpointResponse> readResponse(ClientResponse response) {
    var status = response.statusCode();
    var contentType = response.headers().contentType().orElse(null);
    if (contentType != null
        && (contentType.isCompatibleWith(MediaType.APPLICATION_FORM_URLENCODED)
            || contentType.isCompatibleWith(MediaType.TEXT_PLAIN))) {
      // Some providers label form-encoded token responses as text/plain
      return response
          .mutate()
          .headers(headers -> headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED))
          .build()
          .bodyToMono(FORM_TYPE)
          .map(WebClientAuthorizationServerClient::firstValues)
          .defaultIfEmpty(new LinkedHashMap<>())
          .map(body -> new EndpointResponse(status, body));
    }
    return response
        .bodyToMono(String.class)
        .defaultIfEmpty("")
        .map(body -> new EndpointResponse(status, decodeJson(body, contentType)));
  }

  /**
   * Lets 2xx and 4xx token endpoint answers through. A 4xx is the authorization server rejecting
   * the grant; any other status means it could not answer.
   */
  private Mono<EndpointResponse> requireAnswer(EndpointResponse response) {
    var status = response.status();
    if (status.is2xxSuccessful() || status.is4xxClientError()) {
      return Mono.just(response);
    }
    log.error("Token endpoint failed with status {}", status.value());
    return Mono.error(
        new AuthorizationServerException("Token endpoint returned status " + status.value()));
  }

  private OAuth2Data toTokenData(EndpointResponse response) {
    var body = response.body();
    if (response.status().is2xxSuccessful() && body.get("access_token") != null) {
      return OAuth2Data.fromTokenResponse(body);
    }

    var error = body.get("error");
    var description = body.get("error_description");
    log.warn(
        "Token endpoint returned status {} with error {}", response.status().value(), error);
    throw new OAuth2ProtocolException(
        error == null ? "invalid_token_response" : error.toString(),
        description == null ? null : description.toString());
  }

  private Map<String, Object> decodeJson(String body, MediaType contentType) {
    var trimmed = body.trim();
    boolean json =
        (contentType != null && contentType.isCompatibleWith(MediaType.APPLICATION_JSON))
            || trimmed.startsWith("{");
    if (trimmed.isEmpty() || !json) {
      return new LinkedHashMap<>();
    }
    try {
      return objectMapper.readValue(trimmed, MAP_TYPE);
    } catch (JsonProcessingException e) {
      throw new AuthorizationServerException(
          "Malformed JSON response from authorization server", e);
    }
  }

  private static Map<String, Object> firstValues(MultiValueMap<String, String> form) {
    Map<String, Object> values = new LinkedHashMap<>();
    form.forEach((name, list) -> values.put(name, list.isEmpty() ? "" : list.get(0)));
    return values;
  }

  private Throwable unreachable(WebClientRequestException e) {
    log.error("Authorization server request to {} failed: {}", e.getUri(), e.getMessage());
    return new AuthorizationServerException("Authorization server is unreachable", e);
  }

  private record EndpointResponse(HttpStatusCode status, Map<String, Object> body) {}
}
