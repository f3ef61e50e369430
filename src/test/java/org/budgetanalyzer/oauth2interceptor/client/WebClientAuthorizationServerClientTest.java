package org.budgetanalyzer.oauth2interceptor.client;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.containing;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.notContaining;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import reactor.test.StepVerifier;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;

import org.budgetanalyzer.oauth2interceptor.exception.AuthorizationServerException;
import org.budgetanalyzer.oauth2interceptor.exception.OAuth2ProtocolException;
import org.budgetanalyzer.oauth2interceptor.exception.OAuth2StateMismatchException;
import org.budgetanalyzer.oauth2interceptor.model.AuthorizationRequest;
import org.budgetanalyzer.oauth2interceptor.model.OAuth2Data;
import org.budgetanalyzer.oauth2interceptor.model.OAuth2Params;
import org.budgetanalyzer.oauth2interceptor.model.ResourceOwnerCredentials;

/**
 * Tests for {@link WebClientAuthorizationServerClient} against a WireMock authorization server.
 */
class WebClientAuthorizationServerClientTest {

  private static final String STATE = "abcdefghij0123456789";

  private WireMockServer wireMockServer;

  private WebClientAuthorizationServerClient client;

  private OAuth2Params params;

  @BeforeEach
  void setUp() {
    wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
    wireMockServer.start();

    client = new WebClientAuthorizationServerClient(WebClient.create(), new ObjectMapper());
    params = paramsFor(baseUrl(), false);
  }

  @AfterEach
  void tearDown() {
    wireMockServer.stop();
  }

  private String baseUrl() {
    return "http://localhost:" + wireMockServer.port();
  }

  private static OAuth2Params paramsFor(String baseUrl, boolean authorizationHeader) {
    return OAuth2Params.builder()
        .clientId("test-client")
        .clientSecret("test-secret")
        .scope("openid", "profile")
        .authorizationUri(baseUrl + "/oauth/authorize")
        .accessTokenUri(baseUrl + "/oauth/token")
        .redirectUri("http://app.example/oauth2/callback")
        .tokenInfoUri(baseUrl + "/oauth/tokeninfo")
        .userinfoUri(baseUrl + "/userinfo")
        .authorizationHeader(authorizationHeader)
        .build();
  }

  private static MultiValueMap<String, String> callback(String code, String state) {
    MultiValueMap<String, String> callbackParams = new LinkedMultiValueMap<>();
    if (code != null) {
      callbackParams.add("code", code);
    }
    if (state != null) {
      callbackParams.add("state", state);
    }
    return callbackParams;
  }

  private AuthorizationRequest sentRequest() {
    return client.buildAuthorizationRequest(params, STATE);
  }

  private void stubTokenEndpoint(String contentType, String body) {
    wireMockServer.stubFor(
        post(urlEqualTo("/oauth/token"))
            .willReturn(
                aResponse()
                    .withStatus(200)
                    .withHeader("Content-Type", contentType)
                    .withBody(body)));
  }

  @Test
  void testBuildAuthorizationRequest_carriesAllAuthorizeParameters() {
    // When
    var request = client.buildAuthorizationRequest(params, STATE);

    // Then
    var uri = UriComponentsBuilder.fromUriString(request.uri()).build();
    var query = uri.getQueryParams();
    assertEquals("/oauth/authorize", uri.getPath());
    assertEquals("code", decode(query.getFirst("response_type")));
    assertEquals("test-client", decode(query.getFirst("client_id")));
    assertEquals("http://app.example/oauth2/callback", decode(query.getFirst("redirect_uri")));
    assertEquals("openid profile", decode(query.getFirst("scope")));
    assertEquals(STATE, decode(query.getFirst("state")));
    assertEquals(List.of("openid", "profile"), request.scope());
    assertEquals(STATE, request.state());
  }

  private static String decode(String value) {
    return UriUtils.decode(value, StandardCharsets.UTF_8);
  }

  @Test
  void testExchangeCodeForToken_parsesJsonResponse() {
    // Given
    stubTokenEndpoint(
        "application/json",
        """
        {"access_token": "sesame", "token_type": "bearer", "expires_in": 120,
         "refresh_token": "foo"}
        """);

    // When / Then
    StepVerifier.create(client.exchangeCodeForToken(params, callback("abc", STATE), sentRequest()))
        .assertNext(
            data -> {
              assertEquals("sesame", data.getAccessToken());
              assertEquals("bearer", data.getTokenType());
              assertEquals(120L, data.getExpiresIn());
              assertEquals("foo", data.getRefreshToken());
            })
        .verifyComplete();

    wireMockServer.verify(
        postRequestedFor(urlEqualTo("/oauth/token"))
            .withHeader("Content-Type", containing("application/x-www-form-urlencoded"))
            .withRequestBody(containing("grant_type=authorization_code"))
            .withRequestBody(containing("code=abc"))
            .withRequestBody(containing("client_id=test-client"))
            .withRequestBody(containing("client_secret=test-secret")));
  }

  @Test
  void testExchangeCodeForToken_parsesFormEncodedResponse() {
    // Given
    stubTokenEndpoint(
        "text/plain",
        "access_token=sesame&token_type=bearer&expires_in=120&refresh_token=new%20foo");

    // When / Then
    StepVerifier.create(client.exchangeCodeForToken(params, callback("abc", STATE), sentRequest()))
        .assertNext(
            data -> {
              assertEquals("sesame", data.getAccessToken());
              assertEquals(120L, data.getExpiresIn());
              assertEquals("new foo", data.getRefreshToken());
            })
        .verifyComplete();
  }

  @Test
  void testExchangeCodeForToken_parsesFormContentType() {
    // Given
    stubTokenEndpoint(
        "application/x-www-form-urlencoded;charset=UTF-8",
        "access_token=sesame&refresh_token=a%2Bb&scope=openid+profile");

    // When / Then
    StepVerifier.create(client.exchangeCodeForToken(params, callback("abc", STATE), sentRequest()))
        .assertNext(
            data -> {
              assertEquals("sesame", data.getAccessToken());
              assertEquals("a+b", data.getRefreshToken());
              assertEquals("openid profile", data.getParams().get("scope"));
            })
        .verifyComplete();
  }

  @Test
  void testExchangeCodeForToken_failsWhenTokenEndpointUnavailable() {
    // Given
    wireMockServer.stubFor(
        post(urlEqualTo("/oauth/token")).willReturn(aResponse().withStatus(503)));

    // When / Then
    StepVerifier.create(client.exchangeCodeForToken(params, callback("abc", STATE), sentRequest()))
        .expectError(AuthorizationServerException.class)
        .verify();
  }

  @Test
  void testExchangeCodeForToken_sendsBasicAuthWhenConfigured() {
    // Given
    params = paramsFor(baseUrl(), true);
    stubTokenEndpoint("application/json", "{\"access_token\": \"sesame\"}");
    var expected =
        "Basic "
            + Base64.getEncoder()
                .encodeToString("test-client:test-secret".getBytes(StandardCharsets.UTF_8));

    // When / Then
    StepVerifier.create(client.exchangeCodeForToken(params, callback("abc", STATE), sentRequest()))
        .expectNextCount(1)
        .verifyComplete();

    wireMockServer.verify(
        postRequestedFor(urlEqualTo("/oauth/token"))
            .withHeader("Authorization", equalTo(expected))
            .withRequestBody(notContaining("client_secret")));
  }

  @Test
  void testExchangeCodeForToken_failsWithProviderError() {
    // Given
    wireMockServer.stubFor(
        post(urlEqualTo("/oauth/token"))
            .willReturn(
                aResponse().withStatus(400).withBody("error=fail&error_description=invalid")));

    // When / Then
    StepVerifier.create(client.exchangeCodeForToken(params, callback("abc", STATE), sentRequest()))
        .expectErrorSatisfies(
            error -> {
              var protocolError = (OAuth2ProtocolException) error;
              assertEquals("fail", protocolError.getError());
              assertEquals("invalid", protocolError.getErrorDescription());
            })
        .verify();
  }

  @Test
  void testExchangeCodeForToken_failsOnErrorCallbackWithoutCallingServer() {
    // Given
    MultiValueMap<String, String> callbackParams = new LinkedMultiValueMap<>();
    callbackParams.add("error", "access_denied");
    callbackParams.add("error_description", "User said no");

    // When / Then
    StepVerifier.create(client.exchangeCodeForToken(params, callbackParams, null))
        .expectErrorSatisfies(
            error -> {
              var protocolError = (OAuth2ProtocolException) error;
              assertEquals("access_denied", protocolError.getError());
              assertEquals("User said no", protocolError.getErrorDescription());
            })
        .verify();
    wireMockServer.verify(0, postRequestedFor(urlEqualTo("/oauth/token")));
  }

  @Test
  void testExchangeCodeForToken_failsOnStateMismatch() {
    StepVerifier.create(
            client.exchangeCodeForToken(params, callback("abc", "other-state"), sentRequest()))
        .expectError(OAuth2StateMismatchException.class)
        .verify();
    wireMockServer.verify(0, postRequestedFor(urlEqualTo("/oauth/token")));
  }

  @Test
  void testExchangeCodeForToken_failsWithoutStoredState() {
    StepVerifier.create(client.exchangeCodeForToken(params, callback("abc", STATE), null))
        .expectError(OAuth2StateMismatchException.class)
        .verify();
  }

  @Test
  void testExchangeCodeForToken_failsWithoutCode() {
    StepVerifier.create(client.exchangeCodeForToken(params, callback(null, STATE), sentRequest()))
        .expectError(OAuth2ProtocolException.class)
        .verify();
  }

  @Test
  void testRequestPasswordToken_sendsResourceOwnerCredentials() {
    // Given
    stubTokenEndpoint("application/json", "{\"access_token\": \"sesame\", \"expires_in\": 60}");

    // When / Then
    StepVerifier.create(
            client.requestPasswordToken(params, new ResourceOwnerCredentials("alice", "s3cret")))
        .assertNext(data -> assertEquals("sesame", data.getAccessToken()))
        .verifyComplete();

    wireMockServer.verify(
        postRequestedFor(urlEqualTo("/oauth/token"))
            .withRequestBody(containing("grant_type=password"))
            .withRequestBody(containing("username=alice"))
            .withRequestBody(containing("password=s3cret"))
            .withRequestBody(containing("scope=openid+profile")));
  }

  @Test
  void testRequestPasswordToken_failsWithProviderError() {
    // Given
    wireMockServer.stubFor(
        post(urlEqualTo("/oauth/token"))
            .willReturn(
                aResponse()
                    .withStatus(401)
                    .withHeader("Content-Type", "application/json")
                    .withBody("{\"error\": \"invalid_grant\"}")));

    // When / Then
    StepVerifier.create(
            client.requestPasswordToken(params, new ResourceOwnerCredentials("alice", "wrong")))
        .expectErrorSatisfies(
            error -> assertEquals("invalid_grant", ((OAuth2ProtocolException) error).getError()))
        .verify();
  }

  @Test
  void testRefreshAccessToken_returnsSuccessWithResponseBody() {
    // Given
    stubTokenEndpoint(
        "application/json",
        "{\"access_token\": \"sesame\", \"expires_in\": 120, \"refresh_token\": \"new-foo\"}");

    // When / Then
    StepVerifier.create(client.refreshAccessToken("foo", params))
        .assertNext(
            result -> {
              assertTrue(result.succeeded());
              assertEquals(
                  Map.of("access_token", "sesame", "expires_in", 120, "refresh_token", "new-foo"),
                  result.body());
            })
        .verifyComplete();

    wireMockServer.verify(
        postRequestedFor(urlEqualTo("/oauth/token"))
            .withRequestBody(containing("grant_type=refresh_token"))
            .withRequestBody(containing("refresh_token=foo")));
  }

  @Test
  void testRefreshAccessToken_returnsFailureOnRejection() {
    // Given
    wireMockServer.stubFor(
        post(urlEqualTo("/oauth/token"))
            .willReturn(
                aResponse()
                    .withStatus(400)
                    .withHeader("Content-Type", "application/json")
                    .withBody("{\"error\": \"invalid_grant\"}")));

    // When / Then
    StepVerifier.create(client.refreshAccessToken("foo", params))
        .assertNext(
            result -> {
              assertFalse(result.succeeded());
              assertEquals("invalid_grant", result.body().get("error"));
            })
        .verifyComplete();
  }

  @Test
  void testRefreshAccessToken_failsWhenTokenEndpointUnavailable() {
    // Given
    wireMockServer.stubFor(
        post(urlEqualTo("/oauth/token"))
            .willReturn(
                aResponse()
                    .withStatus(503)
                    .withHeader("Content-Type", "text/html")
                    .withBody("<html>Service Unavailable</html>")));

    // When / Then
    StepVerifier.create(client.refreshAccessToken("foo", params))
        .expectError(AuthorizationServerException.class)
        .verify();
  }

  @Test
  void testRefreshAccessToken_failsOnServerErrorWithOAuth2Body() {
    // Given
    wireMockServer.stubFor(
        post(urlEqualTo("/oauth/token"))
            .willReturn(
                aResponse()
                    .withStatus(500)
                    .withHeader("Content-Type", "application/json")
                    .withBody("{\"error\": \"server_error\"}")));

    // When / Then
    StepVerifier.create(client.refreshAccessToken("foo", params))
        .expectError(AuthorizationServerException.class)
        .verify();
  }

  @Test
  void testRefreshAccessToken_failsWithoutRefreshTokenWithoutCallingServer() {
    StepVerifier.create(client.refreshAccessToken(null, params))
        .assertNext(result -> assertFalse(result.succeeded()))
        .verifyComplete();

    wireMockServer.verify(0, postRequestedFor(urlEqualTo("/oauth/token")));
  }

  @Test
  void testIntrospectToken_validOnSuccessStatus() {
    // Given
    wireMockServer.stubFor(
        get(urlPathEqualTo("/oauth/tokeninfo"))
            .withQueryParam("access_token", equalTo("always valid"))
            .willReturn(aResponse().withStatus(200).withBody("{}")));

    // When / Then
    StepVerifier.create(client.introspectToken(baseUrl() + "/oauth/tokeninfo", "always valid"))
        .expectNext(true)
        .verifyComplete();
  }

  @Test
  void testIntrospectToken_invalidOnClientErrorStatus() {
    // Given
    wireMockServer.stubFor(
        get(urlPathEqualTo("/oauth/tokeninfo"))
            .willReturn(aResponse().withStatus(400).withBody("{\"error\": \"invalid_token\"}")));

    // When / Then
    StepVerifier.create(client.introspectToken(baseUrl() + "/oauth/tokeninfo", "expired"))
        .expectNext(false)
        .verifyComplete();
  }

  @Test
  void testIntrospectToken_failsOnServerError() {
    // Given
    wireMockServer.stubFor(
        get(urlPathEqualTo("/oauth/tokeninfo")).willReturn(aResponse().withStatus(503)));

    // When / Then
    StepVerifier.create(client.introspectToken(baseUrl() + "/oauth/tokeninfo", "token"))
        .expectError(AuthorizationServerException.class)
        .verify();
  }

  @Test
  void testIntrospectToken_failsWhenServerUnreachable() throws IOException {
    // Given
    int closedPort;
    try (var socket = new ServerSocket(0)) {
      closedPort = socket.getLocalPort();
    }

    // When / Then
    StepVerifier.create(
            client.introspectToken("http://localhost:" + closedPort + "/oauth/tokeninfo", "token"))
        .expectError(AuthorizationServerException.class)
        .verify();
  }

  @Test
  void testFetchUserinfo_mergesUserinfoUsingBearerToken() {
    // Given
    wireMockServer.stubFor(
        get(urlEqualTo("/userinfo"))
            .willReturn(
                aResponse()
                    .withStatus(200)
                    .withHeader("Content-Type", "application/json")
                    .withBody("{\"sub\": \"user-1\", \"email\": \"user@example.com\"}")));
    var data = OAuth2Data.of(Map.of("access-token", "sesame"));

    // When / Then
    StepVerifier.create(client.fetchUserinfo(data, params))
        .assertNext(
            withUserinfo -> {
              assertEquals("sesame", withUserinfo.getAccessToken());
              assertEquals("user-1", withUserinfo.getUserinfo().get("sub"));
              assertEquals("user@example.com", withUserinfo.getUserinfo().get("email"));
            })
        .verifyComplete();

    wireMockServer.verify(
        getRequestedFor(urlEqualTo("/userinfo"))
            .withHeader("Authorization", equalTo("Bearer sesame")));
  }

  @Test
  void testFetchUserinfo_returnsDataUnchangedWithoutUserinfoUri() {
    // Given
    var withoutUserinfo =
        OAuth2Params.builder()
            .clientId("test-client")
            .authorizationUri(baseUrl() + "/oauth/authorize")
            .accessTokenUri(baseUrl() + "/oauth/token")
            .redirectUri("/oauth2/callback")
            .build();
    var data = OAuth2Data.of(Map.of("access-token", "sesame"));

    // When / Then
    StepVerifier.create(client.fetchUserinfo(data, withoutUserinfo))
        .expectNext(data)
        .verifyComplete();
    wireMockServer.verify(0, getRequestedFor(urlEqualTo("/userinfo")));
  }
}
