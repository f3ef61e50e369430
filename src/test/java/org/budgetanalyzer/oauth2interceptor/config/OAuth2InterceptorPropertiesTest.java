package org.budgetanalyzer.oauth2interceptor.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import org.budgetanalyzer.oauth2interceptor.exception.OAuth2ConfigurationException;

// CHECKSTYLE.SUPPRESS: AbbreviationAsWordInName
class OAuth2InterceptorPropertiesTest {

  private OAuth2InterceptorProperties properties;

  @BeforeEach
  void setUp() {
    properties = new OAuth2InterceptorProperties();
    properties.setClientId("test-client");
    properties.setClientSecret("test-secret");
    properties.setScope(List.of("openid", "profile"));
    properties.setAuthorizationUri("https://auth.example.com/oauth/authorize");
    properties.setAccessTokenUri("https://auth.example.com/oauth/token");
    properties.setRedirectUri("https://app.example.com/oauth2/callback");
  }

  @Test
  void testToParams_carriesBoundValues() {
    // Given
    properties.setTokenInfoUri("");
    properties.setAuthorizationHeader(true);

    // When
    var params = properties.toParams();

    // Then
    assertEquals("test-client", params.getClientId());
    assertEquals(List.of("openid", "profile"), params.getScope());
    assertEquals("/oauth2/callback", params.getRedirectPath());
    assertNull(params.getTokenInfoUri());
    assertTrue(params.isAuthorizationHeader());
    assertEquals("/", params.getLogoutCallbackRedirect());
  }

  @Test
  void testToParams_combinesExcludeListAndPattern() {
    // Given
    properties.setExclude(List.of("/public"));
    properties.setExcludePattern("/actuator(/.*)?");

    // When
    var params = properties.toParams();

    // Then
    assertTrue(params.isExcluded("/public"));
    assertTrue(params.isExcluded("/actuator"));
    assertTrue(params.isExcluded("/actuator/health"));
    assertFalse(params.isExcluded("/public/page"));
    assertFalse(params.isExcluded("/reports"));
  }

  @Test
  void testToParams_withoutExclusionsExcludesNothing() {
    assertFalse(properties.toParams().isExcluded("/actuator/health"));
  }

  @Test
  void testToParams_rejectsInvalidPattern() {
    properties.setExcludePattern("/actuator(");

    assertThrows(OAuth2ConfigurationException.class, () -> properties.toParams());
  }

  @Test
  void testToParams_rejectsMissingClientId() {
    properties.setClientId("");

    var exception = assertThrows(OAuth2ConfigurationException.class, () -> properties.toParams());

    assertTrue(exception.getMessage().contains("client-id"));
  }

  @Test
  void testDefaults() {
    var defaults = new OAuth2InterceptorProperties();

    assertEquals(20, defaults.getStateLength());
    assertTrue(defaults.getSession().isRedisEnabled());
    assertEquals("SESSION", defaults.getSession().getCookieName());
    assertEquals(5, defaults.getHttp().getConnectTimeout().toSeconds());
    assertEquals(10, defaults.getHttp().getResponseTimeout().toSeconds());
  }
}
