package org.budgetanalyzer.oauth2interceptor.config;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;

/** Shared WireMock server standing in for both the authorization server and the proxied API. */
@TestConfiguration(proxyBeanMethods = false)
public class WireMockConfig {

  private static WireMockServer wireMockServer;

  static {
    wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
    wireMockServer.start();
  }

  @Bean(destroyMethod = "stop")
  public WireMockServer wireMockServer() {
    return wireMockServer;
  }

  public static WireMockServer getWireMockServer() {
    return wireMockServer;
  }

  public static String baseUrl() {
    return "http://localhost:" + wireMockServer.port();
  }
}
