package org.budgetanalyzer.oauth2interceptor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.reactive.ReactiveUserDetailsServiceAutoConfiguration;

@SpringBootApplication(
    exclude = {
      // Authentication is handled by the OAuth2 interceptor pipeline, there are no local users
      ReactiveUserDetailsServiceAutoConfiguration.class
    })
// CHECKSTYLE.SUPPRESS: AbbreviationAsWordInName
public class OAuth2InterceptorApplication {

  public static void main(String[] args) {
    SpringApplication.run(OAuth2InterceptorApplication.class, args);
  }
}
