package org.budgetanalyzer.oauth2interceptor.exception;

/**
 * Raised at startup when the interceptor configuration is missing a required value or carries a
 * value of an unsupported shape. Never raised per request.
 */
// CHECKSTYLE.SUPPRESS: AbbreviationAsWordInName
public class OAuth2ConfigurationException extends OAuth2InterceptorException {

  public OAuth2ConfigurationException(String message) {
    super(message);
  }
}
