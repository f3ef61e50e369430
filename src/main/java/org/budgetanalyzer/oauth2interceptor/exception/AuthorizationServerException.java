package org.budgetanalyzer.oauth2interceptor.exception;

/**
 * The authorization server could not be reached or answered in a way that is neither a success
 * nor an OAuth2 rejection (connection refused, timeout, 5xx on introspection).
 *
 * <p>Never retried inside the pipeline and never mistaken for an invalid token.
 */
public class AuthorizationServerException extends OAuth2InterceptorException {

  public AuthorizationServerException(String message) {
    super(message);
  }

  public AuthorizationServerException(String message, Throwable cause) {
    super(message, cause);
  }
}
