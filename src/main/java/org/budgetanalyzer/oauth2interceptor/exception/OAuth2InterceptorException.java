package org.budgetanalyzer.oauth2interceptor.exception;

/**
 * Base type for every failure raised by the OAuth2 interceptor pipeline.
 *
 * <p>All subtypes are unchecked. Failures travel through Reactor's error channel and reach the
 * host's {@code WebExceptionHandler} unless a stage recovers from them locally.
 */
public class OAuth2InterceptorException extends RuntimeException {

  public OAuth2InterceptorException(String message) {
    super(message);
  }

  public OAuth2InterceptorException(String message, Throwable cause) {
    super(message, cause);
  }
}
