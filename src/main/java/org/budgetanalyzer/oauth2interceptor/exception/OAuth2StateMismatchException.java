package org.budgetanalyzer.oauth2interceptor.exception;

/**
 * The {@code state} returned on the authorization callback does not equal the state stored in
 * the session. Treated as a forged callback: the code is never exchanged.
 */
// CHECKSTYLE.SUPPRESS: AbbreviationAsWordInName
public class OAuth2StateMismatchException extends OAuth2InterceptorException {

  public OAuth2StateMismatchException(String message) {
    super(message);
  }
}
