package org.budgetanalyzer.oauth2interceptor.exception;

/**
 * The authorization server answered with an OAuth2 error ({@code error} and optionally {@code
 * error_description}) instead of a code or a token.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc6749#section-5.2">RFC 6749, Section
 *     5.2</a>
 */
// CHECKSTYLE.SUPPRESS: AbbreviationAsWordInName
public class OAuth2ProtocolException extends OAuth2InterceptorException {

  private final String error;
  private final String errorDescription;

  public OAuth2ProtocolException(String error, String errorDescription) {
    super(
        errorDescription == null
            ? "Authorization server returned error: " + error
            : "Authorization server returned error: " + error + " (" + errorDescription + ")");
    this.error = error;
    this.errorDescription = errorDescription;
  }

  public String getError() {
    return error;
  }

  public String getErrorDescription() {
    return errorDescription;
  }
}
