package org.budgetanalyzer.oauth2interceptor.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks the post-login target before the authorization callback redirects to it.
 *
 * <p>The target is captured from the request that triggered the login, so it normally is a path
 * on this host. It still lives in a session that other components may write to; anything that
 * could send the user off-site is replaced by a fallback.
 *
 * <p>Accepted: {@code /}, {@code /reports?year=2024}. Rejected: {@code https://evil.example},
 * {@code //evil.example}, {@code /\evil.example}, {@code javascript:alert(1)}, {@code
 * /login?next=https://evil.example}.
 *
 * <p><strong>OWASP Reference:</strong> <a
 * href="https://cheatsheetseries.owasp.org/cheatsheets/Unvalidated_Redirects_and_Forwards_Cheat_Sheet.html">
 * Unvalidated Redirects and Forwards</a>
 */
public final class RedirectUrlValidator {

  private static final Logger log = LoggerFactory.getLogger(RedirectUrlValidator.class);

  private static final int MAX_LOGGED_LENGTH = 200;

  private RedirectUrlValidator() {
    throw new UnsupportedOperationException("Utility class cannot be instantiated");
  }

  /**
   * Returns whether the target is a same-origin path.
   *
   * @param target the stored target
   * @return {@code true} if the target may be used as a redirect location
   */
  public static boolean isSameOriginPath(String target) {
    if (target == null || target.isEmpty()) {
      return false;
    }
    if (!target.startsWith("/") || target.startsWith("//") || target.startsWith("/\\")) {
      log.warn("Rejected login target (not a same-origin path): {}", sanitizeForLog(target));
      return false;
    }
    if (target.contains("://")) {
      log.warn("Rejected login target (contains protocol): {}", sanitizeForLog(target));
      return false;
    }
    return true;
  }

  /**
   * Returns the target when it is safe, the fallback otherwise.
   *
   * @param target the stored target, possibly {@code null}
   * @param fallback location used when the target is missing or unsafe
   * @return a location safe to redirect to
   */
  public static String targetOrDefault(String target, String fallback) {
    return isSameOriginPath(target) ? target : fallback;
  }

  private static String sanitizeForLog(String value) {
    String truncated =
        value.length() > MAX_LOGGED_LENGTH ? value.substring(0, MAX_LOGGED_LENGTH) + "..." : value;
    return truncated.replaceAll("\\p{Cntrl}", "");
  }
}
