package org.budgetanalyzer.oauth2interceptor.security;

import java.security.SecureRandom;
import java.util.Objects;
import java.util.Random;

import org.springframework.security.crypto.keygen.StringKeyGenerator;

/**
 * Generates the CSRF {@code state} sent with every authorization request: a mixed-case
 * alphanumeric string of at least {@value #MIN_LENGTH} characters (about 119 bits).
 *
 * <p>The random source is injectable so tests can produce deterministic states.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc6749#section-10.12">RFC 6749, Section
 *     10.12</a>
 */
public class AlphanumericStateKeyGenerator implements StringKeyGenerator {

  public static final int MIN_LENGTH = 20;

  private static final char[] ALPHABET =
      "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz".toCharArray();

  private final Random random;
  private final int length;

  public AlphanumericStateKeyGenerator() {
    this(new SecureRandom(), MIN_LENGTH);
  }

  /**
   * Creates a generator.
   *
   * @param random the random source
   * @param length number of characters per state, at least {@value #MIN_LENGTH}
   */
  public AlphanumericStateKeyGenerator(Random random, int length) {
    if (length < MIN_LENGTH) {
      throw new IllegalArgumentException(
          "State length must be at least " + MIN_LENGTH + " but was " + length);
    }
    this.random = Objects.requireNonNull(random, "random");
    this.length = length;
  }

  @Override
  public String generateKey() {
    var state = new StringBuilder(length);
    for (int i = 0; i < length; i++) {
      state.append(ALPHABET[random.nextInt(ALPHABET.length)]);
    }
    return state.toString();
  }
}
