package org.budgetanalyzer.oauth2interceptor.security;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

import org.budgetanalyzer.oauth2interceptor.exception.OAuth2ConfigurationException;

/**
 * Decides which request paths bypass OAuth2 processing entirely.
 *
 * <p>One variant per supported configuration shape:
 *
 * <ul>
 *   <li>{@link None}: nothing is excluded
 *   <li>{@link Exact}: a single path, compared with {@code equals}
 *   <li>{@link AnyOf}: membership in a set of paths
 *   <li>{@link Matching}: full match against a regular expression
 *   <li>{@link Custom}: an arbitrary predicate over the path
 *   <li>{@link Either}: two specs combined with "or"
 * </ul>
 *
 * <p>Matching is side-effect free; calling {@link #isExcluded(String)} repeatedly with the same
 * path yields the same answer.
 */
public sealed interface ExclusionSpec
    permits ExclusionSpec.None,
        ExclusionSpec.Exact,
        ExclusionSpec.AnyOf,
        ExclusionSpec.Matching,
        ExclusionSpec.Custom,
        ExclusionSpec.Either {

  /**
   * Returns whether the path is exempt from OAuth2 processing.
   *
   * @param path the request path
   * @return {@code true} if the request must reach the downstream handler untouched
   */
  boolean isExcluded(String path);

  static ExclusionSpec none() {
    return None.INSTANCE;
  }

  static ExclusionSpec exact(String path) {
    return new Exact(path);
  }

  static ExclusionSpec anyOf(Collection<String> paths) {
    return new AnyOf(Set.copyOf(paths));
  }

  static ExclusionSpec pattern(Pattern pattern) {
    return new Matching(pattern);
  }

  static ExclusionSpec predicate(Predicate<String> predicate) {
    return new Custom(predicate);
  }

  default ExclusionSpec or(ExclusionSpec other) {
    if (other instanceof None) {
      return this;
    }
    if (this instanceof None) {
      return other;
    }
    return new Either(this, other);
  }

  /**
   * Converts a loosely typed configuration value into a spec.
   *
   * <p>Accepts {@code null} (nothing excluded), a {@link String}, a {@link Collection} of strings,
   * a {@link Pattern}, a {@link Predicate} or an existing {@link ExclusionSpec}.
   *
   * @param value the configured value
   * @return the matching spec
   * @throws OAuth2ConfigurationException if the value has any other shape
   */
  @SuppressWarnings("unchecked")
  static ExclusionSpec from(Object value) {
    if (value == null) {
      return none();
    }
    if (value instanceof ExclusionSpec spec) {
      return spec;
    }
    if (value instanceof String path) {
      return exact(path);
    }
    if (value instanceof Pattern pattern) {
      return pattern(pattern);
    }
    if (value instanceof Predicate<?> predicate) {
      return predicate((Predicate<String>) predicate);
    }
    if (value instanceof Collection<?> collection) {
      Set<String> paths = new LinkedHashSet<>();
      for (Object element : collection) {
        if (!(element instanceof String path)) {
          throw new OAuth2ConfigurationException(
              "Exclusion collections may only contain strings, found: "
                  + (element == null ? "null" : element.getClass().getName()));
        }
        paths.add(path);
      }
      return anyOf(paths);
    }
    throw new OAuth2ConfigurationException(
        "Unsupported exclusion spec type: " + value.getClass().getName());
  }

  /** Excludes nothing. */
  final class None implements ExclusionSpec {

    private static final None INSTANCE = new None();

    private None() {}

    @Override
    public boolean isExcluded(String path) {
      return false;
    }

    @Override
    public String toString() {
      return "ExclusionSpec.None";
    }
  }

  record Exact(String path) implements ExclusionSpec {

    public Exact {
      Objects.requireNonNull(path, "path");
    }

    @Override
    public boolean isExcluded(String candidate) {
      return path.equals(candidate);
    }
  }

  record AnyOf(Set<String> paths) implements ExclusionSpec {

    @Override
    public boolean isExcluded(String candidate) {
      return candidate != null && paths.contains(candidate);
    }
  }

  record Matching(Pattern pattern) implements ExclusionSpec {

    public Matching {
      Objects.requireNonNull(pattern, "pattern");
    }

    @Override
    public boolean isExcluded(String candidate) {
      return candidate != null && pattern.matcher(candidate).matches();
    }
  }

  record Custom(Predicate<String> predicate) implements ExclusionSpec {

    public Custom {
      Objects.requireNonNull(predicate, "predicate");
    }

    @Override
    public boolean isExcluded(String candidate) {
      return predicate.test(candidate);
    }
  }

  record Either(ExclusionSpec first, ExclusionSpec second) implements ExclusionSpec {

    @Override
    public boolean isExcluded(String candidate) {
      return first.isExcluded(candidate) || second.isExcluded(candidate);
    }
  }
}
