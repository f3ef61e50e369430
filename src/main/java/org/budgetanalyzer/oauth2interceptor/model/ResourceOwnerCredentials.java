package org.budgetanalyzer.oauth2interceptor.model;

/**
 * Username and password for the resource owner password grant.
 *
 * @param username the resource owner's username
 * @param password the resource owner's password
 */
public record ResourceOwnerCredentials(String username, String password) {

  @Override
  public String toString() {
    return "ResourceOwnerCredentials{username=" + username + ", password=[PROTECTED]}";
  }
}
