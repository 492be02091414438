package com.codeheadsystems.quill.dropwizard.api;

import com.fasterxml.jackson.annotation.JsonAlias;

/**
 * Login request body.
 *
 * @param identifier username or email; {@code username} and {@code email} are accepted as aliases
 * @param password   plaintext password
 */
public record LoginRequest(@JsonAlias({"username", "email"}) String identifier, String password) {

  @Override
  public String toString() {
    return "LoginRequest[identifier=" + identifier + ", password=<redacted>]";
  }
}
