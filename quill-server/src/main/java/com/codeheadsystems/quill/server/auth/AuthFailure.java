package com.codeheadsystems.quill.server.auth;

/**
 * Reasons an authentication step can fail. Outward messages deliberately collapse reasons that
 * would otherwise let a caller enumerate accounts or learn why a token was rejected.
 */
public enum AuthFailure {
  BAD_CREDENTIALS("credentials incorrect"),
  ACCOUNT_NOT_FOUND("credentials incorrect"),
  ACCOUNT_DISABLED("account disabled"),
  UNAUTHORIZED("unauthorized"),
  FORBIDDEN("forbidden");

  private final String publicMessage;

  AuthFailure(String publicMessage) {
    this.publicMessage = publicMessage;
  }

  public String publicMessage() {
    return publicMessage;
  }
}
