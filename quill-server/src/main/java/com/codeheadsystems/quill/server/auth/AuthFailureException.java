package com.codeheadsystems.quill.server.auth;

/**
 * Authentication or authorization failure. The exception message is the public message of the
 * {@link AuthFailure}; the precise reason is available to server code through {@link #failure()}.
 */
public class AuthFailureException extends SecurityException {

  private final AuthFailure failure;

  public AuthFailureException(AuthFailure failure) {
    super(failure.publicMessage());
    this.failure = failure;
  }

  public AuthFailure failure() {
    return failure;
  }
}
