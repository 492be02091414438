package com.codeheadsystems.quill.server.store;

/**
 * The revocation ledger or the credential store could not be reached, or an operation against it
 * failed or timed out. Retryable; never to be treated as success.
 */
public class StoreUnavailableException extends IllegalStateException {

  public StoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
