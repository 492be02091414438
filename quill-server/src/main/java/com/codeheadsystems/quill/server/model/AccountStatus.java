package com.codeheadsystems.quill.server.model;

/**
 * Account status. Disabled accounts never receive a session token.
 */
public enum AccountStatus {
  ENABLED,
  DISABLED;

  /**
   * Maps the integer status column used by the user tables ({@code 1} = enabled).
   *
   * @param code the stored status code
   * @return the status
   */
  public static AccountStatus fromCode(int code) {
    return code == 1 ? ENABLED : DISABLED;
  }
}
