package com.codeheadsystems.quill.server.model;

import java.time.Instant;

/**
 * An account record as held by the credential store.
 *
 * @param id           numeric id, unique within the namespace
 * @param namespace    end-user or admin
 * @param username     login name
 * @param email        email address, unique within the namespace
 * @param passwordHash one-way hash of the password; never leaves the server
 * @param status       enabled or disabled
 * @param role         role label ({@code user} for end-users)
 * @param createdAt    creation time
 * @param lastLoginAt  last successful login, or null
 */
public record Account(
    long id,
    AccountNamespace namespace,
    String username,
    String email,
    String passwordHash,
    AccountStatus status,
    String role,
    Instant createdAt,
    Instant lastLoginAt) {

  /**
   * Role label carried by every end-user account.
   */
  public static final String END_USER_ROLE = "user";

  public boolean enabled() {
    return status == AccountStatus.ENABLED;
  }

  /**
   * Copy with a new last-login time.
   *
   * @param when the login time
   * @return the updated account
   */
  public Account withLastLoginAt(Instant when) {
    return new Account(id, namespace, username, email, passwordHash, status, role, createdAt, when);
  }

  /**
   * Sanitized view without the password hash.
   *
   * @return the view
   */
  public AccountView toView() {
    return new AccountView(id, namespace, username, email, role, status, createdAt, lastLoginAt);
  }

  @Override
  public String toString() {
    return "Account[id=" + id + ", namespace=" + namespace + ", username=" + username
        + ", status=" + status + ", role=" + role + ", passwordHash=<redacted>]";
  }
}
