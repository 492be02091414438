package com.codeheadsystems.quill.server.model;

import java.time.Instant;

/**
 * Account data that is safe to hand to callers: everything but the password hash.
 *
 * @param id          account id
 * @param namespace   end-user or admin
 * @param username    login name
 * @param email       email address
 * @param role        role label
 * @param status      enabled or disabled
 * @param createdAt   creation time
 * @param lastLoginAt last successful login, or null
 */
public record AccountView(
    long id,
    AccountNamespace namespace,
    String username,
    String email,
    String role,
    AccountStatus status,
    Instant createdAt,
    Instant lastLoginAt) {
}
