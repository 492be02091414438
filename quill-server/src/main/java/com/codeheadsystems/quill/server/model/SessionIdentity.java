package com.codeheadsystems.quill.server.model;

import java.time.Instant;

/**
 * Identity recovered from a verified, unrevoked session token.
 *
 * @param subjectId account id
 * @param namespace namespace the account belongs to
 * @param username  login name
 * @param email     email address
 * @param role      role label
 * @param issuedAt  token issue time
 * @param expiresAt token expiry
 */
public record SessionIdentity(
    long subjectId,
    AccountNamespace namespace,
    String username,
    String email,
    String role,
    Instant issuedAt,
    Instant expiresAt) {
}
