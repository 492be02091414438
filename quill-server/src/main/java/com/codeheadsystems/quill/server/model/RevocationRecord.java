package com.codeheadsystems.quill.server.model;

import java.time.Instant;

/**
 * A durable revocation entry.
 *
 * @param token     the token string exactly as issued
 * @param subjectId account id the token belongs to
 * @param expiresAt expiry copied from the token; the record is purgeable after this time
 * @param reason    why it was revoked
 * @param revokedAt when it was revoked
 */
public record RevocationRecord(
    String token,
    long subjectId,
    Instant expiresAt,
    String reason,
    Instant revokedAt) {
}
