package com.codeheadsystems.quill.server.store;

import java.time.Instant;
import java.util.Map;

/**
 * Durable record of revoked session tokens. This is the source of truth for revocation; any
 * in-process copy is derived from it.
 * <p>
 * Implementations must be thread-safe. Every method signals I/O failure (including timeouts)
 * with {@link StoreUnavailableException}.
 */
public interface RevocationLedger {

  /**
   * Prepares the backing table. Idempotent; safe to call on every boot and before first use.
   */
  void initialize();

  /**
   * Durably records a revoked token. Returns only once the write is committed.
   *
   * @param token     the token string as issued
   * @param subjectId id of the account owning the token
   * @param expiresAt expiry copied from the token
   * @param reason    reason tag
   */
  void record(String token, long subjectId, Instant expiresAt, String reason);

  /**
   * Whether the token has a revocation record.
   *
   * @param token the token string
   * @return true if revoked
   */
  boolean contains(String token);

  /**
   * Deletes records whose copied expiry is before {@code now}.
   *
   * @param now the cut-off
   * @return number of records removed
   */
  int purgeExpired(Instant now);

  /**
   * Loads every record that has not yet expired.
   *
   * @param now the cut-off
   * @return token to expiry, for all records expiring after {@code now}
   */
  Map<String, Instant> loadActive(Instant now);
}
