package com.codeheadsystems.quill.server.revocation;

import com.codeheadsystems.quill.server.store.RevocationLedger;
import com.codeheadsystems.quill.server.store.StoreUnavailableException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-local mirror of the {@link RevocationLedger}: the set of revoked token strings that have
 * not yet expired.
 * <p>
 * One instance per process, constructed at startup and handed to whoever checks or revokes
 * tokens. The ledger is authoritative and the mirror may be thrown away and rebuilt at any time.
 * <ul>
 *   <li>Revocation is write-through: the ledger write must commit before the token enters the
 *       mirror. If the write fails or times out, the token is not revoked and the caller gets a
 *       {@link StoreUnavailableException}.</li>
 *   <li>Reloads build a complete new map and swap it in atomically; readers never see a partial
 *       one. Tokens revoked while a reload is in flight are carried into the new map.</li>
 *   <li>No lock is held across ledger I/O.</li>
 * </ul>
 * <p>
 * With {@code confirmMisses} set, a token absent from the mirror is looked up in the ledger
 * before it is reported as not revoked. This is required when several processes share one
 * ledger, since each mirror only sees its own revocations between reloads. If that lookup fails
 * the token is reported as not revoked: availability is preferred over strict enforcement while
 * the ledger is unreachable.
 */
public class RevocationCache {

  private static final Logger log = LoggerFactory.getLogger(RevocationCache.class);

  /**
   * How long a revocation found in the ledger on a cache miss stays mirrored when its real
   * expiry is unknown. The next reload replaces it with the ledger's own expiry.
   */
  static final Duration CONFIRMED_ENTRY_TTL = Duration.ofHours(1);

  private final RevocationLedger ledger;
  private final Clock clock;
  private final boolean confirmMisses;

  private final AtomicReference<ConcurrentHashMap<String, Instant>> revoked =
      new AtomicReference<>(new ConcurrentHashMap<>());
  private volatile RevocationCacheState state = RevocationCacheState.UNINITIALIZED;

  /**
   * Instantiates a new revocation cache.
   *
   * @param ledger        the authoritative ledger
   * @param clock         time source for expiry comparisons
   * @param confirmMisses whether a cache miss is confirmed against the ledger
   */
  public RevocationCache(RevocationLedger ledger, Clock clock, boolean confirmMisses) {
    this.ledger = ledger;
    this.clock = clock;
    this.confirmMisses = confirmMisses;
  }

  /**
   * Creates the ledger table if needed and loads the active revocations. A ledger failure leaves
   * the cache {@link RevocationCacheState#DEGRADED} rather than failing startup.
   *
   * @return the resulting state
   */
  public RevocationCacheState initialize() {
    try {
      ledger.initialize();
      replaceWith(ledger.loadActive(clock.instant()));
      state = RevocationCacheState.SYNCED;
      log.info("Revocation cache synced with ledger, {} active revocation(s)", size());
    } catch (StoreUnavailableException e) {
      state = RevocationCacheState.DEGRADED;
      log.warn("Revocation ledger unavailable at startup; serving with an empty revocation cache. "
          + "Tokens revoked earlier are only rejected once the ledger is reachable again: {}",
          e.getMessage());
    }
    return state;
  }

  /**
   * Revokes a token: ledger first, then the in-memory set.
   *
   * @param token     token string as issued
   * @param subjectId id of the account owning the token
   * @param expiresAt the token's own expiry
   * @param reason    reason tag
   * @throws StoreUnavailableException if the ledger write fails; the token is then not revoked
   */
  public void revoke(String token, long subjectId, Instant expiresAt, String reason) {
    ledger.record(token, subjectId, expiresAt, reason);
    ConcurrentHashMap<String, Instant> current;
    do {
      current = revoked.get();
      current.put(token, expiresAt);
    } while (current != revoked.get());
    log.debug("Revoked token for subject={} reason={}", subjectId, reason);
  }

  /**
   * Whether the token is revoked.
   *
   * @param token token string
   * @return true if revoked
   */
  public boolean isRevoked(String token) {
    Instant expiresAt = revoked.get().get(token);
    if (expiresAt != null) {
      return true;
    }
    if (!confirmMisses) {
      return false;
    }
    try {
      if (ledger.contains(token)) {
        revoked.get().putIfAbsent(token, clock.instant().plus(CONFIRMED_ENTRY_TTL));
        return true;
      }
      return false;
    } catch (StoreUnavailableException e) {
      log.warn("Revocation ledger unavailable, accepting cache miss as not revoked: {}", e.getMessage());
      return false;
    }
  }

  /**
   * Replaces the in-memory set with the ledger's current active revocations.
   *
   * @throws StoreUnavailableException if the ledger cannot be read; the current set is kept and
   *                                   the cache becomes {@link RevocationCacheState#DEGRADED}
   */
  public void reload() {
    Map<String, Instant> active;
    try {
      active = ledger.loadActive(clock.instant());
    } catch (StoreUnavailableException e) {
      degrade("reload", e);
      throw e;
    }
    replaceWith(active);
    if (state != RevocationCacheState.SYNCED) {
      log.info("Revocation cache re-synced with ledger");
    }
    state = RevocationCacheState.SYNCED;
  }

  /**
   * Purges expired ledger records and reloads the in-memory set.
   *
   * @return number of ledger records purged
   * @throws StoreUnavailableException if the ledger cannot be reached; the cache becomes
   *                                   {@link RevocationCacheState#DEGRADED}
   */
  public int sweep() {
    int purged;
    try {
      purged = ledger.purgeExpired(clock.instant());
    } catch (StoreUnavailableException e) {
      degrade("purge", e);
      throw e;
    }
    reload();
    log.debug("Revocation sweep purged {} record(s), {} active", purged, size());
    return purged;
  }

  public RevocationCacheState state() {
    return state;
  }

  /**
   * Number of tokens currently mirrored.
   *
   * @return the size
   */
  public int size() {
    return revoked.get().size();
  }

  private void degrade(String operation, StoreUnavailableException e) {
    if (state != RevocationCacheState.DEGRADED) {
      log.warn("Revocation ledger {} failed, cache is now degraded: {}", operation, e.getMessage());
    }
    state = RevocationCacheState.DEGRADED;
  }

  private void replaceWith(Map<String, Instant> active) {
    Instant now = clock.instant();
    ConcurrentHashMap<String, Instant> fresh = new ConcurrentHashMap<>(active);
    ConcurrentHashMap<String, Instant> previous = revoked.getAndSet(fresh);
    // Revocations that landed in the old map while the ledger was being read.
    previous.forEach((token, expiresAt) -> {
      if (expiresAt.isAfter(now)) {
        fresh.putIfAbsent(token, expiresAt);
      }
    });
  }
}
