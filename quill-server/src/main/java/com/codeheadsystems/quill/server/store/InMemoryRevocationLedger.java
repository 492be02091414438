package com.codeheadsystems.quill.server.store;

import com.codeheadsystems.quill.server.model.RevocationRecord;
import java.time.Clock;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link RevocationLedger}.
 * <p>
 * Revocations are lost on restart, which un-revokes every token that has not yet expired.
 * Suitable for development and integration testing only.
 */
public class InMemoryRevocationLedger implements RevocationLedger {

  private static final Logger log = LoggerFactory.getLogger(InMemoryRevocationLedger.class);

  private final ConcurrentHashMap<String, RevocationRecord> records = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryRevocationLedger() {
    this(Clock.systemUTC());
  }

  public InMemoryRevocationLedger(Clock clock) {
    this.clock = clock;
    log.warn("Using InMemoryRevocationLedger, revocations will NOT survive restarts. "
        + "Replace with a persistent RevocationLedger for production.");
  }

  @Override
  public void initialize() {
    // nothing to create
  }

  @Override
  public void record(String token, long subjectId, Instant expiresAt, String reason) {
    records.put(token, new RevocationRecord(token, subjectId, expiresAt, reason, clock.instant()));
  }

  @Override
  public boolean contains(String token) {
    return records.containsKey(token);
  }

  @Override
  public int purgeExpired(Instant now) {
    int removed = 0;
    for (Iterator<RevocationRecord> it = records.values().iterator(); it.hasNext(); ) {
      if (it.next().expiresAt().isBefore(now)) {
        it.remove();
        removed++;
      }
    }
    return removed;
  }

  @Override
  public Map<String, Instant> loadActive(Instant now) {
    return records.values().stream()
        .filter(r -> r.expiresAt().isAfter(now))
        .collect(Collectors.toMap(RevocationRecord::token, RevocationRecord::expiresAt));
  }
}
