package com.codeheadsystems.quill.server.revocation;

/**
 * Lifecycle of the in-process revocation mirror.
 */
public enum RevocationCacheState {
  /**
   * Not yet loaded from the ledger.
   */
  UNINITIALIZED,
  /**
   * Loaded from the ledger; kept current by write-through and periodic reloads.
   */
  SYNCED,
  /**
   * The last ledger access by startup, a reload or a sweep failed. After a failed startup the
   * mirror is empty; after a failed reload or sweep it keeps the set it last loaded plus local
   * revocations. Either way revocations made by other processes since are only rejected if a
   * ledger confirmation on cache miss succeeds. The next successful reload returns to
   * {@link #SYNCED}.
   */
  DEGRADED
}
