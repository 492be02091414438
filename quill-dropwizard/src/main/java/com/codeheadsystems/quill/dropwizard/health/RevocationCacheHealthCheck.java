package com.codeheadsystems.quill.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.quill.server.revocation.RevocationCache;
import com.codeheadsystems.quill.server.revocation.RevocationCacheState;

/**
 * Health check that reports unhealthy while the revocation cache could not be loaded from the
 * ledger. Tokens revoked before startup are not rejected in that state.
 */
public class RevocationCacheHealthCheck extends HealthCheck {

  private final RevocationCache revocationCache;

  public RevocationCacheHealthCheck(RevocationCache revocationCache) {
    this.revocationCache = revocationCache;
  }

  @Override
  protected Result check() {
    RevocationCacheState state = revocationCache.state();
    if (state != RevocationCacheState.SYNCED) {
      return Result.unhealthy("Revocation cache is %s", state);
    }
    return Result.healthy("%d active revocation(s)", revocationCache.size());
  }
}
