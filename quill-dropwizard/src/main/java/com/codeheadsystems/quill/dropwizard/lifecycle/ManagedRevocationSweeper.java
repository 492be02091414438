package com.codeheadsystems.quill.dropwizard.lifecycle;

import com.codeheadsystems.quill.server.revocation.RevocationSweeper;
import io.dropwizard.lifecycle.Managed;

/**
 * Ties the {@link RevocationSweeper} thread to the Dropwizard server lifecycle.
 */
public class ManagedRevocationSweeper implements Managed {

  private final RevocationSweeper sweeper;

  public ManagedRevocationSweeper(RevocationSweeper sweeper) {
    this.sweeper = sweeper;
  }

  @Override
  public void start() {
    sweeper.start();
  }

  @Override
  public void stop() {
    sweeper.stop();
  }
}
