package com.codeheadsystems.quill.server.revocation;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs {@link RevocationCache#sweep()} on a fixed interval from a single daemon thread.
 * <p>
 * The sweeper owns its thread: {@link #start()} creates it and {@link #stop()} shuts it down and
 * waits briefly for a running sweep to finish. A failed sweep is logged and the schedule
 * continues. In Dropwizard, register it as a {@code Managed} component so it follows the server
 * lifecycle.
 */
public class RevocationSweeper {

  private static final Logger log = LoggerFactory.getLogger(RevocationSweeper.class);

  private static final long STOP_TIMEOUT_SECONDS = 5;

  private final RevocationCache cache;
  private final Duration interval;
  private ScheduledExecutorService executor;

  /**
   * Instantiates a new revocation sweeper.
   *
   * @param cache    the cache to sweep
   * @param interval time between sweeps
   */
  public RevocationSweeper(RevocationCache cache, Duration interval) {
    if (interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("Sweep interval must be positive");
    }
    this.cache = cache;
    this.interval = interval;
  }

  /**
   * Starts the periodic sweep. The first run happens one interval from now.
   *
   * @throws IllegalStateException if already started
   */
  public synchronized void start() {
    if (executor != null) {
      throw new IllegalStateException("Revocation sweeper already started");
    }
    executor = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, "revocation-sweeper");
      t.setDaemon(true);
      return t;
    });
    long millis = interval.toMillis();
    executor.scheduleAtFixedRate(this::runSweep, millis, millis, TimeUnit.MILLISECONDS);
    log.info("Revocation sweeper started, interval={}", interval);
  }

  /**
   * Stops the periodic sweep. Safe to call when not started.
   */
  public synchronized void stop() {
    if (executor == null) {
      return;
    }
    executor.shutdownNow();
    try {
      if (!executor.awaitTermination(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
        log.warn("Revocation sweeper did not terminate within {}s", STOP_TIMEOUT_SECONDS);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } finally {
      executor = null;
    }
    log.info("Revocation sweeper stopped");
  }

  public synchronized boolean isRunning() {
    return executor != null;
  }

  void runSweep() {
    try {
      int purged = cache.sweep();
      log.info("Revocation sweep removed {} expired record(s)", purged);
    } catch (RuntimeException e) {
      // an exception escaping here would cancel every later run
      log.error("Revocation sweep failed", e);
    }
  }
}
