package com.codeheadsystems.tessera.store;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically purges expired sessions from a backend on a single daemon thread.
 * <p>
 * Runs on its own cadence, independent of request traffic. Call {@link #shutdown()} when the
 * application stops. In Dropwizard, wrap it in a {@code Managed}; in Spring Boot, declare the bean
 * with {@code @Bean(destroyMethod = "shutdown")}.
 */
public class SessionReaper implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(SessionReaper.class);

  private final ExpiredSessionPurger purger;
  private final Duration interval;
  private final ScheduledExecutorService executor;
  private boolean started;

  /**
   * Instantiates a new Session reaper. Nothing runs until {@link #start()}.
   *
   * @param purger     the backend to purge
   * @param interval   time between sweeps
   * @param threadName name of the sweeper thread
   */
  public SessionReaper(ExpiredSessionPurger purger, Duration interval, String threadName) {
    if (interval == null || interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("interval must be positive");
    }
    this.purger = purger;
    this.interval = interval;
    this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, threadName);
      t.setDaemon(true);
      return t;
    });
  }

  /**
   * Schedules the sweep. Calling it again has no effect.
   */
  public synchronized void start() {
    if (started) {
      return;
    }
    started = true;
    long millis = interval.toMillis();
    executor.scheduleAtFixedRate(this::sweep, millis, millis, TimeUnit.MILLISECONDS);
    log.debug("Session reaper started, interval={}", interval);
  }

  /**
   * Runs one sweep on the calling thread.
   *
   * @return number of sessions purged, or 0 if the sweep failed
   */
  public int sweep() {
    try {
      int purged = purger.purgeExpired();
      if (purged > 0) {
        log.debug("Purged {} expired session(s)", purged);
      }
      return purged;
    } catch (RuntimeException e) {
      // An exception escaping a scheduled task cancels every later run.
      log.warn("Expired session sweep failed: {}", e.getMessage(), e);
      return 0;
    }
  }

  /**
   * Stops the sweeper thread.
   */
  public void shutdown() {
    executor.shutdownNow();
  }

  public boolean isShutdown() {
    return executor.isShutdown();
  }

  @Override
  public void close() {
    shutdown();
  }
}
