package com.codeheadsystems.tessera.dropwizard.lifecycle;

import com.codeheadsystems.tessera.store.SessionReaper;
import io.dropwizard.lifecycle.Managed;

/**
 * Ties a {@link SessionReaper} to the application lifecycle.
 */
public class SessionReaperManaged implements Managed {

  private final SessionReaper reaper;

  /**
   * Instantiates a new Session reaper managed.
   *
   * @param reaper the reaper
   */
  public SessionReaperManaged(SessionReaper reaper) {
    this.reaper = reaper;
  }

  @Override
  public void start() {
    reaper.start();
  }

  @Override
  public void stop() {
    reaper.shutdown();
  }
}
