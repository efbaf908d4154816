package com.codeheadsystems.tessera.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.tessera.exceptions.SessionStoreException;
import com.codeheadsystems.tessera.store.SessionStore;
import com.codeheadsystems.tessera.token.SessionIdGenerator;

/**
 * Health check that performs a lookup of a freshly generated id, which no session can have,
 * against the store. Healthy as long as the store answers.
 */
public class SessionStoreHealthCheck extends HealthCheck {

  private final SessionStore store;
  private final SessionIdGenerator generator;

  /**
   * Instantiates a new Session store health check.
   *
   * @param store     the store
   * @param generator source of probe ids
   */
  public SessionStoreHealthCheck(SessionStore store, SessionIdGenerator generator) {
    this.store = store;
    this.generator = generator;
  }

  @Override
  protected Result check() {
    try {
      store.load(generator.newToken());
    } catch (SessionStoreException e) {
      return Result.unhealthy(e);
    }
    return Result.healthy("store=%s", store.getClass().getSimpleName());
  }
}
