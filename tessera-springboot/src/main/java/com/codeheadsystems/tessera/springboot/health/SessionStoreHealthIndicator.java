package com.codeheadsystems.tessera.springboot.health;

import com.codeheadsystems.tessera.exceptions.SessionStoreException;
import com.codeheadsystems.tessera.store.SessionStore;
import com.codeheadsystems.tessera.token.SessionIdGenerator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Reports the store as up when a lookup of an unused id completes.
 */
public class SessionStoreHealthIndicator implements HealthIndicator {

  private final SessionStore store;
  private final SessionIdGenerator generator;

  public SessionStoreHealthIndicator(SessionStore store, SessionIdGenerator generator) {
    this.store = store;
    this.generator = generator;
  }

  @Override
  public Health health() {
    try {
      store.load(generator.newToken());
    } catch (SessionStoreException e) {
      return Health.down(e).withDetail("store", store.getClass().getSimpleName()).build();
    }
    return Health.up().withDetail("store", store.getClass().getSimpleName()).build();
  }
}
