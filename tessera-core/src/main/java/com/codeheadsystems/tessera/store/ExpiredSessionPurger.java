package com.codeheadsystems.tessera.store;

/**
 * A backend that can reclaim space held by expired sessions. Correctness never depends on it;
 * expiry is always enforced lazily on load.
 */
@FunctionalInterface
public interface ExpiredSessionPurger {

  /**
   * Deletes every expired session.
   *
   * @return number of sessions deleted
   */
  int purgeExpired();
}
