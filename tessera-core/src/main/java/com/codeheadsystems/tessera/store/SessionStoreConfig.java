package com.codeheadsystems.tessera.store;

import java.time.Duration;

/**
 * Options shared by every {@link SessionStore} backend.
 *
 * @param ttl                session lifetime; also the extension applied by sliding loads and touch
 * @param slidingExpiration  whether a successful load extends the expiry
 * @param maxPayloadSize     upper bound for the encoded payload, in bytes
 */
public record SessionStoreConfig(Duration ttl, boolean slidingExpiration, int maxPayloadSize) {

  public static final Duration DEFAULT_TTL = Duration.ofHours(24);
  public static final int DEFAULT_MAX_PAYLOAD_SIZE = 64 * 1024;

  /**
   * Instantiates a new Session store config.
   */
  public SessionStoreConfig {
    if (ttl == null || ttl.isZero() || ttl.isNegative()) {
      throw new IllegalArgumentException("ttl must be positive");
    }
    if (maxPayloadSize <= 0) {
      throw new IllegalArgumentException("maxPayloadSize must be positive");
    }
  }

  /**
   * 24 hour fixed expiry with a 64 KiB payload bound.
   *
   * @return the default config
   */
  public static SessionStoreConfig defaults() {
    return new SessionStoreConfig(DEFAULT_TTL, false, DEFAULT_MAX_PAYLOAD_SIZE);
  }

  public SessionStoreConfig withTtl(Duration newTtl) {
    return new SessionStoreConfig(newTtl, slidingExpiration, maxPayloadSize);
  }

  public SessionStoreConfig withSlidingExpiration(boolean sliding) {
    return new SessionStoreConfig(ttl, sliding, maxPayloadSize);
  }

  public SessionStoreConfig withMaxPayloadSize(int size) {
    return new SessionStoreConfig(ttl, slidingExpiration, size);
  }

  /**
   * Rejects non-positive per-call lifetimes.
   *
   * @param ttl the lifetime passed to {@link SessionStore#create}
   * @return the same ttl
   */
  public static Duration requirePositive(Duration ttl) {
    if (ttl == null || ttl.isZero() || ttl.isNegative()) {
      throw new IllegalArgumentException("ttl must be positive");
    }
    return ttl;
  }
}
