package com.codeheadsystems.tessera.redis;

import com.codeheadsystems.tessera.exceptions.BackendUnavailableException;
import java.time.Duration;
import java.util.Optional;

/**
 * The handful of atomic per-key commands {@link RemoteCacheSessionStore} needs from a key-value
 * cache with native expiry.
 * <p>
 * Every method throws {@link BackendUnavailableException} when the cache cannot be reached.
 */
public interface CacheClient {

  /**
   * Stores the value only if the key does not exist.
   *
   * @param key   the key
   * @param value the value
   * @param ttl   expiry of the new key
   * @return true if the value was stored
   */
  boolean setIfAbsent(String key, byte[] value, Duration ttl);

  /**
   * Replaces the value only if the key exists, leaving the key's expiry as it is.
   *
   * @param key   the key
   * @param value the value
   * @return true if the value was replaced
   */
  boolean setIfPresent(String key, byte[] value);

  Optional<byte[]> get(String key);

  /**
   * Reads the value and resets its expiry in one command.
   *
   * @param key the key
   * @param ttl new expiry
   * @return the value, or empty if the key does not exist
   */
  Optional<byte[]> getAndExpire(String key, Duration ttl);

  /**
   * Time left before the key expires.
   *
   * @param key the key
   * @return remaining time, or empty if the key does not exist or never expires
   */
  Optional<Duration> remainingTtl(String key);

  /**
   * Resets the expiry of an existing key.
   *
   * @param key the key
   * @param ttl new expiry
   * @return false if the key does not exist
   */
  boolean expire(String key, Duration ttl);

  void delete(String key);
}
