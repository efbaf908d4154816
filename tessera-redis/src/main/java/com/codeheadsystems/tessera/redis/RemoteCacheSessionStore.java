package com.codeheadsystems.tessera.redis;

import com.codeheadsystems.tessera.exceptions.SessionNotFoundException;
import com.codeheadsystems.tessera.exceptions.TokenCollisionException;
import com.codeheadsystems.tessera.model.Session;
import com.codeheadsystems.tessera.model.SessionId;
import com.codeheadsystems.tessera.store.SessionCodec;
import com.codeheadsystems.tessera.store.SessionStore;
import com.codeheadsystems.tessera.store.SessionStoreConfig;
import com.codeheadsystems.tessera.store.StoredSession;
import com.codeheadsystems.tessera.token.SessionIdGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SessionStore} on a remote key-value cache such as Redis.
 * <p>
 * Each session is one key, {@code prefix + id}, holding the encoded session without its id. The
 * cache's own per-key expiry is authoritative: expired sessions disappear from the medium without
 * any sweeping, and the {@code expiresAt} of a loaded session is derived from the key's remaining
 * time to live. Every write is a single atomic command. A fixed-expiry load reads the value and
 * then its remaining time to live, and a save reads the remaining time to live after writing.
 */
public class RemoteCacheSessionStore implements SessionStore {

  private static final Logger log = LoggerFactory.getLogger(RemoteCacheSessionStore.class);

  public static final String DEFAULT_KEY_PREFIX = "tessera:session:";

  private final CacheClient client;
  private final SessionStoreConfig config;
  private final SessionIdGenerator generator;
  private final Clock clock;
  private final String keyPrefix;
  private final SessionCodec codec;

  /**
   * Instantiates a new Remote cache session store with the default key prefix.
   *
   * @param client the cache client
   * @param config the config
   */
  public RemoteCacheSessionStore(CacheClient client, SessionStoreConfig config) {
    this(client, config, new SessionIdGenerator(), Clock.systemUTC(), DEFAULT_KEY_PREFIX);
  }

  /**
   * Instantiates a new Remote cache session store.
   *
   * @param client    the cache client
   * @param config    the config
   * @param generator id source
   * @param clock     time source
   * @param keyPrefix namespace for session keys
   */
  public RemoteCacheSessionStore(CacheClient client,
                                 SessionStoreConfig config,
                                 SessionIdGenerator generator,
                                 Clock clock,
                                 String keyPrefix) {
    this.client = client;
    this.config = config;
    this.generator = generator;
    this.clock = clock;
    this.keyPrefix = keyPrefix;
    this.codec = new SessionCodec(config.maxPayloadSize());
  }

  @Override
  public Session create(Map<String, JsonNode> payload, Duration ttl) {
    SessionStoreConfig.requirePositive(ttl);
    Instant now = clock.instant();
    StoredSession stored = new StoredSession(payload, now, now, now.plus(ttl));
    byte[] value = codec.encode(stored);
    for (int attempt = 1; attempt <= MAX_CREATE_ATTEMPTS; attempt++) {
      SessionId id = generator.newToken();
      if (client.setIfAbsent(key(id), value, ttl)) {
        log.debug("Created session {}", id);
        return stored.toSession(id);
      }
      log.warn("Session id collision on attempt {}", attempt);
    }
    throw new TokenCollisionException(MAX_CREATE_ATTEMPTS);
  }

  @Override
  public Optional<Session> load(SessionId id) {
    Instant now = clock.instant();
    if (config.slidingExpiration()) {
      return client.getAndExpire(key(id), config.ttl())
          .map(codec::decode)
          .map(s -> new StoredSession(s.payload(), s.createdAt(), now, now.plus(config.ttl())))
          .map(s -> s.toSession(id));
    }
    Optional<byte[]> value = client.get(key(id));
    if (value.isEmpty()) {
      return Optional.empty();
    }
    Optional<Duration> remaining = client.remainingTtl(key(id));
    if (remaining.isEmpty() || remaining.get().isZero() || remaining.get().isNegative()) {
      // expired between the two reads
      return Optional.empty();
    }
    StoredSession stored = codec.decode(value.get());
    Instant lastAccessedAt = stored.lastAccessedAt().isAfter(now) ? now : stored.lastAccessedAt();
    return Optional.of(Session.restore(id, stored.payload(), stored.createdAt(), lastAccessedAt,
        now.plus(remaining.get())));
  }

  /**
   * Replaces the payload of a live key. The key keeps its own time to live, so an extension made
   * by a concurrent touch or sliding load survives the write; the in-hand copy picks up the
   * expiry the key has after the write.
   */
  @Override
  public void save(Session session) {
    SessionId id = session.id();
    Instant now = clock.instant();
    StoredSession stored = new StoredSession(session.attributes(), session.createdAt(), now,
        session.expiresAt().isAfter(now) ? session.expiresAt() : now);
    byte[] value = codec.encode(stored);
    if (!client.setIfPresent(key(id), value)) {
      throw new SessionNotFoundException("Session " + id + " no longer exists");
    }
    Instant expiresAt = client.remainingTtl(key(id))
        .map(now::plus)
        .orElse(now);
    session.recordAccess(now, expiresAt);
    log.debug("Saved session {}", id);
  }

  @Override
  public void remove(SessionId id) {
    client.delete(key(id));
    log.debug("Removed session {}", id);
  }

  @Override
  public void touch(SessionId id) {
    if (!client.expire(key(id), config.ttl())) {
      throw new SessionNotFoundException("Session " + id + " no longer exists");
    }
  }

  @Override
  public SessionStoreConfig config() {
    return config;
  }

  String key(SessionId id) {
    return keyPrefix + id.value();
  }
}
