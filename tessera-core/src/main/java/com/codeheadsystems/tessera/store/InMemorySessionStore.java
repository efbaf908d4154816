package com.codeheadsystems.tessera.store;

import com.codeheadsystems.tessera.exceptions.SessionNotFoundException;
import com.codeheadsystems.tessera.exceptions.TokenCollisionException;
import com.codeheadsystems.tessera.model.Session;
import com.codeheadsystems.tessera.model.SessionId;
import com.codeheadsystems.tessera.token.SessionIdGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link SessionStore}.
 * <p>
 * Sessions are spread over independently locked partitions selected by the hash of the id, so
 * traffic on different ids rarely contends. Each partition holds immutable entries with the
 * payload kept in encoded form, which makes every loaded session a detached copy.
 * <p>
 * Expired sessions are ignored on {@link #load} and evicted lazily; a {@link SessionReaper}
 * also sweeps them on its own cadence to bound memory. All sessions are lost on restart.
 */
public class InMemorySessionStore implements SessionStore, ExpiredSessionPurger {

  private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

  public static final int DEFAULT_PARTITIONS = 16;
  public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofMinutes(1);

  private final SessionStoreConfig config;
  private final SessionIdGenerator generator;
  private final Clock clock;
  private final SessionCodec codec;
  private final Partition[] partitions;
  private final SessionReaper reaper;

  /**
   * Default configuration, system clock and a one minute sweep.
   */
  public InMemorySessionStore() {
    this(SessionStoreConfig.defaults());
  }

  /**
   * Instantiates a new In memory session store with a system clock and a one minute sweep.
   *
   * @param config the config
   */
  public InMemorySessionStore(SessionStoreConfig config) {
    this(config, new SessionIdGenerator(), Clock.systemUTC(), DEFAULT_PARTITIONS, DEFAULT_SWEEP_INTERVAL);
  }

  /**
   * Instantiates a new In memory session store.
   *
   * @param config        the config
   * @param generator     id source
   * @param clock         time source
   * @param partitions    number of independently locked partitions
   * @param sweepInterval time between background sweeps, or null to disable the sweeper
   */
  public InMemorySessionStore(SessionStoreConfig config,
                              SessionIdGenerator generator,
                              Clock clock,
                              int partitions,
                              Duration sweepInterval) {
    if (partitions < 1) {
      throw new IllegalArgumentException("partitions must be at least 1");
    }
    log.warn("InMemorySessionStore in use: sessions are lost on restart and not shared between instances");
    this.config = config;
    this.generator = generator;
    this.clock = clock;
    this.codec = new SessionCodec(config.maxPayloadSize());
    this.partitions = new Partition[partitions];
    for (int i = 0; i < partitions; i++) {
      this.partitions[i] = new Partition();
    }
    if (sweepInterval != null) {
      this.reaper = new SessionReaper(this, sweepInterval, "tessera-memory-session-reaper");
      this.reaper.start();
    } else {
      this.reaper = null;
    }
  }

  @Override
  public Session create(Map<String, JsonNode> payload, Duration ttl) {
    SessionStoreConfig.requirePositive(ttl);
    byte[] encoded = codec.encodePayload(payload);
    Instant now = clock.instant();
    Entry entry = new Entry(encoded, now, now, now.plus(ttl));
    for (int attempt = 1; attempt <= MAX_CREATE_ATTEMPTS; attempt++) {
      SessionId id = generator.newToken();
      Partition partition = partitionFor(id);
      partition.lock.writeLock().lock();
      try {
        Entry existing = partition.entries.get(id);
        if (existing == null || existing.isExpiredAt(now)) {
          partition.entries.put(id, entry);
          log.debug("Created session {}", id);
          return entry.toSession(id, codec);
        }
      } finally {
        partition.lock.writeLock().unlock();
      }
      log.warn("Session id collision on attempt {}", attempt);
    }
    throw new TokenCollisionException(MAX_CREATE_ATTEMPTS);
  }

  @Override
  public Optional<Session> load(SessionId id) {
    return config.slidingExpiration() ? loadSliding(id) : loadFixed(id);
  }

  private Optional<Session> loadFixed(SessionId id) {
    Partition partition = partitionFor(id);
    Instant now = clock.instant();
    Entry entry;
    partition.lock.readLock().lock();
    try {
      entry = partition.entries.get(id);
    } finally {
      partition.lock.readLock().unlock();
    }
    if (entry == null) {
      return Optional.empty();
    }
    if (entry.isExpiredAt(now)) {
      evictIfExpired(partition, id, now);
      return Optional.empty();
    }
    return Optional.of(entry.toSession(id, codec));
  }

  private Optional<Session> loadSliding(SessionId id) {
    Partition partition = partitionFor(id);
    Instant now = clock.instant();
    partition.lock.writeLock().lock();
    try {
      Entry entry = partition.entries.get(id);
      if (entry == null) {
        return Optional.empty();
      }
      if (entry.isExpiredAt(now)) {
        partition.entries.remove(id);
        return Optional.empty();
      }
      Entry extended = entry.accessed(now, now.plus(config.ttl()));
      partition.entries.put(id, extended);
      return Optional.of(extended.toSession(id, codec));
    } finally {
      partition.lock.writeLock().unlock();
    }
  }

  @Override
  public void save(Session session) {
    SessionId id = session.id();
    byte[] encoded = codec.encodePayload(session.attributes());
    Partition partition = partitionFor(id);
    Instant now = clock.instant();
    partition.lock.writeLock().lock();
    try {
      Entry entry = partition.entries.get(id);
      if (entry == null || entry.isExpiredAt(now)) {
        throw new SessionNotFoundException("Session " + id + " no longer exists");
      }
      // expiry belongs to the stored entry, never to the caller's copy
      Instant expiresAt = entry.expiresAt();
      partition.entries.put(id, new Entry(encoded, entry.createdAt(), now, expiresAt));
      session.recordAccess(now, expiresAt);
    } finally {
      partition.lock.writeLock().unlock();
    }
    log.debug("Saved session {}", id);
  }

  @Override
  public void remove(SessionId id) {
    Partition partition = partitionFor(id);
    partition.lock.writeLock().lock();
    try {
      partition.entries.remove(id);
    } finally {
      partition.lock.writeLock().unlock();
    }
    log.debug("Removed session {}", id);
  }

  @Override
  public void touch(SessionId id) {
    Partition partition = partitionFor(id);
    Instant now = clock.instant();
    partition.lock.writeLock().lock();
    try {
      Entry entry = partition.entries.get(id);
      if (entry == null || entry.isExpiredAt(now)) {
        throw new SessionNotFoundException("Session " + id + " no longer exists");
      }
      partition.entries.put(id, entry.accessed(now, now.plus(config.ttl())));
    } finally {
      partition.lock.writeLock().unlock();
    }
  }

  @Override
  public SessionStoreConfig config() {
    return config;
  }

  @Override
  public int purgeExpired() {
    Instant now = clock.instant();
    int purged = 0;
    for (Partition partition : partitions) {
      partition.lock.writeLock().lock();
      try {
        int before = partition.entries.size();
        partition.entries.values().removeIf(e -> e.isExpiredAt(now));
        purged += before - partition.entries.size();
      } finally {
        partition.lock.writeLock().unlock();
      }
    }
    return purged;
  }

  /**
   * Number of entries held, expired ones included until they are evicted.
   *
   * @return the size
   */
  public int size() {
    int size = 0;
    for (Partition partition : partitions) {
      partition.lock.readLock().lock();
      try {
        size += partition.entries.size();
      } finally {
        partition.lock.readLock().unlock();
      }
    }
    return size;
  }

  /**
   * Stops the background sweeper, if one was started.
   */
  public void shutdown() {
    if (reaper != null) {
      reaper.shutdown();
    }
  }

  private void evictIfExpired(Partition partition, SessionId id, Instant now) {
    partition.lock.writeLock().lock();
    try {
      Entry entry = partition.entries.get(id);
      if (entry != null && entry.isExpiredAt(now)) {
        partition.entries.remove(id);
      }
    } finally {
      partition.lock.writeLock().unlock();
    }
  }

  private Partition partitionFor(SessionId id) {
    return partitions[Math.floorMod(id.hashCode(), partitions.length)];
  }

  private static final class Partition {
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<SessionId, Entry> entries = new HashMap<>();
  }

  private record Entry(byte[] payload, Instant createdAt, Instant lastAccessedAt, Instant expiresAt) {

    boolean isExpiredAt(Instant now) {
      return !expiresAt.isAfter(now);
    }

    Entry accessed(Instant now, Instant newExpiry) {
      return new Entry(payload, createdAt, now, newExpiry);
    }

    Session toSession(SessionId id, SessionCodec codec) {
      return Session.restore(id, codec.decodePayload(payload), createdAt, lastAccessedAt, expiresAt);
    }
  }
}
