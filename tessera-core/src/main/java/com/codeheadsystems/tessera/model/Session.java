package com.codeheadsystems.tessera.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Server-held session state: an id, a key/value payload and its timestamps.
 * <p>
 * A {@code Session} handed out by a {@link com.codeheadsystems.tessera.store.SessionStore} is a
 * detached copy. Mutating it changes nothing in the store until the copy is saved back, which the
 * session middleware does at the end of the request. Payload values are held as Jackson
 * {@link JsonNode}s, so anything Jackson can serialize can be stored.
 * <p>
 * A session created during a request but not persisted yet is <em>pending</em>: it has no id or
 * timestamps until the store creates it.
 * <p>
 * Instances are request-scoped and not thread-safe.
 */
public final class Session {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final SessionId id;
  private final Map<String, JsonNode> payload;
  private final Instant createdAt;
  private Instant lastAccessedAt;
  private Instant expiresAt;
  private SessionStatus status;
  private boolean modified;
  private boolean rotationRequested;

  private Session(SessionId id,
                  Map<String, JsonNode> payload,
                  Instant createdAt,
                  Instant lastAccessedAt,
                  Instant expiresAt,
                  boolean modified) {
    this.id = id;
    this.payload = new LinkedHashMap<>(payload);
    this.createdAt = createdAt;
    this.lastAccessedAt = lastAccessedAt;
    this.expiresAt = expiresAt;
    this.status = SessionStatus.ACTIVE;
    this.modified = modified;
  }

  /**
   * Creates a pending session that has not been persisted yet.
   *
   * @return the pending session
   */
  public static Session pending() {
    return new Session(null, Map.of(), null, null, null, true);
  }

  /**
   * Materializes a stored session. Used by store implementations.
   *
   * @param id             the id
   * @param payload        the payload
   * @param createdAt      creation time
   * @param lastAccessedAt last access time
   * @param expiresAt      expiry time, never before {@code lastAccessedAt}
   * @return an active, unmodified session
   */
  public static Session restore(SessionId id,
                                Map<String, JsonNode> payload,
                                Instant createdAt,
                                Instant lastAccessedAt,
                                Instant expiresAt) {
    if (id == null) {
      throw new IllegalArgumentException("id is required");
    }
    if (expiresAt.isBefore(lastAccessedAt)) {
      throw new IllegalArgumentException("expiresAt must not precede lastAccessedAt");
    }
    return new Session(id, payload, createdAt, lastAccessedAt, expiresAt, false);
  }

  /**
   * Id of a persisted session.
   *
   * @return the id
   * @throws IllegalStateException if the session is still pending
   */
  public SessionId id() {
    if (id == null) {
      throw new IllegalStateException("Session has not been persisted yet");
    }
    return id;
  }

  public boolean isPersisted() {
    return id != null;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public Instant lastAccessedAt() {
    return lastAccessedAt;
  }

  public Instant expiresAt() {
    return expiresAt;
  }

  public SessionStatus status() {
    return status;
  }

  /**
   * Whether the payload changed since this copy was loaded.
   *
   * @return true if modified
   */
  public boolean isModified() {
    return modified;
  }

  public boolean isRevoked() {
    return status == SessionStatus.REVOKED;
  }

  public boolean isRotationRequested() {
    return rotationRequested;
  }

  /**
   * Whether {@code expiresAt} is at or before the given instant.
   *
   * @param now the current time
   * @return true if expired
   */
  public boolean isExpiredAt(Instant now) {
    return expiresAt != null && !expiresAt.isAfter(now);
  }

  /**
   * Stores a value under the given key.
   *
   * @param key   the key
   * @param value any Jackson-serializable value
   * @throws IllegalArgumentException if the value cannot be serialized
   */
  public void put(String key, Object value) {
    requireUsable();
    payload.put(key, MAPPER.valueToTree(value));
    modified = true;
  }

  /**
   * Reads a value.
   *
   * @param key  the key
   * @param type the expected type
   * @param <T>  the value type
   * @return the value, or empty if the key is absent
   * @throws IllegalArgumentException if the stored value cannot be read as {@code type}
   */
  public <T> Optional<T> get(String key, Class<T> type) {
    JsonNode node = payload.get(key);
    if (node == null) {
      return Optional.empty();
    }
    try {
      return Optional.ofNullable(MAPPER.treeToValue(node, type));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Session value '" + key + "' is not a " + type.getSimpleName(), e);
    }
  }

  /**
   * Removes a key. The session only counts as modified if the key was present.
   *
   * @param key the key
   * @return true if a value was removed
   */
  public boolean remove(String key) {
    requireUsable();
    boolean removed = payload.remove(key) != null;
    if (removed) {
      modified = true;
    }
    return removed;
  }

  /**
   * Removes every key.
   */
  public void clear() {
    requireUsable();
    payload.clear();
    modified = true;
  }

  public boolean isEmpty() {
    return payload.isEmpty();
  }

  /**
   * Immutable snapshot of the payload.
   *
   * @return the attributes
   */
  public Map<String, JsonNode> attributes() {
    Map<String, JsonNode> copy = new LinkedHashMap<>();
    payload.forEach((k, v) -> copy.put(k, v.deepCopy()));
    return Collections.unmodifiableMap(copy);
  }

  /**
   * Marks the session for removal at the end of the request (logout).
   */
  public void invalidate() {
    status = SessionStatus.REVOKED;
  }

  /**
   * Requests a new id for this session at the end of the request, keeping the payload.
   * Has no effect on a pending session, which receives a fresh id anyway.
   */
  public void rotateId() {
    requireUsable();
    if (id != null) {
      rotationRequested = true;
    }
  }

  /**
   * Records a store-side access. Used by store implementations after a save or touch.
   *
   * @param accessedAt the access time
   * @param newExpiry  the expiry in effect after the access
   */
  public void recordAccess(Instant accessedAt, Instant newExpiry) {
    if (newExpiry.isBefore(accessedAt)) {
      throw new IllegalArgumentException("expiresAt must not precede lastAccessedAt");
    }
    this.lastAccessedAt = accessedAt;
    this.expiresAt = newExpiry;
  }

  private void requireUsable() {
    if (status == SessionStatus.REVOKED) {
      throw new IllegalStateException("Session has been invalidated");
    }
  }

  @Override
  public String toString() {
    return "Session{id=" + id + ", status=" + status + ", expiresAt=" + expiresAt + '}';
  }
}
