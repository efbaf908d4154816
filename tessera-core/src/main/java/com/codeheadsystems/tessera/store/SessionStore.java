package com.codeheadsystems.tessera.store;

import com.codeheadsystems.tessera.exceptions.BackendUnavailableException;
import com.codeheadsystems.tessera.exceptions.PayloadTooLargeException;
import com.codeheadsystems.tessera.exceptions.SessionNotFoundException;
import com.codeheadsystems.tessera.exceptions.TokenCollisionException;
import com.codeheadsystems.tessera.model.Session;
import com.codeheadsystems.tessera.model.SessionId;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Storage abstraction for sessions.
 * <p>
 * These five operations are the whole contract between a backend and the session middleware.
 * Implementations must be thread-safe: operations on different ids must not interfere, and two
 * concurrent {@link #save}s of the same id must leave exactly one of the submitted payloads in
 * place (last write wins, never a mixture).
 * <p>
 * Sessions returned by a store are detached copies; nothing changes in the store until
 * {@link #save} is called.
 */
public interface SessionStore {

  /**
   * How many fresh ids {@link #create} tries before giving up with a {@link TokenCollisionException}.
   */
  int MAX_CREATE_ATTEMPTS = 3;

  /**
   * Allocates a new id and persists a session with {@code expiresAt = now + ttl}.
   *
   * @param payload initial payload
   * @param ttl     lifetime, must be positive
   * @return the persisted session
   * @throws PayloadTooLargeException    if the encoded payload exceeds the configured bound
   * @throws BackendUnavailableException if the medium cannot be reached
   * @throws TokenCollisionException     if no unique id could be allocated
   */
  Session create(Map<String, JsonNode> payload, Duration ttl);

  /**
   * Creates a session living for the configured ttl.
   *
   * @param payload initial payload
   * @return the persisted session
   */
  default Session create(Map<String, JsonNode> payload) {
    return create(payload, config().ttl());
  }

  /**
   * Loads a session.
   * <p>
   * Absent, expired and revoked sessions all come back as empty so callers cannot tell them
   * apart. With sliding expiration configured, a successful load also extends the expiry by the
   * configured ttl as part of the same atomic operation.
   *
   * @param id the id
   * @return the session, or empty
   * @throws BackendUnavailableException if the medium cannot be reached
   */
  Optional<Session> load(SessionId id);

  /**
   * Overwrites payload and last access time of an existing, unexpired session. Never upserts.
   * Existence and expiry are decided by the stored record alone: the expiry of the copy is
   * ignored and replaced by the stored one, so a save never undoes a touch or sliding extension.
   *
   * @param session a persisted session
   * @throws SessionNotFoundException    if the id no longer exists
   * @throws PayloadTooLargeException    if the encoded payload exceeds the configured bound
   * @throws BackendUnavailableException if the medium cannot be reached
   */
  void save(Session session);

  /**
   * Removes a session. Removing an unknown id is not an error.
   *
   * @param id the id
   * @throws BackendUnavailableException if the medium cannot be reached
   */
  void remove(SessionId id);

  /**
   * Extends the expiry by the configured ttl without reading or writing the payload.
   *
   * @param id the id
   * @throws SessionNotFoundException    if the id no longer exists
   * @throws BackendUnavailableException if the medium cannot be reached
   */
  void touch(SessionId id);

  /**
   * Options this store was built with.
   *
   * @return the config
   */
  SessionStoreConfig config();
}
