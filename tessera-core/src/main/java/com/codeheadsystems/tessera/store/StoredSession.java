package com.codeheadsystems.tessera.store;

import com.codeheadsystems.tessera.model.Session;
import com.codeheadsystems.tessera.model.SessionId;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.Map;

/**
 * A session as a backend keeps it: everything except the id, which is the storage key.
 *
 * @param payload        the payload
 * @param createdAt      creation time
 * @param lastAccessedAt last access time
 * @param expiresAt      expiry time
 */
public record StoredSession(Map<String, JsonNode> payload,
                            Instant createdAt,
                            Instant lastAccessedAt,
                            Instant expiresAt) {

  public boolean isExpiredAt(Instant now) {
    return !expiresAt.isAfter(now);
  }

  public Session toSession(SessionId id) {
    return Session.restore(id, payload, createdAt, lastAccessedAt, expiresAt);
  }
}
