package com.codeheadsystems.tessera.model;

/**
 * Lifecycle status of a {@link Session}.
 * <p>
 * Stores only ever hand out {@link #ACTIVE} sessions. {@link #REVOKED} is set on the in-hand copy
 * when a handler invalidates it; {@link #EXPIRED} describes a stored session whose
 * {@code expiresAt} has passed.
 */
public enum SessionStatus {
  ACTIVE,
  EXPIRED,
  REVOKED
}
