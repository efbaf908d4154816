package com.codeheadsystems.tessera.auth;

/**
 * A user that can be bound to a session.
 *
 * @param <I> the user id type, stored in the session payload
 */
public interface AuthUser<I> {

  I id();
}
