package com.codeheadsystems.tessera.auth;

import java.util.Optional;

/**
 * Looks users up by id. Implemented by the application over its own user storage.
 *
 * @param <U> user type
 * @param <I> user id type
 */
@FunctionalInterface
public interface UserLoader<U extends AuthUser<I>, I> {

  /**
   * Load optional.
   *
   * @param id the id
   * @return the user, or empty if it no longer exists
   */
  Optional<U> load(I id);
}
