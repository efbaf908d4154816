package com.codeheadsystems.tessera.exceptions;

/**
 * Base type for failures raised by a {@link com.codeheadsystems.tessera.store.SessionStore}.
 * <p>
 * Thrown directly for unreadable stored records; the subclasses cover the outcomes callers are
 * expected to tell apart.
 */
public class SessionStoreException extends RuntimeException {

  /**
   * Instantiates a new Session store exception.
   *
   * @param message the message
   */
  public SessionStoreException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Session store exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public SessionStoreException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
