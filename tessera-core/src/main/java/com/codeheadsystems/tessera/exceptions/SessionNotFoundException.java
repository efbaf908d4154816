package com.codeheadsystems.tessera.exceptions;

/**
 * The session no longer exists at write time (removed, or expired and reaped).
 * The middleware treats this as "session ended".
 */
public class SessionNotFoundException extends SessionStoreException {

  /**
   * Instantiates a new Session not found exception.
   *
   * @param message the message
   */
  public SessionNotFoundException(final String message) {
    super(message);
  }
}
