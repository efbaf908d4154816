package com.codeheadsystems.tessera.exceptions;

/**
 * The storage medium could not be reached or timed out.
 */
public class BackendUnavailableException extends SessionStoreException {

  /**
   * Instantiates a new Backend unavailable exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public BackendUnavailableException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
