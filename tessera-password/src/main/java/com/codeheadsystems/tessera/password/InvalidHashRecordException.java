package com.codeheadsystems.tessera.password;

/**
 * A stored credential record could not be parsed. Distinct from a wrong password.
 */
public class InvalidHashRecordException extends RuntimeException {

  /**
   * Instantiates a new Invalid hash record exception.
   *
   * @param message the message
   */
  public InvalidHashRecordException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Invalid hash record exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public InvalidHashRecordException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
