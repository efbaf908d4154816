package com.codeheadsystems.tessera.exceptions;

/**
 * Raised by the session middleware when session storage failed for a reason other than the
 * session being gone. Framework adapters map it to a 5xx response; it is never turned into an
 * anonymous request.
 */
public class SessionInfrastructureException extends RuntimeException {

  /**
   * Instantiates a new Session infrastructure exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public SessionInfrastructureException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
