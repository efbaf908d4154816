package com.codeheadsystems.tessera.exceptions;

/**
 * Every freshly drawn session id was already taken. Stores retry internally before raising this,
 * so under a sound random source it is never observed.
 */
public class TokenCollisionException extends SessionStoreException {

  /**
   * Instantiates a new Token collision exception.
   *
   * @param attempts number of ids tried
   */
  public TokenCollisionException(final int attempts) {
    super("Could not allocate a unique session id after " + attempts + " attempts");
  }
}
