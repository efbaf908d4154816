package com.codeheadsystems.tessera.exceptions;

/**
 * The encoded payload exceeds the configured maximum. Raised before anything is written.
 */
public class PayloadTooLargeException extends SessionStoreException {

  private final int size;
  private final int limit;

  /**
   * Instantiates a new Payload too large exception.
   *
   * @param size  encoded size in bytes
   * @param limit configured maximum in bytes
   */
  public PayloadTooLargeException(final int size, final int limit) {
    super("Session payload of " + size + " bytes exceeds the limit of " + limit + " bytes");
    this.size = size;
    this.limit = limit;
  }

  public int size() {
    return size;
  }

  public int limit() {
    return limit;
  }
}
