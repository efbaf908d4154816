package com.codeheadsystems.tessera.token;

import com.codeheadsystems.tessera.model.SessionId;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Generates cryptographically random session ids.
 * <p>
 * Each id is {@value #TOKEN_BYTES} bytes (256 bits) drawn from a {@link SecureRandom} and encoded
 * as URL-safe base64 without padding. Supply a custom {@link SecureRandom} (HSM-backed, or a
 * specific provider) through the constructor.
 */
public class SessionIdGenerator {

  /**
   * Number of random bytes per token.
   */
  public static final int TOKEN_BYTES = 32;

  private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

  private final SecureRandom random;

  /**
   * Instantiates a new Session id generator backed by a default {@link SecureRandom}.
   */
  public SessionIdGenerator() {
    this(new SecureRandom());
  }

  /**
   * Instantiates a new Session id generator.
   *
   * @param random the random source
   */
  public SessionIdGenerator(SecureRandom random) {
    this.random = random;
  }

  /**
   * Draws a fresh session id.
   *
   * @return the session id
   */
  public SessionId newToken() {
    byte[] bytes = new byte[TOKEN_BYTES];
    random.nextBytes(bytes);
    return new SessionId(ENCODER.encodeToString(bytes));
  }
}
