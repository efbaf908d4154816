package com.codeheadsystems.tessera.model;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Opaque session token as carried in the session cookie.
 * <p>
 * The value is always {@value #ENCODED_LENGTH} characters of URL-safe base64 (256 random bits,
 * no padding). Instances are created by {@link com.codeheadsystems.tessera.token.SessionIdGenerator}
 * or parsed back from a cookie with {@link #parse(String)}.
 *
 * @param value the cookie string form
 */
public record SessionId(String value) {

  /**
   * Length of the encoded token.
   */
  public static final int ENCODED_LENGTH = 43;

  private static final Pattern FORMAT = Pattern.compile("^[A-Za-z0-9_-]{" + ENCODED_LENGTH + "}$");

  /**
   * Instantiates a new Session id.
   *
   * @param value the cookie string form
   * @throws IllegalArgumentException if the value is not a well-formed token
   */
  public SessionId {
    if (value == null || !FORMAT.matcher(value).matches()) {
      throw new IllegalArgumentException("Malformed session id");
    }
  }

  /**
   * Parses a raw cookie value.
   *
   * @param raw the raw cookie value, may be null
   * @return the session id, or empty when the value is absent or malformed
   */
  public static Optional<SessionId> parse(String raw) {
    if (raw == null || !FORMAT.matcher(raw).matches()) {
      return Optional.empty();
    }
    return Optional.of(new SessionId(raw));
  }

  // Keep full tokens out of log lines.
  @Override
  public String toString() {
    return "SessionId[" + value.substring(0, 6) + "...]";
  }
}
