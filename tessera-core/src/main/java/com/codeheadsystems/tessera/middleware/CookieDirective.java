package com.codeheadsystems.tessera.middleware;

import com.codeheadsystems.tessera.model.SessionId;

/**
 * Instruction to set or clear the session cookie on the response.
 *
 * @param settings      cookie attributes
 * @param value         the session id string, empty when clearing
 * @param maxAgeSeconds Max-Age, 0 when clearing
 */
public record CookieDirective(CookieSettings settings, String value, long maxAgeSeconds) {

  /**
   * Instantiates a new Cookie directive.
   */
  public CookieDirective {
    if (maxAgeSeconds < 0) {
      throw new IllegalArgumentException("maxAgeSeconds must not be negative");
    }
  }

  /**
   * Sets the cookie to the given id.
   *
   * @param settings      the settings
   * @param id            the id
   * @param maxAgeSeconds seconds until the session expires
   * @return the directive
   */
  public static CookieDirective set(CookieSettings settings, SessionId id, long maxAgeSeconds) {
    return new CookieDirective(settings, id.value(), maxAgeSeconds);
  }

  /**
   * Expires the cookie on the client.
   *
   * @param settings the settings
   * @return the directive
   */
  public static CookieDirective clear(CookieSettings settings) {
    return new CookieDirective(settings, "", 0);
  }

  public boolean isClear() {
    return value.isEmpty();
  }

  public String name() {
    return settings.name();
  }

  /**
   * Renders the value of a {@code Set-Cookie} header.
   *
   * @return the header value
   */
  public String toSetCookieHeader() {
    StringBuilder sb = new StringBuilder()
        .append(settings.name()).append('=').append(value)
        .append("; Path=").append(settings.path());
    if (settings.domain() != null && !settings.domain().isBlank()) {
      sb.append("; Domain=").append(settings.domain());
    }
    sb.append("; Max-Age=").append(maxAgeSeconds);
    if (settings.secure()) {
      sb.append("; Secure");
    }
    if (settings.httpOnly()) {
      sb.append("; HttpOnly");
    }
    sb.append("; SameSite=").append(settings.sameSite());
    return sb.toString();
  }

  @Override
  public String toString() {
    return "CookieDirective{" + (isClear() ? "clear" : "set") + ", maxAge=" + maxAgeSeconds + '}';
  }
}
