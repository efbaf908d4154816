package com.codeheadsystems.tessera.middleware;

import java.util.Set;

/**
 * Attributes of the session cookie.
 *
 * @param name             cookie name
 * @param path             Path attribute
 * @param domain           Domain attribute, or null to omit it
 * @param secure           whether Secure is set
 * @param httpOnly         whether HttpOnly is set
 * @param sameSite         Strict, Lax or None
 * @param clearStaleCookie whether a cookie naming an unknown session is cleared in the response
 */
public record CookieSettings(String name,
                             String path,
                             String domain,
                             boolean secure,
                             boolean httpOnly,
                             String sameSite,
                             boolean clearStaleCookie) {

  public static final String DEFAULT_NAME = "tessera_session";

  private static final Set<String> SAME_SITE_VALUES = Set.of("Strict", "Lax", "None");

  /**
   * Instantiates a new Cookie settings.
   */
  public CookieSettings {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("cookie name is required");
    }
    if (path == null || path.isBlank()) {
      throw new IllegalArgumentException("cookie path is required");
    }
    if (!SAME_SITE_VALUES.contains(sameSite)) {
      throw new IllegalArgumentException("sameSite must be one of " + SAME_SITE_VALUES + ": " + sameSite);
    }
    if ("None".equals(sameSite) && !secure) {
      throw new IllegalArgumentException("sameSite=None requires a secure cookie");
    }
  }

  /**
   * Secure, HttpOnly, SameSite=Lax cookie named {@value #DEFAULT_NAME} on path "/".
   *
   * @return the defaults
   */
  public static CookieSettings defaults() {
    return new CookieSettings(DEFAULT_NAME, "/", null, true, true, "Lax", true);
  }

  public CookieSettings withName(String newName) {
    return new CookieSettings(newName, path, domain, secure, httpOnly, sameSite, clearStaleCookie);
  }

  public CookieSettings withSecure(boolean newSecure) {
    return new CookieSettings(name, path, domain, newSecure, httpOnly, sameSite, clearStaleCookie);
  }

  public CookieSettings withDomain(String newDomain) {
    return new CookieSettings(name, path, newDomain, secure, httpOnly, sameSite, clearStaleCookie);
  }

  public CookieSettings withClearStaleCookie(boolean clear) {
    return new CookieSettings(name, path, domain, secure, httpOnly, sameSite, clear);
  }
}
