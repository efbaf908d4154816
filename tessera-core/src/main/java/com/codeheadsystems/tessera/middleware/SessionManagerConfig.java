package com.codeheadsystems.tessera.middleware;

/**
 * Options of the session middleware.
 *
 * @param cookie                the cookie attributes
 * @param backendFailurePolicy  what to do when the store is down while resolving the cookie
 */
public record SessionManagerConfig(CookieSettings cookie, BackendFailurePolicy backendFailurePolicy) {

  /**
   * Instantiates a new Session manager config.
   */
  public SessionManagerConfig {
    if (cookie == null) {
      throw new IllegalArgumentException("cookie settings are required");
    }
    if (backendFailurePolicy == null) {
      throw new IllegalArgumentException("backendFailurePolicy is required");
    }
  }

  public static SessionManagerConfig defaults() {
    return new SessionManagerConfig(CookieSettings.defaults(), BackendFailurePolicy.PROPAGATE);
  }
}
