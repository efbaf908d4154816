package com.codeheadsystems.tessera.dropwizard;

import com.codeheadsystems.tessera.middleware.BackendFailurePolicy;
import com.codeheadsystems.tessera.middleware.CookieSettings;
import com.codeheadsystems.tessera.middleware.SessionManagerConfig;
import com.codeheadsystems.tessera.store.SessionStoreConfig;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import java.time.Duration;

/**
 * Dropwizard configuration for session handling. Applications extend this class with their own
 * settings.
 * <p>
 * The store settings only apply to the in-memory store the bundle builds by default; a store
 * handed to the bundle keeps its own {@link SessionStoreConfig}.
 * <p>
 * Cookies are {@code Secure} by default. Set {@code cookieSecure: false} only for plain HTTP
 * development setups.
 */
public class TesseraConfiguration extends Configuration {

  /**
   * Session lifetime in seconds, from creation or from the last access with sliding expiration.
   */
  @Min(1)
  private long sessionTtlSeconds = SessionStoreConfig.DEFAULT_TTL.getSeconds();

  /**
   * Whether every successful load extends the session by the full TTL.
   */
  private boolean slidingExpiration = false;

  /**
   * Largest encoded session payload accepted, in bytes.
   */
  @Min(1)
  private int maxPayloadBytes = SessionStoreConfig.DEFAULT_MAX_PAYLOAD_SIZE;

  @NotEmpty
  private String cookieName = CookieSettings.DEFAULT_NAME;

  @NotEmpty
  private String cookiePath = "/";

  /**
   * Domain attribute of the cookie. Empty omits it, scoping the cookie to the request host.
   */
  private String cookieDomain = "";

  private boolean cookieSecure = true;

  private boolean cookieHttpOnly = true;

  @NotEmpty
  @Pattern(regexp = "Strict|Lax|None")
  private String cookieSameSite = "Lax";

  /**
   * Whether a cookie naming an unknown or expired session is cleared in the response.
   */
  private boolean clearStaleCookie = true;

  /**
   * What to do when the store cannot be reached while resolving the cookie.
   */
  @NotNull
  private BackendFailurePolicy backendFailurePolicy = BackendFailurePolicy.PROPAGATE;

  /**
   * Seconds between sweeps of expired sessions, for stores that need them. 0 disables sweeping.
   */
  @Min(0)
  private long reaperIntervalSeconds = 60;

  /**
   * Store settings derived from this configuration.
   *
   * @return the session store config
   */
  public SessionStoreConfig buildSessionStoreConfig() {
    return new SessionStoreConfig(Duration.ofSeconds(sessionTtlSeconds), slidingExpiration, maxPayloadBytes);
  }

  /**
   * Middleware settings derived from this configuration.
   *
   * @return the session manager config
   */
  public SessionManagerConfig buildSessionManagerConfig() {
    CookieSettings cookie = new CookieSettings(
        cookieName,
        cookiePath,
        cookieDomain == null || cookieDomain.isEmpty() ? null : cookieDomain,
        cookieSecure,
        cookieHttpOnly,
        cookieSameSite,
        clearStaleCookie);
    return new SessionManagerConfig(cookie, backendFailurePolicy);
  }

  @JsonProperty
  public long getSessionTtlSeconds() {
    return sessionTtlSeconds;
  }

  @JsonProperty
  public void setSessionTtlSeconds(long sessionTtlSeconds) {
    this.sessionTtlSeconds = sessionTtlSeconds;
  }

  @JsonProperty
  public boolean isSlidingExpiration() {
    return slidingExpiration;
  }

  @JsonProperty
  public void setSlidingExpiration(boolean slidingExpiration) {
    this.slidingExpiration = slidingExpiration;
  }

  @JsonProperty
  public int getMaxPayloadBytes() {
    return maxPayloadBytes;
  }

  @JsonProperty
  public void setMaxPayloadBytes(int maxPayloadBytes) {
    this.maxPayloadBytes = maxPayloadBytes;
  }

  @JsonProperty
  public String getCookieName() {
    return cookieName;
  }

  @JsonProperty
  public void setCookieName(String cookieName) {
    this.cookieName = cookieName;
  }

  @JsonProperty
  public String getCookiePath() {
    return cookiePath;
  }

  @JsonProperty
  public void setCookiePath(String cookiePath) {
    this.cookiePath = cookiePath;
  }

  @JsonProperty
  public String getCookieDomain() {
    return cookieDomain;
  }

  @JsonProperty
  public void setCookieDomain(String cookieDomain) {
    this.cookieDomain = cookieDomain;
  }

  @JsonProperty
  public boolean isCookieSecure() {
    return cookieSecure;
  }

  @JsonProperty
  public void setCookieSecure(boolean cookieSecure) {
    this.cookieSecure = cookieSecure;
  }

  @JsonProperty
  public boolean isCookieHttpOnly() {
    return cookieHttpOnly;
  }

  @JsonProperty
  public void setCookieHttpOnly(boolean cookieHttpOnly) {
    this.cookieHttpOnly = cookieHttpOnly;
  }

  @JsonProperty
  public String getCookieSameSite() {
    return cookieSameSite;
  }

  @JsonProperty
  public void setCookieSameSite(String cookieSameSite) {
    this.cookieSameSite = cookieSameSite;
  }

  @JsonProperty
  public boolean isClearStaleCookie() {
    return clearStaleCookie;
  }

  @JsonProperty
  public void setClearStaleCookie(boolean clearStaleCookie) {
    this.clearStaleCookie = clearStaleCookie;
  }

  @JsonProperty
  public BackendFailurePolicy getBackendFailurePolicy() {
    return backendFailurePolicy;
  }

  @JsonProperty
  public void setBackendFailurePolicy(BackendFailurePolicy backendFailurePolicy) {
    this.backendFailurePolicy = backendFailurePolicy;
  }

  /**
   * Gets reaper interval seconds.
   *
   * @return the reaper interval seconds
   */
  @JsonProperty
  public long getReaperIntervalSeconds() {
    return reaperIntervalSeconds;
  }

  /**
   * Sets reaper interval seconds.
   *
   * @param reaperIntervalSeconds the reaper interval seconds
   */
  @JsonProperty
  public void setReaperIntervalSeconds(long reaperIntervalSeconds) {
    this.reaperIntervalSeconds = reaperIntervalSeconds;
  }
}
