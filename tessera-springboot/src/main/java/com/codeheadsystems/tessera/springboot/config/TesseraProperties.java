package com.codeheadsystems.tessera.springboot.config;

import com.codeheadsystems.tessera.middleware.BackendFailurePolicy;
import com.codeheadsystems.tessera.middleware.CookieSettings;
import com.codeheadsystems.tessera.middleware.SessionManagerConfig;
import com.codeheadsystems.tessera.store.SessionStoreConfig;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "tessera")
public class TesseraProperties {

  /**
   * Which backend the auto-configured {@code SessionStore} uses.
   */
  public enum StoreType {
    MEMORY, REDIS, JDBC
  }

  private StoreType storeType = StoreType.MEMORY;
  private long sessionTtlSeconds = SessionStoreConfig.DEFAULT_TTL.getSeconds();
  private boolean slidingExpiration = false;
  private int maxPayloadBytes = SessionStoreConfig.DEFAULT_MAX_PAYLOAD_SIZE;
  private String cookieName = CookieSettings.DEFAULT_NAME;
  private String cookiePath = "/";
  private String cookieDomain = "";
  private boolean cookieSecure = true;
  private boolean cookieHttpOnly = true;
  private String cookieSameSite = "Lax";
  private boolean clearStaleCookie = true;
  private BackendFailurePolicy backendFailurePolicy = BackendFailurePolicy.PROPAGATE;
  private long reaperIntervalSeconds = 60;
  private String redisKeyPrefix = "tessera:session:";
  private String jdbcTable = "tessera_sessions";
  private int argon2MemoryKib = 65536;
  private int argon2Iterations = 3;
  private int argon2Parallelism = 1;

  public SessionStoreConfig buildSessionStoreConfig() {
    return new SessionStoreConfig(Duration.ofSeconds(sessionTtlSeconds), slidingExpiration, maxPayloadBytes);
  }

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

  public StoreType getStoreType() {
    return storeType;
  }

  public void setStoreType(StoreType storeType) {
    this.storeType = storeType;
  }

  public long getSessionTtlSeconds() {
    return sessionTtlSeconds;
  }

  public void setSessionTtlSeconds(long sessionTtlSeconds) {
    this.sessionTtlSeconds = sessionTtlSeconds;
  }

  public boolean isSlidingExpiration() {
    return slidingExpiration;
  }

  public void setSlidingExpiration(boolean slidingExpiration) {
    this.slidingExpiration = slidingExpiration;
  }

  public int getMaxPayloadBytes() {
    return maxPayloadBytes;
  }

  public void setMaxPayloadBytes(int maxPayloadBytes) {
    this.maxPayloadBytes = maxPayloadBytes;
  }

  public String getCookieName() {
    return cookieName;
  }

  public void setCookieName(String cookieName) {
    this.cookieName = cookieName;
  }

  public String getCookiePath() {
    return cookiePath;
  }

  public void setCookiePath(String cookiePath) {
    this.cookiePath = cookiePath;
  }

  public String getCookieDomain() {
    return cookieDomain;
  }

  public void setCookieDomain(String cookieDomain) {
    this.cookieDomain = cookieDomain;
  }

  public boolean isCookieSecure() {
    return cookieSecure;
  }

  public void setCookieSecure(boolean cookieSecure) {
    this.cookieSecure = cookieSecure;
  }

  public boolean isCookieHttpOnly() {
    return cookieHttpOnly;
  }

  public void setCookieHttpOnly(boolean cookieHttpOnly) {
    this.cookieHttpOnly = cookieHttpOnly;
  }

  public String getCookieSameSite() {
    return cookieSameSite;
  }

  public void setCookieSameSite(String cookieSameSite) {
    this.cookieSameSite = cookieSameSite;
  }

  public boolean isClearStaleCookie() {
    return clearStaleCookie;
  }

  public void setClearStaleCookie(boolean clearStaleCookie) {
    this.clearStaleCookie = clearStaleCookie;
  }

  public BackendFailurePolicy getBackendFailurePolicy() {
    return backendFailurePolicy;
  }

  public void setBackendFailurePolicy(BackendFailurePolicy backendFailurePolicy) {
    this.backendFailurePolicy = backendFailurePolicy;
  }

  public long getReaperIntervalSeconds() {
    return reaperIntervalSeconds;
  }

  public void setReaperIntervalSeconds(long reaperIntervalSeconds) {
    this.reaperIntervalSeconds = reaperIntervalSeconds;
  }

  public String getRedisKeyPrefix() {
    return redisKeyPrefix;
  }

  public void setRedisKeyPrefix(String redisKeyPrefix) {
    this.redisKeyPrefix = redisKeyPrefix;
  }

  public String getJdbcTable() {
    return jdbcTable;
  }

  public void setJdbcTable(String jdbcTable) {
    this.jdbcTable = jdbcTable;
  }

  public int getArgon2MemoryKib() {
    return argon2MemoryKib;
  }

  public void setArgon2MemoryKib(int argon2MemoryKib) {
    this.argon2MemoryKib = argon2MemoryKib;
  }

  public int getArgon2Iterations() {
    return argon2Iterations;
  }

  public void setArgon2Iterations(int argon2Iterations) {
    this.argon2Iterations = argon2Iterations;
  }

  public int getArgon2Parallelism() {
    return argon2Parallelism;
  }

  public void setArgon2Parallelism(int argon2Parallelism) {
    this.argon2Parallelism = argon2Parallelism;
  }
}
