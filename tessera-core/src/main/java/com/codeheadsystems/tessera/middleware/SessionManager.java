package com.codeheadsystems.tessera.middleware;

import com.codeheadsystems.tessera.exceptions.BackendUnavailableException;
import com.codeheadsystems.tessera.exceptions.SessionInfrastructureException;
import com.codeheadsystems.tessera.exceptions.SessionNotFoundException;
import com.codeheadsystems.tessera.exceptions.SessionStoreException;
import com.codeheadsystems.tessera.model.Session;
import com.codeheadsystems.tessera.model.SessionId;
import com.codeheadsystems.tessera.store.SessionStore;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds sessions to requests: resolves the cookie into a {@link SessionContext} before the
 * handler runs and persists whatever the handler did to it afterwards.
 * <p>
 * Nothing is written to the store unless {@link #commit} is called, so a request whose handler
 * fails leaves the store as it found it. Store calls are never retried.
 */
public class SessionManager {

  private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

  private final SessionStore store;
  private final SessionManagerConfig config;
  private final Clock clock;

  /**
   * Creates a new SessionManager with the system clock.
   *
   * @param store  the store
   * @param config the config
   */
  public SessionManager(SessionStore store, SessionManagerConfig config) {
    this(store, config, Clock.systemUTC());
  }

  /**
   * Creates a new SessionManager.
   *
   * @param store  the store
   * @param config the config
   * @param clock  used to derive the cookie Max-Age from the session expiry
   */
  public SessionManager(SessionStore store, SessionManagerConfig config, Clock clock) {
    this.store = store;
    this.config = config;
    this.clock = clock;
  }

  public CookieSettings cookieSettings() {
    return config.cookie();
  }

  public SessionStore store() {
    return store;
  }

  /**
   * Resolves the request cookie.
   *
   * @param cookieValue the cookie value, or null if the request has none
   * @return the request context
   * @throws SessionInfrastructureException if the store is unavailable and the policy is
   *                                        {@link BackendFailurePolicy#PROPAGATE}
   */
  public SessionContext open(String cookieValue) {
    if (cookieValue == null || cookieValue.isEmpty()) {
      return new SessionContext(null, false, false);
    }
    Optional<SessionId> id = SessionId.parse(cookieValue);
    if (id.isEmpty()) {
      log.warn("Ignoring malformed session cookie");
      return new SessionContext(null, true, false);
    }
    try {
      Optional<Session> session = store.load(id.get());
      if (session.isEmpty()) {
        log.debug("Session {} not found, treating request as anonymous", id.get());
        return new SessionContext(null, true, false);
      }
      return new SessionContext(session.get(), false, false);
    } catch (BackendUnavailableException e) {
      if (config.backendFailurePolicy() == BackendFailurePolicy.TREAT_AS_ANONYMOUS) {
        log.warn("Session store unavailable, treating request as anonymous: {}", e.getMessage());
        return new SessionContext(null, false, true);
      }
      throw new SessionInfrastructureException("Unable to resolve session", e);
    } catch (SessionStoreException e) {
      throw new SessionInfrastructureException("Unable to resolve session", e);
    }
  }

  /**
   * Persists the outcome of the request and works out the cookie to send back.
   *
   * @param context the context returned by {@link #open}
   * @return the cookie directive, or empty if the response needs none
   * @throws SessionInfrastructureException if the store failed for any reason other than the
   *                                        session having ended
   */
  public Optional<CookieDirective> commit(SessionContext context) {
    context.markCommitted();
    try {
      return persist(context);
    } catch (SessionNotFoundException e) {
      log.debug("Session ended before the request completed: {}", e.getMessage());
      return Optional.of(CookieDirective.clear(config.cookie()));
    } catch (SessionStoreException e) {
      throw new SessionInfrastructureException("Unable to persist session", e);
    }
  }

  private Optional<CookieDirective> persist(SessionContext context) {
    Session discarded = context.discarded();
    if (discarded != null) {
      store.remove(discarded.id());
      log.debug("Removed invalidated session {}", discarded.id());
    }
    Session current = context.current();
    if (current == null) {
      if (discarded != null || (context.hasStaleCookie() && config.cookie().clearStaleCookie())) {
        return Optional.of(CookieDirective.clear(config.cookie()));
      }
      return Optional.empty();
    }
    if (current.isRevoked()) {
      // invalidated through the session itself rather than the context
      if (current.isPersisted()) {
        store.remove(current.id());
      }
      return Optional.of(CookieDirective.clear(config.cookie()));
    }
    if (!current.isPersisted()) {
      Session created = store.create(current.attributes());
      log.debug("Created session {}", created.id());
      return Optional.of(directiveFor(created));
    }
    if (current.isRotationRequested()) {
      // a session ended by another request must not come back under a new id
      store.touch(current.id());
      Session rotated = store.create(current.attributes());
      store.remove(current.id());
      log.debug("Rotated session {} to {}", current.id(), rotated.id());
      return Optional.of(directiveFor(rotated));
    }
    if (current.isModified()) {
      store.save(current);
      return Optional.of(directiveFor(current));
    }
    if (store.config().slidingExpiration()) {
      return Optional.of(directiveFor(current));
    }
    return Optional.empty();
  }

  private CookieDirective directiveFor(Session session) {
    Duration remaining = Duration.between(clock.instant(), session.expiresAt());
    long seconds = Math.max(0, remaining.getSeconds());
    return CookieDirective.set(config.cookie(), session.id(), seconds);
  }
}
