package com.codeheadsystems.tessera.middleware;

import com.codeheadsystems.tessera.model.Session;
import java.util.Optional;

/**
 * Per-request holder of the session, created by {@link SessionManager#open} and resolved by
 * {@link SessionManager#commit}.
 * <p>
 * Handlers read and mutate the session through this object for the duration of one request and
 * must not keep references to it afterwards. Not thread-safe.
 */
public class SessionContext {

  /**
   * Name under which framework adapters expose the context as a request attribute.
   */
  public static final String ATTRIBUTE = SessionContext.class.getName();

  private final boolean staleCookie;
  private final boolean degraded;
  private Session current;
  private Session discarded;
  private boolean committed;

  SessionContext(Session loaded, boolean staleCookie, boolean degraded) {
    this.current = loaded;
    this.staleCookie = staleCookie;
    this.degraded = degraded;
  }

  /**
   * The session bound to this request, if any. Empty for anonymous requests and after
   * {@link #invalidate()}.
   *
   * @return the session
   */
  public Optional<Session> session() {
    if (current == null || current.isRevoked()) {
      return Optional.empty();
    }
    return Optional.of(current);
  }

  /**
   * Returns the bound session, or binds a new pending one that will be created when the request
   * completes.
   *
   * @return the session
   */
  public Session getOrCreate() {
    requireOpen();
    if (current != null && current.isRevoked()) {
      retire();
    }
    if (current == null) {
      current = Session.pending();
    }
    return current;
  }

  /**
   * Ends the bound session. The store entry is removed and the cookie cleared when the request
   * completes.
   */
  public void invalidate() {
    requireOpen();
    if (current != null) {
      current.invalidate();
      retire();
    }
  }

  /**
   * Gives the bound session a new id when the request completes. The payload is kept.
   */
  public void rotateId() {
    requireOpen();
    if (current != null) {
      current.rotateId();
    }
  }

  public boolean isAnonymous() {
    return session().isEmpty();
  }

  /**
   * Whether the request carried a cookie naming a session the store no longer knows.
   *
   * @return true if stale
   */
  public boolean hasStaleCookie() {
    return staleCookie;
  }

  /**
   * Whether the cookie could not be resolved because the store was unavailable.
   *
   * @return true if degraded
   */
  public boolean isDegraded() {
    return degraded;
  }

  public boolean isCommitted() {
    return committed;
  }

  Session current() {
    return current;
  }

  Session discarded() {
    return discarded;
  }

  void markCommitted() {
    requireOpen();
    committed = true;
  }

  private void retire() {
    if (current.isPersisted()) {
      discarded = current;
    }
    current = null;
  }

  private void requireOpen() {
    if (committed) {
      throw new IllegalStateException("Session context has already been committed");
    }
  }
}
