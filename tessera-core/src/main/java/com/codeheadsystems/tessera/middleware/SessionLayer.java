package com.codeheadsystems.tessera.middleware;

import java.util.Optional;

/**
 * Wraps a {@link SessionHandler} with the session middleware for any request/response pair a
 * {@link CookieAdapter} understands.
 * <p>
 * If the handler throws, the session is not committed and the exception propagates unchanged.
 *
 * @param <Q> request type
 * @param <R> response type
 */
public class SessionLayer<Q, R> {

  private final SessionManager manager;
  private final CookieAdapter<Q, R> cookies;

  /**
   * Instantiates a new Session layer.
   *
   * @param manager the manager
   * @param cookies the cookie adapter
   */
  public SessionLayer(SessionManager manager, CookieAdapter<Q, R> cookies) {
    this.manager = manager;
    this.cookies = cookies;
  }

  /**
   * Applies the middleware to a handler.
   *
   * @param handler the handler
   * @return a handler that opens and commits a session around each call
   */
  public RequestHandler<Q, R> wrap(SessionHandler<Q, R> handler) {
    return request -> handle(request, handler);
  }

  private R handle(Q request, SessionHandler<Q, R> handler) {
    String cookieName = manager.cookieSettings().name();
    SessionContext context = manager.open(cookies.readCookie(request, cookieName).orElse(null));
    R response = handler.handle(request, context);
    Optional<CookieDirective> directive = manager.commit(context);
    return directive.isPresent() ? cookies.applyDirective(response, directive.get()) : response;
  }
}
