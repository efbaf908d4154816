package com.codeheadsystems.tessera.middleware;

/**
 * Application code run inside the session middleware.
 *
 * @param <Q> request type
 * @param <R> response type
 */
@FunctionalInterface
public interface SessionHandler<Q, R> {

  /**
   * Handles one request.
   *
   * @param request the request
   * @param context the session context, valid only for this call
   * @return the response
   */
  R handle(Q request, SessionContext context);
}
