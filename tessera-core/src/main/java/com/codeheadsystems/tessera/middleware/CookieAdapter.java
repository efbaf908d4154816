package com.codeheadsystems.tessera.middleware;

import java.util.Optional;

/**
 * Reads and writes cookies on a framework's request and response types.
 *
 * @param <Q> request type
 * @param <R> response type
 */
public interface CookieAdapter<Q, R> {

  /**
   * Value of the named cookie on the request.
   *
   * @param request the request
   * @param name    the cookie name
   * @return the value, or empty if absent
   */
  Optional<String> readCookie(Q request, String name);

  /**
   * Applies a directive to the response.
   *
   * @param response  the response
   * @param directive the directive
   * @return the response carrying the directive
   */
  R applyDirective(R response, CookieDirective directive);
}
