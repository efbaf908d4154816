package com.codeheadsystems.tessera.middleware;

/**
 * A request handler with the session middleware applied.
 *
 * @param <Q> request type
 * @param <R> response type
 */
@FunctionalInterface
public interface RequestHandler<Q, R> {

  R handle(Q request);
}
