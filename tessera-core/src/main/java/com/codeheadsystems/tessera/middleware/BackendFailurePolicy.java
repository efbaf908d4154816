package com.codeheadsystems.tessera.middleware;

/**
 * What the session middleware does when the store cannot be reached while resolving the cookie.
 */
public enum BackendFailurePolicy {

  /**
   * Fail the request with a {@link com.codeheadsystems.tessera.exceptions.SessionInfrastructureException}.
   */
  PROPAGATE,

  /**
   * Log a warning and continue as an anonymous request.
   */
  TREAT_AS_ANONYMOUS
}
