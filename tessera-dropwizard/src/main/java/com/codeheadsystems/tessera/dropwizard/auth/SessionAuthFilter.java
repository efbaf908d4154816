package com.codeheadsystems.tessera.dropwizard.auth;

import com.codeheadsystems.tessera.middleware.SessionContext;
import io.dropwizard.auth.AuthFilter;
import jakarta.annotation.Priority;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import java.security.Principal;

/**
 * {@link AuthFilter} whose credentials are the request's {@link SessionContext}, as left by the
 * {@link com.codeheadsystems.tessera.dropwizard.filter.SessionContainerFilter}.
 * <p>
 * Register it the same way as the stock Dropwizard filters:
 * <pre>{@code
 *   environment.jersey().register(new AuthDynamicFeature(
 *       new SessionAuthFilter.Builder<User>()
 *           .setAuthenticator(new SessionUserAuthenticator<>(sessionAuthenticator))
 *           .buildAuthFilter()));
 * }</pre>
 *
 * @param <P> principal type
 */
@Priority(Priorities.AUTHENTICATION)
public class SessionAuthFilter<P extends Principal> extends AuthFilter<SessionContext, P> {

  public static final String SCHEME = "Session";

  private SessionAuthFilter() {
  }

  @Override
  public void filter(ContainerRequestContext requestContext) {
    Object property = requestContext.getProperty(SessionContext.ATTRIBUTE);
    SessionContext context = property instanceof SessionContext ? (SessionContext) property : null;
    if (context == null || !authenticate(requestContext, context, SCHEME)) {
      throw unauthorizedHandler.buildException(prefix, realm);
    }
  }

  /**
   * Builder for {@link SessionAuthFilter}. The prefix defaults to {@value #SCHEME}.
   *
   * @param <P> principal type
   */
  public static class Builder<P extends Principal>
      extends AuthFilterBuilder<SessionContext, P, SessionAuthFilter<P>> {

    /**
     * Instantiates a new Builder.
     */
    public Builder() {
      setPrefix(SCHEME);
    }

    @Override
    protected SessionAuthFilter<P> newInstance() {
      return new SessionAuthFilter<>();
    }
  }
}
