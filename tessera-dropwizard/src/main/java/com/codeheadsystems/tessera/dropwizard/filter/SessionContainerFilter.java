package com.codeheadsystems.tessera.dropwizard.filter;

import com.codeheadsystems.tessera.exceptions.SessionInfrastructureException;
import com.codeheadsystems.tessera.middleware.CookieDirective;
import com.codeheadsystems.tessera.middleware.SessionContext;
import com.codeheadsystems.tessera.middleware.SessionManager;
import io.dropwizard.jersey.errors.ErrorMessage;
import jakarta.annotation.Priority;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.core.Cookie;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS filter pair that opens a {@link SessionContext} before the resource method runs and
 * commits it once the response is known.
 * <p>
 * The context is stored as the request property {@link SessionContext#ATTRIBUTE}; resources
 * reach it through {@link #sessionContext(ContainerRequestContext)}. A response with a 5xx status
 * counts as a failed request and nothing is committed. Runs ahead of the authentication filters
 * so they can see the session.
 */
@Priority(Priorities.AUTHENTICATION - 100)
public class SessionContainerFilter implements ContainerRequestFilter, ContainerResponseFilter {

  private static final Logger log = LoggerFactory.getLogger(SessionContainerFilter.class);

  private final SessionManager sessionManager;

  /**
   * Instantiates a new Session container filter.
   *
   * @param sessionManager the session manager
   */
  public SessionContainerFilter(SessionManager sessionManager) {
    this.sessionManager = sessionManager;
  }

  /**
   * The session context of the current request.
   *
   * @param requestContext the request context
   * @return the session context
   * @throws IllegalStateException if the filter did not run for this request
   */
  public static SessionContext sessionContext(ContainerRequestContext requestContext) {
    Object context = requestContext.getProperty(SessionContext.ATTRIBUTE);
    if (!(context instanceof SessionContext)) {
      throw new IllegalStateException("No session context on request; is the TesseraBundle registered?");
    }
    return (SessionContext) context;
  }

  @Override
  public void filter(ContainerRequestContext requestContext) {
    Cookie cookie = requestContext.getCookies().get(sessionManager.cookieSettings().name());
    SessionContext context = sessionManager.open(cookie == null ? null : cookie.getValue());
    requestContext.setProperty(SessionContext.ATTRIBUTE, context);
  }

  @Override
  public void filter(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
    Object property = requestContext.getProperty(SessionContext.ATTRIBUTE);
    if (!(property instanceof SessionContext context) || context.isCommitted()) {
      return;
    }
    if (responseContext.getStatusInfo().getFamily() == Response.Status.Family.SERVER_ERROR) {
      log.debug("Request failed with status {}, session not committed", responseContext.getStatus());
      return;
    }
    Optional<CookieDirective> directive;
    try {
      directive = sessionManager.commit(context);
    } catch (SessionInfrastructureException e) {
      // exception mappers do not apply to response filters
      log.warn("Unable to commit session: {}", e.getMessage(), e);
      responseContext.setStatus(Response.Status.SERVICE_UNAVAILABLE.getStatusCode());
      responseContext.setEntity(
          new ErrorMessage(Response.Status.SERVICE_UNAVAILABLE.getStatusCode(), "Session store unavailable"),
          null,
          MediaType.APPLICATION_JSON_TYPE);
      return;
    }
    directive.ifPresent(d -> responseContext.getHeaders().add(HttpHeaders.SET_COOKIE, d.toSetCookieHeader()));
  }
}
