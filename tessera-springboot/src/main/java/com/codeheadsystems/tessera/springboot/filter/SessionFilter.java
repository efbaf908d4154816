package com.codeheadsystems.tessera.springboot.filter;

import com.codeheadsystems.tessera.exceptions.SessionInfrastructureException;
import com.codeheadsystems.tessera.middleware.CookieDirective;
import com.codeheadsystems.tessera.middleware.SessionContext;
import com.codeheadsystems.tessera.middleware.SessionManager;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;

/**
 * Servlet filter that opens a {@link SessionContext} for each request and commits it after the
 * handler returns.
 * <p>
 * The response body is buffered so the {@code Set-Cookie} header can still be added once the
 * outcome is known. The context is exposed as the request attribute {@link SessionContext#ATTRIBUTE}.
 * If the handler throws, or the response has a 5xx status, nothing is committed. Store failures
 * become 503 responses.
 */
public class SessionFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(SessionFilter.class);

  private final SessionManager sessionManager;

  /**
   * Instantiates a new Session filter.
   *
   * @param sessionManager the session manager
   */
  public SessionFilter(SessionManager sessionManager) {
    this.sessionManager = sessionManager;
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {
    SessionContext context;
    try {
      context = sessionManager.open(readCookie(request));
    } catch (SessionInfrastructureException e) {
      log.warn("Unable to resolve session: {}", e.getMessage(), e);
      response.sendError(HttpServletResponse.SC_SERVICE_UNAVAILABLE, "Session store unavailable");
      return;
    }
    request.setAttribute(SessionContext.ATTRIBUTE, context);

    ContentCachingResponseWrapper wrapper = new ContentCachingResponseWrapper(response);
    filterChain.doFilter(request, wrapper);

    if (wrapper.getStatus() >= HttpServletResponse.SC_INTERNAL_SERVER_ERROR) {
      log.debug("Request failed with status {}, session not committed", wrapper.getStatus());
    } else {
      Optional<CookieDirective> directive;
      try {
        directive = sessionManager.commit(context);
      } catch (SessionInfrastructureException e) {
        log.warn("Unable to commit session: {}", e.getMessage(), e);
        wrapper.resetBuffer();
        response.sendError(HttpServletResponse.SC_SERVICE_UNAVAILABLE, "Session store unavailable");
        return;
      }
      directive.ifPresent(d -> wrapper.addHeader(HttpHeaders.SET_COOKIE, d.toSetCookieHeader()));
    }
    wrapper.copyBodyToResponse();
  }

  private String readCookie(HttpServletRequest request) {
    Cookie[] cookies = request.getCookies();
    if (cookies == null) {
      return null;
    }
    String name = sessionManager.cookieSettings().name();
    for (Cookie cookie : cookies) {
      if (name.equals(cookie.getName())) {
        return cookie.getValue();
      }
    }
    return null;
  }
}
