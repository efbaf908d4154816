package com.codeheadsystems.tessera.dropwizard.auth;

import com.codeheadsystems.tessera.auth.AuthUser;
import com.codeheadsystems.tessera.auth.SessionAuthenticator;
import com.codeheadsystems.tessera.middleware.SessionContext;
import io.dropwizard.auth.Authenticator;
import java.security.Principal;
import java.util.Optional;

/**
 * Dropwizard {@link Authenticator} that resolves the user bound to the request's session.
 *
 * @param <U> user type, which doubles as the principal
 * @param <I> user id type
 */
public class SessionUserAuthenticator<U extends Principal & AuthUser<I>, I>
    implements Authenticator<SessionContext, U> {

  private final SessionAuthenticator<U, I> sessionAuthenticator;

  /**
   * Instantiates a new Session user authenticator.
   *
   * @param sessionAuthenticator the session authenticator
   */
  public SessionUserAuthenticator(SessionAuthenticator<U, I> sessionAuthenticator) {
    this.sessionAuthenticator = sessionAuthenticator;
  }

  @Override
  public Optional<U> authenticate(SessionContext context) {
    return sessionAuthenticator.currentUser(context);
  }
}
