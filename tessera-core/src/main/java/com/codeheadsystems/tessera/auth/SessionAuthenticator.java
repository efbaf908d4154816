package com.codeheadsystems.tessera.auth;

import com.codeheadsystems.tessera.middleware.SessionContext;
import com.codeheadsystems.tessera.model.Session;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Associates users with sessions.
 * <p>
 * Only the user id is kept in the session, under {@value #USER_ID_KEY}; the user itself is
 * loaded fresh through the {@link UserLoader} on every {@link #currentUser} call.
 *
 * @param <U> user type
 * @param <I> user id type
 */
public class SessionAuthenticator<U extends AuthUser<I>, I> {

  private static final Logger log = LoggerFactory.getLogger(SessionAuthenticator.class);

  public static final String USER_ID_KEY = "user_id";

  private final UserLoader<U, I> loader;
  private final Class<I> idType;

  /**
   * Instantiates a new Session authenticator.
   *
   * @param loader the loader
   * @param idType the user id class, used to read the id back from the payload
   */
  public SessionAuthenticator(UserLoader<U, I> loader, Class<I> idType) {
    this.loader = loader;
    this.idType = idType;
  }

  /**
   * Binds the user to the request's session, creating one if needed. An existing session gets a
   * new id so an id known before login cannot be used afterwards.
   *
   * @param context the context
   * @param user    the authenticated user
   */
  public void login(SessionContext context, U user) {
    Session session = context.getOrCreate();
    session.put(USER_ID_KEY, user.id());
    session.rotateId();
    log.debug("User logged in to session");
  }

  /**
   * Ends the request's session.
   *
   * @param context the context
   */
  public void logout(SessionContext context) {
    context.invalidate();
  }

  /**
   * The user bound to the request's session.
   *
   * @param context the context
   * @return the user, or empty if there is no session, no user in it, or the user is gone
   */
  public Optional<U> currentUser(SessionContext context) {
    Optional<I> userId = context.session().flatMap(s -> s.get(USER_ID_KEY, idType));
    if (userId.isEmpty()) {
      return Optional.empty();
    }
    Optional<U> user = loader.load(userId.get());
    if (user.isEmpty()) {
      log.warn("Session references a user that no longer exists");
    }
    return user;
  }
}
