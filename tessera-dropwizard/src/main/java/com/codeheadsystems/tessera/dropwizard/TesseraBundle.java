package com.codeheadsystems.tessera.dropwizard;

import com.codeheadsystems.tessera.dropwizard.filter.SessionContainerFilter;
import com.codeheadsystems.tessera.dropwizard.filter.SessionInfrastructureExceptionMapper;
import com.codeheadsystems.tessera.dropwizard.health.SessionStoreHealthCheck;
import com.codeheadsystems.tessera.dropwizard.lifecycle.SessionReaperManaged;
import com.codeheadsystems.tessera.middleware.SessionManager;
import com.codeheadsystems.tessera.store.ExpiredSessionPurger;
import com.codeheadsystems.tessera.store.InMemorySessionStore;
import com.codeheadsystems.tessera.store.SessionReaper;
import com.codeheadsystems.tessera.store.SessionStore;
import com.codeheadsystems.tessera.token.SessionIdGenerator;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that puts cookie sessions in front of an application's resources.
 * <p>
 * Registers the {@link SessionContainerFilter}, the 503 mapping for store failures, a
 * {@code session-store} health check and, for stores that need sweeping, a managed
 * {@link SessionReaper}. Requires a {@link TesseraConfiguration} block in the application's YAML
 * config.
 * <p>
 * Embed in your application with the in-memory store (dev/test only):
 * <pre>{@code
 *   bootstrap.addBundle(new TesseraBundle<>());
 * }</pre>
 * <p>
 * Or supply a shared store:
 * <pre>{@code
 *   bootstrap.addBundle(new TesseraBundle<>(new JdbcSessionStore(dataSource, storeConfig)));
 * }</pre>
 */
@Singleton
public class TesseraBundle<C extends TesseraConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(TesseraBundle.class);

  public static final String HEALTH_CHECK_NAME = "session-store";

  private final SessionStore suppliedStore;
  private final SessionIdGenerator generator;
  private SessionStore sessionStore;
  private SessionManager sessionManager;

  /**
   * Creates a bundle backed by an in-memory store built from the configuration.
   * <p>
   * For dev/test only: sessions are lost on restart and not shared between instances.
   */
  public TesseraBundle() {
    this.suppliedStore = null;
    this.generator = new SessionIdGenerator();
  }

  /**
   * Creates a bundle backed by the supplied store. The store's own configuration governs TTL,
   * sliding expiration and payload size.
   *
   * @param sessionStore the session store
   */
  @Inject
  public TesseraBundle(SessionStore sessionStore) {
    this.suppliedStore = sessionStore;
    this.generator = new SessionIdGenerator();
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    sessionStore = suppliedStore != null ? suppliedStore : buildInMemoryStore(configuration);
    sessionManager = new SessionManager(sessionStore, configuration.buildSessionManagerConfig());

    environment.jersey().register(new SessionContainerFilter(sessionManager));
    environment.jersey().register(new SessionInfrastructureExceptionMapper());
    environment.healthChecks().register(HEALTH_CHECK_NAME, new SessionStoreHealthCheck(sessionStore, generator));

    if (sessionStore instanceof ExpiredSessionPurger purger) {
      long interval = configuration.getReaperIntervalSeconds();
      if (interval > 0) {
        SessionReaper reaper = new SessionReaper(purger, Duration.ofSeconds(interval), "tessera-session-reaper");
        environment.lifecycle().manage(new SessionReaperManaged(reaper));
      } else {
        log.info("Session reaper disabled; expired sessions of {} are only dropped lazily",
            sessionStore.getClass().getSimpleName());
      }
    }
  }

  /**
   * The store in use. Available once the bundle has run.
   *
   * @return the session store
   */
  public SessionStore getSessionStore() {
    requireRun();
    return sessionStore;
  }

  /**
   * The manager in use. Available once the bundle has run.
   *
   * @return the session manager
   */
  public SessionManager getSessionManager() {
    requireRun();
    return sessionManager;
  }

  private SessionStore buildInMemoryStore(C configuration) {
    log.warn("""
        #################################################################
        # WARNING: Using the in-memory session store. Sessions are lost #
        # on restart and not shared between instances.                  #
        # Do not use in production.                                     #
        #################################################################
        """);
    // swept by the managed reaper instead of the store's own thread
    return new InMemorySessionStore(configuration.buildSessionStoreConfig(), generator, Clock.systemUTC(),
        InMemorySessionStore.DEFAULT_PARTITIONS, null);
  }

  private void requireRun() {
    if (sessionManager == null) {
      throw new IllegalStateException("TesseraBundle has not run yet");
    }
  }
}
