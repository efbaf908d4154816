package com.codeheadsystems.tessera.springboot.config;

import com.codeheadsystems.tessera.jdbc.JdbcSessionStore;
import com.codeheadsystems.tessera.middleware.SessionManager;
import com.codeheadsystems.tessera.password.Argon2CredentialHasher;
import com.codeheadsystems.tessera.password.CredentialHasher;
import com.codeheadsystems.tessera.password.HashParameters;
import com.codeheadsystems.tessera.redis.RedisTemplateCacheClient;
import com.codeheadsystems.tessera.redis.RemoteCacheSessionStore;
import com.codeheadsystems.tessera.springboot.filter.SessionFilter;
import com.codeheadsystems.tessera.springboot.health.SessionStoreHealthIndicator;
import com.codeheadsystems.tessera.springboot.web.SessionContextArgumentResolver;
import com.codeheadsystems.tessera.store.InMemorySessionStore;
import com.codeheadsystems.tessera.store.SessionStore;
import com.codeheadsystems.tessera.token.SessionIdGenerator;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.List;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Auto-configuration for cookie sessions.
 * <p>
 * The store is picked by {@code tessera.store-type}: {@code memory} (default, dev/test only),
 * {@code redis} (needs a {@link RedisConnectionFactory} and tessera-redis) or {@code jdbc} (needs a
 * {@link DataSource} and tessera-jdbc). Every bean backs off when the application defines its own.
 */
@AutoConfiguration
@EnableConfigurationProperties(TesseraProperties.class)
public class TesseraAutoConfiguration {

  private static final Logger log = LoggerFactory.getLogger(TesseraAutoConfiguration.class);

  /**
   * Default {@link SecureRandom} instance. Override this bean to supply a custom implementation:
   * <pre>{@code
   *   @Bean
   *   public SecureRandom secureRandom() {
   *     return SecureRandom.getInstance("NativePRNG");
   *   }
   * }</pre>
   */
  @Bean
  @ConditionalOnMissingBean
  public SecureRandom secureRandom() {
    return new SecureRandom();
  }

  @Bean
  @ConditionalOnMissingBean
  public SessionIdGenerator sessionIdGenerator(SecureRandom secureRandom) {
    return new SessionIdGenerator(secureRandom);
  }

  @Bean(destroyMethod = "shutdown")
  @ConditionalOnMissingBean(SessionStore.class)
  @ConditionalOnProperty(prefix = "tessera", name = "store-type", havingValue = "memory", matchIfMissing = true)
  public InMemorySessionStore memorySessionStore(TesseraProperties props, SessionIdGenerator sessionIdGenerator) {
    log.warn("Using in-memory session store. All sessions will be lost on restart. Do not use in production.");
    // swept by the SessionReaper bean
    return new InMemorySessionStore(props.buildSessionStoreConfig(), sessionIdGenerator, Clock.systemUTC(),
        InMemorySessionStore.DEFAULT_PARTITIONS, null);
  }

  @Bean
  @ConditionalOnMissingBean
  public SessionManager sessionManager(SessionStore sessionStore, TesseraProperties props) {
    return new SessionManager(sessionStore, props.buildSessionManagerConfig());
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass({RemoteCacheSessionStore.class, RedisConnectionFactory.class})
  @ConditionalOnProperty(prefix = "tessera", name = "store-type", havingValue = "redis")
  static class RedisSessionStoreConfiguration {

    @Bean
    @ConditionalOnMissingBean(SessionStore.class)
    public RemoteCacheSessionStore redisSessionStore(RedisConnectionFactory connectionFactory,
                                                     TesseraProperties props,
                                                     SessionIdGenerator sessionIdGenerator) {
      RedisTemplateCacheClient client =
          new RedisTemplateCacheClient(RedisTemplateCacheClient.templateFor(connectionFactory));
      return new RemoteCacheSessionStore(client, props.buildSessionStoreConfig(), sessionIdGenerator,
          Clock.systemUTC(), props.getRedisKeyPrefix());
    }
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(JdbcSessionStore.class)
  @ConditionalOnProperty(prefix = "tessera", name = "store-type", havingValue = "jdbc")
  static class JdbcSessionStoreConfiguration {

    @Bean
    @ConditionalOnMissingBean(SessionStore.class)
    public JdbcSessionStore jdbcSessionStore(DataSource dataSource,
                                             TesseraProperties props,
                                             SessionIdGenerator sessionIdGenerator) {
      return new JdbcSessionStore(dataSource, props.buildSessionStoreConfig(), sessionIdGenerator,
          Clock.systemUTC(), props.getJdbcTable());
    }
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
  static class SessionWebConfiguration {

    @Bean
    @ConditionalOnMissingBean(name = "sessionFilterRegistration")
    public FilterRegistrationBean<SessionFilter> sessionFilterRegistration(SessionManager sessionManager) {
      FilterRegistrationBean<SessionFilter> registration = new FilterRegistrationBean<>(new SessionFilter(sessionManager));
      registration.setName("tesseraSessionFilter");
      // ahead of application filters that may read the session
      registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 100);
      return registration;
    }

    @Bean
    public WebMvcConfigurer sessionContextWebMvcConfigurer() {
      return new WebMvcConfigurer() {
        @Override
        public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
          resolvers.add(new SessionContextArgumentResolver());
        }
      };
    }
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(HealthIndicator.class)
  static class SessionHealthConfiguration {

    @Bean
    @ConditionalOnMissingBean(name = "sessionStoreHealthIndicator")
    public SessionStoreHealthIndicator sessionStoreHealthIndicator(SessionStore sessionStore,
                                                                   SessionIdGenerator sessionIdGenerator) {
      return new SessionStoreHealthIndicator(sessionStore, sessionIdGenerator);
    }
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(Argon2CredentialHasher.class)
  static class CredentialHasherConfiguration {

    @Bean
    @ConditionalOnMissingBean(CredentialHasher.class)
    public Argon2CredentialHasher credentialHasher(TesseraProperties props, SecureRandom secureRandom) {
      HashParameters parameters = new HashParameters(
          props.getArgon2MemoryKib(), props.getArgon2Iterations(), props.getArgon2Parallelism());
      return new Argon2CredentialHasher(parameters, secureRandom);
    }
  }
}
