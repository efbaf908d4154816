package com.codeheadsystems.tessera.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.tessera.middleware.BackendFailurePolicy;
import com.codeheadsystems.tessera.middleware.CookieSettings;
import com.codeheadsystems.tessera.middleware.SessionManagerConfig;
import com.codeheadsystems.tessera.store.SessionStoreConfig;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class TesseraConfigurationTest {

  @Test
  void defaults_matchCoreDefaults() {
    TesseraConfiguration configuration = new TesseraConfiguration();

    assertThat(configuration.buildSessionStoreConfig()).isEqualTo(SessionStoreConfig.defaults());
    assertThat(configuration.buildSessionManagerConfig()).isEqualTo(SessionManagerConfig.defaults());
  }

  @Test
  void customValues_flowIntoCoreConfig() {
    TesseraConfiguration configuration = new TesseraConfiguration();
    configuration.setSessionTtlSeconds(600);
    configuration.setSlidingExpiration(true);
    configuration.setCookieName("sid");
    configuration.setCookieDomain("example.com");
    configuration.setCookieSameSite("Strict");
    configuration.setBackendFailurePolicy(BackendFailurePolicy.TREAT_AS_ANONYMOUS);

    SessionStoreConfig store = configuration.buildSessionStoreConfig();
    SessionManagerConfig manager = configuration.buildSessionManagerConfig();

    assertThat(store.ttl()).isEqualTo(Duration.ofMinutes(10));
    assertThat(store.slidingExpiration()).isTrue();
    CookieSettings cookie = manager.cookie();
    assertThat(cookie.name()).isEqualTo("sid");
    assertThat(cookie.domain()).isEqualTo("example.com");
    assertThat(cookie.sameSite()).isEqualTo("Strict");
    assertThat(manager.backendFailurePolicy()).isEqualTo(BackendFailurePolicy.TREAT_AS_ANONYMOUS);
  }

  @Test
  void sameSiteNone_withoutSecure_isRejected() {
    TesseraConfiguration configuration = new TesseraConfiguration();
    configuration.setCookieSameSite("None");
    configuration.setCookieSecure(false);

    assertThatThrownBy(configuration::buildSessionManagerConfig).isInstanceOf(IllegalArgumentException.class);
  }
}
