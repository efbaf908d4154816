package com.codeheadsystems.tessera.dropwizard.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.tessera.exceptions.BackendUnavailableException;
import com.codeheadsystems.tessera.store.SessionStore;
import com.codeheadsystems.tessera.token.SessionIdGenerator;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SessionStoreHealthCheckTest {

  @Mock private SessionStore store;

  @Test
  void storeAnswers_isHealthy() {
    when(store.load(any())).thenReturn(Optional.empty());

    HealthCheck.Result result = new SessionStoreHealthCheck(store, new SessionIdGenerator()).execute();

    assertThat(result.isHealthy()).isTrue();
  }

  @Test
  void storeUnavailable_isUnhealthy() {
    when(store.load(any())).thenThrow(new BackendUnavailableException("down", new RuntimeException("boom")));

    HealthCheck.Result result = new SessionStoreHealthCheck(store, new SessionIdGenerator()).execute();

    assertThat(result.isHealthy()).isFalse();
    assertThat(result.getError()).isInstanceOf(BackendUnavailableException.class);
  }
}
