package com.codeheadsystems.tessera.dropwizard.filter;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.tessera.exceptions.BackendUnavailableException;
import com.codeheadsystems.tessera.exceptions.SessionInfrastructureException;
import io.dropwizard.jersey.errors.ErrorMessage;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.Test;

class SessionInfrastructureExceptionMapperTest {

  @Test
  void mapsToServiceUnavailable() {
    SessionInfrastructureException exception = new SessionInfrastructureException("Unable to resolve session",
        new BackendUnavailableException("connection refused", new RuntimeException()));

    Response response = new SessionInfrastructureExceptionMapper().toResponse(exception);

    assertThat(response.getStatus()).isEqualTo(503);
    assertThat(response.getEntity()).isInstanceOf(ErrorMessage.class);
    assertThat(((ErrorMessage) response.getEntity()).getMessage()).doesNotContain("connection refused");
  }
}
