package com.codeheadsystems.tessera.dropwizard.filter;

import com.codeheadsystems.tessera.exceptions.SessionInfrastructureException;
import io.dropwizard.jersey.errors.ErrorMessage;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps session store failures raised while resolving the cookie to 503 Service Unavailable.
 */
@Provider
public class SessionInfrastructureExceptionMapper implements ExceptionMapper<SessionInfrastructureException> {

  private static final Logger log = LoggerFactory.getLogger(SessionInfrastructureExceptionMapper.class);

  @Override
  public Response toResponse(SessionInfrastructureException exception) {
    log.warn("Session infrastructure failure: {}", exception.getMessage(), exception);
    int status = Response.Status.SERVICE_UNAVAILABLE.getStatusCode();
    return Response.status(status)
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(new ErrorMessage(status, "Session store unavailable"))
        .build();
  }
}
