package com.codeheadsystems.tessera.server.resource;

import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

/**
 * Returns the prepared error response unchanged. Containers such as Dropwizard otherwise map
 * every {@code WebApplicationException} to their own generic error body, dropping the error
 * code, {@code retryAfterSeconds} and {@code attemptsRemaining}.
 */
@Provider
public class AuthFailureExceptionMapper implements ExceptionMapper<AuthFailureException> {

  @Override
  public Response toResponse(AuthFailureException exception) {
    return exception.getResponse();
  }
}
