package com.codeheadsystems.tessera.server.resource;

import com.codeheadsystems.tessera.server.error.AuthFailure;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;

/**
 * A failed authentication step carrying its complete error response.
 */
public class AuthFailureException extends WebApplicationException {

  private final transient AuthFailure failure;

  public AuthFailureException(AuthFailure failure, Response response) {
    super(failure.message(), response);
    this.failure = failure;
  }

  public AuthFailure failure() {
    return failure;
  }
}
