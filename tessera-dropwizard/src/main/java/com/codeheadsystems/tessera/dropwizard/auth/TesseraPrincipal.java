package com.codeheadsystems.tessera.dropwizard.auth;

import com.codeheadsystems.tessera.server.auth.AuthMethod;
import java.security.Principal;

/**
 * Principal representing a user authenticated by a tessera session token.
 *
 * @param subject hashed identifier from the JWT subject
 * @param jti     JWT ID for session management
 * @param method  how the user authenticated
 */
public record TesseraPrincipal(String subject, String jti, AuthMethod method) implements Principal {

  @Override
  public String getName() {
    return subject;
  }
}
