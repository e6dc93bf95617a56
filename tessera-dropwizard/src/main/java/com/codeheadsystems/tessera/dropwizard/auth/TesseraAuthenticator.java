package com.codeheadsystems.tessera.dropwizard.auth;

import com.codeheadsystems.tessera.server.auth.JwtManager;
import io.dropwizard.auth.AuthenticationException;
import io.dropwizard.auth.Authenticator;
import java.util.Optional;

/**
 * Dropwizard {@link Authenticator} that validates session tokens using {@link JwtManager}.
 */
public class TesseraAuthenticator implements Authenticator<String, TesseraPrincipal> {

  private final JwtManager jwtManager;

  public TesseraAuthenticator(JwtManager jwtManager) {
    this.jwtManager = jwtManager;
  }

  @Override
  public Optional<TesseraPrincipal> authenticate(String token) throws AuthenticationException {
    return jwtManager.verify(token)
        .map(result -> new TesseraPrincipal(result.subject(), result.jti(), result.method()));
  }
}
