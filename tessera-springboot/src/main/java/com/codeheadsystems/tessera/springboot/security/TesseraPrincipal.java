package com.codeheadsystems.tessera.springboot.security;

import com.codeheadsystems.tessera.server.auth.AuthMethod;

/**
 * The authenticated caller of a request bearing a valid tessera session token.
 *
 * @param subject hashed identifier of the user
 * @param jti     token id
 * @param method  how the token was earned
 */
public record TesseraPrincipal(String subject, String jti, AuthMethod method) {
}
