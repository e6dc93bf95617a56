package com.codeheadsystems.tessera.server.resource;

import com.codeheadsystems.tessera.model.webauthn.WebAuthnCompleteRequest;
import com.codeheadsystems.tessera.model.webauthn.WebAuthnCompleteResponse;
import com.codeheadsystems.tessera.model.webauthn.WebAuthnStartRequest;
import com.codeheadsystems.tessera.model.webauthn.WebAuthnStartResponse;
import com.codeheadsystems.tessera.server.manager.WebAuthnManager;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource for the WebAuthn second factor.
 * <ul>
 *   <li>{@code POST /webauthn/start} issues a challenge</li>
 *   <li>{@code POST /webauthn/complete} verifies the assertion and its counter</li>
 * </ul>
 */
@Singleton
@Path("/webauthn")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class WebAuthnResource {

  private static final Logger log = LoggerFactory.getLogger(WebAuthnResource.class);

  private final WebAuthnManager webAuthnManager;

  @Inject
  public WebAuthnResource(final WebAuthnManager webAuthnManager) {
    this.webAuthnManager = webAuthnManager;
    log.info("WebAuthnResource({})", webAuthnManager);
  }

  @POST
  @Path("/start")
  public WebAuthnStartResponse start(final WebAuthnStartRequest request, @Context final HttpServletRequest http) {
    log.trace("start()");
    return OutcomeResponses.unwrap(webAuthnManager.start(request, OutcomeResponses.clientMeta(http)));
  }

  @POST
  @Path("/complete")
  public WebAuthnCompleteResponse complete(final WebAuthnCompleteRequest request) {
    log.trace("complete()");
    return OutcomeResponses.unwrap(webAuthnManager.complete(request));
  }
}
