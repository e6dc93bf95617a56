package com.codeheadsystems.tessera.server.resource;

import com.codeheadsystems.tessera.model.otp.InitiateRequest;
import com.codeheadsystems.tessera.model.otp.InitiateResponse;
import com.codeheadsystems.tessera.model.otp.VerifyRequest;
import com.codeheadsystems.tessera.model.otp.VerifyResponse;
import com.codeheadsystems.tessera.server.manager.OtpManager;
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
 * JAX-RS resource for one-time-code login.
 * <ul>
 *   <li>{@code POST /otp/initiate} creates a session and sends the code</li>
 *   <li>{@code POST /otp/verify} checks the code and returns a session token</li>
 * </ul>
 */
@Singleton
@Path("/otp")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class OtpResource {

  private static final Logger log = LoggerFactory.getLogger(OtpResource.class);

  private final OtpManager otpManager;

  @Inject
  public OtpResource(final OtpManager otpManager) {
    this.otpManager = otpManager;
    log.info("OtpResource({})", otpManager);
  }

  @POST
  @Path("/initiate")
  public InitiateResponse initiate(final InitiateRequest request, @Context final HttpServletRequest http) {
    log.trace("initiate()");
    return OutcomeResponses.unwrap(otpManager.initiate(request, OutcomeResponses.clientMeta(http)));
  }

  @POST
  @Path("/verify")
  public VerifyResponse verify(final VerifyRequest request, @Context final HttpServletRequest http) {
    log.trace("verify()");
    return OutcomeResponses.unwrap(otpManager.verify(request, OutcomeResponses.clientMeta(http)));
  }
}
