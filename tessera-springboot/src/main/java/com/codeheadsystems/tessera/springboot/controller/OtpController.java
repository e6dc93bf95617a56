package com.codeheadsystems.tessera.springboot.controller;

import com.codeheadsystems.tessera.model.otp.InitiateRequest;
import com.codeheadsystems.tessera.model.otp.VerifyRequest;
import com.codeheadsystems.tessera.server.manager.OtpManager;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Spring MVC controller for one-time-code login.
 * <ul>
 *   <li>{@code POST /otp/initiate} creates a session and sends the code</li>
 *   <li>{@code POST /otp/verify} checks the code and returns a session token</li>
 * </ul>
 * Failures are returned as an {@code ErrorResponse} body with the matching status.
 */
@RestController
@RequestMapping("/otp")
public class OtpController {

  private static final Logger log = LoggerFactory.getLogger(OtpController.class);

  private final OtpManager otpManager;

  public OtpController(OtpManager otpManager) {
    this.otpManager = otpManager;
    log.info("OtpController({})", otpManager);
  }

  @PostMapping("/initiate")
  public ResponseEntity<Object> initiate(@RequestBody InitiateRequest request, HttpServletRequest http) {
    log.trace("initiate()");
    return OutcomeEntities.toEntity(otpManager.initiate(request, OutcomeEntities.clientMeta(http)));
  }

  @PostMapping("/verify")
  public ResponseEntity<Object> verify(@RequestBody VerifyRequest request, HttpServletRequest http) {
    log.trace("verify()");
    return OutcomeEntities.toEntity(otpManager.verify(request, OutcomeEntities.clientMeta(http)));
  }
}
