package com.codeheadsystems.tessera.springboot.controller;

import com.codeheadsystems.tessera.model.webauthn.WebAuthnCompleteRequest;
import com.codeheadsystems.tessera.model.webauthn.WebAuthnStartRequest;
import com.codeheadsystems.tessera.server.manager.WebAuthnManager;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Spring MVC controller for the WebAuthn second factor.
 */
@RestController
@RequestMapping("/webauthn")
public class WebAuthnController {

  private static final Logger log = LoggerFactory.getLogger(WebAuthnController.class);

  private final WebAuthnManager webAuthnManager;

  public WebAuthnController(WebAuthnManager webAuthnManager) {
    this.webAuthnManager = webAuthnManager;
    log.info("WebAuthnController({})", webAuthnManager);
  }

  @PostMapping("/start")
  public ResponseEntity<Object> start(@RequestBody WebAuthnStartRequest request, HttpServletRequest http) {
    log.trace("start()");
    return OutcomeEntities.toEntity(webAuthnManager.start(request, OutcomeEntities.clientMeta(http)));
  }

  @PostMapping("/complete")
  public ResponseEntity<Object> complete(@RequestBody WebAuthnCompleteRequest request) {
    log.trace("complete()");
    return OutcomeEntities.toEntity(webAuthnManager.complete(request));
  }
}
