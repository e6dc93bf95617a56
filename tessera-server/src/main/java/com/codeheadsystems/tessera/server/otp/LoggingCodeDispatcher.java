package com.codeheadsystems.tessera.server.otp;

import com.codeheadsystems.tessera.crypto.common.Hashing;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Placeholder used when no delivery channel is configured. It delivers nothing; in development
 * the code reaches the client in the initiate response instead.
 */
public class LoggingCodeDispatcher implements CodeDispatcher {

  private static final Logger log = LoggerFactory.getLogger(LoggingCodeDispatcher.class);

  @Override
  public void dispatch(String identifier, String code, Duration ttl) {
    log.warn("No code delivery channel configured; code for {} was not delivered",
        Hashing.forLogging(identifier));
  }
}
