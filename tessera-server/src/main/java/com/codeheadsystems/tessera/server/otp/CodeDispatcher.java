package com.codeheadsystems.tessera.server.otp;

import java.time.Duration;

/**
 * Delivers a code to its destination (email, Nostr DM, SMS). The delivery wire format is the
 * implementation's business.
 */
public interface CodeDispatcher {

  /**
   * Delivers the code.
   *
   * @param identifier the raw destination identifier
   * @param code       the code
   * @param ttl        how long the code stays valid, for the message text
   * @throws CodeDeliveryException if the channel rejected the message
   */
  void dispatch(String identifier, String code, Duration ttl);
}
