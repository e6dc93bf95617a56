package com.codeheadsystems.tessera.server.config;

import com.codeheadsystems.tessera.crypto.common.DeploymentMode;
import com.codeheadsystems.tessera.crypto.kdf.KdfParameters;
import com.codeheadsystems.tessera.server.ratelimit.RateLimitRule;
import com.codeheadsystems.tessera.server.ratelimit.RateLimitScope;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable runtime configuration of the authentication core. Built by the framework adapters
 * from their own configuration classes.
 *
 * @param mode             deployment mode; production hides OTP codes and enforces KDF bounds
 * @param kdfParameters    KDF cost parameters for the credential cipher
 * @param otpTtl           lifetime of an OTP session
 * @param maxOtpAttempts   verification attempts per OTP session
 * @param rateLimits       limit per scope, every scope present
 * @param rpId             WebAuthn relying party id
 * @param origin           expected WebAuthn origin
 * @param webAuthnTimeout  client-side ceremony timeout
 * @param challengeTtl     lifetime of a pending WebAuthn challenge
 * @param jwtIssuer        issuer claim of session tokens
 * @param jwtTtlSeconds    lifetime of session tokens
 * @param sweepInterval    period of the expired OTP session and challenge sweep
 */
public record TesseraConfig(
    DeploymentMode mode,
    KdfParameters kdfParameters,
    Duration otpTtl,
    int maxOtpAttempts,
    Map<RateLimitScope, RateLimitRule> rateLimits,
    String rpId,
    String origin,
    Duration webAuthnTimeout,
    Duration challengeTtl,
    String jwtIssuer,
    long jwtTtlSeconds,
    Duration sweepInterval) {

  public static final Duration DEFAULT_OTP_TTL = Duration.ofMinutes(5);
  public static final int DEFAULT_MAX_OTP_ATTEMPTS = 3;
  public static final Duration DEFAULT_CHALLENGE_TTL = Duration.ofMinutes(10);

  /**
   * Production defaults for a relying party on {@code localhost}.
   */
  public static final TesseraConfig DEFAULT = new TesseraConfig(
      DeploymentMode.PRODUCTION,
      KdfParameters.DEFAULT,
      DEFAULT_OTP_TTL,
      DEFAULT_MAX_OTP_ATTEMPTS,
      defaultRateLimits(),
      "localhost",
      "https://localhost",
      Duration.ofMinutes(1),
      DEFAULT_CHALLENGE_TTL,
      "tessera",
      3600,
      Duration.ofMinutes(1));

  public TesseraConfig {
    if (mode == null || kdfParameters == null) {
      throw new IllegalArgumentException("mode and kdfParameters are required");
    }
    requirePositive(otpTtl, "otpTtl");
    requirePositive(webAuthnTimeout, "webAuthnTimeout");
    requirePositive(challengeTtl, "challengeTtl");
    requirePositive(sweepInterval, "sweepInterval");
    if (maxOtpAttempts < 1) {
      throw new IllegalArgumentException("maxOtpAttempts must be positive: " + maxOtpAttempts);
    }
    if (jwtTtlSeconds < 1) {
      throw new IllegalArgumentException("jwtTtlSeconds must be positive: " + jwtTtlSeconds);
    }
    if (rpId == null || rpId.isBlank() || origin == null || origin.isBlank()) {
      throw new IllegalArgumentException("rpId and origin are required");
    }
    if (jwtIssuer == null || jwtIssuer.isBlank()) {
      throw new IllegalArgumentException("jwtIssuer is required");
    }
    EnumMap<RateLimitScope, RateLimitRule> limits = new EnumMap<>(defaultRateLimits());
    if (rateLimits != null) {
      limits.putAll(rateLimits);
    }
    rateLimits = Map.copyOf(limits);
  }

  /**
   * Development mode with cheap KDF parameters and the defaults otherwise.
   *
   * @return the config
   */
  public static TesseraConfig forTesting() {
    return DEFAULT.withMode(DeploymentMode.DEVELOPMENT).withKdfParameters(KdfParameters.forTesting());
  }

  /**
   * Initiate: 10 per IP and 5 per identifier per hour. Verify: 5 per session and 20 per IP per
   * minute. WebAuthn start: 10 per IP per minute.
   *
   * @return the default limits
   */
  public static Map<RateLimitScope, RateLimitRule> defaultRateLimits() {
    EnumMap<RateLimitScope, RateLimitRule> limits = new EnumMap<>(RateLimitScope.class);
    limits.put(RateLimitScope.OTP_INITIATE_IP, RateLimitRule.perHour(10));
    limits.put(RateLimitScope.OTP_INITIATE_IDENTIFIER, RateLimitRule.perHour(5));
    limits.put(RateLimitScope.OTP_VERIFY_SESSION, RateLimitRule.perMinute(5));
    limits.put(RateLimitScope.OTP_VERIFY_IP, RateLimitRule.perMinute(20));
    limits.put(RateLimitScope.WEBAUTHN_START_IP, RateLimitRule.perMinute(10));
    return limits;
  }

  public boolean isProduction() {
    return mode.isProduction();
  }

  public TesseraConfig withMode(DeploymentMode newMode) {
    return new TesseraConfig(newMode, kdfParameters, otpTtl, maxOtpAttempts, rateLimits, rpId, origin,
        webAuthnTimeout, challengeTtl, jwtIssuer, jwtTtlSeconds, sweepInterval);
  }

  public TesseraConfig withKdfParameters(KdfParameters newParameters) {
    return new TesseraConfig(mode, newParameters, otpTtl, maxOtpAttempts, rateLimits, rpId, origin,
        webAuthnTimeout, challengeTtl, jwtIssuer, jwtTtlSeconds, sweepInterval);
  }

  public TesseraConfig withRateLimit(RateLimitScope scope, RateLimitRule rule) {
    EnumMap<RateLimitScope, RateLimitRule> limits = new EnumMap<>(rateLimits);
    limits.put(scope, rule);
    return new TesseraConfig(mode, kdfParameters, otpTtl, maxOtpAttempts, limits, rpId, origin,
        webAuthnTimeout, challengeTtl, jwtIssuer, jwtTtlSeconds, sweepInterval);
  }

  public TesseraConfig withRelyingParty(String newRpId, String newOrigin) {
    return new TesseraConfig(mode, kdfParameters, otpTtl, maxOtpAttempts, rateLimits, newRpId, newOrigin,
        webAuthnTimeout, challengeTtl, jwtIssuer, jwtTtlSeconds, sweepInterval);
  }

  private static void requirePositive(Duration value, String name) {
    if (value == null || value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(name + " must be positive");
    }
  }
}
