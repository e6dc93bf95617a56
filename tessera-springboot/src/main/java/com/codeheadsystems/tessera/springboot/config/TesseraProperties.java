package com.codeheadsystems.tessera.springboot.config;

import com.codeheadsystems.tessera.crypto.common.DeploymentMode;
import com.codeheadsystems.tessera.crypto.kdf.KdfParameters;
import com.codeheadsystems.tessera.server.config.TesseraConfig;
import com.codeheadsystems.tessera.server.ratelimit.RateLimitRule;
import com.codeheadsystems.tessera.server.ratelimit.RateLimitScope;
import java.time.Duration;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "tessera")
public class TesseraProperties {

  private String mode = "production";
  private String kdfAlgorithm = "argon2id";
  private int argon2MemoryExponent = 16;
  private int argon2TimeCost = 3;
  private int pbkdf2Iterations = KdfParameters.DEFAULT_PBKDF2_ITERATIONS;
  private Duration otpTtl = TesseraConfig.DEFAULT_OTP_TTL;
  private int maxOtpAttempts = TesseraConfig.DEFAULT_MAX_OTP_ATTEMPTS;
  private Map<RateLimitScope, RateLimit> rateLimits = new HashMap<>();
  private String rpId = "localhost";
  private String origin = "https://localhost";
  private Duration webAuthnTimeout = Duration.ofMinutes(1);
  private Duration challengeTtl = TesseraConfig.DEFAULT_CHALLENGE_TTL;
  private String jwtSecretHex = "";
  private long jwtTtlSeconds = 3600;
  private String jwtIssuer = "tessera";
  private Duration sweepInterval = Duration.ofMinutes(1);

  /**
   * Builds the framework-independent configuration.
   *
   * @return the config
   * @throws IllegalArgumentException if a value is inconsistent
   */
  public TesseraConfig toTesseraConfig() {
    Map<RateLimitScope, RateLimitRule> limits = new EnumMap<>(RateLimitScope.class);
    rateLimits.forEach((scope, limit) -> limits.put(scope, new RateLimitRule(limit.getLimit(), limit.getWindow())));
    return new TesseraConfig(DeploymentMode.fromName(mode), kdfParameters(), otpTtl, maxOtpAttempts, limits,
        rpId, origin, webAuthnTimeout, challengeTtl, jwtIssuer, jwtTtlSeconds, sweepInterval);
  }

  private KdfParameters kdfParameters() {
    if ("argon2id".equalsIgnoreCase(kdfAlgorithm)) {
      return KdfParameters.argon2id(argon2MemoryExponent, argon2TimeCost);
    }
    if ("pbkdf2-sha256".equalsIgnoreCase(kdfAlgorithm) || "pbkdf2".equalsIgnoreCase(kdfAlgorithm)) {
      return KdfParameters.pbkdf2(pbkdf2Iterations);
    }
    throw new IllegalArgumentException("Unknown tessera.kdf-algorithm: " + kdfAlgorithm);
  }

  /**
   * A limit override: {@code limit} requests per {@code window}.
   */
  public static class RateLimit {

    private int limit = 1;
    private Duration window = Duration.ofMinutes(1);

    public int getLimit() {
      return limit;
    }

    public void setLimit(int limit) {
      this.limit = limit;
    }

    public Duration getWindow() {
      return window;
    }

    public void setWindow(Duration window) {
      this.window = window;
    }
  }

  public String getMode() {
    return mode;
  }

  public void setMode(String mode) {
    this.mode = mode;
  }

  public String getKdfAlgorithm() {
    return kdfAlgorithm;
  }

  public void setKdfAlgorithm(String kdfAlgorithm) {
    this.kdfAlgorithm = kdfAlgorithm;
  }

  public int getArgon2MemoryExponent() {
    return argon2MemoryExponent;
  }

  public void setArgon2MemoryExponent(int argon2MemoryExponent) {
    this.argon2MemoryExponent = argon2MemoryExponent;
  }

  public int getArgon2TimeCost() {
    return argon2TimeCost;
  }

  public void setArgon2TimeCost(int argon2TimeCost) {
    this.argon2TimeCost = argon2TimeCost;
  }

  public int getPbkdf2Iterations() {
    return pbkdf2Iterations;
  }

  public void setPbkdf2Iterations(int pbkdf2Iterations) {
    this.pbkdf2Iterations = pbkdf2Iterations;
  }

  public Duration getOtpTtl() {
    return otpTtl;
  }

  public void setOtpTtl(Duration otpTtl) {
    this.otpTtl = otpTtl;
  }

  public int getMaxOtpAttempts() {
    return maxOtpAttempts;
  }

  public void setMaxOtpAttempts(int maxOtpAttempts) {
    this.maxOtpAttempts = maxOtpAttempts;
  }

  public Map<RateLimitScope, RateLimit> getRateLimits() {
    return rateLimits;
  }

  public void setRateLimits(Map<RateLimitScope, RateLimit> rateLimits) {
    this.rateLimits = rateLimits;
  }

  public String getRpId() {
    return rpId;
  }

  public void setRpId(String rpId) {
    this.rpId = rpId;
  }

  public String getOrigin() {
    return origin;
  }

  public void setOrigin(String origin) {
    this.origin = origin;
  }

  public Duration getWebAuthnTimeout() {
    return webAuthnTimeout;
  }

  public void setWebAuthnTimeout(Duration webAuthnTimeout) {
    this.webAuthnTimeout = webAuthnTimeout;
  }

  public Duration getChallengeTtl() {
    return challengeTtl;
  }

  public void setChallengeTtl(Duration challengeTtl) {
    this.challengeTtl = challengeTtl;
  }

  public String getJwtSecretHex() {
    return jwtSecretHex;
  }

  public void setJwtSecretHex(String jwtSecretHex) {
    this.jwtSecretHex = jwtSecretHex;
  }

  public long getJwtTtlSeconds() {
    return jwtTtlSeconds;
  }

  public void setJwtTtlSeconds(long jwtTtlSeconds) {
    this.jwtTtlSeconds = jwtTtlSeconds;
  }

  public String getJwtIssuer() {
    return jwtIssuer;
  }

  public void setJwtIssuer(String jwtIssuer) {
    this.jwtIssuer = jwtIssuer;
  }

  public Duration getSweepInterval() {
    return sweepInterval;
  }

  public void setSweepInterval(Duration sweepInterval) {
    this.sweepInterval = sweepInterval;
  }
}
