package com.codeheadsystems.tessera.dropwizard;

import com.codeheadsystems.tessera.crypto.common.DeploymentMode;
import com.codeheadsystems.tessera.crypto.kdf.KdfParameters;
import com.codeheadsystems.tessera.server.config.TesseraConfig;
import com.codeheadsystems.tessera.server.ratelimit.RateLimitRule;
import com.codeheadsystems.tessera.server.ratelimit.RateLimitScope;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Dropwizard configuration for the tessera OTP and WebAuthn endpoints.
 * <p>
 * For production set {@code mode: production}, a {@code jwtSecretHex} of at least 32 bytes
 * ({@code openssl rand -hex 32}) and the relying party's {@code rpId} and {@code origin}.
 * In production, KDF parameters outside the supported range stop the application at startup.
 */
public class TesseraConfiguration extends Configuration {

  /**
   * {@code development} or {@code production}. Development echoes one-time codes in the
   * initiate response and only warns about weak KDF parameters.
   */
  @NotEmpty
  private String mode = "production";

  /**
   * {@code argon2id} (default) or {@code pbkdf2-sha256}.
   */
  @NotEmpty
  private String kdfAlgorithm = "argon2id";

  /**
   * Argon2id memory cost as a power of two in KiB; 16 means 64 MiB.
   */
  @Min(1)
  @Max(30)
  private int argon2MemoryExponent = 16;

  /**
   * Argon2id iteration count.
   */
  @Min(1)
  private int argon2TimeCost = 3;

  /**
   * PBKDF2 iteration count, used when {@code kdfAlgorithm} is {@code pbkdf2-sha256}.
   */
  @Min(KdfParameters.MIN_PBKDF2_ITERATIONS)
  private int pbkdf2Iterations = KdfParameters.DEFAULT_PBKDF2_ITERATIONS;

  @Min(1)
  private long otpTtlSeconds = TesseraConfig.DEFAULT_OTP_TTL.toSeconds();

  @Min(1)
  private int maxOtpAttempts = TesseraConfig.DEFAULT_MAX_OTP_ATTEMPTS;

  /**
   * Overrides of the default limits, keyed by scope name, e.g. {@code OTP_INITIATE_IDENTIFIER}.
   */
  @Valid
  @NotNull
  private Map<RateLimitScope, RateLimitSettings> rateLimits = new HashMap<>();

  @NotEmpty
  private String rpId = "localhost";

  @NotEmpty
  private String origin = "https://localhost";

  @Min(1)
  private long webAuthnTimeoutMs = 60_000;

  @Min(1)
  private long challengeTtlSeconds = TesseraConfig.DEFAULT_CHALLENGE_TTL.toSeconds();

  /**
   * Hex-encoded HMAC-SHA256 signing secret for session tokens.
   * Leave empty for random generation (dev only, tokens become invalid on restart).
   */
  private String jwtSecretHex = "";

  @Min(1)
  private long jwtTtlSeconds = 3600;

  @NotEmpty
  private String jwtIssuer = "tessera";

  /**
   * Period of the sweep that removes expired OTP sessions, rate-limit windows and challenges.
   */
  @Min(1)
  private long sweepIntervalSeconds = 60;

  /**
   * Builds the framework-independent configuration.
   *
   * @return the config
   * @throws IllegalArgumentException if a value is inconsistent
   */
  public TesseraConfig toTesseraConfig() {
    Map<RateLimitScope, RateLimitRule> limits = new EnumMap<>(RateLimitScope.class);
    rateLimits.forEach((scope, settings) -> limits.put(scope, settings.toRule()));
    return new TesseraConfig(
        DeploymentMode.fromName(mode),
        kdfParameters(),
        Duration.ofSeconds(otpTtlSeconds),
        maxOtpAttempts,
        limits,
        rpId,
        origin,
        Duration.ofMillis(webAuthnTimeoutMs),
        Duration.ofSeconds(challengeTtlSeconds),
        jwtIssuer,
        jwtTtlSeconds,
        Duration.ofSeconds(sweepIntervalSeconds));
  }

  private KdfParameters kdfParameters() {
    if ("argon2id".equalsIgnoreCase(kdfAlgorithm)) {
      return KdfParameters.argon2id(argon2MemoryExponent, argon2TimeCost);
    }
    if ("pbkdf2-sha256".equalsIgnoreCase(kdfAlgorithm) || "pbkdf2".equalsIgnoreCase(kdfAlgorithm)) {
      return KdfParameters.pbkdf2(pbkdf2Iterations);
    }
    throw new IllegalArgumentException("Unknown kdfAlgorithm: " + kdfAlgorithm);
  }

  /**
   * A limit override: {@code limit} requests per {@code windowSeconds}.
   */
  public static class RateLimitSettings {

    @Min(1)
    private int limit = 1;

    @Min(1)
    private long windowSeconds = 60;

    @JsonProperty
    public int getLimit() {
      return limit;
    }

    @JsonProperty
    public void setLimit(int limit) {
      this.limit = limit;
    }

    @JsonProperty
    public long getWindowSeconds() {
      return windowSeconds;
    }

    @JsonProperty
    public void setWindowSeconds(long windowSeconds) {
      this.windowSeconds = windowSeconds;
    }

    RateLimitRule toRule() {
      return new RateLimitRule(limit, Duration.ofSeconds(windowSeconds));
    }
  }

  @JsonProperty
  public String getMode() {
    return mode;
  }

  @JsonProperty
  public void setMode(String mode) {
    this.mode = mode;
  }

  @JsonProperty
  public String getKdfAlgorithm() {
    return kdfAlgorithm;
  }

  @JsonProperty
  public void setKdfAlgorithm(String kdfAlgorithm) {
    this.kdfAlgorithm = kdfAlgorithm;
  }

  @JsonProperty
  public int getArgon2MemoryExponent() {
    return argon2MemoryExponent;
  }

  @JsonProperty
  public void setArgon2MemoryExponent(int argon2MemoryExponent) {
    this.argon2MemoryExponent = argon2MemoryExponent;
  }

  @JsonProperty
  public int getArgon2TimeCost() {
    return argon2TimeCost;
  }

  @JsonProperty
  public void setArgon2TimeCost(int argon2TimeCost) {
    this.argon2TimeCost = argon2TimeCost;
  }

  @JsonProperty
  public int getPbkdf2Iterations() {
    return pbkdf2Iterations;
  }

  @JsonProperty
  public void setPbkdf2Iterations(int pbkdf2Iterations) {
    this.pbkdf2Iterations = pbkdf2Iterations;
  }

  @JsonProperty
  public long getOtpTtlSeconds() {
    return otpTtlSeconds;
  }

  @JsonProperty
  public void setOtpTtlSeconds(long otpTtlSeconds) {
    this.otpTtlSeconds = otpTtlSeconds;
  }

  @JsonProperty
  public int getMaxOtpAttempts() {
    return maxOtpAttempts;
  }

  @JsonProperty
  public void setMaxOtpAttempts(int maxOtpAttempts) {
    this.maxOtpAttempts = maxOtpAttempts;
  }

  @JsonProperty
  public Map<RateLimitScope, RateLimitSettings> getRateLimits() {
    return rateLimits;
  }

  @JsonProperty
  public void setRateLimits(Map<RateLimitScope, RateLimitSettings> rateLimits) {
    this.rateLimits = rateLimits;
  }

  @JsonProperty
  public String getRpId() {
    return rpId;
  }

  @JsonProperty
  public void setRpId(String rpId) {
    this.rpId = rpId;
  }

  @JsonProperty
  public String getOrigin() {
    return origin;
  }

  @JsonProperty
  public void setOrigin(String origin) {
    this.origin = origin;
  }

  @JsonProperty
  public long getWebAuthnTimeoutMs() {
    return webAuthnTimeoutMs;
  }

  @JsonProperty
  public void setWebAuthnTimeoutMs(long webAuthnTimeoutMs) {
    this.webAuthnTimeoutMs = webAuthnTimeoutMs;
  }

  @JsonProperty
  public long getChallengeTtlSeconds() {
    return challengeTtlSeconds;
  }

  @JsonProperty
  public void setChallengeTtlSeconds(long challengeTtlSeconds) {
    this.challengeTtlSeconds = challengeTtlSeconds;
  }

  /**
   * Gets jwt secret hex.
   *
   * @return the jwt secret hex
   */
  @JsonProperty
  public String getJwtSecretHex() {
    return jwtSecretHex;
  }

  @JsonProperty
  public void setJwtSecretHex(String jwtSecretHex) {
    this.jwtSecretHex = jwtSecretHex;
  }

  @JsonProperty
  public long getJwtTtlSeconds() {
    return jwtTtlSeconds;
  }

  @JsonProperty
  public void setJwtTtlSeconds(long jwtTtlSeconds) {
    this.jwtTtlSeconds = jwtTtlSeconds;
  }

  @JsonProperty
  public String getJwtIssuer() {
    return jwtIssuer;
  }

  @JsonProperty
  public void setJwtIssuer(String jwtIssuer) {
    this.jwtIssuer = jwtIssuer;
  }

  @JsonProperty
  public long getSweepIntervalSeconds() {
    return sweepIntervalSeconds;
  }

  @JsonProperty
  public void setSweepIntervalSeconds(long sweepIntervalSeconds) {
    this.sweepIntervalSeconds = sweepIntervalSeconds;
  }
}
