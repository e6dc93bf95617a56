package com.codeheadsystems.tessera.springboot.config;

import com.codeheadsystems.tessera.crypto.cipher.CredentialCipher;
import com.codeheadsystems.tessera.crypto.common.RandomProvider;
import com.codeheadsystems.tessera.crypto.exceptions.ConfigurationException;
import com.codeheadsystems.tessera.server.audit.AuditSink;
import com.codeheadsystems.tessera.server.audit.LoggingAuditSink;
import com.codeheadsystems.tessera.server.auth.JwtManager;
import com.codeheadsystems.tessera.server.config.TesseraConfig;
import com.codeheadsystems.tessera.server.manager.OtpManager;
import com.codeheadsystems.tessera.server.manager.OtpSessionSweeper;
import com.codeheadsystems.tessera.server.manager.WebAuthnManager;
import com.codeheadsystems.tessera.server.otp.CodeDispatcher;
import com.codeheadsystems.tessera.server.otp.InMemoryOtpSessionRepository;
import com.codeheadsystems.tessera.server.otp.LoggingCodeDispatcher;
import com.codeheadsystems.tessera.server.otp.OtpSessionRepository;
import com.codeheadsystems.tessera.server.otp.OtpSessionStore;
import com.codeheadsystems.tessera.server.ratelimit.InMemoryRateLimitStore;
import com.codeheadsystems.tessera.server.ratelimit.RateLimitStore;
import com.codeheadsystems.tessera.server.ratelimit.RateLimiter;
import com.codeheadsystems.tessera.server.store.InMemorySessionStore;
import com.codeheadsystems.tessera.server.store.SessionStore;
import com.codeheadsystems.tessera.server.webauthn.AssertionVerifier;
import com.codeheadsystems.tessera.server.webauthn.ChallengeStore;
import com.codeheadsystems.tessera.server.webauthn.InMemoryChallengeStore;
import com.codeheadsystems.tessera.server.webauthn.InMemoryWebAuthnCredentialRepository;
import com.codeheadsystems.tessera.server.webauthn.SecondFactorCloneDetector;
import com.codeheadsystems.tessera.server.webauthn.WebAuthnCredentialRepository;
import com.codeheadsystems.tessera.springboot.controller.OtpController;
import com.codeheadsystems.tessera.springboot.controller.WebAuthnController;
import com.codeheadsystems.tessera.springboot.health.CredentialCipherHealthIndicator;
import com.codeheadsystems.tessera.springboot.security.TesseraSecurityConfig;
import java.time.Clock;
import java.util.HexFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

/**
 * Wires the tessera OTP and WebAuthn services with in-memory defaults.
 * <p>
 * Every store, the code dispatcher and the audit sink can be replaced by declaring a bean of the
 * same type. An {@link AssertionVerifier} bean must always be supplied: there is no default
 * FIDO2 verifier.
 */
@AutoConfiguration
@EnableConfigurationProperties(TesseraProperties.class)
@Import({OtpController.class, WebAuthnController.class, TesseraSecurityConfig.class,
    CredentialCipherHealthIndicator.class})
public class TesseraAutoConfiguration {

  private static final Logger log = LoggerFactory.getLogger(TesseraAutoConfiguration.class);

  @Bean
  @ConditionalOnMissingBean
  public TesseraConfig tesseraConfig(TesseraProperties props) {
    TesseraConfig config = props.toTesseraConfig();
    if (!config.isProduction()) {
      log.warn("Running in {} mode: one-time codes are returned in responses", config.mode());
    }
    return config;
  }

  /**
   * Default {@link RandomProvider}. Override to supply a different {@code SecureRandom}:
   * <pre>{@code
   *   @Bean
   *   public RandomProvider randomProvider() {
   *     return new RandomProvider(SecureRandom.getInstance("NativePRNG"));
   *   }
   * }</pre>
   */
  @Bean
  @ConditionalOnMissingBean
  public RandomProvider randomProvider() {
    return new RandomProvider();
  }

  @Bean
  @ConditionalOnMissingBean
  public Clock tesseraClock() {
    return Clock.systemUTC();
  }

  /**
   * The credential cipher. Construction fails in production mode when the configured KDF
   * parameters are outside the supported range.
   */
  @Bean(destroyMethod = "shutdown")
  @ConditionalOnMissingBean
  public CredentialCipher credentialCipher(TesseraConfig config) {
    return CredentialCipher.create(config.kdfParameters(), config.mode());
  }

  // ── Storage ──────────────────────────────────────────────────────────────

  @Bean
  @ConditionalOnMissingBean
  public OtpSessionRepository otpSessionRepository() {
    log.warn("Using in-memory OTP session store. All data will be lost on restart. Do not use in production.");
    return new InMemoryOtpSessionRepository();
  }

  @Bean
  @ConditionalOnMissingBean
  public RateLimitStore rateLimitStore() {
    log.warn("Using in-memory rate limit store. Limits do not hold across replicas. Do not use in production.");
    return new InMemoryRateLimitStore();
  }

  @Bean
  @ConditionalOnMissingBean
  public WebAuthnCredentialRepository webAuthnCredentialRepository() {
    log.warn("Using in-memory WebAuthn credential store. All data will be lost on restart. "
        + "Do not use in production.");
    return new InMemoryWebAuthnCredentialRepository();
  }

  @Bean
  @ConditionalOnMissingBean
  public ChallengeStore challengeStore() {
    return new InMemoryChallengeStore();
  }

  @Bean
  @ConditionalOnMissingBean
  public SessionStore sessionStore() {
    log.warn("Using in-memory session store. All data will be lost on restart. Do not use in production.");
    return new InMemorySessionStore();
  }

  @Bean
  @ConditionalOnMissingBean
  public CodeDispatcher codeDispatcher() {
    return new LoggingCodeDispatcher();
  }

  @Bean
  @ConditionalOnMissingBean
  public AuditSink auditSink() {
    return new LoggingAuditSink();
  }

  // ── Services ─────────────────────────────────────────────────────────────

  @Bean
  @ConditionalOnMissingBean
  public JwtManager jwtManager(TesseraProperties props, TesseraConfig config, SessionStore sessionStore,
                               RandomProvider randomProvider) {
    String secretHex = props.getJwtSecretHex();
    byte[] secret;
    if (secretHex == null || secretHex.isEmpty()) {
      if (config.isProduction()) {
        throw new ConfigurationException("tessera.jwt-secret-hex is required in production mode");
      }
      log.warn("No JWT secret configured, generating randomly. "
          + "Tokens will be invalidated on restart. Do not use in production.");
      secret = randomProvider.randomBytes(32);
    } else {
      secret = HexFormat.of().parseHex(secretHex);
    }
    return new JwtManager(secret, config.jwtIssuer(), config.jwtTtlSeconds(), sessionStore);
  }

  @Bean
  @ConditionalOnMissingBean
  public RateLimiter rateLimiter(TesseraConfig config, RateLimitStore store, AuditSink auditSink, Clock tesseraClock) {
    return new RateLimiter(store, config.rateLimits(), auditSink, tesseraClock);
  }

  @Bean
  @ConditionalOnMissingBean
  public OtpSessionStore otpSessionStore(TesseraConfig config, OtpSessionRepository repository,
                                         RandomProvider randomProvider, AuditSink auditSink, Clock tesseraClock) {
    return new OtpSessionStore(repository, randomProvider, auditSink, tesseraClock, config.maxOtpAttempts());
  }

  @Bean
  @ConditionalOnMissingBean
  public SecondFactorCloneDetector secondFactorCloneDetector(TesseraConfig config,
                                                             WebAuthnCredentialRepository credentials,
                                                             ChallengeStore challenges,
                                                             AssertionVerifier assertionVerifier,
                                                             RandomProvider randomProvider,
                                                             AuditSink auditSink,
                                                             Clock tesseraClock) {
    return new SecondFactorCloneDetector(credentials, challenges, assertionVerifier, randomProvider, auditSink,
        tesseraClock, config.rpId(), config.origin(), config.webAuthnTimeout(), config.challengeTtl());
  }

  @Bean
  @ConditionalOnMissingBean
  public OtpManager otpManager(TesseraConfig config, OtpSessionStore otpSessionStore, RateLimiter rateLimiter,
                               CodeDispatcher codeDispatcher, JwtManager jwtManager, AuditSink auditSink) {
    return new OtpManager(config, otpSessionStore, rateLimiter, codeDispatcher, jwtManager, auditSink);
  }

  @Bean
  @ConditionalOnMissingBean
  public WebAuthnManager webAuthnManager(SecondFactorCloneDetector cloneDetector, RateLimiter rateLimiter,
                                         JwtManager jwtManager, AuditSink auditSink) {
    return new WebAuthnManager(cloneDetector, rateLimiter, jwtManager, auditSink);
  }

  @Bean(destroyMethod = "shutdown")
  @ConditionalOnMissingBean
  public OtpSessionSweeper otpSessionSweeper(TesseraConfig config, OtpSessionStore otpSessionStore,
                                             RateLimiter rateLimiter, SecondFactorCloneDetector cloneDetector,
                                             SessionStore sessionStore) {
    return new OtpSessionSweeper(otpSessionStore, rateLimiter, cloneDetector, sessionStore,
        config.sweepInterval());
  }
}
