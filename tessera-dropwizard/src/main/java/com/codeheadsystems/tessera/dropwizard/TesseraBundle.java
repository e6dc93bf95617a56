package com.codeheadsystems.tessera.dropwizard;

import com.codeheadsystems.tessera.crypto.cipher.CredentialCipher;
import com.codeheadsystems.tessera.crypto.common.RandomProvider;
import com.codeheadsystems.tessera.crypto.exceptions.ConfigurationException;
import com.codeheadsystems.tessera.dropwizard.auth.TesseraAuthenticator;
import com.codeheadsystems.tessera.dropwizard.auth.TesseraPrincipal;
import com.codeheadsystems.tessera.dropwizard.health.CredentialCipherHealthCheck;
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
import com.codeheadsystems.tessera.server.resource.AuthFailureExceptionMapper;
import com.codeheadsystems.tessera.server.resource.OtpResource;
import com.codeheadsystems.tessera.server.resource.WebAuthnResource;
import com.codeheadsystems.tessera.server.store.InMemorySessionStore;
import com.codeheadsystems.tessera.server.store.SessionStore;
import com.codeheadsystems.tessera.server.webauthn.AssertionVerifier;
import com.codeheadsystems.tessera.server.webauthn.ChallengeStore;
import com.codeheadsystems.tessera.server.webauthn.InMemoryChallengeStore;
import com.codeheadsystems.tessera.server.webauthn.InMemoryWebAuthnCredentialRepository;
import com.codeheadsystems.tessera.server.webauthn.SecondFactorCloneDetector;
import com.codeheadsystems.tessera.server.webauthn.WebAuthnCredentialRepository;
import io.dropwizard.auth.AuthDynamicFeature;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.auth.oauth.OAuthCredentialAuthFilter;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import io.dropwizard.lifecycle.Managed;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.util.HexFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the tessera OTP and WebAuthn endpoints into an existing Dropwizard
 * application.
 * <p>
 * Registers {@link OtpResource}, {@link WebAuthnResource}, the credential cipher health check,
 * the expiry sweeper and a JWT bearer filter for {@code @Auth TesseraPrincipal} parameters.
 * Requires a {@link TesseraConfiguration} block in the application's YAML config.
 * <p>
 * Embed in your application with in-memory stores (dev/test only):
 * <pre>{@code
 *   bootstrap.addBundle(new TesseraBundle<>(myAssertionVerifier));
 * }</pre>
 * <p>
 * Or supply persistent stores and a real code dispatcher:
 * <pre>{@code
 *   bootstrap.addBundle(new TesseraBundle<>(verifier, otpSessions, rateLimitCounters,
 *       credentials, challenges, sessions, smsDispatcher, auditSink));
 * }</pre>
 * The {@link AssertionVerifier} is always required: the bundle never verifies WebAuthn
 * signatures itself.
 */
@Singleton
public class TesseraBundle<C extends TesseraConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(TesseraBundle.class);

  private final AssertionVerifier assertionVerifier;
  private final OtpSessionRepository otpSessionRepository;
  private final RateLimitStore rateLimitStore;
  private final WebAuthnCredentialRepository credentialRepository;
  private final ChallengeStore challengeStore;
  private final SessionStore sessionStore;
  private final CodeDispatcher codeDispatcher;
  private final AuditSink auditSink;

  private volatile SecondFactorCloneDetector cloneDetector;
  private volatile CredentialCipher credentialCipher;
  private volatile JwtManager jwtManager;

  /**
   * Creates a bundle backed by in-memory stores and a code dispatcher that only logs.
   * <p>
   * For dev/test only: sessions, credentials and rate-limit windows are lost on restart and
   * rate limits do not hold across replicas.
   *
   * @param assertionVerifier the FIDO2 verifier
   */
  public TesseraBundle(AssertionVerifier assertionVerifier) {
    this(assertionVerifier,
        new InMemoryOtpSessionRepository(),
        new InMemoryRateLimitStore(),
        new InMemoryWebAuthnCredentialRepository(),
        new InMemoryChallengeStore(),
        new InMemorySessionStore(),
        new LoggingCodeDispatcher(),
        new LoggingAuditSink());
    log.warn("""
        #################################################################
        # WARNING: Using in-memory stores and a logging code dispatcher.#
        # All sessions and credentials will be lost on restart.         #
        # Do not use in production.                                     #
        #################################################################
        """);
  }

  /**
   * Creates a bundle backed by the supplied stores.
   *
   * @param assertionVerifier    the FIDO2 verifier
   * @param otpSessionRepository OTP session storage
   * @param rateLimitStore       rate-limit counters, shared by every replica
   * @param credentialRepository WebAuthn credentials
   * @param challengeStore       pending WebAuthn challenges
   * @param sessionStore         issued session tokens
   * @param codeDispatcher       delivers one-time codes
   * @param auditSink            audit destination
   */
  @Inject
  public TesseraBundle(AssertionVerifier assertionVerifier,
                       OtpSessionRepository otpSessionRepository,
                       RateLimitStore rateLimitStore,
                       WebAuthnCredentialRepository credentialRepository,
                       ChallengeStore challengeStore,
                       SessionStore sessionStore,
                       CodeDispatcher codeDispatcher,
                       AuditSink auditSink) {
    if (assertionVerifier == null) {
      throw new IllegalArgumentException("An AssertionVerifier is required");
    }
    this.assertionVerifier = assertionVerifier;
    this.otpSessionRepository = otpSessionRepository;
    this.rateLimitStore = rateLimitStore;
    this.credentialRepository = credentialRepository;
    this.challengeStore = challengeStore;
    this.sessionStore = sessionStore;
    this.codeDispatcher = codeDispatcher;
    this.auditSink = auditSink;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    TesseraConfig config = configuration.toTesseraConfig();
    if (!config.isProduction()) {
      log.warn("Running in {} mode: one-time codes are returned in responses", config.mode());
    }
    Clock clock = Clock.systemUTC();
    RandomProvider randomProvider = new RandomProvider();

    // fails startup in production when the KDF parameters are out of range
    CredentialCipher cipher = CredentialCipher.create(config.kdfParameters(), config.mode());
    JwtManager jwt = buildJwtManager(configuration, config);

    RateLimiter rateLimiter = new RateLimiter(rateLimitStore, config.rateLimits(), auditSink, clock);
    OtpSessionStore otpSessionStore = new OtpSessionStore(otpSessionRepository, randomProvider, auditSink,
        clock, config.maxOtpAttempts());
    SecondFactorCloneDetector detector = new SecondFactorCloneDetector(credentialRepository, challengeStore,
        assertionVerifier, randomProvider, auditSink, clock, config.rpId(), config.origin(),
        config.webAuthnTimeout(), config.challengeTtl());

    OtpManager otpManager = new OtpManager(config, otpSessionStore, rateLimiter, codeDispatcher, jwt, auditSink);
    WebAuthnManager webAuthnManager = new WebAuthnManager(detector, rateLimiter, jwt, auditSink);
    environment.jersey().register(new OtpResource(otpManager));
    environment.jersey().register(new WebAuthnResource(webAuthnManager));
    environment.jersey().register(new AuthFailureExceptionMapper());
    environment.healthChecks().register("credential-cipher", new CredentialCipherHealthCheck(cipher, randomProvider));

    OtpSessionSweeper sweeper = new OtpSessionSweeper(otpSessionStore, rateLimiter, detector, sessionStore,
        config.sweepInterval());
    environment.lifecycle().manage(new Managed() {
      @Override
      public void start() {
        // sweeper is scheduled on construction
      }

      @Override
      public void stop() {
        sweeper.shutdown();
        cipher.shutdown();
      }
    });

    // JWT auth filter
    TesseraAuthenticator authenticator = new TesseraAuthenticator(jwt);
    environment.jersey().register(new AuthDynamicFeature(
        new OAuthCredentialAuthFilter.Builder<TesseraPrincipal>()
            .setAuthenticator(authenticator)
            .setPrefix("Bearer")
            .buildAuthFilter()));
    environment.jersey().register(new AuthValueFactoryProvider.Binder<>(TesseraPrincipal.class));

    this.cloneDetector = detector;
    this.credentialCipher = cipher;
    this.jwtManager = jwt;
  }

  /**
   * The clone detector, for registering WebAuthn credentials. Available once the bundle has run.
   *
   * @return the detector
   */
  public SecondFactorCloneDetector cloneDetector() {
    return requireRun(cloneDetector);
  }

  /**
   * The credential cipher built from the configured KDF parameters. Available once the bundle
   * has run.
   *
   * @return the cipher
   */
  public CredentialCipher credentialCipher() {
    return requireRun(credentialCipher);
  }

  public JwtManager jwtManager() {
    return requireRun(jwtManager);
  }

  private static <T> T requireRun(T value) {
    if (value == null) {
      throw new IllegalStateException("TesseraBundle has not run yet");
    }
    return value;
  }

  private JwtManager buildJwtManager(C configuration, TesseraConfig config) {
    String secretHex = configuration.getJwtSecretHex();
    byte[] secret;
    if (secretHex == null || secretHex.isEmpty()) {
      if (config.isProduction()) {
        throw new ConfigurationException("jwtSecretHex is required in production mode");
      }
      log.warn("No JWT secret configured, generating randomly. "
          + "Tokens will be invalidated on restart. Do not use in production.");
      secret = new RandomProvider().randomBytes(32);
    } else {
      secret = HexFormat.of().parseHex(secretHex);
    }
    return new JwtManager(secret, config.jwtIssuer(), config.jwtTtlSeconds(), sessionStore);
  }
}
