package com.codeheadsystems.tessera.crypto.kdf;

import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses the key derivation backend once per process.
 * <p>
 * On first use the Argon2id backend is created and probed with a tiny derivation. If that fails
 * (the provider is missing or incompatible) PBKDF2 is selected instead. The choice is made exactly
 * once, even under concurrent first calls, and never re-dispatched per call.
 */
public class KeyDerivationBackendSelector {

  private static final Logger log = LoggerFactory.getLogger(KeyDerivationBackendSelector.class);

  private static final KdfParameters PROBE_PARAMETERS = KdfParameters.argon2id(3, 1);
  private static final byte[] PROBE_SALT = new byte[16];

  private final Supplier<KeyDerivationBackend> argon2Factory;
  private final KeyDerivationBackend fallback;
  private final Object lock = new Object();
  private volatile KeyDerivationBackend selected;
  private volatile boolean argon2Available;

  /**
   * Selector using the BouncyCastle Argon2id backend with the PBKDF2 fallback.
   */
  public KeyDerivationBackendSelector() {
    this(Argon2idBackend::new, new Pbkdf2Backend());
  }

  /**
   * Selector with a custom Argon2id factory.
   *
   * @param argon2Factory creates the preferred backend; may throw if unavailable
   * @param fallback      backend used when the preferred one cannot be loaded
   */
  public KeyDerivationBackendSelector(Supplier<KeyDerivationBackend> argon2Factory,
                                      KeyDerivationBackend fallback) {
    this.argon2Factory = argon2Factory;
    this.fallback = fallback;
  }

  /**
   * The selected backend, initializing it on first call.
   *
   * @return the backend
   */
  public KeyDerivationBackend backend() {
    KeyDerivationBackend result = selected;
    if (result == null) {
      synchronized (lock) {
        result = selected;
        if (result == null) {
          result = select();
          selected = result;
        }
      }
    }
    return result;
  }

  /**
   * The backend able to derive with the given algorithm, if any. PBKDF2 is always available;
   * Argon2id only when the probe succeeded.
   *
   * @param algorithm the algorithm
   * @return the backend
   */
  public Optional<KeyDerivationBackend> backendFor(KdfAlgorithm algorithm) {
    KeyDerivationBackend current = backend();
    if (current.algorithm() == algorithm) {
      return Optional.of(current);
    }
    if (algorithm == fallback.algorithm()) {
      return Optional.of(fallback);
    }
    return Optional.empty();
  }

  /**
   * Whether the Argon2id probe succeeded. Triggers selection.
   *
   * @return true if Argon2id is in use
   */
  public boolean isArgon2Available() {
    backend();
    return argon2Available;
  }

  private KeyDerivationBackend select() {
    try {
      KeyDerivationBackend candidate = argon2Factory.get();
      candidate.derive(new byte[]{0}, PROBE_SALT, PROBE_PARAMETERS, 16);
      argon2Available = true;
      log.info("Key derivation backend: {}", candidate.algorithm().id());
      return candidate;
    } catch (RuntimeException | LinkageError e) {
      log.warn("Argon2id unavailable ({}); falling back to {}", e.toString(), fallback.algorithm().id());
      return fallback;
    }
  }
}
