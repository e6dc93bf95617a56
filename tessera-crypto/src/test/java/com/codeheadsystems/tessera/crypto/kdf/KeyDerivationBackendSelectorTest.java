package com.codeheadsystems.tessera.crypto.kdf;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class KeyDerivationBackendSelectorTest {

  @Mock private KeyDerivationBackend argon2;
  @Mock private KeyDerivationBackend fallback;

  @Test
  void default_selectsArgon2id() {
    KeyDerivationBackendSelector selector = new KeyDerivationBackendSelector();
    assertThat(selector.backend()).isInstanceOf(Argon2idBackend.class);
    assertThat(selector.isArgon2Available()).isTrue();
    assertThat(selector.backendFor(KdfAlgorithm.PBKDF2_SHA256)).get().isInstanceOf(Pbkdf2Backend.class);
  }

  @Test
  void argon2Failure_fallsBackToPbkdf2() {
    KeyDerivationBackendSelector selector = new KeyDerivationBackendSelector(
        () -> {
          throw new NoClassDefFoundError("org/bouncycastle/crypto/generators/Argon2BytesGenerator");
        },
        new Pbkdf2Backend());
    assertThat(selector.backend()).isInstanceOf(Pbkdf2Backend.class);
    assertThat(selector.isArgon2Available()).isFalse();
    assertThat(selector.backendFor(KdfAlgorithm.ARGON2ID)).isEmpty();
  }

  @Test
  void concurrentFirstUse_initializesExactlyOnce() throws Exception {
    AtomicInteger created = new AtomicInteger();
    KeyDerivationBackendSelector selector = new KeyDerivationBackendSelector(
        () -> {
          created.incrementAndGet();
          return new Argon2idBackend();
        },
        new Pbkdf2Backend());

    int threads = 16;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<KeyDerivationBackend>> futures = new ArrayList<>();
    for (int i = 0; i < threads; i++) {
      futures.add(pool.submit(() -> {
        start.await();
        return selector.backend();
      }));
    }
    start.countDown();
    Set<KeyDerivationBackend> seen = ConcurrentHashMap.newKeySet();
    for (Future<KeyDerivationBackend> future : futures) {
      seen.add(future.get(10, TimeUnit.SECONDS));
    }
    pool.shutdown();

    assertThat(created).hasValue(1);
    assertThat(seen).hasSize(1);
  }

  @Test
  void argon2SelfTestFailure_selectsFallback() {
    when(argon2.derive(any(), any(), any(), anyInt())).thenThrow(new IllegalStateException("provider broken"));
    when(fallback.algorithm()).thenReturn(KdfAlgorithm.PBKDF2_SHA256);
    KeyDerivationBackendSelector selector = new KeyDerivationBackendSelector(() -> argon2, fallback);

    assertThat(selector.backend()).isSameAs(fallback);
    assertThat(selector.isArgon2Available()).isFalse();
    verify(argon2).derive(any(), any(), eq(KdfParameters.argon2id(3, 1)), eq(16));
  }

  @Test
  void argon2SelfTestSuccess_runsOnlyOnce() {
    when(argon2.algorithm()).thenReturn(KdfAlgorithm.ARGON2ID);
    KeyDerivationBackendSelector selector = new KeyDerivationBackendSelector(() -> argon2, fallback);

    assertThat(selector.backend()).isSameAs(argon2);
    assertThat(selector.backend()).isSameAs(argon2);
    assertThat(selector.backendFor(KdfAlgorithm.ARGON2ID)).containsSame(argon2);

    verify(argon2, times(1)).derive(any(), any(), any(), anyInt());
    verifyNoInteractions(fallback);
  }
}
