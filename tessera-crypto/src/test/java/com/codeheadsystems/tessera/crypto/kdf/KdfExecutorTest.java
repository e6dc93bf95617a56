package com.codeheadsystems.tessera.crypto.kdf;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.tessera.crypto.exceptions.ConfigurationException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class KdfExecutorTest {

  private KdfExecutor executor;

  @AfterEach
  void tearDown() {
    if (executor != null) {
      executor.shutdown();
    }
  }

  @Test
  void execute_returnsResult() {
    executor = new KdfExecutor(1, 1, Duration.ofSeconds(1));
    assertThat(executor.execute(() -> 42)).isEqualTo(42);
  }

  @Test
  void execute_timeout_raisesConfigurationException() {
    executor = new KdfExecutor(1, 1, Duration.ofMillis(50));
    assertThatThrownBy(() -> executor.execute(() -> {
      Thread.sleep(5_000);
      return 1;
    }))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("exceeded 50 ms");
  }

  @Test
  void execute_runtimeExceptionIsRethrownUnwrapped() {
    executor = new KdfExecutor(1, 1, Duration.ofSeconds(1));
    assertThatThrownBy(() -> executor.execute(() -> {
      throw new IllegalArgumentException("bad parameters");
    }))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("bad parameters");
  }

  @Test
  void execute_saturatedPool_raisesIllegalState() throws Exception {
    executor = new KdfExecutor(1, 1, Duration.ofSeconds(5));
    CountDownLatch release = new CountDownLatch(1);
    CountDownLatch running = new CountDownLatch(1);
    Thread blocker = new Thread(() -> executor.execute(() -> {
      running.countDown();
      release.await();
      return 0;
    }));
    blocker.start();
    running.await();
    Thread queued = new Thread(() -> executor.execute(() -> 0));
    queued.start();
    // let the second task reach the queue
    Thread.sleep(100);

    assertThatThrownBy(() -> executor.execute(() -> 0))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("saturated");

    release.countDown();
    blocker.join();
    queued.join();
  }

  @Test
  void constructor_rejectsNonPositiveTimeout() {
    assertThatThrownBy(() -> new KdfExecutor(1, 1, Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
