package com.codeheadsystems.tessera.crypto.kdf;

import com.codeheadsystems.tessera.crypto.exceptions.ConfigurationException;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded worker pool for CPU-bound key derivation.
 * <p>
 * Every task is subject to a hard timeout; exceeding it raises {@link ConfigurationException}
 * because it means the configured cost parameters are too high for this host. A full queue
 * raises {@link IllegalStateException}.
 */
public class KdfExecutor {

  private static final Logger log = LoggerFactory.getLogger(KdfExecutor.class);

  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);
  private static final int DEFAULT_QUEUE_CAPACITY = 64;

  private final ThreadPoolExecutor pool;
  private final Duration timeout;

  /**
   * Pool sized to half the available processors (at least two) with the default timeout.
   */
  public KdfExecutor() {
    this(Math.max(2, Runtime.getRuntime().availableProcessors() / 2), DEFAULT_QUEUE_CAPACITY,
        DEFAULT_TIMEOUT);
  }

  /**
   * Instantiates a new Kdf executor.
   *
   * @param threads       number of worker threads
   * @param queueCapacity maximum queued derivations
   * @param timeout       hard timeout per derivation
   */
  public KdfExecutor(int threads, int queueCapacity, Duration timeout) {
    if (threads < 1 || queueCapacity < 1) {
      throw new IllegalArgumentException("threads and queueCapacity must be positive");
    }
    if (timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    AtomicInteger counter = new AtomicInteger();
    this.pool = new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
        new ArrayBlockingQueue<>(queueCapacity),
        r -> {
          Thread t = new Thread(r, "tessera-kdf-" + counter.incrementAndGet());
          t.setDaemon(true);
          return t;
        },
        new ThreadPoolExecutor.AbortPolicy());
    this.timeout = timeout;
  }

  /**
   * Runs the task on the pool and waits for it, at most the configured timeout.
   *
   * @param task the derivation
   * @param <T>  the result type
   * @return the task result
   * @throws ConfigurationException if the task exceeds the timeout
   * @throws IllegalStateException  if the pool is saturated or the caller is interrupted
   */
  public <T> T execute(Callable<T> task) {
    Future<T> future;
    try {
      future = pool.submit(task);
    } catch (RejectedExecutionException e) {
      throw new IllegalStateException("Key derivation pool is saturated", e);
    }
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      log.error("Key derivation exceeded {} ms", timeout.toMillis());
      throw new ConfigurationException(
          "Key derivation exceeded " + timeout.toMillis() + " ms; lower the KDF cost parameters", e);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while deriving key", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new IllegalStateException("Key derivation failed", cause);
    }
  }

  public Duration timeout() {
    return timeout;
  }

  /**
   * Stops the worker threads. Queued derivations are abandoned.
   */
  public void shutdown() {
    pool.shutdownNow();
  }
}
