package org.devolia.secretfs.cache;

import com.github.benmanes.caffeine.cache.Ticker;
import java.io.Closeable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.devolia.secretfs.backend.SecretBackend;
import org.devolia.secretfs.log.CacheLogger;
import org.devolia.secretfs.log.LogConfig;
import org.devolia.secretfs.metrics.SecretCacheMetrics;
import org.devolia.secretfs.model.Secret;

/**
 * In-memory secret cache sitting between the filesystem layer and a {@link SecretBackend}.
 *
 * <p>Lookups follow this flow:
 *
 * <ol>
 *   <li>A cached entry younger than the fresh threshold is returned without a backend call
 *   <li>Otherwise the backend is asked, waiting at most the configured fetch timeout
 *   <li>A backend answer replaces the cached entry and is returned
 *   <li>If the backend fails or misses its deadline, whatever is cached is returned, however old
 * </ol>
 *
 * <p>Backend calls run on a separate executor so that a stalled backend never holds a caller past
 * its deadline. The entry map is guarded by a single lock that is never held while waiting on the
 * backend. A backend answer that arrives after its deadline is discarded and never stored.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class SecretCache implements Closeable {

  private final SecretBackend backend;
  private final Timeouts timeouts;
  private final CacheLogger log;
  private final SecretCacheMetrics metrics;
  private final Ticker ticker;
  private final ExecutorService executor;
  private final boolean ownsExecutor;
  private final long freshThresholdNanos;

  private final ReentrantLock lock = new ReentrantLock();
  private final Map<String, CacheEntry> entries = new HashMap<>();

  /**
   * Constructor with default metrics, system ticker and a private fetch executor.
   *
   * @param backend source of live secrets
   * @param timeouts freshness and deadline policy
   * @param logConfig logging options
   */
  public SecretCache(SecretBackend backend, Timeouts timeouts, LogConfig logConfig) {
    this(
        backend,
        timeouts,
        logConfig,
        SecretCacheMetrics.inMemory(logConfig.getMountpoint()),
        Ticker.systemTicker(),
        null);
  }

  /**
   * Constructor with all collaborators.
   *
   * @param backend source of live secrets
   * @param timeouts freshness and deadline policy
   * @param logConfig logging options
   * @param metrics metrics collector
   * @param ticker time source for freshness checks
   * @param executor executor for backend calls, or null to create a private one that is shut down
   *     by {@link #close()}
   */
  public SecretCache(
      SecretBackend backend,
      Timeouts timeouts,
      LogConfig logConfig,
      SecretCacheMetrics metrics,
      Ticker ticker,
      ExecutorService executor) {
    this.backend = Objects.requireNonNull(backend, "backend cannot be null");
    this.timeouts = Objects.requireNonNull(timeouts, "timeouts cannot be null");
    this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
    this.ticker = Objects.requireNonNull(ticker, "ticker cannot be null");
    timeouts.validate();

    this.log = new CacheLogger(SecretCache.class, Objects.requireNonNull(logConfig, "logConfig"));
    this.ownsExecutor = executor == null;
    this.executor = executor != null ? executor : Executors.newCachedThreadPool(fetchThreads());
    this.freshThresholdNanos = saturatedNanos(timeouts.getFreshThreshold());

    metrics.bindCacheSize(this::len);

    log.info("Initialized secret cache with {}", timeouts);
  }

  /**
   * Looks up a secret, preferring a fresh cached entry, then the backend, then any cached entry.
   *
   * @param name the secret name
   * @return the secret, or empty if neither the backend nor the cache has it
   */
  public Optional<Secret> secret(String name) {
    if (name == null || name.isEmpty()) {
      log.warn("Attempted to look up secret with null or empty name");
      return Optional.empty();
    }

    CacheEntry cached = entry(name);
    if (cached != null && cached.isFresh(ticker.read(), freshThresholdNanos)) {
      metrics.incrementFreshHit();
      log.debug("Serving fresh cached secret: {}", CacheLogger.mask(name));
      return Optional.of(cached.getSecret());
    }

    Optional<Secret> fetched =
        awaitBackend(
            () -> backend.fetchSecret(name),
            timeouts.getSecretFetchTimeout(),
            SecretCacheMetrics.OPERATION_SECRET);
    if (fetched.isPresent()) {
      Secret secret = fetched.get();
      store(secret);
      metrics.incrementBackendHit();
      log.debug("Backend answered for secret: {}", CacheLogger.mask(name));
      return fetched;
    }

    // Re-read: a concurrent writer may have stored something while we waited.
    CacheEntry fallback = entry(name);
    if (fallback != null) {
      metrics.incrementFallbackHit();
      log.debug("Backend unavailable, serving cached secret: {}", CacheLogger.mask(name));
      return Optional.of(fallback.getSecret());
    }

    metrics.incrementMiss();
    log.debug("Secret not found in backend or cache: {}", CacheLogger.mask(name));
    return Optional.empty();
  }

  /**
   * Lists all secrets, asking the backend first.
   *
   * <p>A backend answer atomically replaces the whole cache. If the backend fails or misses its
   * deadline the cached secrets are returned unchanged.
   *
   * @return the secrets, in no particular order
   */
  public List<Secret> secretList() {
    Optional<List<Secret>> fetched =
        awaitBackend(
            backend::fetchSecretList,
            timeouts.getSecretListFetchTimeout(),
            SecretCacheMetrics.OPERATION_SECRET_LIST);

    if (fetched.isPresent()) {
      long now = ticker.read();
      Map<String, CacheEntry> replacement = new LinkedHashMap<>();
      for (Secret secret : fetched.get()) {
        if (secret == null) {
          log.warn("Backend returned a null secret in list, skipping it");
          continue;
        }
        replacement.put(secret.getName(), new CacheEntry(secret, now));
      }
      List<Secret> secrets = new ArrayList<>(replacement.size());
      for (CacheEntry entry : replacement.values()) {
        secrets.add(entry.getSecret());
      }

      lock.lock();
      try {
        entries.clear();
        entries.putAll(replacement);
      } finally {
        lock.unlock();
      }

      metrics.recordList(true);
      log.debug("Replaced cache contents with {} secrets from backend", replacement.size());
      return secrets;
    }

    List<Secret> snapshot;
    lock.lock();
    try {
      snapshot = new ArrayList<>(entries.size());
      for (CacheEntry entry : entries.values()) {
        snapshot.add(entry.getSecret());
      }
    } finally {
      lock.unlock();
    }

    metrics.recordList(false);
    log.debug("Backend unavailable, serving {} cached secrets", snapshot.size());
    return snapshot;
  }

  /**
   * Inserts or overwrites the entry for a secret without contacting the backend.
   *
   * @param secret the secret to seed
   */
  public void add(Secret secret) {
    Objects.requireNonNull(secret, "secret cannot be null");
    store(secret);
    log.debug("Seeded cache with secret: {}", CacheLogger.mask(secret.getName()));
  }

  /** Removes every cached secret. */
  public void clear() {
    lock.lock();
    try {
      entries.clear();
    } finally {
      lock.unlock();
    }
    log.debug("Cleared all secrets from cache");
  }

  /**
   * Gets the number of cached secrets.
   *
   * @return current entry count
   */
  public int len() {
    lock.lock();
    try {
      return entries.size();
    } finally {
      lock.unlock();
    }
  }

  public Timeouts getTimeouts() {
    return timeouts;
  }

  public SecretCacheMetrics getMetrics() {
    return metrics;
  }

  /**
   * Shuts down the fetch executor if this cache created it and removes the cache gauges. Backend
   * calls still in flight are interrupted.
   */
  @Override
  public void close() {
    if (ownsExecutor) {
      executor.shutdownNow();
    }
    metrics.close();
    log.debug("Closed secret cache");
  }

  private CacheEntry entry(String name) {
    lock.lock();
    try {
      return entries.get(name);
    } finally {
      lock.unlock();
    }
  }

  private void store(Secret secret) {
    CacheEntry entry = new CacheEntry(secret, ticker.read());
    lock.lock();
    try {
      entries.put(secret.getName(), entry);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Runs a backend call on the fetch executor and waits for it up to a deadline.
   *
   * <p>Every failure mode (empty answer, null, exception, timeout, interruption, rejected task)
   * comes back as an empty result. On timeout the call is cancelled with interruption and its
   * eventual result is dropped.
   */
  private <T> Optional<T> awaitBackend(
      Supplier<Optional<T>> call, Duration deadline, String operation) {
    long startTime = System.nanoTime();

    Callable<Optional<T>> task = call::get;
    Future<Optional<T>> future;
    try {
      future = executor.submit(task);
    } catch (RejectedExecutionException e) {
      metrics.recordBackendCall(operation, SecretCacheMetrics.STATUS_ERROR, 0L);
      log.warn("Backend {} call rejected, cache is closed", operation);
      return Optional.empty();
    }

    try {
      Optional<T> result = future.get(saturatedNanos(deadline), TimeUnit.NANOSECONDS);
      boolean ok = result != null && result.isPresent();
      metrics.recordBackendCall(
          operation,
          ok ? SecretCacheMetrics.STATUS_SUCCESS : SecretCacheMetrics.STATUS_FAILURE,
          System.nanoTime() - startTime);
      return ok ? result : Optional.empty();

    } catch (TimeoutException e) {
      future.cancel(true);
      metrics.recordBackendCall(
          operation, SecretCacheMetrics.STATUS_TIMEOUT, System.nanoTime() - startTime);
      log.warn("Backend {} call timed out after {}ms", operation, deadline.toMillis());
      return Optional.empty();

    } catch (ExecutionException e) {
      metrics.recordBackendCall(
          operation, SecretCacheMetrics.STATUS_ERROR, System.nanoTime() - startTime);
      log.warn("Backend {} call failed", operation, e.getCause());
      return Optional.empty();

    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      metrics.recordBackendCall(
          operation, SecretCacheMetrics.STATUS_ERROR, System.nanoTime() - startTime);
      log.warn("Interrupted while waiting for backend {} call", operation);
      return Optional.empty();
    }
  }

  private static long saturatedNanos(Duration duration) {
    try {
      return duration.toNanos();
    } catch (ArithmeticException e) {
      return Long.MAX_VALUE;
    }
  }

  private static ThreadFactory fetchThreads() {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, "secretfs-fetch-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}
