package org.devolia.secretfs.cache;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.devolia.secretfs.backend.SecretBackend;
import org.devolia.secretfs.log.LogConfig;
import org.devolia.secretfs.metrics.SecretCacheMetrics;
import org.devolia.secretfs.model.Fixtures;
import org.devolia.secretfs.model.Secret;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for SecretCache.
 *
 * <p>These tests focus on the lookup policy:
 *
 * <ul>
 *   <li>Backend answers win over cached values
 *   <li>Fresh entries skip the backend
 *   <li>Failures and timeouts fall back to whatever is cached
 *   <li>List requests replace or preserve the whole cache
 * </ul>
 *
 * @author Devolia
 * @since 1.0.0
 */
class SecretCacheTest {

  private static final LogConfig LOG_CONFIG = new LogConfig(false, "/tmp/mnt");

  private static final Timeouts TIMEOUTS =
      new Timeouts(Duration.ZERO, Duration.ofMillis(100), Duration.ofMillis(200));

  private Secret fixture1;
  private Secret fixture2;
  private SecretCache cache;

  @BeforeEach
  void setUp() {
    fixture1 = Fixtures.secret("secret.json");
    fixture2 = Fixtures.secret("secretNormalOwner.json");
  }

  @AfterEach
  void tearDown() {
    if (cache != null) {
      cache.close();
    }
  }

  @Test
  void testSecretUsesValueFromBackend() {
    QueueBackend backend = new QueueBackend();
    backend.secrets.add(fixture1);

    cache = new SecretCache(backend, TIMEOUTS, LOG_CONFIG);
    Optional<Secret> result = cache.secret("password-file");

    assertTrue(result.isPresent());
    assertEquals(fixture1, result.get());
    assertEquals(1, cache.len());
  }

  @Test
  void testSecretPassesThroughNotFound() {
    cache = new SecretCache(new FailingBackend(), TIMEOUTS, LOG_CONFIG);

    assertTrue(cache.secret(fixture1.getName()).isEmpty());

    cache.add(fixture1);
    Optional<Secret> result = cache.secret(fixture1.getName());
    assertTrue(result.isPresent());
    assertEquals(fixture1, result.get());
  }

  @Test
  void testSecretWhenBackendTimesOut() {
    // Nothing queued, so every backend call blocks until cancelled
    cache = new SecretCache(new QueueBackend(), TIMEOUTS, LOG_CONFIG);

    assertTrue(cache.secret(fixture1.getName()).isEmpty());

    cache.add(fixture1);
    Optional<Secret> result = cache.secret(fixture1.getName());
    assertTrue(result.isPresent());
    assertEquals(fixture1, result.get());
  }

  @Test
  void testSecretUsesBackendOverCache() {
    Secret cached = fixture2.withName(fixture1.getName());
    QueueBackend backend = new QueueBackend();
    backend.secrets.add(fixture1);

    cache = new SecretCache(backend, TIMEOUTS, LOG_CONFIG);
    cache.add(cached);

    // Although the renamed fixture2 is cached, the backend answers with fixture1
    Optional<Secret> result = cache.secret(cached.getName());
    assertTrue(result.isPresent());
    assertEquals(fixture1, result.get());
    assertEquals(1, cache.len());
  }

  @Test
  void testSecretAvoidsBackendWhenResultFresh() {
    Secret cached = fixture2.withName(fixture1.getName());
    QueueBackend backend = new QueueBackend();
    backend.secrets.add(fixture1);

    Timeouts oneHourFresh =
        new Timeouts(Duration.ofHours(1), Duration.ofMillis(10), Duration.ofMillis(20));
    cache = new SecretCache(backend, oneHourFresh, LOG_CONFIG);
    cache.add(cached);

    assertEquals(cached, cache.secret(cached.getName()).orElseThrow());
    assertEquals(cached, cache.secret(cached.getName()).orElseThrow());

    // The queued backend answer was never consumed
    assertEquals(1, backend.secrets.size());
    assertEquals(0, backend.secretCalls.get());
  }

  @Test
  void testSecretAsksBackendWhenResultStale() throws InterruptedException {
    Secret cached = fixture2.withName(fixture1.getName());
    QueueBackend backend = new QueueBackend();
    backend.secrets.add(fixture1);

    Timeouts oneNanoFresh =
        new Timeouts(Duration.ofNanos(1), Duration.ofMillis(200), Duration.ofMillis(200));
    cache = new SecretCache(backend, oneNanoFresh, LOG_CONFIG);
    cache.add(cached);
    Thread.sleep(2);

    assertEquals(fixture1, cache.secret(cached.getName()).orElseThrow());

    // The backend now blocks, so the next lookup falls back to the refreshed entry
    assertEquals(fixture1, cache.secret(cached.getName()).orElseThrow());
    assertEquals(1, cache.len());
  }

  @Test
  void testFreshnessFollowsTicker() {
    AtomicLong nanos = new AtomicLong();
    Ticker ticker = nanos::get;
    SecretBackend backend = mock(SecretBackend.class);
    when(backend.fetchSecret(fixture1.getName())).thenReturn(Optional.of(fixture2));

    Timeouts timeouts =
        new Timeouts(Duration.ofSeconds(10), Duration.ofSeconds(1), Duration.ofSeconds(1));
    cache =
        new SecretCache(
            backend,
            timeouts,
            LOG_CONFIG,
            SecretCacheMetrics.inMemory("/tmp/mnt"),
            ticker,
            null);
    cache.add(fixture1);

    nanos.set(Duration.ofSeconds(9).toNanos());
    assertEquals(fixture1, cache.secret(fixture1.getName()).orElseThrow());
    verifyNoInteractions(backend);

    nanos.set(Duration.ofSeconds(10).toNanos());
    assertEquals(fixture2, cache.secret(fixture1.getName()).orElseThrow());
    verify(backend).fetchSecret(fixture1.getName());
  }

  @Test
  void testStaleEntryIsKeptAfterBackendFailure() {
    AtomicLong nanos = new AtomicLong();
    FailingBackend backend = new FailingBackend();
    Timeouts timeouts =
        new Timeouts(Duration.ofSeconds(1), Duration.ofMillis(100), Duration.ofMillis(100));
    cache =
        new SecretCache(
            backend,
            timeouts,
            LOG_CONFIG,
            SecretCacheMetrics.inMemory("/tmp/mnt"),
            nanos::get,
            null);
    cache.add(fixture1);
    nanos.set(Duration.ofHours(1).toNanos());

    assertEquals(fixture1, cache.secret(fixture1.getName()).orElseThrow());
    assertEquals(fixture1, cache.secret(fixture1.getName()).orElseThrow());
    assertEquals(2, backend.secretCalls.get());
    assertEquals(1, cache.len());
  }

  @Test
  void testSecretFallsBackWhenBackendThrows() {
    SecretBackend backend = mock(SecretBackend.class);
    when(backend.fetchSecret(anyString())).thenThrow(new IllegalStateException("boom"));

    cache = new SecretCache(backend, TIMEOUTS, LOG_CONFIG);
    assertTrue(cache.secret("password-file").isEmpty());

    cache.add(fixture1);
    assertEquals(fixture1, cache.secret("password-file").orElseThrow());
  }

  @Test
  void testSecretTreatsNullBackendAnswerAsFailure() {
    SecretBackend backend = mock(SecretBackend.class);
    when(backend.fetchSecret(anyString())).thenReturn(null);

    cache = new SecretCache(backend, TIMEOUTS, LOG_CONFIG);
    assertTrue(cache.secret("password-file").isEmpty());
    assertEquals(0, cache.len());
  }

  @Test
  void testSecretWithNullOrEmptyName() {
    SecretBackend backend = mock(SecretBackend.class);
    cache = new SecretCache(backend, TIMEOUTS, LOG_CONFIG);

    assertTrue(cache.secret(null).isEmpty());
    assertTrue(cache.secret("").isEmpty());
    verifyNoInteractions(backend);
  }

  @Test
  void testSecretListUsesValuesFromCacheIfBackendFails() {
    cache = new SecretCache(new FailingBackend(), TIMEOUTS, LOG_CONFIG);
    cache.add(fixture1);

    List<Secret> list = cache.secretList();
    assertEquals(1, list.size());
    assertTrue(list.contains(fixture1));
  }

  @Test
  void testSecretListWhenBackendTimesOut() {
    cache = new SecretCache(new QueueBackend(), TIMEOUTS, LOG_CONFIG);

    assertTrue(cache.secretList().isEmpty());

    cache.add(fixture1);
    List<Secret> list = cache.secretList();
    assertEquals(1, list.size());
    assertTrue(list.contains(fixture1));
  }

  @Test
  void testSecretListUsesValuesFromBackend() {
    QueueBackend backend = new QueueBackend();
    backend.lists.add(List.of(fixture1));

    cache = new SecretCache(backend, TIMEOUTS, LOG_CONFIG);
    List<Secret> list = cache.secretList();

    assertEquals(1, list.size());
    assertTrue(list.contains(fixture1));
    assertEquals(1, cache.len());
  }

  @Test
  void testSecretListUsesBackendOverCache() {
    QueueBackend backend = new QueueBackend();
    backend.lists.add(List.of(fixture1));

    cache = new SecretCache(backend, TIMEOUTS, LOG_CONFIG);
    cache.add(fixture2);

    // Although fixture2 is cached, the backend says only fixture1 is available
    List<Secret> list = cache.secretList();
    assertEquals(1, list.size());
    assertTrue(list.contains(fixture1));
    assertEquals(1, cache.len());

    // fixture2 is gone for good: with the backend now blocking, lookups find nothing
    assertTrue(cache.secret(fixture2.getName()).isEmpty());
  }

  @Test
  void testSecretListReplacementRefreshesEntries() {
    AtomicLong nanos = new AtomicLong();
    SecretBackend backend = mock(SecretBackend.class);
    when(backend.fetchSecretList()).thenReturn(Optional.of(List.of(fixture1, fixture2)));

    Timeouts timeouts =
        new Timeouts(Duration.ofSeconds(5), Duration.ofMillis(10), Duration.ofSeconds(1));
    cache =
        new SecretCache(
            backend,
            timeouts,
            LOG_CONFIG,
            SecretCacheMetrics.inMemory("/tmp/mnt"),
            nanos::get,
            null);

    nanos.set(Duration.ofSeconds(100).toNanos());
    assertEquals(2, cache.secretList().size());

    // Entries stored by the list are fresh, so no single-secret fetch happens
    nanos.addAndGet(Duration.ofSeconds(1).toNanos());
    assertEquals(fixture2, cache.secret(fixture2.getName()).orElseThrow());
    verify(backend, never()).fetchSecret(anyString());
  }

  @Test
  void testSecretListSkipsNullEntries() {
    SecretBackend backend = mock(SecretBackend.class);
    when(backend.fetchSecretList()).thenReturn(Optional.of(Arrays.asList(fixture1, null)));

    cache = new SecretCache(backend, TIMEOUTS, LOG_CONFIG);
    List<Secret> list = cache.secretList();

    assertEquals(List.of(fixture1), list);
    assertEquals(1, cache.len());
  }

  @Test
  void testSecretListCollapsesDuplicateNames() {
    Secret renamed = fixture2.withName(fixture1.getName());
    SecretBackend backend = mock(SecretBackend.class);
    when(backend.fetchSecretList())
        .thenReturn(Optional.of(List.of(fixture1, fixture2, renamed)));

    cache = new SecretCache(backend, TIMEOUTS, LOG_CONFIG);
    List<Secret> list = cache.secretList();

    assertEquals(2, list.size());
    assertEquals(list.size(), cache.len());
    assertTrue(list.contains(renamed));
    assertFalse(list.contains(fixture1));
  }

  @Test
  void testAddDoesNotContactBackend() {
    SecretBackend backend = mock(SecretBackend.class);
    cache = new SecretCache(backend, TIMEOUTS, LOG_CONFIG);

    cache.add(fixture1);
    cache.add(fixture2);
    cache.add(fixture1);

    assertEquals(2, cache.len());
    verifyNoInteractions(backend);
  }

  @Test
  void testAddRejectsNull() {
    cache = new SecretCache(new FailingBackend(), TIMEOUTS, LOG_CONFIG);
    assertThrows(NullPointerException.class, () -> cache.add(null));
  }

  @Test
  void testClear() {
    cache = new SecretCache(new FailingBackend(), TIMEOUTS, LOG_CONFIG);

    cache.add(fixture1);
    cache.add(fixture2);
    assertNotEquals(0, cache.len());

    cache.clear();
    assertEquals(0, cache.len());
    assertTrue(cache.secret(fixture1.getName()).isEmpty());

    // Clearing an empty cache is fine
    cache.clear();
    assertEquals(0, cache.len());
  }

  @Test
  void testConstructorRejectsInvalidArguments() {
    assertThrows(NullPointerException.class, () -> new SecretCache(null, TIMEOUTS, LOG_CONFIG));
    assertThrows(
        NullPointerException.class, () -> new SecretCache(new FailingBackend(), null, LOG_CONFIG));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new SecretCache(
                new FailingBackend(),
                new Timeouts(Duration.ofSeconds(-1), Duration.ZERO, Duration.ZERO),
                LOG_CONFIG));
  }

  @Test
  void testLookupAfterCloseFallsBackToCache() {
    cache = new SecretCache(new FailingBackend(), TIMEOUTS, LOG_CONFIG);
    cache.add(fixture1);
    cache.close();

    assertEquals(fixture1, cache.secret(fixture1.getName()).orElseThrow());
    assertTrue(cache.secret("missing").isEmpty());
    assertEquals(List.of(fixture1), cache.secretList());
  }

  @Test
  void testMetricsRecordLookupResults() {
    QueueBackend backend = new QueueBackend();
    backend.secrets.add(fixture1);
    Timeouts timeouts =
        new Timeouts(Duration.ofHours(1), Duration.ofMillis(200), Duration.ofMillis(50));
    cache = new SecretCache(backend, timeouts, LOG_CONFIG);

    cache.secret(fixture1.getName()); // backend
    cache.secret(fixture1.getName()); // fresh hit
    cache.secret("missing"); // timeout, miss
    cache.secretList(); // timeout, fallback

    SecretCacheMetrics metrics = cache.getMetrics();
    assertEquals(1.0, metrics.getBackendHitCount());
    assertEquals(1.0, metrics.getFreshHitCount());
    assertEquals(1.0, metrics.getMissCount());
    assertEquals(0.0, metrics.getFallbackHitCount());
    assertEquals(1.0, metrics.getListFallbackCount());
    assertEquals(
        1.0,
        metrics.getBackendCallCount(
            SecretCacheMetrics.OPERATION_SECRET, SecretCacheMetrics.STATUS_TIMEOUT));
    assertEquals(
        1.0,
        metrics.getBackendCallCount(
            SecretCacheMetrics.OPERATION_SECRET, SecretCacheMetrics.STATUS_SUCCESS));
    assertEquals(
        1.0,
        metrics.getBackendCallCount(
            SecretCacheMetrics.OPERATION_SECRET_LIST, SecretCacheMetrics.STATUS_TIMEOUT));
    assertEquals(
        1.0, metrics.getMeterRegistry().get("secretfs_cache_entries").gauge().value());
  }

  /** Always reports no usable answer. */
  static class FailingBackend implements SecretBackend {

    final AtomicInteger secretCalls = new AtomicInteger();

    @Override
    public Optional<Secret> fetchSecret(String name) {
      secretCalls.incrementAndGet();
      return Optional.empty();
    }

    @Override
    public Optional<List<Secret>> fetchSecretList() {
      return Optional.empty();
    }
  }

  /** Answers from queues, blocking until something is queued or the call is interrupted. */
  static class QueueBackend implements SecretBackend {

    final BlockingQueue<Secret> secrets = new ArrayBlockingQueue<>(16);
    final BlockingQueue<List<Secret>> lists = new ArrayBlockingQueue<>(16);
    final AtomicInteger secretCalls = new AtomicInteger();

    @Override
    public Optional<Secret> fetchSecret(String name) {
      secretCalls.incrementAndGet();
      try {
        return Optional.of(secrets.take());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return Optional.empty();
      }
    }

    @Override
    public Optional<List<Secret>> fetchSecretList() {
      try {
        return Optional.of(lists.take());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return Optional.empty();
      }
    }
  }
}
