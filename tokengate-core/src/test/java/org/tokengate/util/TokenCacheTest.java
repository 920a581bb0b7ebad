package org.tokengate.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

@ExtendWith(VertxExtension.class)
class TokenCacheTest {

  private final AtomicLong now = new AtomicLong(1_000_000L);
  private TokenCache cache;

  @BeforeEach
  void setUp() {
    cache = TokenCache.builder().withClock(now::get).build();
  }

  @Test
  void missOnEmpty() {
    assertThat(cache.get("svc")).isNull();
    assertThat(cache.size()).isZero();
  }

  @Test
  void visibleUntilTtl() {
    cache.put("svc", "tok1", 10_000L);
    assertThat(cache.get("svc")).isEqualTo("tok1");
    now.addAndGet(9_999L);
    assertThat(cache.get("svc")).isEqualTo("tok1");
    now.addAndGet(1L);
    assertThat(cache.get("svc")).isNull();
    // still there until swept
    assertThat(cache.size()).isEqualTo(1);
  }

  @Test
  void zeroTtlNeverVisible() {
    cache.put("svc", "tok1", 0L);
    assertThat(cache.get("svc")).isNull();
  }

  @Test
  void overwrite() {
    cache.put("svc", "tok1", 1_000L);
    now.addAndGet(900L);
    cache.put("svc", "tok2", 1_000L);
    assertThat(cache.get("svc")).isEqualTo("tok2");
    now.addAndGet(900L);
    assertThat(cache.get("svc")).isEqualTo("tok2");
    assertThat(cache.size()).isEqualTo(1);
  }

  @Test
  void keysAreIndependent() {
    cache.put("a", "tokA", 1_000L);
    cache.put("b", "tokB", 5_000L);
    now.addAndGet(2_000L);
    assertThat(cache.get("a")).isNull();
    assertThat(cache.get("b")).isEqualTo("tokB");
  }

  @Test
  void removeAndClear() {
    cache.put("a", "tokA", 1_000L);
    cache.put("b", "tokB", 1_000L);
    cache.remove("a");
    cache.remove("nope");
    assertThat(cache.get("a")).isNull();
    assertThat(cache.size()).isEqualTo(1);
    cache.clear();
    assertThat(cache.size()).isZero();
    assertThat(cache.get("b")).isNull();
  }

  @Test
  void sweepRemovesExpiredOnly() {
    cache.put("a", "tokA", 1_000L);
    cache.put("b", "tokB", 3_000L);
    cache.put("c", "tokC", 1_500L);
    assertThat(cache.sweep()).isZero();
    now.addAndGet(2_000L);
    assertThat(cache.sweep()).isEqualTo(2);
    assertThat(cache.size()).isEqualTo(1);
    assertThat(cache.get("b")).isEqualTo("tokB");
    assertThat(cache.sweep()).isZero();
  }

  @Test
  void invalidArguments() {
    assertThatThrownBy(() -> cache.put(null, "t", 1L)).isInstanceOf(NullPointerException.class);
    assertThatThrownBy(() -> cache.put("k", null, 1L)).isInstanceOf(NullPointerException.class);
    assertThatThrownBy(() -> cache.put("k", "t", -1L))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> cache.get(null)).isInstanceOf(NullPointerException.class);
    assertThatThrownBy(() -> TokenCache.builder().withSweepInterval(0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void periodicSweep(Vertx vertx) {
    TokenCache swept = TokenCache.builder().withSweepInterval(20L).build();
    swept.put("short", "tok1", 50L);
    swept.put("long", "tok2", 60_000L);
    swept.start(vertx);
    swept.start(vertx);
    assertThat(swept.isStarted()).isTrue();
    await().atMost(5, TimeUnit.SECONDS).until(() -> swept.size() == 1);
    assertThat(swept.get("long")).isEqualTo("tok2");
    swept.stop();
    swept.stop();
    assertThat(swept.isStarted()).isFalse();
  }

  @Test
  void stopHaltsSweep(Vertx vertx) throws InterruptedException {
    TokenCache swept = TokenCache.builder().withSweepInterval(20L).withClock(now::get).build();
    swept.start(vertx);
    swept.stop();
    swept.put("k", "t", 10L);
    now.addAndGet(100L);
    Thread.sleep(200);
    assertThat(swept.size()).isEqualTo(1);
  }

  @Test
  void concurrentAccess() throws Exception {
    TokenCache shared = TokenCache.builder().build();
    int threads = 8;
    int iterations = 2000;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch startGate = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    for (int t = 0; t < threads; t++) {
      final int id = t;
      futures.add(executor.submit(() -> {
        startGate.await();
        for (int i = 0; i < iterations; i++) {
          String key = "client-" + (i % 10);
          shared.put(key, "tok-" + id + "-" + i, 60_000L);
          if (i % 7 == 3) {
            shared.remove(key);
          }
          if (i % 500 == 250) {
            shared.clear();
          }
          if (i % 100 == 0) {
            shared.sweep();
          }
          // removed by some thread, or a complete value from any writer
          String got = shared.get(key);
          assertThat(got == null || got.startsWith("tok-")).as("value %s", got).isTrue();
        }
        return null;
      }));
    }
    startGate.countDown();
    executor.shutdown();
    assertThat(executor.awaitTermination(30, TimeUnit.SECONDS)).as("no deadlock").isTrue();
    for (Future<?> f : futures) {
      f.get();
    }
    assertThat(shared.size()).isBetween(0, 10);
    for (int k = 0; k < 10; k++) {
      String got = shared.get("client-" + k);
      assertThat(got == null || got.startsWith("tok-")).isTrue();
    }
  }
}
