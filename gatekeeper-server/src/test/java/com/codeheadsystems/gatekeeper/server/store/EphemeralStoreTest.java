package com.codeheadsystems.gatekeeper.server.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.gatekeeper.server.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EphemeralStoreTest {

  private MutableClock clock;
  private EphemeralStore<String> store;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2026-01-15T10:00:00Z"));
    store = new EphemeralStore<>("test", Duration.ofSeconds(300), 3, clock);
  }

  @Test
  void take_returnsValueOnce() {
    store.put("k", "v");

    assertThat(store.take("k")).contains("v");
    assertThat(store.take("k")).isEmpty();
  }

  @Test
  void take_afterTtl_returnsEmpty() {
    store.put("k", "v");
    clock.advance(Duration.ofSeconds(301));

    assertThat(store.take("k")).isEmpty();
  }

  @Test
  void take_exactlyAtTtl_stillPresent() {
    store.put("k", "v");
    clock.advance(Duration.ofSeconds(300));

    assertThat(store.take("k")).contains("v");
  }

  @Test
  void put_evictsExpiredBeforeCapacityCheck() {
    store.put("a", "1");
    store.put("b", "2");
    store.put("c", "3");
    clock.advance(Duration.ofSeconds(301));

    store.put("d", "4");

    assertThat(store.size()).isEqualTo(1);
  }

  @Test
  void put_atCapacity_throws() {
    store.put("a", "1");
    store.put("b", "2");
    store.put("c", "3");

    assertThatThrownBy(() -> store.put("d", "4")).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void take_concurrentRacers_exactlyOneSucceeds() throws Exception {
    EphemeralStore<String> shared = new EphemeralStore<>("race", Duration.ofSeconds(300), clock);
    shared.put("session", "state");
    int threads = 16;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<Optional<String>>> results = new ArrayList<>();
    for (int i = 0; i < threads; i++) {
      results.add(executor.submit(() -> {
        start.await();
        return shared.take("session");
      }));
    }
    start.countDown();
    long successes = 0;
    for (Future<Optional<String>> result : results) {
      if (result.get(5, TimeUnit.SECONDS).isPresent()) {
        successes++;
      }
    }
    executor.shutdown();
    assertThat(successes).isEqualTo(1);
  }
}
