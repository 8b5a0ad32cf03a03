package com.example.mcpauth.adapter.store;

import static org.assertj.core.api.Assertions.assertThat;

import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryKeyValueStoreTest {

  private final AtomicLong nanos = new AtomicLong();
  private final Ticker ticker = nanos::get;
  private InMemoryKeyValueStore store;

  @BeforeEach
  void setUp() {
    store = new InMemoryKeyValueStore(100, ticker);
  }

  @Test
  void storedValueIsReadableBeforeExpiry() {
    store.put("session:abc", "value", Duration.ofHours(1));
    advance(Duration.ofMinutes(59));

    assertThat(store.get("session:abc")).contains("value");
  }

  @Test
  void valueIsAbsentAfterTtlElapses() {
    store.put("session:abc", "value", Duration.ofHours(1));
    advance(Duration.ofHours(1).plusSeconds(1));

    assertThat(store.get("session:abc")).isEmpty();
  }

  @Test
  void entriesExpireIndependently() {
    store.put("short", "a", Duration.ofSeconds(30));
    store.put("long", "b", Duration.ofDays(7));
    advance(Duration.ofMinutes(1));

    assertThat(store.get("short")).isEmpty();
    assertThat(store.get("long")).contains("b");
  }

  @Test
  void overwriteResetsTtl() {
    store.put("key", "first", Duration.ofSeconds(10));
    advance(Duration.ofSeconds(8));
    store.put("key", "second", Duration.ofSeconds(10));
    advance(Duration.ofSeconds(8));

    assertThat(store.get("key")).contains("second");
  }

  @Test
  void putIfAbsentOnlySucceedsOnce() {
    assertThat(store.putIfAbsent("used_code:x", "1", Duration.ofMinutes(15))).isTrue();
    assertThat(store.putIfAbsent("used_code:x", "2", Duration.ofMinutes(15))).isFalse();
    assertThat(store.get("used_code:x")).contains("1");
  }

  @Test
  void putIfAbsentSucceedsAgainAfterExpiry() {
    store.putIfAbsent("used_code:x", "1", Duration.ofMinutes(15));
    advance(Duration.ofMinutes(16));

    assertThat(store.putIfAbsent("used_code:x", "2", Duration.ofMinutes(15))).isTrue();
  }

  @Test
  void deleteRemovesValueAndMissingKeyIsIgnored() {
    store.put("key", "value", Duration.ofHours(1));
    store.delete("key");
    store.delete("never-written");

    assertThat(store.get("key")).isEmpty();
  }

  private void advance(Duration duration) {
    nanos.addAndGet(duration.toNanos());
  }
}
