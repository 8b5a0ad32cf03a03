package com.example.mcpauth.adapter.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.Optional;

/**
 * Single-process store for local runs and tests. Each entry carries its own TTL.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

  private final Cache<String, Entry> entries;

  public InMemoryKeyValueStore(int maxEntries) {
    this(maxEntries, Ticker.systemTicker());
  }

  public InMemoryKeyValueStore(int maxEntries, Ticker ticker) {
    this.entries = Caffeine.newBuilder()
        .maximumSize(maxEntries)
        .ticker(ticker)
        .executor(Runnable::run)
        .expireAfter(new PerEntryExpiry())
        .build();
  }

  @Override
  public Optional<String> get(String key) {
    return Optional.ofNullable(entries.getIfPresent(key)).map(Entry::value);
  }

  @Override
  public void put(String key, String value, Duration ttl) {
    entries.put(key, new Entry(value, ttl));
  }

  @Override
  public boolean putIfAbsent(String key, String value, Duration ttl) {
    return entries.asMap().putIfAbsent(key, new Entry(value, ttl)) == null;
  }

  @Override
  public void delete(String key) {
    entries.invalidate(key);
  }

  private record Entry(String value, Duration ttl) {}

  private static final class PerEntryExpiry implements Expiry<String, Entry> {

    @Override
    public long expireAfterCreate(String key, Entry entry, long currentTime) {
      return entry.ttl().toNanos();
    }

    @Override
    public long expireAfterUpdate(String key, Entry entry, long currentTime,
                                  long currentDuration) {
      return entry.ttl().toNanos();
    }

    @Override
    public long expireAfterRead(String key, Entry entry, long currentTime,
                                long currentDuration) {
      return currentDuration;
    }
  }
}
