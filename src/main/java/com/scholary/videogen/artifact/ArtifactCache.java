package com.scholary.videogen.artifact;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Download cache keyed by source URL, backed by Caffeine.
 *
 * <p>Entries expire a fixed time after they are written. Expiry is reclaimed lazily: Caffeine does
 * its maintenance on access and on {@link #cleanUp()}, and the file behind an expired or evicted
 * entry is deleted then. A replaced entry keeps its file, because the job that downloaded it may
 * still be reading it; the orphan sweep picks it up later.
 *
 * <p>Concurrent puts for the same URL are last-write-wins.
 */
public class ArtifactCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(ArtifactCache.class);

  /** A cached download. */
  public record Entry(Path path, Instant downloadedAt) {}

  private final Cache<String, Entry> cache;
  private final Duration ttl;

  public ArtifactCache(Duration ttl, long maxSize, Clock clock) {
    this.ttl = ttl;
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(ttl)
            .ticker(clockTicker(clock))
            .executor(Runnable::run)
            .removalListener(
                (String url, Entry entry, RemovalCause cause) -> {
                  if (entry != null
                      && (cause == RemovalCause.EXPIRED || cause == RemovalCause.SIZE)) {
                    deleteQuietly(entry.path(), url);
                  }
                })
            .recordStats()
            .build();

    LOGGER.info("Initialized artifact cache: maxSize={}, ttl={}", maxSize, ttl);
  }

  /** Cached path for {@code url}, if present and the file still exists. */
  public Optional<Path> get(String url) {
    Entry entry = cache.getIfPresent(url);
    if (entry == null) {
      LOGGER.debug("Cache miss: url={}", url);
      return Optional.empty();
    }
    if (!Files.exists(entry.path())) {
      LOGGER.debug("Cached file vanished, dropping entry: url={}, path={}", url, entry.path());
      cache.asMap().remove(url, entry);
      return Optional.empty();
    }
    LOGGER.debug("Cache hit: url={}", url);
    return Optional.of(entry.path());
  }

  public void put(String url, Path path, Instant downloadedAt) {
    cache.put(url, new Entry(path, downloadedAt));
  }

  /** Absolute paths of every live entry. */
  public Set<Path> trackedPaths() {
    return cache.asMap().values().stream()
        .map(entry -> entry.path().toAbsolutePath().normalize())
        .collect(Collectors.toSet());
  }

  /** Run pending maintenance, reclaiming expired entries and their files. */
  public void cleanUp() {
    cache.cleanUp();
  }

  public long size() {
    cache.cleanUp();
    return cache.estimatedSize();
  }

  public Duration ttl() {
    return ttl;
  }

  public String getStats() {
    var stats = cache.stats();
    return String.format(
        "ArtifactCache[size=%d, hitRate=%.2f%%, evictions=%d]",
        cache.estimatedSize(), stats.hitRate() * 100, stats.evictionCount());
  }

  private static Ticker clockTicker(Clock clock) {
    return () -> {
      Instant now = clock.instant();
      return now.getEpochSecond() * 1_000_000_000L + now.getNano();
    };
  }

  private static void deleteQuietly(Path path, String url) {
    try {
      if (Files.deleteIfExists(path)) {
        LOGGER.info("Deleted expired cached file: {} (from {})", path, url);
      }
    } catch (IOException e) {
      LOGGER.warn("Failed to delete expired cached file {}: {}", path, e.getMessage());
    }
  }
}
