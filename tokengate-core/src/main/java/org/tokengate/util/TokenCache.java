package org.tokengate.util;

import io.vertx.core.Vertx;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.LongSupplier;
import org.apache.logging.log4j.Logger;
import org.tokengate.common.GatewayLogger;

/**
 * Access tokens by client ID, each with its own time to live.
 *
 * <p>Expired entries are never returned by {@link #get(String)}. They stay in
 * the map until {@link #sweep()} runs, either directly or from the periodic
 * timer installed by {@link #start(Vertx)}.
 */
public class TokenCache {

  public static final long DEFAULT_SWEEP_INTERVAL = 60 * 1000L;

  private static final Logger logger = GatewayLogger.get(TokenCache.class);

  private final Map<String, CacheEntry> cache = new HashMap<>();
  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final long sweepInterval;
  private final LongSupplier clock;

  private Vertx vertx;
  private long timerId = -1;

  private TokenCache(long sweepInterval, LongSupplier clock) {
    logger.info("Initializing token cache w/ sweep interval: {}", sweepInterval);
    this.sweepInterval = sweepInterval;
    this.clock = clock;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Cache a token.
   *
   * @param clientId client ID
   * @param token access token
   * @param ttl time to live in milliseconds
   * @throws NullPointerException for null client ID or token
   * @throws IllegalArgumentException for negative ttl
   */
  public void put(String clientId, String token, long ttl) {
    Objects.requireNonNull(clientId, "clientId");
    Objects.requireNonNull(token, "token");
    if (ttl < 0) {
      throw new IllegalArgumentException("negative ttl " + ttl);
    }
    CacheEntry entry = new CacheEntry(token, clock.getAsLong() + ttl);
    lock.writeLock().lock();
    try {
      cache.put(clientId, entry);
    } finally {
      lock.writeLock().unlock();
    }
    MetricsHelper.recordTokenCacheCached();
    logger.debug("Caching token for {} ttl={}", clientId, ttl);
  }

  /**
   * Get a cached token.
   *
   * @param clientId client ID
   * @return token or null if absent or expired
   */
  public String get(String clientId) {
    Objects.requireNonNull(clientId, "clientId");
    CacheEntry entry;
    lock.readLock().lock();
    try {
      entry = cache.get(clientId);
    } finally {
      lock.readLock().unlock();
    }
    if (entry == null) {
      MetricsHelper.recordTokenCacheMiss();
      logger.debug("Cache Miss: {}", clientId);
      return null;
    }
    if (entry.isExpired(clock.getAsLong())) {
      MetricsHelper.recordTokenCacheExpired();
      logger.debug("Cache Hit (Expired): {}", clientId);
      return null;
    }
    MetricsHelper.recordTokenCacheHit();
    logger.debug("Cache Hit: {}", clientId);
    return entry.token;
  }

  public void remove(String clientId) {
    Objects.requireNonNull(clientId, "clientId");
    lock.writeLock().lock();
    try {
      cache.remove(clientId);
    } finally {
      lock.writeLock().unlock();
    }
  }

  public void clear() {
    lock.writeLock().lock();
    try {
      cache.clear();
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Number of entries, including expired ones not swept yet.
   */
  public int size() {
    lock.readLock().lock();
    try {
      return cache.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Remove all expired entries.
   *
   * @return number of entries removed
   */
  public int sweep() {
    int removed = 0;
    lock.writeLock().lock();
    try {
      long now = clock.getAsLong();
      Iterator<CacheEntry> it = cache.values().iterator();
      while (it.hasNext()) {
        if (it.next().isExpired(now)) {
          it.remove();
          removed++;
        }
      }
    } finally {
      lock.writeLock().unlock();
    }
    if (removed > 0) {
      MetricsHelper.recordTokenCacheSwept(removed);
      logger.debug("Swept {} expired tokens", removed);
    }
    return removed;
  }

  /**
   * Start periodic sweep. No-op if already started.
   *
   * @param vertx Vert.x handle that owns the timer
   */
  public synchronized void start(Vertx vertx) {
    if (timerId != -1) {
      return;
    }
    this.vertx = vertx;
    timerId = vertx.setPeriodic(sweepInterval, id -> sweep());
  }

  /**
   * Stop periodic sweep. No-op if not started.
   */
  public synchronized void stop() {
    if (timerId == -1) {
      return;
    }
    vertx.cancelTimer(timerId);
    timerId = -1;
    vertx = null;
  }

  synchronized boolean isStarted() {
    return timerId != -1;
  }

  public static final class Builder {

    private long sweepInterval = DEFAULT_SWEEP_INTERVAL;
    private LongSupplier clock = System::currentTimeMillis;

    public TokenCache build() {
      return new TokenCache(sweepInterval, clock);
    }

    /**
     * Set period of the sweep timer.
     * @param sweepInterval milliseconds; must be positive
     * @return builder
     */
    public Builder withSweepInterval(long sweepInterval) {
      if (sweepInterval <= 0) {
        throw new IllegalArgumentException("sweep interval must be positive: " + sweepInterval);
      }
      this.sweepInterval = sweepInterval;
      return this;
    }

    public Builder withClock(LongSupplier clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }
  }

  private static final class CacheEntry {
    final String token;
    final long expires;

    CacheEntry(String token, long expires) {
      this.token = token;
      this.expires = expires;
    }

    boolean isExpired(long now) {
      return now >= expires;
    }
  }
}
