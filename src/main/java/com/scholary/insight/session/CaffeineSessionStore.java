package com.scholary.insight.session;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Scheduler;
import com.github.benmanes.caffeine.cache.Ticker;
import com.scholary.insight.logging.StructuredLogger;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory implementation of SessionStore using Caffeine.
 *
 * <p>Each entry expires at whichever comes first: {@code absoluteExpiration} after the {@link #put}
 * that created it, or {@code slidingExpiration} after its last read or write. Updates keep the
 * creation instant, so a busy session still dies at its absolute deadline.
 *
 * <p>Updates to one video are serialized with a per-video {@link ReentrantLock}. Locks live in a
 * weak-valued table and disappear once no thread holds them. The read-modify-write itself runs
 * through {@code asMap().computeIfPresent}, so a concurrent {@link #put} is never overwritten with
 * a value derived from the replaced session.
 */
public class CaffeineSessionStore implements SessionStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(CaffeineSessionStore.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final Cache<String, SessionEntry> cache;
  private final Cache<String, ReentrantLock> locks;
  private final Ticker ticker;

  public CaffeineSessionStore(
      Duration absoluteExpiration, Duration slidingExpiration, Ticker ticker) {
    if (absoluteExpiration.isNegative() || absoluteExpiration.isZero()) {
      throw new IllegalArgumentException("Absolute expiration must be positive");
    }
    if (slidingExpiration.isNegative() || slidingExpiration.isZero()) {
      throw new IllegalArgumentException("Sliding expiration must be positive");
    }
    this.ticker = ticker;
    this.cache =
        Caffeine.newBuilder()
            .expireAfter(new SessionExpiry(absoluteExpiration, slidingExpiration))
            .ticker(ticker)
            .scheduler(Scheduler.systemScheduler())
            .recordStats()
            .build();
    this.locks = Caffeine.newBuilder().weakValues().build();

    LOGGER.info(
        "Initialized session store: absoluteExpiration={}, slidingExpiration={}",
        absoluteExpiration,
        slidingExpiration);
  }

  @Override
  public Optional<VideoSession> get(String videoId) {
    SessionEntry entry = cache.getIfPresent(videoId);
    if (entry != null) {
      LOGGER.debug("Session hit: videoId={}", videoId);
      return Optional.of(entry.session());
    } else {
      LOGGER.debug("Session miss: videoId={}", videoId);
      return Optional.empty();
    }
  }

  @Override
  public boolean exists(String videoId) {
    return cache.getIfPresent(videoId) != null;
  }

  @Override
  public void put(VideoSession session) {
    cache.put(session.videoId(), new SessionEntry(session, ticker.read()));
    structuredLogger.logSessionCached(session.videoId(), session.chunks().size());
  }

  @Override
  public VideoSession updateSummary(String videoId, String summary) {
    VideoSession updated = update(videoId, session -> session.withSummary(summary));
    structuredLogger.logSessionUpdated(videoId, "summary", updated.conversationHistory().size());
    return updated;
  }

  @Override
  public VideoSession addConversationMessage(String videoId, ConversationMessage message) {
    VideoSession updated = update(videoId, session -> session.withMessage(message));
    structuredLogger.logSessionUpdated(
        videoId, "message_" + message.role().promptName(), updated.conversationHistory().size());
    return updated;
  }

  /** Drop every session and lock. */
  public void close() {
    LOGGER.info("Closing session store: {}", getStats());
    cache.invalidateAll();
    cache.cleanUp();
    locks.invalidateAll();
  }

  /**
   * Get cache statistics for monitoring.
   *
   * @return cache stats
   */
  public String getStats() {
    var stats = cache.stats();
    return String.format(
        "SessionStore[size=%d, hitRate=%.2f%%, evictions=%d]",
        cache.estimatedSize(), stats.hitRate() * 100, stats.evictionCount());
  }

  private VideoSession update(String videoId, UnaryOperator<VideoSession> mutation) {
    ReentrantLock lock = locks.get(videoId, k -> new ReentrantLock());
    lock.lock();
    try {
      SessionEntry stored =
          cache
              .asMap()
              .computeIfPresent(
                  videoId,
                  (k, current) ->
                      new SessionEntry(mutation.apply(current.session()), current.createdNanos()));
      if (stored == null) {
        throw new SessionNotFoundException(videoId);
      }
      return stored.session();
    } finally {
      lock.unlock();
    }
  }

  /** Cached value plus the ticker reading of the put that created it. */
  record SessionEntry(VideoSession session, long createdNanos) {}

  /** Remaining lifetime is min(sliding window, time left until the absolute deadline). */
  static final class SessionExpiry implements Expiry<String, SessionEntry> {

    private final long absoluteNanos;
    private final long slidingNanos;

    SessionExpiry(Duration absolute, Duration sliding) {
      this.absoluteNanos = absolute.toNanos();
      this.slidingNanos = sliding.toNanos();
    }

    @Override
    public long expireAfterCreate(String key, SessionEntry value, long currentTime) {
      return remaining(value, currentTime);
    }

    @Override
    public long expireAfterUpdate(
        String key, SessionEntry value, long currentTime, long currentDuration) {
      return remaining(value, currentTime);
    }

    @Override
    public long expireAfterRead(
        String key, SessionEntry value, long currentTime, long currentDuration) {
      return remaining(value, currentTime);
    }

    private long remaining(SessionEntry value, long currentTime) {
      long untilAbsolute = absoluteNanos - (currentTime - value.createdNanos());
      return Math.max(0, Math.min(slidingNanos, untilAbsolute));
    }
  }
}
