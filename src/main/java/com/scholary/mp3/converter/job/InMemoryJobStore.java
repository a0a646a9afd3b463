package com.scholary.mp3.converter.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory job store backed by a Caffeine cache.
 *
 * <p>Records are immutable snapshots; updates run inside {@code computeIfPresent} on the cache's
 * map view, which makes the read-merge-write of a patch atomic per key. Reads return whole
 * snapshots, so they never see half of an update.
 *
 * <p>By default the store keeps every job for the lifetime of the process. A maximum size or an
 * expiry can be configured; evicted jobs are handed to the eviction handler so their artifacts can
 * be removed. Explicit deletes do not reach the handler.
 */
public class InMemoryJobStore implements JobStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryJobStore.class);

  private static final Comparator<ConversionJob> MOST_RECENT_FIRST =
      Comparator.comparing(ConversionJob::createdAt)
          .thenComparingLong(ConversionJob::id)
          .reversed();

  private final Cache<Long, ConversionJob> cache;
  private final IdSequence ids;
  private final Clock clock;

  /** Unbounded store with no eviction. */
  public InMemoryJobStore() {
    this(0, Duration.ZERO, Clock.systemUTC(), job -> {});
  }

  /**
   * @param maxSize maximum number of retained jobs, 0 for unbounded
   * @param expireAfterWrite idle time after which a job is evicted, zero for never
   * @param clock source of creation timestamps
   * @param evictionHandler called with jobs dropped by size or expiry
   */
  public InMemoryJobStore(
      long maxSize,
      Duration expireAfterWrite,
      Clock clock,
      Consumer<ConversionJob> evictionHandler) {
    Caffeine<Object, Object> builder = Caffeine.newBuilder();
    if (maxSize > 0) {
      builder.maximumSize(maxSize);
    }
    if (!expireAfterWrite.isZero()) {
      builder.expireAfterWrite(expireAfterWrite);
    }
    this.cache =
        builder
            .<Long, ConversionJob>evictionListener(
                (id, job, cause) -> onEviction(id, job, cause, evictionHandler))
            .build();
    this.ids = new IdSequence();
    this.clock = clock;

    LOGGER.info(
        "Initialized job store: maxSize={}, expireAfterWrite={}",
        maxSize > 0 ? maxSize : "unbounded",
        expireAfterWrite.isZero() ? "never" : expireAfterWrite);
  }

  @Override
  public ConversionJob create(String sourceUrl) {
    ConversionJob job = ConversionJob.pending(ids.nextId(), sourceUrl, clock.instant());
    cache.put(job.id(), job);
    LOGGER.debug("Created job: id={}, url={}", job.id(), sourceUrl);
    return job;
  }

  @Override
  public Optional<ConversionJob> get(long id) {
    return Optional.ofNullable(cache.getIfPresent(id));
  }

  @Override
  public List<ConversionJob> list() {
    return cache.asMap().values().stream().sorted(MOST_RECENT_FIRST).toList();
  }

  @Override
  public Optional<ConversionJob> update(long id, JobPatch patch) {
    ConversionJob updated =
        cache.asMap().computeIfPresent(id, (key, current) -> patch.applyTo(current));
    if (updated == null) {
      LOGGER.debug("Ignoring update for missing job: id={}, patch={}", id, patch);
    }
    return Optional.ofNullable(updated);
  }

  @Override
  public boolean delete(long id) {
    return remove(id).isPresent();
  }

  @Override
  public Optional<ConversionJob> remove(long id) {
    ConversionJob removed = cache.asMap().remove(id);
    LOGGER.debug("Delete job: id={}, existed={}", id, removed != null);
    return Optional.ofNullable(removed);
  }

  @Override
  public List<ConversionJob> listByStatus(JobStatus status) {
    return cache.asMap().values().stream()
        .filter(job -> job.status() == status)
        .sorted(MOST_RECENT_FIRST)
        .toList();
  }

  private static void onEviction(
      Long id, ConversionJob job, RemovalCause cause, Consumer<ConversionJob> handler) {
    if (job == null) {
      return;
    }
    LOGGER.info("Evicted job: id={}, status={}, cause={}", id, job.status(), cause);
    try {
      handler.accept(job);
    } catch (RuntimeException e) {
      LOGGER.warn("Eviction handler failed for job {}", id, e);
    }
  }
}
