package com.github.lukaszbudnik.logroll;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs periodic rotation checks, daily maintenance and retention sweeps.
 *
 * <p>Jobs are kept in a table and run by a single background thread that wakes up every tick and
 * runs each job whose next run time has passed. Jobs never overlap. A job that throws is logged and
 * rescheduled as usual, it never stops the scheduler or other jobs.
 *
 * <p>Daily jobs run at a wall-clock time in the zone of the scheduler's clock.
 */
public class RotationScheduler implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(RotationScheduler.class);

  static final Duration SIZE_CHECK_INTERVAL = Duration.ofMinutes(5);
  static final Duration AGE_CHECK_INTERVAL = Duration.ofHours(1);
  static final LocalTime MAINTENANCE_TIME = LocalTime.of(2, 0);
  static final LocalTime RETENTION_TIME = LocalTime.of(3, 0);
  static final Duration DEFAULT_TICK = Duration.ofMinutes(1);

  private final Clock clock;
  private final Duration tick;
  private final List<ScheduledJob> jobs = new CopyOnWriteArrayList<>();
  private ScheduledExecutorService executor;

  public RotationScheduler(Clock clock) {
    this(clock, DEFAULT_TICK);
  }

  public RotationScheduler(Clock clock, Duration tick) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.tick = Objects.requireNonNull(tick, "tick");
    if (tick.isZero() || tick.isNegative()) {
      throw new IllegalArgumentException("tick must be positive");
    }
  }

  /**
   * Register the periodic jobs of a rotating log: a check every 5 minutes when the policy has a size
   * or free-space trigger, an hourly check when it has an age trigger, and daily maintenance at
   * 02:00 which prunes and compresses leftover rotated files.
   */
  public void scheduleRotationChecks(RotatingLogHandle handle) {
    RotationPolicy policy = handle.getPolicy();
    String file = handle.getFile().toString();
    if (policy.hasSizeTrigger() || policy.hasFreeSpaceTrigger()) {
      scheduleEvery("size-check:" + file, SIZE_CHECK_INTERVAL, handle::rolloverIfNeeded);
    }
    if (policy.hasAgeTrigger()) {
      scheduleEvery("age-check:" + file, AGE_CHECK_INTERVAL, handle::rolloverIfNeeded);
    }
    scheduleDaily("maintenance:" + file, MAINTENANCE_TIME, handle::runMaintenance);
  }

  /** Register a daily 03:00 retention sweep for every category the manager knows. */
  public void scheduleRetentionCleanup(RetentionManager retentionManager) {
    for (String category : retentionManager.getCategories()) {
      scheduleDaily(
          "retention:" + category,
          RETENTION_TIME,
          () -> retentionManager.cleanupExpiredLogs(category));
    }
  }

  public void scheduleEvery(String name, Duration interval, JobTask task) {
    if (interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("interval must be positive");
    }
    addJob(new ScheduledJob(name, task, interval, null));
  }

  public void scheduleDaily(String name, LocalTime at, JobTask task) {
    addJob(new ScheduledJob(name, task, null, Objects.requireNonNull(at, "at")));
  }

  private void addJob(ScheduledJob job) {
    job.nextRun = job.nextRunAfter(clock.instant(), clock.getZone());
    jobs.add(job);
    logger.debug("Scheduled job {}, next run at {}", job.name, job.nextRun);
  }

  public List<String> getJobNames() {
    List<String> names = new ArrayList<>();
    for (ScheduledJob job : jobs) {
      names.add(job.name);
    }
    return names;
  }

  /**
   * Run every job that is due and reschedule it.
   *
   * @return number of jobs run
   */
  public synchronized int runPending() {
    Instant now = clock.instant();
    int ran = 0;
    for (ScheduledJob job : jobs) {
      if (job.nextRun.isAfter(now)) {
        continue;
      }
      try {
        job.task.run();
      } catch (Exception e) {
        logger.error("Scheduled job {} failed: {}", job.name, e.getMessage(), e);
      } finally {
        job.nextRun = job.nextRunAfter(now, clock.getZone());
      }
      ran++;
    }
    return ran;
  }

  public synchronized void start() {
    if (executor != null) {
      return;
    }
    executor = Executors.newSingleThreadScheduledExecutor(
        new NamedThreadFactory("log-rotation-scheduler"));
    executor.scheduleWithFixedDelay(
        this::tick, tick.toMillis(), tick.toMillis(), TimeUnit.MILLISECONDS);
    logger.info("Rotation scheduler started with {} jobs, tick {}", jobs.size(), tick);
  }

  public synchronized boolean isRunning() {
    return executor != null;
  }

  private void tick() {
    try {
      runPending();
    } catch (RuntimeException e) {
      logger.error("Rotation scheduler tick failed: {}", e.getMessage(), e);
    }
  }

  public synchronized void stop() {
    if (executor == null) {
      return;
    }
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
    executor = null;
    logger.info("Rotation scheduler stopped");
  }

  @Override
  public void close() {
    stop();
  }

  /** Body of a scheduled job. */
  @FunctionalInterface
  public interface JobTask {
    void run() throws Exception;
  }

  private static final class ScheduledJob {
    final String name;
    final JobTask task;
    final Duration interval;
    final LocalTime dailyAt;
    volatile Instant nextRun;

    ScheduledJob(String name, JobTask task, Duration interval, LocalTime dailyAt) {
      this.name = Objects.requireNonNull(name, "name");
      this.task = Objects.requireNonNull(task, "task");
      this.interval = interval;
      this.dailyAt = dailyAt;
    }

    Instant nextRunAfter(Instant now, ZoneId zone) {
      if (interval != null) {
        return now.plus(interval);
      }
      ZonedDateTime today = now.atZone(zone).toLocalDate().atTime(dailyAt).atZone(zone);
      if (today.toInstant().isAfter(now)) {
        return today.toInstant();
      }
      return now.atZone(zone).toLocalDate().plusDays(1).atTime(dailyAt).atZone(zone).toInstant();
    }
  }
}
