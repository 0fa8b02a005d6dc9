package com.github.lukaszbudnik.logroll;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RotationSchedulerTest {

  @TempDir Path tempDir;

  private MutableClock clock;
  private RotationScheduler scheduler;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2026-01-01T01:00:00Z"), ZoneOffset.UTC);
    scheduler = new RotationScheduler(clock);
  }

  @AfterEach
  void tearDown() {
    scheduler.close();
  }

  @Test
  void shouldScheduleChecksMatchingPolicyTriggers() throws Exception {
    try (RotatingLogHandle sizeOnly =
            new RotatingLogHandle(
                tempDir.resolve("size.log"),
                RotationPolicy.builder("size").maxSizeBytes(100L).build());
        RotatingLogHandle ageOnly =
            new RotatingLogHandle(
                tempDir.resolve("age.log"),
                RotationPolicy.builder("age").maxAge(Duration.ofDays(1)).build())) {

      scheduler.scheduleRotationChecks(sizeOnly);
      scheduler.scheduleRotationChecks(ageOnly);

      List<String> jobs = scheduler.getJobNames();
      assertEquals(4, jobs.size());
      assertTrue(jobs.contains("size-check:" + sizeOnly.getFile()));
      assertTrue(jobs.contains("maintenance:" + sizeOnly.getFile()));
      assertTrue(jobs.contains("age-check:" + ageOnly.getFile()));
      assertTrue(jobs.contains("maintenance:" + ageOnly.getFile()));
    }
  }

  @Test
  void shouldRunSizeCheckEveryFiveMinutes() throws Exception {
    // Given
    RotationPolicy policy =
        RotationPolicy.builder("size").maxSizeBytes(10L).compressionEnabled(false).build();
    try (RotatingLogHandle handle =
        new RotatingLogHandle(
            tempDir.resolve("app.log"), policy, null, new RotationMetrics(), clock)) {
      scheduler.scheduleRotationChecks(handle);
      handle.write("0123456789");

      // When / Then
      assertEquals(0, scheduler.runPending(), "Nothing is due yet");
      assertTrue(handle.rotatedArtifacts().isEmpty());

      clock.advance(Duration.ofMinutes(5));
      assertEquals(1, scheduler.runPending());
      assertEquals(1, handle.rotatedArtifacts().size());
      assertEquals(0, scheduler.runPending(), "Job should be rescheduled");
    }
  }

  @Test
  void shouldRunAgeCheckHourlyAndMaintenanceAtTwo() throws Exception {
    // Given
    RotationPolicy policy = RotationPolicy.builder("age").maxAge(Duration.ofMinutes(30)).build();
    try (RotatingLogHandle handle =
        new RotatingLogHandle(
            tempDir.resolve("app.log"), policy, null, new RotationMetrics(), clock)) {
      scheduler.scheduleRotationChecks(handle);
      handle.write("line\n");

      // When / Then
      clock.advance(Duration.ofMinutes(59));
      assertEquals(0, scheduler.runPending());

      clock.set(Instant.parse("2026-01-01T02:00:00Z"));
      assertEquals(2, scheduler.runPending(), "Age check and maintenance are both due");
      assertEquals(1, handle.rotatedArtifacts().size());
    }
  }

  @Test
  void shouldRunRetentionCleanupDailyAtThree() {
    // Given
    RetentionManager retentionManager = mock(RetentionManager.class);
    when(retentionManager.getCategories()).thenReturn(Set.of("application"));
    scheduler.scheduleRetentionCleanup(retentionManager);

    // When / Then
    clock.set(Instant.parse("2026-01-01T02:59:59Z"));
    assertEquals(0, scheduler.runPending());
    verify(retentionManager, never()).cleanupExpiredLogs(anyString());

    clock.set(Instant.parse("2026-01-01T03:00:00Z"));
    assertEquals(1, scheduler.runPending());
    verify(retentionManager, times(1)).cleanupExpiredLogs("application");

    clock.set(Instant.parse("2026-01-02T02:00:00Z"));
    assertEquals(0, scheduler.runPending(), "Next run is the following day at 03:00");
    clock.set(Instant.parse("2026-01-02T03:00:00Z"));
    assertEquals(1, scheduler.runPending());
    verify(retentionManager, times(2)).cleanupExpiredLogs("application");
  }

  @Test
  void shouldKeepRunningJobsWhenOneFails() {
    // Given
    AtomicInteger runs = new AtomicInteger();
    scheduler.scheduleEvery(
        "failing",
        Duration.ofMinutes(1),
        () -> {
          throw new IllegalStateException("boom");
        });
    scheduler.scheduleEvery("counting", Duration.ofMinutes(1), runs::incrementAndGet);

    // When
    clock.advance(Duration.ofMinutes(1));
    int first = scheduler.runPending();
    clock.advance(Duration.ofMinutes(1));
    int second = scheduler.runPending();

    // Then
    assertEquals(2, first);
    assertEquals(2, second, "Failing job should be rescheduled too");
    assertEquals(2, runs.get());
  }

  @Test
  void shouldScheduleDailyJobForLaterTodayWhenTimeNotPassed() {
    AtomicInteger runs = new AtomicInteger();
    scheduler.scheduleDaily("late", LocalTime.of(23, 30), runs::incrementAndGet);

    clock.set(Instant.parse("2026-01-01T23:29:59Z"));
    scheduler.runPending();
    assertEquals(0, runs.get());

    clock.set(Instant.parse("2026-01-01T23:30:00Z"));
    scheduler.runPending();
    assertEquals(1, runs.get());
  }

  @Test
  void shouldStartAndStopBackgroundThread() {
    assertFalse(scheduler.isRunning());

    scheduler.start();
    scheduler.start();
    assertTrue(scheduler.isRunning());

    scheduler.stop();
    assertFalse(scheduler.isRunning());
  }

  @Test
  void shouldRejectNonPositiveIntervals() {
    assertThrows(IllegalArgumentException.class, () -> new RotationScheduler(clock, Duration.ZERO));
    assertThrows(
        IllegalArgumentException.class,
        () -> scheduler.scheduleEvery("never", Duration.ofSeconds(-1), () -> {}));
  }
}
