package com.scholary.converthub.progress;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.converthub.config.ProgressProperties;
import com.scholary.converthub.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ProgressTrackerTest {

  private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

  private MutableClock clock;
  private ProgressTracker tracker;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(START);
    tracker =
        new ProgressTracker(
            new ProgressProperties(
                Duration.ofHours(1), Duration.ofMinutes(5), Duration.ofMinutes(1), 50),
            clock);
  }

  @AfterEach
  void tearDown() {
    tracker.stop();
  }

  @Test
  void createTask_startsQueuedAtZero() {
    TaskSnapshot task = tracker.createTask("t1", "image_convert", "a.png", 100, Map.of("k", "v"));

    assertThat(task.status()).isEqualTo(TaskStatus.QUEUED);
    assertThat(task.progress()).isZero();
    assertThat(task.message()).isEqualTo("Task queued");
    assertThat(task.metadata()).containsEntry("k", "v");
    assertThat(task.createdAt()).isEqualTo(START);
    assertThat(task.startedAt()).isNull();
  }

  @Test
  void createTask_rejectsDuplicateId() {
    tracker.createTask("t1", "image_convert", "a.png", 100, null);

    assertThatThrownBy(() -> tracker.createTask("t1", "text_transform", "b.txt", 10, null))
        .isInstanceOf(DuplicateTaskException.class);
    assertThat(tracker.getTaskStatus("t1").orElseThrow().taskType()).isEqualTo("image_convert");
  }

  @Test
  void createTask_rejectsNonPositiveSteps() {
    assertThatThrownBy(() -> tracker.createTask("t1", "op", "a", 0, null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void updateProgress_firstCallStartsTask() {
    tracker.createTask("t1", "op", "a", 10, null);
    clock.advance(Duration.ofSeconds(3));

    assertThat(tracker.updateProgress("t1", 3, "Working")).isTrue();

    TaskSnapshot task = tracker.getTaskStatus("t1").orElseThrow();
    assertThat(task.status()).isEqualTo(TaskStatus.PROCESSING);
    assertThat(task.progress()).isEqualTo(30);
    assertThat(task.message()).isEqualTo("Working");
    assertThat(task.startedAt()).isEqualTo(START.plusSeconds(3));
  }

  @Test
  void updateProgress_clampsToTotalSteps() {
    tracker.createTask("t1", "op", "a", 100, null);

    tracker.updateProgress("t1", 150, "Overshoot");

    TaskSnapshot task = tracker.getTaskStatus("t1").orElseThrow();
    assertThat(task.currentStep()).isEqualTo(100);
    assertThat(task.progress()).isEqualTo(100);
    assertThat(task.status()).isEqualTo(TaskStatus.PROCESSING);
  }

  @Test
  void updateProgress_neverMovesBackwards() {
    tracker.createTask("t1", "op", "a", 3, null);

    tracker.updateProgress("t1", 2, null);
    tracker.updateProgress("t1", 1, "Late report");

    TaskSnapshot task = tracker.getTaskStatus("t1").orElseThrow();
    assertThat(task.currentStep()).isEqualTo(2);
    assertThat(task.progress()).isEqualTo(66);
    assertThat(task.message()).isEqualTo("Late report");
  }

  @Test
  void updateProgress_unknownTaskHasNoSideEffects() {
    assertThat(tracker.updateProgress("missing", 5, "x")).isFalse();
    assertThat(tracker.getTaskStatus("missing")).isEmpty();
    assertThat(tracker.getAllTasks(10)).isEmpty();
  }

  @Test
  void completeTask_setsResultAndFullProgress() {
    tracker.createTask("t1", "op", "a", 4, null);
    tracker.updateProgress("t1", 1, null);
    clock.advance(Duration.ofSeconds(10));

    assertThat(tracker.completeTask("t1", "https://cdn/x.png", Map.of("width", 10))).isTrue();

    TaskSnapshot task = tracker.getTaskStatus("t1").orElseThrow();
    assertThat(task.status()).isEqualTo(TaskStatus.COMPLETED);
    assertThat(task.progress()).isEqualTo(100);
    assertThat(task.currentStep()).isEqualTo(4);
    assertThat(task.resultUrl()).isEqualTo("https://cdn/x.png");
    assertThat(task.metadata()).containsEntry("width", 10);
    assertThat(task.completedAt()).isEqualTo(START.plusSeconds(10));
  }

  @Test
  void terminalStatesAreSinks() {
    tracker.createTask("done", "op", "a", 1, null);
    tracker.completeTask("done", "url", null);
    tracker.createTask("failed", "op", "b", 1, null);
    tracker.failTask("failed", "boom", null);

    assertThat(tracker.failTask("done", "late", null)).isFalse();
    assertThat(tracker.completeTask("failed", "url", null)).isFalse();
    assertThat(tracker.updateProgress("done", 1, "again")).isFalse();
    assertThat(tracker.cancelTask("done")).isFalse();
    assertThat(tracker.cancelTask("failed")).isFalse();

    assertThat(tracker.getTaskStatus("done").orElseThrow().status())
        .isEqualTo(TaskStatus.COMPLETED);
    TaskSnapshot failed = tracker.getTaskStatus("failed").orElseThrow();
    assertThat(failed.status()).isEqualTo(TaskStatus.FAILED);
    assertThat(failed.errorMessage()).isEqualTo("boom");
  }

  @Test
  void cancelTask_onlyOnce() {
    tracker.createTask("t1", "op", "a", 10, null);
    tracker.updateProgress("t1", 5, null);

    assertThat(tracker.cancelTask("t1")).isTrue();
    assertThat(tracker.isCancelled("t1")).isTrue();
    assertThat(tracker.cancelTask("t1")).isFalse();
    assertThat(tracker.completeTask("t1", "url", null)).isFalse();
    assertThat(tracker.cancelTask("unknown")).isFalse();
  }

  @Test
  void snapshotsAreDetachedFromLaterUpdates() {
    tracker.createTask("t1", "op", "a", 10, null);
    TaskSnapshot before = tracker.getTaskStatus("t1").orElseThrow();

    tracker.updateProgress("t1", 5, "Half", Map.of("stage", "encode"));

    assertThat(before.progress()).isZero();
    assertThat(before.metadata()).isEmpty();
    assertThat(before.status()).isEqualTo(TaskStatus.QUEUED);
  }

  @Test
  void getAllTasks_mostRecentlyUpdatedFirst() {
    tracker.createTask("old", "op", "a", 10, null);
    clock.advance(Duration.ofSeconds(1));
    tracker.createTask("middle", "op", "b", 10, null);
    clock.advance(Duration.ofSeconds(1));
    tracker.createTask("new", "op", "c", 10, null);
    clock.advance(Duration.ofSeconds(1));
    tracker.updateProgress("old", 1, null);

    assertThat(tracker.getAllTasks(10))
        .extracting(TaskSnapshot::taskId)
        .containsExactly("old", "new", "middle");
    assertThat(tracker.getAllTasks(2)).hasSize(2);
  }

  @Test
  void activeTasksAndCountsByStatus() {
    tracker.createTask("queued", "op", "a", 10, null);
    tracker.createTask("running", "op", "b", 10, null);
    tracker.updateProgress("running", 1, null);
    tracker.createTask("done", "op", "c", 10, null);
    tracker.completeTask("done", "url", null);

    assertThat(tracker.getActiveTasks())
        .extracting(TaskSnapshot::taskId)
        .containsExactlyInAnyOrder("queued", "running");
    assertThat(tracker.getTaskCountByStatus())
        .containsEntry(TaskStatus.QUEUED, 1L)
        .containsEntry(TaskStatus.PROCESSING, 1L)
        .containsEntry(TaskStatus.COMPLETED, 1L)
        .containsEntry(TaskStatus.FAILED, 0L)
        .containsEntry(TaskStatus.CANCELLED, 0L);
  }

  @Test
  void evictExpired_removesOnlyOldTerminalTasks() {
    tracker.createTask("old-done", "op", "a", 1, null);
    tracker.completeTask("old-done", "url", null);
    tracker.createTask("old-running", "op", "b", 10, null);
    tracker.updateProgress("old-running", 1, null);
    clock.advance(Duration.ofMinutes(50));
    tracker.createTask("recent-failed", "op", "c", 1, null);
    tracker.failTask("recent-failed", "boom", null);
    clock.advance(Duration.ofMinutes(11));

    assertThat(tracker.evictExpired()).isEqualTo(1);

    assertThat(tracker.getTaskStatus("old-done")).isEmpty();
    assertThat(tracker.getTaskStatus("old-running")).isPresent();
    assertThat(tracker.getTaskStatus("recent-failed")).isPresent();
  }

  @Test
  void sweep_returnsNormalIntervalAfterSuccess() {
    assertThat(tracker.sweep()).isEqualTo(Duration.ofMinutes(5));
  }

  @Test
  void sweep_backsOffAfterFailureAndRecovers() {
    AtomicBoolean broken = new AtomicBoolean(true);
    MutableClock flakyClock =
        new MutableClock(START) {
          @Override
          public Instant instant() {
            if (broken.get()) {
              throw new IllegalStateException("clock unavailable");
            }
            return super.instant();
          }
        };
    ProgressTracker flaky =
        new ProgressTracker(
            new ProgressProperties(
                Duration.ofHours(1), Duration.ofMinutes(5), Duration.ofMinutes(1), 50),
            flakyClock);

    assertThat(flaky.sweep()).isEqualTo(Duration.ofMinutes(1));

    broken.set(false);
    assertThat(flaky.sweep()).isEqualTo(Duration.ofMinutes(5));
  }

  @Test
  void lifecycle_startsAndStopsSweeper() {
    assertThat(tracker.isRunning()).isFalse();

    tracker.start();
    assertThat(tracker.isRunning()).isTrue();

    tracker.stop();
    assertThat(tracker.isRunning()).isFalse();
  }

  @Test
  void concurrentUpdatesKeepTerminalStateConsistent() throws Exception {
    tracker.createTask("t1", "op", "a", 1000, null);
    ExecutorService pool = Executors.newFixedThreadPool(8);
    CountDownLatch go = new CountDownLatch(1);
    List<Future<Boolean>> cancels = new ArrayList<>();
    try {
      for (int i = 0; i < 8; i++) {
        int step = i;
        pool.submit(
            () -> {
              go.await();
              for (int s = 0; s < 100; s++) {
                tracker.updateProgress("t1", step * 100 + s, null);
              }
              return null;
            });
        cancels.add(
            pool.submit(
                () -> {
                  go.await();
                  return tracker.cancelTask("t1");
                }));
      }
      go.countDown();

      int successfulCancels = 0;
      for (Future<Boolean> cancel : cancels) {
        if (cancel.get(5, TimeUnit.SECONDS)) {
          successfulCancels++;
        }
      }
      assertThat(successfulCancels).isEqualTo(1);
      assertThat(tracker.getTaskStatus("t1").orElseThrow().status())
          .isEqualTo(TaskStatus.CANCELLED);
    } finally {
      pool.shutdownNow();
    }
  }
}
