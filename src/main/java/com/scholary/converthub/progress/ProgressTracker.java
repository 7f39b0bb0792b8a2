package com.scholary.converthub.progress;

import com.scholary.converthub.config.ProgressProperties;
import com.scholary.converthub.logging.StructuredLogger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

/**
 * Registry of long-running single-file tasks: progress, outcome and cooperative cancellation.
 *
 * <p>Workers report through {@link #updateProgress}, {@link #completeTask} and {@link #failTask}
 * and poll {@link #isCancelled}; clients read snapshots. Terminal states are sinks, so a late
 * {@code completeTask} after a cancellation is ignored.
 *
 * <p>Expired terminal tasks are swept by a single background thread that exists only between
 * {@link #start()} and {@link #stop()}. A failing sweep is logged and retried after {@code
 * progress.sweepRetryBackoff} instead of the normal interval.
 */
@Component
public class ProgressTracker implements SmartLifecycle {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProgressTracker.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final Map<String, ProgressTask> tasks = new ConcurrentHashMap<>();
  private final ProgressProperties properties;
  private final Clock clock;

  private volatile ScheduledExecutorService sweeper;

  public ProgressTracker(ProgressProperties properties, Clock clock) {
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Register a new task in QUEUED state.
   *
   * @throws DuplicateTaskException if {@code taskId} is already registered
   * @throws IllegalArgumentException if {@code totalSteps} is not positive
   */
  public TaskSnapshot createTask(
      String taskId,
      String taskType,
      String filename,
      int totalSteps,
      Map<String, Object> metadata) {
    if (totalSteps <= 0) {
      throw new IllegalArgumentException("totalSteps must be positive, got " + totalSteps);
    }
    ProgressTask task = new ProgressTask(taskId, taskType, filename, totalSteps, metadata, now());
    if (tasks.putIfAbsent(taskId, task) != null) {
      throw new DuplicateTaskException(taskId);
    }
    LOGGER.debug("Created task: taskId={}, type={}, file={}", taskId, taskType, filename);
    return task.snapshot();
  }

  /**
   * Record progress. The first call moves the task to PROCESSING.
   *
   * @return false if the task is unknown or already terminal
   */
  public boolean updateProgress(
      String taskId, int currentStep, String message, Map<String, Object> metadata) {
    ProgressTask task = tasks.get(taskId);
    return task != null && task.update(currentStep, message, metadata, now());
  }

  public boolean updateProgress(String taskId, int currentStep, String message) {
    return updateProgress(taskId, currentStep, message, null);
  }

  /** @return false if the task is unknown or already terminal */
  public boolean completeTask(String taskId, String resultUrl, Map<String, Object> metadata) {
    ProgressTask task = tasks.get(taskId);
    boolean completed = task != null && task.complete(resultUrl, metadata, now());
    if (completed) {
      LOGGER.info("Task completed: taskId={}", taskId);
    }
    return completed;
  }

  /** @return false if the task is unknown or already terminal */
  public boolean failTask(String taskId, String errorMessage, Map<String, Object> metadata) {
    ProgressTask task = tasks.get(taskId);
    boolean failed = task != null && task.fail(errorMessage, metadata, now());
    if (failed) {
      LOGGER.warn("Task failed: taskId={}, error={}", taskId, errorMessage);
    }
    return failed;
  }

  /** @return false if the task is unknown or already completed, failed or cancelled */
  public boolean cancelTask(String taskId) {
    ProgressTask task = tasks.get(taskId);
    boolean cancelled = task != null && task.cancel(now());
    if (cancelled) {
      LOGGER.info("Task cancelled: taskId={}", taskId);
    }
    return cancelled;
  }

  public boolean isCancelled(String taskId) {
    ProgressTask task = tasks.get(taskId);
    return task != null && task.isCancelled();
  }

  public Optional<TaskSnapshot> getTaskStatus(String taskId) {
    return Optional.ofNullable(tasks.get(taskId)).map(ProgressTask::snapshot);
  }

  /** Most recently updated first. */
  public List<TaskSnapshot> getAllTasks(int limit) {
    return tasks.values().stream()
        .map(ProgressTask::snapshot)
        .sorted(Comparator.comparing(TaskSnapshot::updatedAt).reversed())
        .limit(Math.max(0, limit))
        .collect(Collectors.toList());
  }

  public List<TaskSnapshot> getActiveTasks() {
    return tasks.values().stream()
        .filter(ProgressTask::isActive)
        .map(ProgressTask::snapshot)
        .collect(Collectors.toList());
  }

  /** Count per status; every status is present. */
  public Map<TaskStatus, Long> getTaskCountByStatus() {
    Map<TaskStatus, Long> counts = new EnumMap<>(TaskStatus.class);
    for (TaskStatus status : TaskStatus.values()) {
      counts.put(status, 0L);
    }
    for (ProgressTask task : tasks.values()) {
      counts.merge(task.snapshot().status(), 1L, Long::sum);
    }
    return counts;
  }

  /**
   * Remove terminal tasks whose last update is older than {@code progress.retention}.
   *
   * @return the number of tasks removed
   */
  public int evictExpired() {
    Instant now = now();
    Duration retention = properties.retention();
    int evicted = 0;
    for (Map.Entry<String, ProgressTask> entry : tasks.entrySet()) {
      ProgressTask task = entry.getValue();
      if (task.isExpired(now, retention) && tasks.remove(entry.getKey(), task)) {
        TaskSnapshot snapshot = task.snapshot();
        STRUCTURED_LOGGER.logTaskEvicted(
            snapshot.taskId(),
            snapshot.status().value(),
            Duration.between(snapshot.updatedAt(), now).toSeconds());
        evicted++;
      }
    }
    if (evicted > 0) {
      LOGGER.info("Evicted {} expired tasks, {} remaining", evicted, tasks.size());
    }
    return evicted;
  }

  /** Run one sweep and return the delay until the next one. */
  Duration sweep() {
    try {
      evictExpired();
      return properties.sweepInterval();
    } catch (RuntimeException e) {
      LOGGER.error(
          "Task sweep failed, retrying in {}: {}",
          properties.sweepRetryBackoff(),
          e.getMessage(),
          e);
      return properties.sweepRetryBackoff();
    }
  }

  @Override
  public synchronized void start() {
    if (sweeper != null) {
      return;
    }
    CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("progress-sweeper-");
    threadFactory.setDaemon(true);
    sweeper = Executors.newSingleThreadScheduledExecutor(threadFactory);
    scheduleSweep(sweeper, properties.sweepInterval());
    LOGGER.info(
        "Progress sweeper started: interval={}, retention={}",
        properties.sweepInterval(),
        properties.retention());
  }

  @Override
  public synchronized void stop() {
    if (sweeper == null) {
      return;
    }
    sweeper.shutdownNow();
    sweeper = null;
    LOGGER.info("Progress sweeper stopped");
  }

  @Override
  public boolean isRunning() {
    return sweeper != null;
  }

  private void scheduleSweep(ScheduledExecutorService executor, Duration delay) {
    try {
      executor.schedule(
          () -> scheduleSweep(executor, sweep()), delay.toMillis(), TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      // Executor shut down by stop(); the loop ends here
      LOGGER.debug("Sweep not rescheduled: sweeper is stopped");
    }
  }

  private Instant now() {
    return clock.instant();
  }
}
