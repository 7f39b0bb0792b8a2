package com.scholary.converthub.conversion;

import com.scholary.converthub.cache.ConversionCache;
import com.scholary.converthub.config.ConversionProperties;
import com.scholary.converthub.converter.ConversionOptions;
import com.scholary.converthub.converter.ConversionProgress;
import com.scholary.converthub.converter.ConversionResult;
import com.scholary.converthub.converter.ConvertedFile;
import com.scholary.converthub.converter.ConverterRegistry;
import com.scholary.converthub.converter.FileConverter;
import com.scholary.converthub.logging.StructuredLogger;
import com.scholary.converthub.objectstore.ArtifactStorage;
import com.scholary.converthub.progress.ProgressTracker;
import com.scholary.converthub.support.Digests;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Single-file conversions.
 *
 * <p>{@link #submit} runs the conversion in the background as a tracked task: progress and the
 * final URL are read from the {@link ProgressTracker}, and a client may cancel it there. {@link
 * #convert} does the same work on the calling thread. Both consult the {@link ConversionCache}
 * first, keyed by content hash, operation and options.
 */
@Service
public class ConversionService {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConversionService.class);

  static final String CACHE_HIT = "cache_hit";

  private final ConverterRegistry registry;
  private final ProgressTracker tracker;
  private final ConversionCache cache;
  private final ArtifactStorage storage;
  private final ConversionProperties properties;
  private final Executor taskExecutor;

  public ConversionService(
      ConverterRegistry registry,
      ProgressTracker tracker,
      ConversionCache cache,
      ArtifactStorage storage,
      ConversionProperties properties,
      @Qualifier("taskExecutor") Executor taskExecutor) {
    this.registry = registry;
    this.tracker = tracker;
    this.cache = cache;
    this.storage = storage;
    this.properties = properties;
    this.taskExecutor = taskExecutor;
  }

  /**
   * Start a tracked background conversion.
   *
   * @return the task id to poll on the progress endpoints
   * @throws com.scholary.converthub.converter.UnknownOperationException if no converter matches
   * @throws RejectedExecutionException if the conversion queue is full
   */
  public String submit(
      String filename, byte[] content, String operation, ConversionOptions options) {
    FileConverter converter = registry.require(operation);
    String taskId = UUID.randomUUID().toString();

    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put(ConversionResult.INPUT_FILENAME, filename);
    metadata.put("file_size", content.length);
    metadata.put("options", options.asMap());
    tracker.createTask(taskId, operation, filename, 100, metadata);

    try {
      taskExecutor.execute(() -> runTracked(taskId, filename, content, converter, options));
    } catch (RejectedExecutionException e) {
      tracker.failTask(taskId, "Conversion queue is full", null);
      throw e;
    }
    LOGGER.info(
        "Submitted conversion: taskId={}, operation={}, file={}", taskId, operation, filename);
    return taskId;
  }

  /**
   * Convert on the calling thread.
   *
   * @throws com.scholary.converthub.converter.ConversionException if the input cannot be converted
   * @throws com.scholary.converthub.objectstore.ObjectStoreException if the output cannot be stored
   */
  public ConversionResult convert(
      String filename, byte[] content, String operation, ConversionOptions options) {
    FileConverter converter = registry.require(operation);
    String taskId = UUID.randomUUID().toString();
    return execute(taskId, filename, content, converter, options, ConversionProgress.NONE);
  }

  private void runTracked(
      String taskId,
      String filename,
      byte[] content,
      FileConverter converter,
      ConversionOptions options) {
    StructuredLogger.setTaskContext(taskId);
    try {
      if (tracker.isCancelled(taskId)) {
        LOGGER.info("Task cancelled before it started: taskId={}", taskId);
        return;
      }
      tracker.updateProgress(taskId, 1, "Conversion started");
      ConversionResult result =
          execute(taskId, filename, content, converter, options, progressOf(taskId));
      if (!tracker.completeTask(taskId, result.resultUrl(), result.metadata())) {
        LOGGER.info("Task finished after it was cancelled: taskId={}", taskId);
      }
    } catch (RuntimeException e) {
      if (tracker.isCancelled(taskId)) {
        LOGGER.info("Task stopped after cancellation: taskId={}", taskId);
      } else {
        LOGGER.warn("Conversion failed: taskId={}, error={}", taskId, e.getMessage());
        tracker.failTask(taskId, describe(e), Map.of(ConversionResult.INPUT_FILENAME, filename));
      }
    } finally {
      StructuredLogger.clearTaskContext();
    }
  }

  private ConversionResult execute(
      String taskId,
      String filename,
      byte[] content,
      FileConverter converter,
      ConversionOptions options,
      ConversionProgress progress) {
    long startedAt = System.nanoTime();
    String cacheKey =
        ConversionCache.generateKey(Digests.sha256Hex(content), converter.operation(), options);

    Optional<ConversionResult> cached = cache.get(cacheKey);
    if (cached.isPresent()) {
      Map<String, Object> metadata = new LinkedHashMap<>(cached.get().metadata());
      metadata.put(ConversionResult.INPUT_FILENAME, filename);
      metadata.put(CACHE_HIT, true);
      LOGGER.info("Serving cached conversion: taskId={}, key={}", taskId, cacheKey);
      return ConversionResult.success(
          taskId, cached.get().resultUrl(), metadata, elapsedMs(startedAt));
    }

    ConvertedFile converted = converter.convert(content, options, progress);
    if (progress.isCancelled()) {
      throw new TaskCancelledException(taskId);
    }
    progress.report(90, "Uploading result");
    String url =
        storage.upload(
            converted.data(), outputName(filename, converted.format()), converted.contentType());

    Map<String, Object> metadata = new LinkedHashMap<>(converted.metadata());
    metadata.put(ConversionResult.INPUT_FILENAME, filename);
    metadata.put(ConversionResult.OUTPUT_FORMAT, converted.format());
    ConversionResult result =
        ConversionResult.success(taskId, url, metadata, elapsedMs(startedAt));
    cache.put(cacheKey, result, properties.cacheTtl());
    return result;
  }

  private ConversionProgress progressOf(String taskId) {
    return new ConversionProgress() {
      @Override
      public void report(int step, String message) {
        tracker.updateProgress(taskId, step, message);
      }

      @Override
      public boolean isCancelled() {
        return tracker.isCancelled(taskId);
      }
    };
  }

  private static String describe(RuntimeException e) {
    String message = e.getMessage();
    return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
  }

  private static long elapsedMs(long startedAt) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
  }

  private static String outputName(String filename, String format) {
    String name = filename == null ? "output" : filename;
    int dot = name.lastIndexOf('.');
    return (dot > 0 ? name.substring(0, dot) : name) + "." + format;
  }
}
