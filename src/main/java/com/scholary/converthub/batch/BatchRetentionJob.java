package com.scholary.converthub.batch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodically drops batches older than {@code batch.retention}. */
@Component
public class BatchRetentionJob {

  private static final Logger LOGGER = LoggerFactory.getLogger(BatchRetentionJob.class);

  private final BatchCoordinator coordinator;

  public BatchRetentionJob(BatchCoordinator coordinator) {
    this.coordinator = coordinator;
  }

  @Scheduled(
      fixedDelayString = "${batch.cleanup-interval}",
      initialDelayString = "${batch.cleanup-interval}")
  public void purgeExpiredBatches() {
    try {
      int removed = coordinator.cleanupOldBatches();
      LOGGER.debug("Batch retention sweep removed {} batches", removed);
    } catch (RuntimeException e) {
      LOGGER.error("Batch retention sweep failed: {}", e.getMessage(), e);
    }
  }
}
