package com.scholary.converthub.conversion;

/** Raised inside a worker once it notices its task was cancelled. */
class TaskCancelledException extends RuntimeException {

  TaskCancelledException(String taskId) {
    super("Task cancelled: " + taskId);
  }
}
