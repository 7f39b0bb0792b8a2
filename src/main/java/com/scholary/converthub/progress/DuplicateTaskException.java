package com.scholary.converthub.progress;

/** Thrown when a task is created under an id that is already registered. */
public class DuplicateTaskException extends RuntimeException {

  public DuplicateTaskException(String taskId) {
    super("Task already exists: " + taskId);
  }
}
