package com.scholary.converthub.progress;

/** Thrown when a task id is not known to the tracker. */
public class TaskNotFoundException extends RuntimeException {

  public TaskNotFoundException(String taskId) {
    super("Task not found: " + taskId);
  }
}
