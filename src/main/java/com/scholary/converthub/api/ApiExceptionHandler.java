package com.scholary.converthub.api;

import com.scholary.converthub.batch.BatchNotFoundException;
import com.scholary.converthub.batch.BatchStateException;
import com.scholary.converthub.batch.BatchValidationException;
import com.scholary.converthub.converter.ConversionException;
import com.scholary.converthub.converter.UnknownOperationException;
import com.scholary.converthub.objectstore.ObjectStoreException;
import com.scholary.converthub.progress.DuplicateTaskException;
import com.scholary.converthub.progress.TaskNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import java.net.URI;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * Maps domain exceptions to RFC 7807 problem responses.
 *
 * <p>Framework exceptions (missing multipart parts, oversized uploads) are handled by the base
 * class.
 */
@RestControllerAdvice
public class ApiExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler({
    BatchValidationException.class,
    UnknownOperationException.class,
    InvalidRequestException.class
  })
  public ResponseEntity<ProblemDetail> handleValidation(
      RuntimeException ex, HttpServletRequest request) {
    return problem(HttpStatus.BAD_REQUEST, "Validation Failed", ex.getMessage(), request);
  }

  @ExceptionHandler({BatchNotFoundException.class, TaskNotFoundException.class})
  public ResponseEntity<ProblemDetail> handleNotFound(
      RuntimeException ex, HttpServletRequest request) {
    return problem(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), request);
  }

  @ExceptionHandler({DuplicateTaskException.class, ResourceConflictException.class})
  public ResponseEntity<ProblemDetail> handleConflict(
      RuntimeException ex, HttpServletRequest request) {
    return problem(HttpStatus.CONFLICT, "Conflict", ex.getMessage(), request);
  }

  @ExceptionHandler(ConversionException.class)
  public ResponseEntity<ProblemDetail> handleConversionFailed(
      ConversionException ex, HttpServletRequest request) {
    return problem(HttpStatus.UNPROCESSABLE_ENTITY, "Conversion Failed", ex.getMessage(), request);
  }

  @ExceptionHandler(ObjectStoreException.class)
  public ResponseEntity<ProblemDetail> handleStorage(
      ObjectStoreException ex, HttpServletRequest request) {
    LOGGER.error("Storage failure on {}: {}", request.getRequestURI(), ex.getMessage());
    return problem(HttpStatus.BAD_GATEWAY, "Storage Unavailable", ex.getMessage(), request);
  }

  @ExceptionHandler(RejectedExecutionException.class)
  public ResponseEntity<ProblemDetail> handleOverload(
      RejectedExecutionException ex, HttpServletRequest request) {
    LOGGER.warn("Rejected work on {}: {}", request.getRequestURI(), ex.getMessage());
    return problem(
        HttpStatus.SERVICE_UNAVAILABLE,
        "Server Busy",
        "Too many conversions in progress, retry later",
        request);
  }

  @ExceptionHandler(BatchStateException.class)
  public ResponseEntity<ProblemDetail> handleBatchState(
      BatchStateException ex, HttpServletRequest request) {
    LOGGER.error("Batch bookkeeping error on {}", request.getRequestURI(), ex);
    return problem(
        HttpStatus.INTERNAL_SERVER_ERROR, "Batch Processing Error", ex.getMessage(), request);
  }

  private static ResponseEntity<ProblemDetail> problem(
      HttpStatus status, String title, String detail, HttpServletRequest request) {
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
    problem.setTitle(title);
    problem.setInstance(URI.create(request.getRequestURI()));
    return ResponseEntity.status(status).body(problem);
  }
}
