package com.scholary.videogen.api;

import com.scholary.videogen.job.JobStoreException;
import com.scholary.videogen.provider.ParameterValidationException;
import com.scholary.videogen.provider.ProviderCallException;
import com.scholary.videogen.provider.ProviderNotFoundException;
import com.scholary.videogen.service.TaskNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/** Maps exceptions to the error envelope. */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(ParameterValidationException.class)
  public ResponseEntity<ApiResponse<Void>> handleValidation(ParameterValidationException e) {
    return respond(HttpStatus.BAD_REQUEST, e.getMessage(), "VALIDATION_ERROR");
  }

  @ExceptionHandler(ProviderNotFoundException.class)
  public ResponseEntity<ApiResponse<Void>> handleProviderNotFound(ProviderNotFoundException e) {
    return respond(HttpStatus.BAD_REQUEST, e.getMessage(), "PROVIDER_NOT_FOUND");
  }

  @ExceptionHandler(TaskNotFoundException.class)
  public ResponseEntity<ApiResponse<Void>> handleTaskNotFound(TaskNotFoundException e) {
    return respond(
        HttpStatus.NOT_FOUND, "Task with ID " + e.getJobId() + " not found", "NOT_FOUND");
  }

  /** Unknown paths, including media files outside the served videos directory. */
  @ExceptionHandler(NoResourceFoundException.class)
  public ResponseEntity<ApiResponse<Void>> handleNoResource(NoResourceFoundException e) {
    return respond(
        HttpStatus.NOT_FOUND, "Resource not found: " + e.getResourcePath(), "NOT_FOUND");
  }

  @ExceptionHandler({
    IllegalArgumentException.class,
    MethodArgumentTypeMismatchException.class,
    HttpMessageNotReadableException.class
  })
  public ResponseEntity<ApiResponse<Void>> handleBadRequest(Exception e) {
    return respond(HttpStatus.BAD_REQUEST, e.getMessage(), "BAD_REQUEST");
  }

  /** Provider errors reach here only from synchronous tasks. */
  @ExceptionHandler(ProviderCallException.class)
  public ResponseEntity<ApiResponse<Void>> handleProviderCall(ProviderCallException e) {
    LOGGER.error("Provider call failed: {}", e.getMessage());
    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), e.getKind().errorKind().name());
  }

  @ExceptionHandler(JobStoreException.class)
  public ResponseEntity<ApiResponse<Void>> handleStore(JobStoreException e) {
    LOGGER.error("Job store failure", e);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Task storage unavailable", "STORE_ERROR");
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiResponse<Void>> handleUnexpected(Exception e) {
    LOGGER.error("Unhandled error", e);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", "INTERNAL_ERROR");
  }

  private static ResponseEntity<ApiResponse<Void>> respond(
      HttpStatus status, String message, String errorCode) {
    return ResponseEntity.status(status).body(ApiResponse.error(message, errorCode));
  }
}
