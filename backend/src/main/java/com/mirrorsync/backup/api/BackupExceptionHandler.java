package com.mirrorsync.backup.api;

import com.mirrorsync.backup.persistence.JobStoreException;
import com.mirrorsync.backup.service.InvalidJobRequestException;
import com.mirrorsync.backup.service.InvalidScheduleException;
import com.mirrorsync.backup.service.JobAlreadyRunningException;
import com.mirrorsync.backup.service.JobNotFoundException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class BackupExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(BackupExceptionHandler.class);

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleNotFound(JobNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, "job_not_found", ex.getMessage());
  }

  @ExceptionHandler(InvalidJobRequestException.class)
  public ResponseEntity<Map<String, String>> handleInvalidJob(InvalidJobRequestException ex) {
    return error(HttpStatus.BAD_REQUEST, "invalid_job", ex.getMessage());
  }

  @ExceptionHandler(InvalidScheduleException.class)
  public ResponseEntity<Map<String, String>> handleInvalidSchedule(InvalidScheduleException ex) {
    return error(HttpStatus.BAD_REQUEST, "invalid_schedule", ex.getMessage());
  }

  @ExceptionHandler(JobAlreadyRunningException.class)
  public ResponseEntity<Map<String, String>> handleRunning(JobAlreadyRunningException ex) {
    return error(HttpStatus.CONFLICT, "job_running", ex.getMessage());
  }

  @ExceptionHandler(JobStoreException.class)
  public ResponseEntity<Map<String, String>> handleStore(JobStoreException ex) {
    log.error("Job table could not be persisted", ex);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, "job_store_failure", ex.getMessage());
  }

  private static ResponseEntity<Map<String, String>> error(HttpStatus status, String code, String message) {
    return ResponseEntity.status(status)
        .body(Map.of("error", code, "message", message == null ? "" : message));
  }
}
