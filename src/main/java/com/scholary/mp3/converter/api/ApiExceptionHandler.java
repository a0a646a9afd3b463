package com.scholary.mp3.converter.api;

import com.scholary.mp3.converter.artifact.ArtifactStorageException;
import com.scholary.mp3.converter.job.JobStoreException;
import com.scholary.mp3.converter.submission.InvalidSubmissionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps service exceptions to HTTP responses.
 *
 * <p>Validation problems become 400, storage faults 500. Lookup misses are handled in the
 * controllers since they are not exceptions.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(InvalidSubmissionException.class)
  public ResponseEntity<MessageResponse> invalidSubmission(InvalidSubmissionException e) {
    LOGGER.info("Rejected submission: {}", e.getMessage());
    return ResponseEntity.badRequest().body(new MessageResponse(e.getMessage()));
  }

  @ExceptionHandler({
    MethodArgumentNotValidException.class,
    HttpMessageNotReadableException.class,
    MethodArgumentTypeMismatchException.class,
    IllegalArgumentException.class
  })
  public ResponseEntity<MessageResponse> invalidRequest(Exception e) {
    LOGGER.info("Invalid request: {}", e.getMessage());
    return ResponseEntity.badRequest().body(new MessageResponse("Invalid request data"));
  }

  @ExceptionHandler({ArtifactStorageException.class, JobStoreException.class})
  public ResponseEntity<MessageResponse> storageFault(RuntimeException e) {
    LOGGER.error("Storage failure", e);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new MessageResponse("Storage failure, please try again"));
  }
}
