package com.debateleague.pairing.api;

import com.debateleague.pairing.engine.ConflictExhaustedException;
import com.debateleague.pairing.engine.ResourceShortageException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  @ExceptionHandler(InvalidPairingRequestException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidRequest(InvalidPairingRequestException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("PAIRING_BAD_REQUEST", ex.getMessage()));
  }

  @ExceptionHandler({
    MethodArgumentNotValidException.class,
    MissingServletRequestParameterException.class,
    MethodArgumentTypeMismatchException.class
  })
  public ResponseEntity<ApiErrorResponse> handleValidation(Exception ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("PAIRING_VALIDATION_ERROR", "request validation failed"));
  }

  @ExceptionHandler(PairingAlreadyGeneratedException.class)
  public ResponseEntity<ApiErrorResponse> handleAlreadyGenerated(
      PairingAlreadyGeneratedException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse("PAIRING_ALREADY_GENERATED", ex.getMessage()));
  }

  @ExceptionHandler(RosterIntegrityException.class)
  public ResponseEntity<ApiErrorResponse> handleRosterIntegrity(RosterIntegrityException ex) {
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(new ApiErrorResponse("PAIRING_ROSTER_INVALID", ex.getMessage()));
  }

  @ExceptionHandler(ResourceShortageException.class)
  public ResponseEntity<ApiErrorResponse> handleResourceShortage(ResourceShortageException ex) {
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(new ApiErrorResponse("PAIRING_RESOURCE_SHORTAGE", ex.getMessage()));
  }

  @ExceptionHandler(ConflictExhaustedException.class)
  public ResponseEntity<ApiErrorResponse> handleConflictExhausted(ConflictExhaustedException ex) {
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(new ApiErrorResponse("PAIRING_CONFLICT_EXHAUSTED", ex.getMessage()));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("PAIRING_INTERNAL_ERROR", ex.getMessage()));
  }
}
