package com.debateleague.pairing.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.debateleague.pairing.engine.ConflictExhaustedException;
import com.debateleague.pairing.engine.ResourceShortageException;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.MethodArgumentNotValidException;

class ApiExceptionHandlerTest {

  private final ApiExceptionHandler handler = new ApiExceptionHandler();

  @Test
  void handleInvalidRequestReturns400() {
    final var response = handler.handleInvalidRequest(new InvalidPairingRequestException("bad"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).isEqualTo(new ApiErrorResponse("PAIRING_BAD_REQUEST", "bad"));
  }

  @Test
  void handleValidationReturns400() {
    final var response = handler.handleValidation((MethodArgumentNotValidException) null);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().code()).isEqualTo("PAIRING_VALIDATION_ERROR");
  }

  @Test
  void handleRosterIntegrityReturns422WithEveryViolation() {
    final var response =
        handler.handleRosterIntegrity(
            new RosterIntegrityException(
                List.of("duplicate venue: hall", "partnership not mutual: ann -> ben")));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
    assertThat(response.getBody().code()).isEqualTo("PAIRING_ROSTER_INVALID");
    assertThat(response.getBody().message())
        .contains("duplicate venue: hall")
        .contains("partnership not mutual: ann -> ben");
  }

  @Test
  void handleResourceShortageReturns422() {
    final var response =
        handler.handleResourceShortage(new ResourceShortageException("venues", 4, 2));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
    assertThat(response.getBody())
        .isEqualTo(
            new ApiErrorResponse(
                "PAIRING_RESOURCE_SHORTAGE",
                "not enough venues: required=4 available=2 shortfall=2"));
  }

  @Test
  void handleConflictExhaustedReturns422() {
    final var response =
        handler.handleConflictExhausted(new ConflictExhaustedException("ann vs ben"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
    assertThat(response.getBody().code()).isEqualTo("PAIRING_CONFLICT_EXHAUSTED");
    assertThat(response.getBody().message()).contains("ann vs ben");
  }

  @Test
  void handleAlreadyGeneratedReturns409() {
    final var response =
        handler.handleAlreadyGenerated(
            new PairingAlreadyGeneratedException("team", "2026-09-08"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    assertThat(response.getBody())
        .isEqualTo(
            new ApiErrorResponse(
                "PAIRING_ALREADY_GENERATED",
                "pairings already generated: format=team eventDate=2026-09-08"));
  }

  @Test
  void handleRuntimeReturns500() {
    final var response = handler.handleRuntime(new RuntimeException("oops"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody().code()).isEqualTo("PAIRING_INTERNAL_ERROR");
  }
}
