package com.infergate.controller;

import com.infergate.exception.AdmissionException;
import com.infergate.exception.CancelledException;
import com.infergate.exception.InvalidRequestException;
import com.infergate.exception.ModelNotFoundException;
import com.infergate.exception.QueueFullException;
import com.infergate.exception.ShuttingDownException;
import com.infergate.model.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

import java.time.Duration;

/**
 * Maps gateway exceptions to OpenAI-style error responses.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    static final String GENERATION_FAILED = "Embedding generation failed";

    @ExceptionHandler(ShuttingDownException.class)
    public ResponseEntity<ErrorResponse> handleShuttingDown(ShuttingDownException e) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorResponse.of(e.getMessage(), "service_unavailable", "shutting_down"));
    }

    /**
     * Queue full and queue timeout: both are overload, both tell the client when to retry.
     */
    @ExceptionHandler(AdmissionException.class)
    public ResponseEntity<ErrorResponse> handleAdmission(AdmissionException e) {
        String code = e instanceof QueueFullException ? "queue_full" : "queue_timeout";
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds(e.getRetryAfter())))
                .body(ErrorResponse.of(e.getMessage(), "rate_limit_exceeded", code));
    }

    @ExceptionHandler(ModelNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleModelNotFound(ModelNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ErrorResponse.of(e.getMessage(), "invalid_request_error", "model_not_found"));
    }

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(InvalidRequestException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of(e.getMessage(), "invalid_request_error", "invalid_input"));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(ServerWebInputException e) {
        log.debug("Rejected unreadable request body: {}", e.getReason());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of("Request body could not be parsed", "invalid_request_error", "invalid_json"));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleStatus(ResponseStatusException e) {
        return ResponseEntity.status(e.getStatusCode())
                .body(ErrorResponse.of(e.getReason() != null ? e.getReason() : e.getMessage(),
                        "invalid_request_error", null));
    }

    @ExceptionHandler(CancelledException.class)
    public ResponseEntity<ErrorResponse> handleCancelled(CancelledException e) {
        return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
                .body(ErrorResponse.of(e.getMessage(), "timeout", "request_timeout"));
    }

    /**
     * Model and batch failures. Details stay in the server log.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleFailure(Exception e) {
        log.debug("Returning 500 for {}", e.getClass().getSimpleName());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(GENERATION_FAILED, "server_error", "internal_error"));
    }

    static long retryAfterSeconds(Duration hint) {
        if (hint == null) {
            return 1;
        }
        long seconds = (hint.toMillis() + 999) / 1000;
        return Math.max(1, seconds);
    }
}
