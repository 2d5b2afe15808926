package com.z254.mender.api;

import com.z254.mender.api.dto.ErrorResponse;
import com.z254.mender.domain.exception.IncidentBusyException;
import com.z254.mender.domain.exception.IncidentNotFoundException;
import com.z254.mender.domain.exception.IncidentStoreException;
import com.z254.mender.domain.exception.IncidentValidationException;
import com.z254.mender.domain.exception.InvalidTransitionException;
import com.z254.mender.domain.exception.MenderException;
import com.z254.mender.domain.exception.UnroutableServiceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

import java.util.List;

/**
 * Maps orchestration errors to HTTP responses with a uniform {@link ErrorResponse} body.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(IncidentValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(IncidentValidationException ex,
                                                          ServerWebExchange exchange) {
        log.warn("Incident rejected: {}", ex.getViolations());
        return respond(HttpStatus.BAD_REQUEST, "INVALID_INCIDENT", ex.getMessage(), exchange, ex.getViolations());
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleBind(WebExchangeBindException ex, ServerWebExchange exchange) {
        List<String> violations = ex.getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .sorted()
                .toList();
        log.warn("Request body rejected: {}", violations);
        return respond(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", "Request validation failed", exchange, violations);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleInput(ServerWebInputException ex, ServerWebExchange exchange) {
        log.warn("Malformed request: {}", ex.getReason());
        return respond(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST", ex.getReason(), exchange, null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex,
                                                               ServerWebExchange exchange) {
        log.warn("Invalid argument: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), exchange, null);
    }

    @ExceptionHandler(IncidentNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(IncidentNotFoundException ex, ServerWebExchange exchange) {
        log.debug("Incident not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, "INCIDENT_NOT_FOUND", ex.getMessage(), exchange, null);
    }

    @ExceptionHandler(UnroutableServiceException.class)
    public ResponseEntity<ErrorResponse> handleUnroutable(UnroutableServiceException ex,
                                                          ServerWebExchange exchange) {
        log.warn("Unroutable service: {}", ex.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "UNROUTABLE_SERVICE", ex.getMessage(), exchange, null);
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidTransition(InvalidTransitionException ex,
                                                                 ServerWebExchange exchange) {
        log.warn("Invalid transition: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, "INVALID_TRANSITION", ex.getMessage(), exchange, null);
    }

    @ExceptionHandler(IncidentBusyException.class)
    public ResponseEntity<ErrorResponse> handleBusy(IncidentBusyException ex, ServerWebExchange exchange) {
        log.warn("Incident busy: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, "INCIDENT_BUSY", ex.getMessage(), exchange, null);
    }

    @ExceptionHandler(IncidentStoreException.class)
    public ResponseEntity<ErrorResponse> handleStore(IncidentStoreException ex, ServerWebExchange exchange) {
        log.error("Incident store failure", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "STORE_ERROR", ex.getMessage(), exchange, null);
    }

    @ExceptionHandler(MenderException.class)
    public ResponseEntity<ErrorResponse> handleMender(MenderException ex, ServerWebExchange exchange) {
        log.error("Orchestration failure", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "ORCHESTRATION_ERROR", ex.getMessage(), exchange, null);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message,
                                                  ServerWebExchange exchange, List<String> violations) {
        ErrorResponse error = ErrorResponse.builder()
                .errorCode(code)
                .message(message)
                .status(status.value())
                .path(exchange.getRequest().getPath().value())
                .violations(violations)
                .build();
        return ResponseEntity.status(status).body(error);
    }
}
