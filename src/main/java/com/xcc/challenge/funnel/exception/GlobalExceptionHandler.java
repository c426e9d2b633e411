package com.xcc.challenge.funnel.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

/**
 * Maps pipeline and lookup failures to HTTP error bodies.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Input file breaks the event data contract
     */
    @ExceptionHandler(MalformedEventException.class)
    public ResponseEntity<ErrorResponse> handleMalformedEvent(MalformedEventException ex) {
        log.error("Pipeline run rejected malformed input", ex);
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Malformed Event", ex.getMessage());
    }

    @ExceptionHandler(InputReadException.class)
    public ResponseEntity<ErrorResponse> handleInputRead(InputReadException ex) {
        log.error("Pipeline run could not read its input", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Input Read Error", ex.getMessage());
    }

    @ExceptionHandler(SessionStoreException.class)
    public ResponseEntity<ErrorResponse> handleSessionStore(SessionStoreException ex) {
        log.error("Session store error", ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Session Store Error", "Unable to access session data");
    }

    @ExceptionHandler(CsvExportException.class)
    public ResponseEntity<ErrorResponse> handleCsvExport(CsvExportException ex) {
        log.error("CSV export failed", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Export Error", ex.getMessage());
    }

    @ExceptionHandler(CustomerNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleCustomerNotFound(CustomerNotFoundException ex) {
        log.debug("Lookup miss: {}", ex.getMessage());
        return build(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage());
    }

    /**
     * Handle generic exceptions
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericError(Exception ex) {
        log.error("Unexpected error", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred");
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String error, String message) {
        ErrorResponse body = ErrorResponse.builder()
                .timestamp(Instant.now())
                .status(status.value())
                .error(error)
                .message(message)
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
