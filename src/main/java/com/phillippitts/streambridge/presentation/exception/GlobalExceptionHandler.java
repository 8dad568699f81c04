package com.phillippitts.streambridge.presentation.exception;

import com.phillippitts.streambridge.exception.ConnectionNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for the REST status endpoints.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * WebSocket errors never reach this class; the gateway reports them as error envelopes.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Unknown or already closed connection (HTTP 404).
     */
    @ExceptionHandler(ConnectionNotFoundException.class)
    ResponseEntity<ApiError> handleConnectionNotFound(ConnectionNotFoundException ex) {
        LOG.debug("Status requested for unknown connection {}", ex.getConnectionId());
        return ResponseEntity
            .status(HttpStatus.NOT_FOUND)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Connection not found",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please retry or contact the operator",
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
