package com.phillippitts.streambridge.presentation.exception;

import com.phillippitts.streambridge.exception.ConnectionNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void verifiesConnectionNotFoundReturns404() {
        ResponseEntity<?> response = handler.handleConnectionNotFound(new ConnectionNotFoundException("abc"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void verifiesConnectionNotFoundNamesConnection() {
        ResponseEntity<?> response = handler.handleConnectionNotFound(new ConnectionNotFoundException("abc"));

        assertThat(response.getBody()).isNotNull();
        String body = response.getBody().toString();
        assertThat(body).contains("errorCode=ConnectionNotFoundException");
        assertThat(body).contains("Connection not found");
        assertThat(body).contains("abc");
    }

    @Test
    void verifiesUnexpectedReturns500WithoutInternalDetails() {
        ResponseEntity<?> response = handler.handleUnexpected(new IllegalStateException("pool password=hunter2"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).isNotNull();
        String body = response.getBody().toString();
        assertThat(body).contains("InternalServerError");
        assertThat(body).doesNotContain("hunter2");
        assertThat(body).doesNotContain("IllegalStateException");
    }

    @Test
    void verifiesErrorResponseHasValidStructure() {
        ResponseEntity<?> response = handler.handleUnexpected(new RuntimeException("x"));

        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString())
                .contains("errorCode=")
                .contains("message=")
                .contains("details=")
                .matches(".*timestamp=\\d{4}-\\d{2}-\\d{2}T.*");
    }
}
