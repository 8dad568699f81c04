package com.phillippitts.streambridge.presentation.controller;

import com.phillippitts.streambridge.exception.ConnectionNotFoundException;
import com.phillippitts.streambridge.presentation.gateway.ConnectionGateway;
import com.phillippitts.streambridge.presentation.gateway.GatewayStatus;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class StatusControllerTest {

    private final ConnectionGateway gateway = mock(ConnectionGateway.class);
    private final StatusController controller = new StatusController(gateway);

    private final GatewayStatus.ConnectionStatus one = new GatewayStatus.ConnectionStatus(
            "c1", "kiosk", "RECORDING", 12, 1, 3, 1, "STREAMING");

    @Test
    void shouldReturnGatewayStatus() {
        when(gateway.status()).thenReturn(new GatewayStatus(1, 100, List.of(one)));

        ResponseEntity<GatewayStatus> response = controller.status();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().connections()).containsExactly(one);
    }

    @Test
    void shouldReturnSingleConnection() {
        when(gateway.status("c1")).thenReturn(Optional.of(one));

        ResponseEntity<GatewayStatus.ConnectionStatus> response = controller.connection("c1");

        assertThat(response.getBody()).isEqualTo(one);
    }

    @Test
    void shouldThrowForUnknownConnection() {
        when(gateway.status("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> controller.connection("nope"))
                .isInstanceOf(ConnectionNotFoundException.class)
                .hasMessageContaining("nope");
    }
}
