package com.phillippitts.streambridge.presentation.controller;

import com.phillippitts.streambridge.exception.ConnectionNotFoundException;
import com.phillippitts.streambridge.presentation.gateway.ConnectionGateway;
import com.phillippitts.streambridge.presentation.gateway.GatewayStatus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only view of open transcription connections.
 */
@RestController
class StatusController {

    private static final Logger log = LogManager.getLogger(StatusController.class);

    private final ConnectionGateway gateway;

    StatusController(ConnectionGateway gateway) {
        this.gateway = gateway;
    }

    @GetMapping("/ws/status")
    ResponseEntity<GatewayStatus> status() {
        GatewayStatus status = gateway.status();
        log.debug("Status requested: {} active connection(s)", status.activeConnections());
        return ResponseEntity.ok(status);
    }

    @GetMapping("/ws/status/{connectionId}")
    ResponseEntity<GatewayStatus.ConnectionStatus> connection(@PathVariable String connectionId) {
        return gateway.status(connectionId)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ConnectionNotFoundException(connectionId));
    }
}
