package com.phillippitts.streambridge.config;

import com.phillippitts.streambridge.config.properties.GatewayProperties;
import com.phillippitts.streambridge.presentation.gateway.ClientHandshakeInterceptor;
import com.phillippitts.streambridge.presentation.gateway.ConnectionGateway;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * Registers the client-facing transcription endpoint.
 *
 * <p>Message buffers are sized from {@code bridge.gateway.max-message-size-bytes} so a single
 * control message or PCM frame never exceeds what the container accepts.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private static final Logger LOG = LogManager.getLogger(WebSocketConfig.class);

    private final ConnectionGateway gateway;
    private final GatewayProperties props;

    public WebSocketConfig(ConnectionGateway gateway, GatewayProperties props) {
        this.gateway = gateway;
        this.props = props;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        String[] origins = StringUtils.commaDelimitedListToStringArray(props.getAllowedOrigins());
        registry.addHandler(gateway, props.getPath())
                .addInterceptors(new ClientHandshakeInterceptor())
                .setAllowedOriginPatterns(StringUtils.trimArrayElements(origins));
        LOG.info("Transcription endpoint registered at {} (protocol {}, max {} connections)",
                props.getPath(), props.getProtocolVersion(), props.getMaxConnections());
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(props.getMaxMessageSizeBytes());
        container.setMaxBinaryMessageBufferSize(props.getMaxMessageSizeBytes());
        container.setAsyncSendTimeout((long) props.getSendTimeLimitMs());
        return container;
    }
}
