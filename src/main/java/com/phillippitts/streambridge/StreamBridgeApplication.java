package com.phillippitts.streambridge;

import com.phillippitts.streambridge.config.properties.BackendProperties;
import com.phillippitts.streambridge.config.properties.GatewayProperties;
import com.phillippitts.streambridge.config.properties.SessionProperties;
import com.phillippitts.streambridge.config.properties.VadProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        GatewayProperties.class,
        VadProperties.class,
        BackendProperties.class,
        SessionProperties.class
})
@EnableScheduling
public class StreamBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(StreamBridgeApplication.class, args);
    }

}
