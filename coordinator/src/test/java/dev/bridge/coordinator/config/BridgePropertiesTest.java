package dev.bridge.coordinator.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;

final class BridgePropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
        .withUserConfiguration(PropertiesConfiguration.class);

    @Test
    void defaultsApplyWithoutConfiguration() {
        runner.run(context -> {
            BridgeProperties properties = context.getBean(BridgeProperties.class);
            assertEquals(8765, properties.getPort());
            assertEquals(1024 * 1024, properties.getMaxFrameBytes());
            assertEquals(Duration.ofSeconds(30), properties.getHeartbeatInterval());
            assertEquals(Duration.ofSeconds(30), properties.getDefaultTimeout());
            assertEquals(1000, properties.getBulk().getMaxItems());
        });
    }

    @Test
    void relaxedNamesBind() {
        runner.withPropertyValues(
                "bridge.port=9000",
                "bridge.heartbeat-interval=5s",
                "bridge.operation-timeouts.export=2m",
                "bridge.bulk.max-items=50")
            .run(context -> {
                BridgeProperties properties = context.getBean(BridgeProperties.class);
                assertEquals(9000, properties.getPort());
                assertEquals(Duration.ofSeconds(5), properties.getHeartbeatInterval());
                assertEquals(Duration.ofMinutes(2), properties.getOperationTimeouts().get("export"));
                assertEquals(50, properties.getBulk().getMaxItems());
            });
    }

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(BridgeProperties.class)
    static class PropertiesConfiguration {
    }
}
