package dev.bridge.coordinator;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.bridge.coordinator.bulk.BulkDispatcher;
import dev.bridge.coordinator.bulk.OperationCatalog;
import dev.bridge.coordinator.bulk.OperationSpec;
import dev.bridge.coordinator.bulk.ParamSpec;
import dev.bridge.coordinator.bulk.ParamType;
import dev.bridge.coordinator.bulk.ParameterDecoder;
import dev.bridge.coordinator.bulk.ParameterNormalizer;
import dev.bridge.coordinator.bulk.ResultAggregator;
import dev.bridge.coordinator.config.BridgeProperties;
import dev.bridge.coordinator.health.BridgeMonitor;
import dev.bridge.coordinator.health.HealthMetrics;
import dev.bridge.coordinator.invoke.BridgeInvoker;
import dev.bridge.coordinator.rpc.RpcClient;
import dev.bridge.coordinator.rpc.TimeoutPolicy;
import dev.bridge.coordinator.transport.ExecutorChannelServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
@EnableConfigurationProperties(BridgeProperties.class)
public class BridgeCoordinatorApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(BridgeCoordinatorApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(BridgeCoordinatorApplication.class, args);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    ExecutorChannelServer executorChannelServer(BridgeProperties properties) {
        LOGGER.info("Bridge limits: max frame {} bytes, heartbeat {}, default timeout {}, max bulk items {}",
            properties.getMaxFrameBytes(), properties.getHeartbeatInterval(), properties.getDefaultTimeout(),
            properties.getBulk().getMaxItems());
        return new ExecutorChannelServer(properties.getHost(), properties.getPort(), properties.getMaxFrameBytes(),
            properties.getHeartbeatInterval());
    }

    @Bean
    ObjectMapper objectMapper() {
        return new ObjectMapper();
    }

    @Bean
    HealthMetrics healthMetrics() {
        return new HealthMetrics();
    }

    @Bean(destroyMethod = "close")
    RpcClient rpcClient(ExecutorChannelServer server, HealthMetrics metrics) {
        return new RpcClient(server, metrics);
    }

    @Bean
    BridgeMonitor bridgeMonitor(ExecutorChannelServer server, RpcClient rpcClient, HealthMetrics metrics) {
        return new BridgeMonitor(server, rpcClient, metrics);
    }

    @Bean
    OperationCatalog operationCatalog() {
        return new OperationCatalog()
            .register(OperationSpec.of("sleep",
                ParamSpec.of("millis", ParamType.NUMBER).asBulk().asRequired()
                    .matching("must not be negative", value -> ((Number) value).doubleValue() >= 0)));
    }

    @Bean
    BridgeInvoker bridgeInvoker(ObjectMapper objectMapper, OperationCatalog catalog, RpcClient rpcClient,
                                BridgeProperties properties) {
        return new BridgeInvoker(
            new ParameterDecoder(objectMapper, catalog),
            new ParameterNormalizer(properties.getBulk().getMaxItems()),
            new BulkDispatcher(rpcClient),
            new ResultAggregator(),
            new TimeoutPolicy(properties));
    }
}
