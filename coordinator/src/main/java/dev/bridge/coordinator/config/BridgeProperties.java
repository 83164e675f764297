package dev.bridge.coordinator.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties of the coordinator: where executors connect, how frames are bounded,
 * how long calls may wait and how large a single bulk call may fan out.
 */
@ConfigurationProperties(prefix = "bridge")
public class BridgeProperties {

    /**
     * Address the executor listener binds to.
     */
    private String host = "0.0.0.0";

    /**
     * TCP port executors connect to. {@code 0} picks a free port.
     */
    private int port = 8765;

    /**
     * Largest frame accepted or sent, in bytes.
     */
    private int maxFrameBytes = 1024 * 1024;

    /**
     * Interval between heartbeats sent to the executor. A connection silent for two intervals
     * is closed.
     */
    private Duration heartbeatInterval = Duration.ofSeconds(30);

    /**
     * Deadline applied to a call when neither the caller nor {@link #operationTimeouts} gives one.
     */
    private Duration defaultTimeout = Duration.ofSeconds(30);

    /**
     * Per-kind deadlines, keyed by request kind.
     */
    private Map<String, Duration> operationTimeouts = new LinkedHashMap<>();

    private final Bulk bulk = new Bulk();

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public int getMaxFrameBytes() {
        return maxFrameBytes;
    }

    public void setMaxFrameBytes(int maxFrameBytes) {
        this.maxFrameBytes = maxFrameBytes;
    }

    public Duration getHeartbeatInterval() {
        return heartbeatInterval;
    }

    public void setHeartbeatInterval(Duration heartbeatInterval) {
        this.heartbeatInterval = Objects.requireNonNullElse(heartbeatInterval, Duration.ofSeconds(30));
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public void setDefaultTimeout(Duration defaultTimeout) {
        this.defaultTimeout = Objects.requireNonNullElse(defaultTimeout, Duration.ofSeconds(30));
    }

    public Map<String, Duration> getOperationTimeouts() {
        return operationTimeouts;
    }

    public void setOperationTimeouts(Map<String, Duration> operationTimeouts) {
        this.operationTimeouts = operationTimeouts == null ? new LinkedHashMap<>() : operationTimeouts;
    }

    public Bulk getBulk() {
        return bulk;
    }

    /**
     * Limits applied to bulk fan-out.
     */
    public static class Bulk {

        /**
         * Largest number of items a single call may expand into.
         */
        private int maxItems = 1000;

        public int getMaxItems() {
            return maxItems;
        }

        public void setMaxItems(int maxItems) {
            this.maxItems = maxItems;
        }
    }
}
