package dev.bridge.coordinator.health;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Counters and a rolling window of response times for calls made to the executor.
 */
public class HealthMetrics {

    static final int WINDOW_SIZE = 100;

    private final Deque<Long> responseTimesMillis = new ArrayDeque<>(WINDOW_SIZE);
    private long successCount;
    private long errorCount;
    private String lastError;

    public synchronized void recordSuccess(Duration responseTime) {
        successCount++;
        addResponseTime(responseTime);
    }

    public synchronized void recordFailure(Duration responseTime, String error) {
        errorCount++;
        lastError = error;
        addResponseTime(responseTime);
    }

    private void addResponseTime(Duration responseTime) {
        if (responseTimesMillis.size() == WINDOW_SIZE) {
            responseTimesMillis.removeFirst();
        }
        responseTimesMillis.addLast(Math.max(0L, responseTime.toMillis()));
    }

    /**
     * Mean of the last {@value #WINDOW_SIZE} response times, or zero before the first call.
     */
    public synchronized Duration averageResponseTime() {
        if (responseTimesMillis.isEmpty()) {
            return Duration.ZERO;
        }
        long total = 0;
        for (long millis : responseTimesMillis) {
            total += millis;
        }
        return Duration.ofMillis(total / responseTimesMillis.size());
    }

    public synchronized long getSuccessCount() {
        return successCount;
    }

    public synchronized long getErrorCount() {
        return errorCount;
    }

    public synchronized String getLastError() {
        return lastError;
    }
}
