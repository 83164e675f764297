package dev.bridge.coordinator.health;

public enum ConnectionHealth {
    UNHEALTHY,
    DEGRADED,
    HEALTHY
}
