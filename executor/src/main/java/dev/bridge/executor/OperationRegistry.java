package dev.bridge.executor;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public class OperationRegistry {

    private final Map<String, OperationHandler> handlers = new ConcurrentHashMap<>();

    public OperationRegistry register(String kind, OperationHandler handler) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(handler, "handler");
        if (handlers.putIfAbsent(kind, handler) != null) {
            throw new IllegalArgumentException("Operation already registered: " + kind);
        }
        return this;
    }

    public OperationHandler find(String kind) {
        return kind == null ? null : handlers.get(kind);
    }

    public Set<String> kinds() {
        return Set.copyOf(handlers.keySet());
    }
}
