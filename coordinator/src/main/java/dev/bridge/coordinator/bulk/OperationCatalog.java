package dev.bridge.coordinator.bulk;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registered {@link OperationSpec}s. Kinds without a spec are dispatched unchecked.
 */
public class OperationCatalog {

    private final Map<String, OperationSpec> specs = new ConcurrentHashMap<>();

    public OperationCatalog register(OperationSpec spec) {
        specs.put(spec.kind(), spec);
        return this;
    }

    public Optional<OperationSpec> find(String kind) {
        return Optional.ofNullable(specs.get(kind));
    }
}
