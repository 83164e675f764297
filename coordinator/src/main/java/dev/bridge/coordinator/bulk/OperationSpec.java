package dev.bridge.coordinator.bulk;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Typed parameter list of a request kind.
 */
public record OperationSpec(String kind, Map<String, ParamSpec> params) {

    public OperationSpec {
        Objects.requireNonNull(kind, "kind");
        params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static OperationSpec of(String kind, ParamSpec... params) {
        Map<String, ParamSpec> byName = new LinkedHashMap<>();
        for (ParamSpec param : params) {
            if (byName.putIfAbsent(param.name(), param) != null) {
                throw new IllegalArgumentException("Duplicate parameter " + param.name() + " for " + kind);
            }
        }
        return new OperationSpec(kind, byName);
    }

    public Set<String> bulkKeys() {
        Set<String> keys = new LinkedHashSet<>();
        params.values().stream().filter(ParamSpec::bulk).forEach(p -> keys.add(p.name()));
        return keys;
    }
}
