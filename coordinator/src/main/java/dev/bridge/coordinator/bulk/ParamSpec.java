package dev.bridge.coordinator.bulk;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Declaration of one parameter of an operation.
 *
 * @param constraint human readable form of {@code predicate}, used in validation messages
 */
public record ParamSpec(String name, ParamType type, boolean bulk, boolean required,
                        Predicate<Object> predicate, String constraint) {

    public ParamSpec {
        Objects.requireNonNull(name, "name");
        type = type == null ? ParamType.ANY : type;
        predicate = predicate == null ? value -> true : predicate;
    }

    public static ParamSpec of(String name, ParamType type) {
        return new ParamSpec(name, type, false, false, null, null);
    }

    public ParamSpec asBulk() {
        return new ParamSpec(name, type, true, required, predicate, constraint);
    }

    public ParamSpec asRequired() {
        return new ParamSpec(name, type, bulk, true, predicate, constraint);
    }

    public ParamSpec matching(String constraint, Predicate<Object> predicate) {
        return new ParamSpec(name, type, bulk, required, predicate, constraint);
    }
}
