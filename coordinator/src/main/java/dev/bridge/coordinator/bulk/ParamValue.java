package dev.bridge.coordinator.bulk;

import java.util.List;
import java.util.Objects;

/**
 * A call parameter as supplied by the caller: either a single value or a list of per-item
 * values to fan out over.
 */
public interface ParamValue {

    /**
     * The value as it was supplied; for an {@link Array} the same list instance.
     */
    Object raw();

    static ParamValue scalar(Object value) {
        return new Scalar(value);
    }

    static ParamValue array(List<?> values) {
        return new Array(values);
    }

    record Scalar(Object value) implements ParamValue {

        @Override
        public Object raw() {
            return value;
        }
    }

    record Array(List<?> values) implements ParamValue {

        public Array {
            Objects.requireNonNull(values, "values");
        }

        @Override
        public Object raw() {
            return values;
        }
    }
}
