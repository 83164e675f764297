package dev.bridge.coordinator.bulk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.bridge.coordinator.error.ValidationException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Turns raw call parameters into {@link ParamValue}s. Bulk keys given as lists, or as strings
 * holding a JSON array, become {@link ParamValue.Array}; everything else is passed through as a
 * {@link ParamValue.Scalar}. When the kind has a registered {@link OperationSpec}, names,
 * presence and types are checked as well.
 */
public class ParameterDecoder {

    private static final Set<String> TRUE_WORDS = Set.of("true", "yes", "on", "1");
    private static final Set<String> FALSE_WORDS = Set.of("false", "no", "off", "0");

    private final ObjectMapper mapper;
    private final OperationCatalog catalog;

    public ParameterDecoder(ObjectMapper mapper, OperationCatalog catalog) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    public DecodedParameters decode(String kind, Map<String, Object> params, Set<String> bulkKeys)
        throws ValidationException {
        OperationSpec spec = catalog.find(kind).orElse(null);
        Set<String> effectiveBulkKeys = new LinkedHashSet<>(bulkKeys);
        if (spec != null) {
            checkNames(spec, params);
            effectiveBulkKeys.addAll(spec.bulkKeys());
        }

        Map<String, ParamValue> values = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : params.entrySet()) {
            String name = entry.getKey();
            ParamValue value = effectiveBulkKeys.contains(name)
                ? toBulkValue(name, entry.getValue())
                : ParamValue.scalar(entry.getValue());
            if (spec != null) {
                value = check(spec.params().get(name), value);
            }
            values.put(name, value);
        }
        return new DecodedParameters(values, effectiveBulkKeys);
    }

    private void checkNames(OperationSpec spec, Map<String, Object> params) throws ValidationException {
        List<String> unknown = new ArrayList<>();
        for (String name : params.keySet()) {
            if (!spec.params().containsKey(name)) {
                unknown.add(name);
            }
        }
        if (!unknown.isEmpty()) {
            throw new ValidationException("Unknown parameter(s) for " + spec.kind() + ": " + String.join(", ", unknown)
                + ". Valid parameters: " + String.join(", ", spec.params().keySet()));
        }
        for (ParamSpec param : spec.params().values()) {
            if (param.required() && params.get(param.name()) == null) {
                throw new ValidationException("Missing required parameter '" + param.name() + "' for " + spec.kind());
            }
        }
    }

    private ParamValue toBulkValue(String name, Object raw) throws ValidationException {
        if (raw instanceof List<?> list) {
            return ParamValue.array(list);
        }
        if (raw instanceof Object[] array) {
            return ParamValue.array(Arrays.asList(array));
        }
        if (raw instanceof String text) {
            String trimmed = text.trim();
            if (trimmed.startsWith("[") && trimmed.endsWith("]")) {
                try {
                    return ParamValue.array(mapper.readValue(trimmed, List.class));
                } catch (JsonProcessingException e) {
                    throw new ValidationException("Parameter '" + name + "' is not a valid JSON array: "
                        + e.getOriginalMessage(), e);
                }
            }
        }
        return ParamValue.scalar(raw);
    }

    private ParamValue check(ParamSpec param, ParamValue value) throws ValidationException {
        if (value instanceof ParamValue.Array array) {
            List<Object> checked = new ArrayList<>(array.values().size());
            boolean changed = false;
            for (int i = 0; i < array.values().size(); i++) {
                Object element = array.values().get(i);
                Object coerced = element == null ? null : coerce(param, element, i);
                changed |= coerced != element;
                checked.add(coerced);
            }
            return changed ? ParamValue.array(checked) : array;
        }
        Object raw = value.raw();
        if (raw == null) {
            return value;
        }
        Object coerced = coerce(param, raw, -1);
        return coerced == raw ? value : ParamValue.scalar(coerced);
    }

    private Object coerce(ParamSpec param, Object value, int index) throws ValidationException {
        Object coerced = switch (param.type()) {
            case STRING -> value instanceof String ? value : null;
            case NUMBER -> toNumber(value);
            case BOOLEAN -> toBoolean(value);
            case OBJECT -> value instanceof Map<?, ?> ? value : null;
            case ANY -> value;
        };
        if (coerced == null) {
            throw new ValidationException(label(param, index) + " must be of type "
                + param.type().name().toLowerCase(Locale.ROOT) + " but was " + value);
        }
        if (!param.predicate().test(coerced)) {
            String constraint = param.constraint() == null ? "is invalid" : param.constraint();
            throw new ValidationException(label(param, index) + " " + constraint + " (was " + coerced + ")");
        }
        return coerced;
    }

    private static Object toNumber(Object value) {
        if (value instanceof Number) {
            return value;
        }
        if (value instanceof String text) {
            String trimmed = text.trim();
            try {
                return Long.valueOf(trimmed);
            } catch (NumberFormatException ignored) {
                // not an integer, try a decimal
            }
            try {
                double parsed = Double.parseDouble(trimmed);
                return Double.isFinite(parsed) ? parsed : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Object toBoolean(Object value) {
        if (value instanceof Boolean) {
            return value;
        }
        String word = value instanceof String text ? text.trim().toLowerCase(Locale.ROOT)
            : value instanceof Number number ? number.toString() : null;
        if (word == null) {
            return null;
        }
        if (TRUE_WORDS.contains(word)) {
            return Boolean.TRUE;
        }
        if (FALSE_WORDS.contains(word)) {
            return Boolean.FALSE;
        }
        return null;
    }

    private static String label(ParamSpec param, int index) {
        return "Parameter '" + param.name() + "'" + (index >= 0 ? "[" + index + "]" : "");
    }

    /**
     * Decoded values together with the bulk keys that apply to the call.
     */
    public record DecodedParameters(Map<String, ParamValue> values, Set<String> bulkKeys) {
    }
}
