package dev.bridge.coordinator.bulk;

import dev.bridge.coordinator.error.ValidationException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Expands one call's parameters into the per-item parameter maps of a fan-out.
 *
 * <p>The item count is the explicit {@code count} when given, otherwise the length of the longest
 * bulk array (at least one). Item {@code i} takes element {@code i % length} of every bulk
 * array, the value itself of every scalar bulk parameter, and every non-bulk value unchanged.
 * A {@code null} array element is kept as {@code null}.
 */
public class ParameterNormalizer {

    private final int maxItems;

    public ParameterNormalizer(int maxItems) {
        if (maxItems < 1) {
            throw new IllegalArgumentException("maxItems must be at least 1: " + maxItems);
        }
        this.maxItems = maxItems;
    }

    public List<Map<String, Object>> normalize(Map<String, ParamValue> params, Set<String> bulkKeys, Integer count)
        throws ValidationException {
        if (count != null && count < 1) {
            throw new ValidationException("count must be at least 1 but was " + count);
        }
        int longest = 0;
        for (String key : bulkKeys) {
            if (params.get(key) instanceof ParamValue.Array array) {
                if (array.values().isEmpty()) {
                    throw new ValidationException("Parameter '" + key + "' is an empty array");
                }
                longest = Math.max(longest, array.values().size());
            }
        }
        int itemCount = count != null ? count : Math.max(longest, 1);
        if (itemCount > maxItems) {
            throw new ValidationException("Call expands to " + itemCount + " items; the limit is " + maxItems);
        }

        List<Map<String, Object>> items = new ArrayList<>(itemCount);
        for (int i = 0; i < itemCount; i++) {
            Map<String, Object> item = new LinkedHashMap<>();
            for (Map.Entry<String, ParamValue> entry : params.entrySet()) {
                String key = entry.getKey();
                ParamValue value = entry.getValue();
                if (bulkKeys.contains(key) && value instanceof ParamValue.Array array) {
                    item.put(key, array.values().get(i % array.values().size()));
                } else {
                    item.put(key, value == null ? null : value.raw());
                }
            }
            items.add(item);
        }
        return items;
    }
}
