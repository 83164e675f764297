package dev.bridge.coordinator.bulk;

import dev.bridge.coordinator.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class ParameterNormalizerTest {

    private final ParameterNormalizer normalizer = new ParameterNormalizer(1000);

    @Test
    void arraysCycleToLongestLength() throws ValidationException {
        Map<String, ParamValue> params = new LinkedHashMap<>();
        params.put("nodeId", ParamValue.array(List.of("a", "b", "c")));
        params.put("color", ParamValue.array(List.of("red", "blue")));

        List<Map<String, Object>> items = normalizer.normalize(params, Set.of("nodeId", "color"), null);

        assertEquals(3, items.size());
        assertEquals(List.of("a", "b", "c"), items.stream().map(i -> i.get("nodeId")).toList());
        assertEquals(List.of("red", "blue", "red"), items.stream().map(i -> i.get("color")).toList());
    }

    @Test
    void scalarBulkValueIsBroadcast() throws ValidationException {
        Map<String, ParamValue> params = new LinkedHashMap<>();
        params.put("nodeId", ParamValue.array(List.of("a", "b")));
        params.put("opacity", ParamValue.scalar(0.5));

        List<Map<String, Object>> items = normalizer.normalize(params, Set.of("nodeId", "opacity"), null);

        assertEquals(0.5, items.get(0).get("opacity"));
        assertEquals(0.5, items.get(1).get("opacity"));
    }

    @Test
    void nonBulkValuesAreTheSameReferenceInEveryItem() throws ValidationException {
        List<String> tags = List.of("x", "y");
        Map<String, Object> style = Map.of("bold", true);
        Map<String, ParamValue> params = new LinkedHashMap<>();
        params.put("nodeId", ParamValue.array(List.of("a", "b", "c")));
        params.put("tags", ParamValue.array(tags));
        params.put("style", ParamValue.scalar(style));

        List<Map<String, Object>> items = normalizer.normalize(params, Set.of("nodeId"), null);

        for (Map<String, Object> item : items) {
            assertSame(tags, item.get("tags"));
            assertSame(style, item.get("style"));
        }
    }

    @Test
    void everyItemHasTheSameKeys() throws ValidationException {
        Map<String, ParamValue> params = new LinkedHashMap<>();
        params.put("nodeId", ParamValue.array(List.of("a", "b")));
        params.put("name", ParamValue.scalar("n"));

        List<Map<String, Object>> items = normalizer.normalize(params, Set.of("nodeId", "width"), null);

        assertEquals(items.get(0).keySet(), items.get(1).keySet());
        assertFalse(items.get(0).containsKey("width"));
    }

    @Test
    void nullElementIsKept() throws ValidationException {
        Map<String, ParamValue> params = new LinkedHashMap<>();
        params.put("fill", ParamValue.array(Arrays.asList("red", null)));

        List<Map<String, Object>> items = normalizer.normalize(params, Set.of("fill"), null);

        assertEquals(2, items.size());
        assertTrue(items.get(1).containsKey("fill"));
        assertNull(items.get(1).get("fill"));
    }

    @Test
    void scalarsOnlyYieldOneItem() throws ValidationException {
        Map<String, ParamValue> params = Map.of("nodeId", ParamValue.scalar("a"));
        assertEquals(1, normalizer.normalize(params, Set.of("nodeId"), null).size());
    }

    @Test
    void explicitCountBroadcastsScalars() throws ValidationException {
        Map<String, ParamValue> params = Map.of("name", ParamValue.scalar("frame"));

        List<Map<String, Object>> items = normalizer.normalize(params, Set.of("name"), 4);

        assertEquals(4, items.size());
        items.forEach(item -> assertEquals("frame", item.get("name")));
    }

    @Test
    void explicitCountAlwaysCyclesMismatchedArrays() throws ValidationException {
        Map<String, ParamValue> params = new LinkedHashMap<>();
        params.put("x", ParamValue.array(List.of(1, 2, 3, 4, 5)));
        params.put("y", ParamValue.array(List.of(10, 20)));

        List<Map<String, Object>> items = normalizer.normalize(params, Set.of("x", "y"), 3);

        assertEquals(List.of(1, 2, 3), items.stream().map(i -> i.get("x")).toList());
        assertEquals(List.of(10, 20, 10), items.stream().map(i -> i.get("y")).toList());
    }

    @Test
    void emptyArrayIsRejected() {
        Map<String, ParamValue> params = Map.of("nodeId", ParamValue.array(List.of()));
        ValidationException e = assertThrows(ValidationException.class,
            () -> normalizer.normalize(params, Set.of("nodeId"), null));
        assertTrue(e.getMessage().contains("nodeId"), e.getMessage());
    }

    @Test
    void countBelowOneIsRejected() {
        Map<String, ParamValue> params = Map.of("nodeId", ParamValue.scalar("a"));
        assertThrows(ValidationException.class, () -> normalizer.normalize(params, Set.of("nodeId"), 0));
    }

    @Test
    void itemLimitIsEnforced() {
        ParameterNormalizer small = new ParameterNormalizer(2);
        Map<String, ParamValue> params = Map.of("nodeId", ParamValue.array(List.of("a", "b", "c")));
        assertThrows(ValidationException.class, () -> small.normalize(params, Set.of("nodeId"), null));
    }
}
