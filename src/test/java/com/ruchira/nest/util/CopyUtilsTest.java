package com.ruchira.nest.util;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.ruchira.nest.TestRecords.record;
import static org.junit.jupiter.api.Assertions.*;

class CopyUtilsTest {

    @Test
    void shouldCopyAllButExcludedFieldsInOrder() {
        Map<String, Object> source = record("z", 1, "a", 2, "m", null, "b", 4);

        Map<String, Object> copy = CopyUtils.copyExcluding(source, Set.of("a", "b"));

        assertEquals(List.of("z", "m"), new ArrayList<>(copy.keySet()));
        assertTrue(copy.containsKey("m"));
        assertNull(copy.get("m"));
        assertEquals(4, source.size());
    }

    @Test
    void shouldReturnIndependentCopy() {
        Map<String, Object> source = record("a", 1);

        Map<String, Object> copy = CopyUtils.copyExcluding(source, Set.of());
        copy.put("b", 2);

        assertEquals(Map.of("a", 1), source);
    }
}
