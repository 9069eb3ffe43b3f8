package com.ruchira.nest.util;

import lombok.experimental.UtilityClass;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

@UtilityClass
public class CopyUtils {

    /**
     * Copies a flat record leaving out the given fields.
     * The source record is not modified and the field order is kept.
     *
     * @param source         The record to copy
     * @param excludedFields Field names to leave out of the copy
     * @return A new record holding every other field of {@code source}
     */
    public Map<String, Object> copyExcluding(Map<String, Object> source, Set<String> excludedFields) {
        Map<String, Object> target = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : source.entrySet()) {
            if (!excludedFields.contains(entry.getKey())) {
                target.put(entry.getKey(), entry.getValue());
            }
        }
        return target;
    }
}
