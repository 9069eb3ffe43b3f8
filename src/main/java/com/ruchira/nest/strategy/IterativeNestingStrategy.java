package com.ruchira.nest.strategy;

import com.ruchira.nest.model.NestingLevels;
import com.ruchira.nest.model.NestingRealization;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the nested structure record by record, walking a cursor down the tree.
 * Depth is bounded by memory only.
 */
@Component
public class IterativeNestingStrategy extends NestingStrategy {

    @Override
    public NestingRealization getRealization() {
        return NestingRealization.ITERATIVE;
    }

    @Override
    @SuppressWarnings("unchecked")
    protected Map<Object, Object> nest(NestingLevels levels, List<Map<String, Object>> flatRecords) {
        Map<Object, Object> nested = new LinkedHashMap<>();

        for (Map<String, Object> flatRecord : flatRecords) {
            Map<Object, Object> cursor = nested;
            for (int depth = 0; depth < levels.lastIndex(); depth++) {
                Object value = groupValue(flatRecord, levels, depth);
                cursor = (Map<Object, Object>) cursor.computeIfAbsent(value, key -> new LinkedHashMap<>());
            }

            Object leafValue = groupValue(flatRecord, levels, levels.lastIndex());
            List<Map<String, Object>> leaf =
                    (List<Map<String, Object>>) cursor.computeIfAbsent(leafValue, key -> new ArrayList<>());
            leaf.add(toLeaf(flatRecord, levels));
        }

        return nested;
    }
}
