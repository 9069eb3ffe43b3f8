package com.ruchira.nest.strategy;

import com.ruchira.nest.model.NestingLevels;
import com.ruchira.nest.model.NestingRealization;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups all records by one level at a time, then recurses into every group
 * with the remaining levels.
 *
 * <p>Each nesting level costs a stack frame, so a very long list of levels ends in
 * {@link StackOverflowError}. Use {@link IterativeNestingStrategy} when that matters.</p>
 */
@Component
public class RecursiveNestingStrategy extends NestingStrategy {

    @Override
    public NestingRealization getRealization() {
        return NestingRealization.RECURSIVE;
    }

    @Override
    protected Map<Object, Object> nest(NestingLevels levels, List<Map<String, Object>> flatRecords) {
        return nestFrom(levels, 0, flatRecords);
    }

    private Map<Object, Object> nestFrom(NestingLevels levels, int depth, List<Map<String, Object>> flatRecords) {
        Map<Object, List<Map<String, Object>>> groups = groupBy(levels, depth, flatRecords);

        Map<Object, Object> nested = new LinkedHashMap<>();
        for (Map.Entry<Object, List<Map<String, Object>>> group : groups.entrySet()) {
            if (levels.isLast(depth)) {
                nested.put(group.getKey(), toLeaves(group.getValue(), levels));
            } else {
                nested.put(group.getKey(), nestFrom(levels, depth + 1, group.getValue()));
            }
        }
        return nested;
    }

    /**
     * One flat grouping pass over the records at the given depth.
     */
    private Map<Object, List<Map<String, Object>>> groupBy(NestingLevels levels,
                                                           int depth,
                                                           List<Map<String, Object>> flatRecords) {
        Map<Object, List<Map<String, Object>>> groups = new LinkedHashMap<>();
        for (Map<String, Object> flatRecord : flatRecords) {
            Object value = groupValue(flatRecord, levels, depth);
            groups.computeIfAbsent(value, key -> new ArrayList<>()).add(flatRecord);
        }
        return groups;
    }
}
