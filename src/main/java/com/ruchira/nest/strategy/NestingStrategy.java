package com.ruchira.nest.strategy;

import com.ruchira.nest.exception.MissingFieldException;
import com.ruchira.nest.exception.NestingConfigurationException;
import com.ruchira.nest.model.NestingLevels;
import com.ruchira.nest.model.NestingRealization;
import com.ruchira.nest.util.CopyUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Strategy for turning flat records into a nested grouping.
 *
 * <p>The result has one map level per nesting level; the values of the innermost map
 * are lists of the matching records, in input order, with every nesting level field
 * removed. Input records are never modified: leaves are fresh copies.</p>
 */
public abstract class NestingStrategy {

    /**
     * Check if this strategy implements the given realization
     *
     * @param realization The realization to check
     * @return true if this strategy supports the realization
     */
    public boolean supports(NestingRealization realization) {
        return getRealization() == realization;
    }

    public abstract NestingRealization getRealization();

    /**
     * Group the flat records by the given nesting levels.
     *
     * @param nestingLevels Field names to group by, outermost first
     * @param flatRecords   The records to group
     * @return Nested grouping, as deep as there are nesting levels
     * @throws NestingConfigurationException if no nesting level is given
     * @throws MissingFieldException         if a record lacks one of the nesting levels
     */
    public final Map<Object, Object> transform(List<String> nestingLevels, List<Map<String, Object>> flatRecords) {
        NestingLevels levels = NestingLevels.of(nestingLevels);
        return nest(levels, flatRecords == null ? List.of() : flatRecords);
    }

    protected abstract Map<Object, Object> nest(NestingLevels levels, List<Map<String, Object>> flatRecords);

    /**
     * Read the value a record is grouped by at the given depth.
     */
    protected Object groupValue(Map<String, Object> flatRecord, NestingLevels levels, int depth) {
        String level = levels.get(depth);
        if (levels.isRepeated(depth) || !flatRecord.containsKey(level)) {
            throw new MissingFieldException(level);
        }
        return flatRecord.get(level);
    }

    protected Map<String, Object> toLeaf(Map<String, Object> flatRecord, NestingLevels levels) {
        return CopyUtils.copyExcluding(flatRecord, levels.asSet());
    }

    protected List<Map<String, Object>> toLeaves(List<Map<String, Object>> flatRecords, NestingLevels levels) {
        List<Map<String, Object>> leaves = new ArrayList<>(flatRecords.size());
        for (Map<String, Object> flatRecord : flatRecords) {
            leaves.add(toLeaf(flatRecord, levels));
        }
        return leaves;
    }
}
