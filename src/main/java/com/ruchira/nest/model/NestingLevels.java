package com.ruchira.nest.model;

import com.ruchira.nest.exception.NestingConfigurationException;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.apache.commons.collections.CollectionUtils;

import java.util.BitSet;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.ruchira.nest.constant.Constants.EMPTY_NESTING_LEVELS;
import static com.ruchira.nest.constant.Constants.EMPTY_NESTING_LEVELS_DETAIL;

/**
 * Ordered, non-empty list of the field names records are grouped by.
 *
 * <p>The first name is the outermost grouping. A name that occurs more than once is
 * flagged as repeated from its second occurrence on: by then the field has already
 * been consumed by a shallower level.</p>
 */
@ToString(of = "names")
@EqualsAndHashCode(of = "names")
public final class NestingLevels {

    private final List<String> names;
    private final Set<String> nameSet;
    private final BitSet repeated;

    private NestingLevels(List<String> names) {
        this.names = List.copyOf(names);
        this.repeated = new BitSet(names.size());
        Set<String> seen = new LinkedHashSet<>();
        for (int depth = 0; depth < this.names.size(); depth++) {
            if (!seen.add(this.names.get(depth))) {
                repeated.set(depth);
            }
        }
        this.nameSet = Collections.unmodifiableSet(seen);
    }

    /**
     * Validate and wrap the requested nesting levels.
     *
     * @param names level names, outermost first
     * @return the nesting levels
     * @throws NestingConfigurationException if {@code names} is null or empty
     */
    public static NestingLevels of(List<String> names) {
        if (CollectionUtils.isEmpty(names)) {
            throw new NestingConfigurationException(EMPTY_NESTING_LEVELS_DETAIL, EMPTY_NESTING_LEVELS);
        }
        return new NestingLevels(names);
    }

    public String get(int depth) {
        return names.get(depth);
    }

    public int size() {
        return names.size();
    }

    public int lastIndex() {
        return names.size() - 1;
    }

    public boolean isLast(int depth) {
        return depth == lastIndex();
    }

    public boolean isRepeated(int depth) {
        return repeated.get(depth);
    }

    /**
     * @return every distinct level name; these never survive into a leaf record
     */
    public Set<String> asSet() {
        return nameSet;
    }

    public List<String> asList() {
        return names;
    }
}
