package com.ruchira.nest.service;

import com.ruchira.nest.exception.TransformationException;
import com.ruchira.nest.model.NestingRealization;
import com.ruchira.nest.strategy.NestingStrategy;
import com.ruchira.nest.strategy.NestingStrategyFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Entry point shared by the HTTP and command-line front ends.
 * Picks the nesting strategy and runs one transformation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NestingTransformationService {

    private final NestingStrategyFactory strategyFactory;

    /**
     * Transform flat records into a nested grouping.
     *
     * @param nestingLevels           Field names to group by, outermost first
     * @param flatRecords             The records to group
     * @param useRecursiveRealization true for the recursive strategy, false for the iterative one
     * @return The nested grouping
     * @throws TransformationException if the nesting levels are empty or a record lacks one of them
     */
    public Map<Object, Object> transform(List<String> nestingLevels,
                                         List<Map<String, Object>> flatRecords,
                                         boolean useRecursiveRealization) {
        NestingRealization realization = NestingRealization.of(useRecursiveRealization);
        NestingStrategy strategy = strategyFactory.getStrategy(realization);

        long start = System.currentTimeMillis();
        try {
            Map<Object, Object> nested = strategy.transform(nestingLevels, flatRecords);
            log.debug("Nested {} records by {} using {} realization in {} ms",
                    flatRecords == null ? 0 : flatRecords.size(), nestingLevels, realization,
                    System.currentTimeMillis() - start);
            return nested;
        } catch (TransformationException ex) {
            log.warn("Transformation rejected: {}: {}", ex.getDetail(), ex.getReason());
            throw ex;
        }
    }
}
