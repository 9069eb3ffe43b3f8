package com.ruchira.nest.strategy;

import com.ruchira.nest.model.NestingRealization;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class IterativeNestingStrategyTest extends AbstractNestingStrategyTest {

    private final IterativeNestingStrategy strategy = new IterativeNestingStrategy();

    @Override
    protected NestingStrategy strategy() {
        return strategy;
    }

    @Test
    void shouldSupportIterativeRealizationOnly() {
        assertTrue(strategy.supports(NestingRealization.ITERATIVE));
        assertFalse(strategy.supports(NestingRealization.RECURSIVE));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldNestDeeperThanTheStackAllows() throws InterruptedException {
        DeepNesting deepNesting = new DeepNesting();
        AtomicReference<Map<Object, Object>> result = new AtomicReference<>();

        Throwable failure = deepNesting.run(strategy, result);

        assertNull(failure);
        Object node = result.get();
        for (int depth = 0; depth < DeepNesting.LEVELS; depth++) {
            Map<Object, Object> map = (Map<Object, Object>) node;
            assertEquals(1, map.size());
            node = map.get(depth);
        }
        assertEquals(List.of(Map.of()), node);
    }
}
