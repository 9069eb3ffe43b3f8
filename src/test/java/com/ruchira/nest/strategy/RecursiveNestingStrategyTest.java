package com.ruchira.nest.strategy;

import com.ruchira.nest.model.NestingRealization;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class RecursiveNestingStrategyTest extends AbstractNestingStrategyTest {

    private final RecursiveNestingStrategy strategy = new RecursiveNestingStrategy();

    @Override
    protected NestingStrategy strategy() {
        return strategy;
    }

    @Test
    void shouldSupportRecursiveRealizationOnly() {
        assertTrue(strategy.supports(NestingRealization.RECURSIVE));
        assertFalse(strategy.supports(NestingRealization.ITERATIVE));
    }

    @Test
    void shouldExhaustTheStackForVeryDeepNesting() throws InterruptedException {
        DeepNesting deepNesting = new DeepNesting();
        AtomicReference<Map<Object, Object>> result = new AtomicReference<>();

        Throwable failure = deepNesting.run(strategy, result);

        assertInstanceOf(StackOverflowError.class, failure);
        assertNull(result.get());
    }
}
