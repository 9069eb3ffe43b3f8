package com.ruchira.nest.strategy;

import com.ruchira.nest.exception.BusinessException;
import com.ruchira.nest.model.NestingRealization;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Factory for nesting strategies
 * Selects the strategy implementing the requested realization
 */
@Component
@RequiredArgsConstructor
public class NestingStrategyFactory {

    private final List<NestingStrategy> strategies;

    /**
     * Get the nesting strategy for the given realization
     *
     * @param realization The realization to find a strategy for
     * @return Nesting strategy that supports the realization
     * @throws BusinessException if no strategy is registered for it
     */
    public NestingStrategy getStrategy(NestingRealization realization) {
        Optional<NestingStrategy> strategy = strategies.stream()
                .filter(s -> s.supports(realization))
                .findFirst();

        return strategy.orElseThrow(() ->
                new BusinessException(
                        String.format("No nesting strategy found for realization: %s", realization)
                ));
    }

    /**
     * Get all available nesting strategies
     *
     * @return List of all registered strategies
     */
    public List<NestingStrategy> getAllStrategies() {
        return List.copyOf(strategies);
    }
}
