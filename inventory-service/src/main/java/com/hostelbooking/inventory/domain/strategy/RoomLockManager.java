package com.hostelbooking.inventory.domain.strategy;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Picks the configured {@link LedgerLockStrategy}.
 * <p>
 * Spring injects every strategy keyed by bean name ({@code local}, {@code distributed},
 * {@code pessimistic}); {@code inventory.ledger.lock-strategy} selects one without a code change.
 */
@Slf4j
@Component
public class RoomLockManager {

    private static final String DEFAULT_STRATEGY = "local";

    private final Map<String, LedgerLockStrategy> strategies;

    @Value("${inventory.ledger.lock-strategy:local}")
    private String strategyType = DEFAULT_STRATEGY;

    public RoomLockManager(Map<String, LedgerLockStrategy> strategies) {
        this.strategies = strategies;
    }

    @PostConstruct
    public void init() {
        log.info("Ledger writes serialized with strategy: {}", getStrategy().getStrategyType());
    }

    public <T> T executeLocked(String roomId, Supplier<T> criticalSection) {
        return getStrategy().executeLocked(roomId, criticalSection);
    }

    public void runLocked(String roomId, Runnable criticalSection) {
        getStrategy().executeLocked(roomId, () -> {
            criticalSection.run();
            return null;
        });
    }

    LedgerLockStrategy getStrategy() {
        LedgerLockStrategy strategy = strategies.get(strategyType.toLowerCase());
        if (strategy == null) {
            log.warn("Unknown lock strategy: {}. Available strategies: {}. Defaulting to {}",
                    strategyType, strategies.keySet(), DEFAULT_STRATEGY);
            strategy = strategies.get(DEFAULT_STRATEGY);
            if (strategy == null) {
                throw new IllegalStateException(
                        DEFAULT_STRATEGY + " strategy not found. Available strategies: " + strategies.keySet());
            }
        }
        return strategy;
    }
}
