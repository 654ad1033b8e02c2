package com.hostelbooking.inventory.domain.availability;

import com.hostelbooking.common.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

/**
 * Guest-facing availability. Answers may be up to one cache TTL old; every ledger write evicts
 * the cache through {@link AvailabilityCacheEvictor}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AvailabilityService {

    private final AvailabilityCalculator calculator;

    @Cacheable(value = Constants.AVAILABILITY_CACHE, key = "#query.cacheKey()")
    public AvailabilityResult checkAvailability(AvailabilityQuery query) {
        log.debug("Availability cache miss for {}", query.cacheKey());
        return calculator.calculate(query);
    }
}
