package com.hostelbooking.inventory.domain.availability;

import com.hostelbooking.common.util.Constants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class AvailabilityCacheEvictor {

    /**
     * Drops every cached availability answer. Called by write paths before they report success.
     */
    @CacheEvict(value = Constants.AVAILABILITY_CACHE, allEntries = true)
    public void evictAll() {
        log.debug("Evicting availability cache");
    }
}
