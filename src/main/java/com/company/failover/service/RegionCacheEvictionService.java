package com.company.failover.service;

import com.company.failover.event.FailoverCompletedEvent;
import com.company.failover.event.FailoverFailedEvent;
import com.company.failover.event.RegionStateChangedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Clears region read caches whenever the orchestrator changes region state.
 * Runs on the publishing thread once the surrounding transaction commits, or at once when
 * there is none, so a read racing the change cannot re-cache the old row.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RegionCacheEvictionService {

    static final String REGION_HEALTH_CACHE = "regionHealth";
    static final String REGION_DETAILS_CACHE = "regionDetails";

    private final CacheManager cacheManager;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onFailoverCompleted(FailoverCompletedEvent event) {
        evictRegionCaches(event.getEvent().getFromRegionId(), event.getEvent().getToRegionId());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onFailoverFailed(FailoverFailedEvent event) {
        evictRegionCaches(event.getEvent().getFromRegionId(), event.getEvent().getToRegionId());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onRegionStateChanged(RegionStateChangedEvent event) {
        log.debug("Region {} changed ({}), evicting caches", event.getRegionId(), event.getChange());
        evictRegionCaches(event.getRegionId());
    }

    private void evictRegionCaches(String... regionIds) {
        Cache healthCache = cacheManager.getCache(REGION_HEALTH_CACHE);
        if (healthCache != null) {
            healthCache.clear();
        }

        Cache detailsCache = cacheManager.getCache(REGION_DETAILS_CACHE);
        if (detailsCache != null) {
            for (String regionId : regionIds) {
                detailsCache.evict(regionId);
            }
        }
    }
}
