package com.company.failover.service;

import com.company.failover.domain.ActivityRecord;
import com.company.failover.domain.Region;
import com.company.failover.dto.request.CreateRegionRequest;
import com.company.failover.dto.response.RegionDetailResponse;
import com.company.failover.event.RegionStateChangedEvent;
import com.company.failover.exception.RegionAlreadyExistsException;
import com.company.failover.exception.RegionNotFoundException;
import com.company.failover.repository.ActivityRepository;
import com.company.failover.repository.FailoverEventRepository;
import com.company.failover.repository.RegionHealthCheckRepository;
import com.company.failover.repository.RegionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;

@Service
@Slf4j
@RequiredArgsConstructor
public class RegionAdminService {

    static final int DEFAULT_PRIORITY = 100;
    static final int DEFAULT_MAX_DEPLOYMENTS = 1000;
    static final int RECENT_CHECKS = 20;
    static final int RECENT_FAILOVERS = 10;

    private final RegionRepository regionRepository;
    private final RegionHealthCheckRepository healthCheckRepository;
    private final FailoverEventRepository eventRepository;
    private final ActivityRepository activityRepository;
    private final HealthMonitorService healthMonitorService;
    private final ApplicationEventPublisher eventPublisher;

    @Cacheable(value = "regionDetails", key = "#regionId")
    public RegionDetailResponse getRegionDetails(String regionId) {
        Region region = regionRepository.findById(regionId)
                .orElseThrow(() -> new RegionNotFoundException(regionId));

        return RegionDetailResponse.builder()
                .region(region)
                .healthStats(healthMonitorService.getRegionHealthStats(regionId))
                .recentChecks(healthCheckRepository.findRecent(regionId, RECENT_CHECKS))
                .recentFailovers(eventRepository.findRecentForRegion(regionId, RECENT_FAILOVERS))
                .build();
    }

    /**
     * Register a region and run its first probe. A failing first probe does not
     * undo the registration.
     */
    public Region createRegion(CreateRegionRequest request, String actor) {
        if (regionRepository.findByName(request.getName()).isPresent()) {
            throw new RegionAlreadyExistsException("Region with this name already exists: " + request.getName());
        }
        if (request.isPrimary() && regionRepository.countPrimary() > 0) {
            throw new RegionAlreadyExistsException("A primary region already exists");
        }

        Region region = Region.builder()
                .id(UUID.randomUUID().toString())
                .name(request.getName())
                .displayName(request.getDisplayName())
                .endpoint(request.getEndpoint())
                .primary(request.isPrimary())
                .priority(request.getPriority() != null ? request.getPriority() : DEFAULT_PRIORITY)
                .maxDeployments(request.getMaxDeployments() != null
                        ? request.getMaxDeployments() : DEFAULT_MAX_DEPLOYMENTS)
                .activeDeployments(0)
                .build();

        try {
            regionRepository.create(region);
        } catch (DuplicateKeyException e) {
            throw new RegionAlreadyExistsException("Region with this name already exists: " + request.getName());
        }

        log.info("Region {} ({}) created by {}", region.getName(), region.getId(), actor);

        try {
            healthMonitorService.checkRegionHealth(region);
        } catch (DataAccessException e) {
            log.warn("Initial health check failed for region {}: {}", region.getName(), e.getMessage());
        }

        try {
            activityRepository.save(ActivityRecord.builder()
                    .actor(actor)
                    .type("admin")
                    .action("region.created")
                    .description("Created region \"" + region.getDisplayName() + "\" (" + region.getName() + ")")
                    .metadata(Map.of("regionId", region.getId()))
                    .build());
        } catch (DataAccessException e) {
            log.warn("Failed to record region.created activity for {}: {}", region.getName(), e.getMessage());
        }

        eventPublisher.publishEvent(new RegionStateChangedEvent(region.getId(), "created"));
        return region;
    }
}
