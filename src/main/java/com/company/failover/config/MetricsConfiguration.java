package com.company.failover.config;

import com.company.failover.repository.FailoverEventRepository;
import com.company.failover.repository.RegionRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Failover gauges
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final FailoverEventRepository eventRepository;
    private final RegionRepository regionRepository;

    @Bean
    public MeterBinder failoverMetrics() {
        return (registry) -> {
            Gauge.builder("failover.events.active", eventRepository, repo -> {
                        try {
                            return repo.countActive();
                        } catch (Exception e) {
                            log.warn("Failed to count active failovers", e);
                            return 0;
                        }
                    })
                    .description("Failover events currently pending or in progress")
                    .register(registry);

            // Anything other than 1 needs an operator
            Gauge.builder("regions.primary", regionRepository, repo -> {
                        try {
                            return repo.countPrimary();
                        } catch (Exception e) {
                            log.warn("Failed to count primary regions", e);
                            return -1;
                        }
                    })
                    .description("Number of regions marked primary")
                    .register(registry);

            log.info("Failover metrics registered");
        };
    }
}
