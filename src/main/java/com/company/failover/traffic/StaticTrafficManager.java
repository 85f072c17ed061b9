package com.company.failover.traffic;

import com.company.failover.domain.Region;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * For deployments with a single fixed ingress: primary designation is the only
 * routing signal, so there is nothing to change at the edge.
 */
@Component
@Slf4j
@ConditionalOnProperty(
        value = "failover.traffic.provider",
        havingValue = "static",
        matchIfMissing = true
)
public class StaticTrafficManager implements TrafficManager {

    @Override
    public void redirectTraffic(Region from, Region to) {
        log.info("Static traffic provider: {} -> {} recorded, no control plane update", from.getName(), to.getName());
    }

    @Override
    public PropagationStatus getPropagationStatus(Region target) {
        return new PropagationStatus(true, target.getName(), "static");
    }
}
