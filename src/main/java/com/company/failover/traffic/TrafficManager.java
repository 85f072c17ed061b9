package com.company.failover.traffic;

import com.company.failover.domain.Region;
import com.company.failover.exception.ExternalServiceException;

/**
 * Moves client traffic between regions through a DNS or load-balancer control plane
 */
public interface TrafficManager {

    /**
     * Route traffic away from {@code from} and towards {@code to}.
     *
     * @throws ExternalServiceException if the control plane rejects or cannot be reached
     */
    void redirectTraffic(Region from, Region to) throws ExternalServiceException;

    /**
     * Whether the control plane currently routes to {@code target}. Never throws;
     * lookup failures are reported as not propagated.
     */
    PropagationStatus getPropagationStatus(Region target);
}
