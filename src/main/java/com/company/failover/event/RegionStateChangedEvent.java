package com.company.failover.event;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Region row or its operational override changed outside a failover run
 */
@Getter
@AllArgsConstructor
public class RegionStateChangedEvent {
    private final String regionId;
    private final String change;
}
