package com.company.failover.event;

import com.company.failover.domain.FailoverEvent;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class FailoverFailedEvent {
    private final FailoverEvent event;
    private final String fromRegionName;
    private final String toRegionName;
    private final String error;
}
