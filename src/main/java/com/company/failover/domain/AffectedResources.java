package com.company.failover.domain;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class AffectedResources {
    private int projects;
    private int deployments;

    public static AffectedResources none() {
        return new AffectedResources(0, 0);
    }
}
