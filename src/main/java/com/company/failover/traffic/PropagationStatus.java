package com.company.failover.traffic;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class PropagationStatus {
    private boolean propagated;
    private String activeRegion;
    private String detail;

    public static PropagationStatus pending(String activeRegion, String detail) {
        return new PropagationStatus(false, activeRegion, detail);
    }
}
