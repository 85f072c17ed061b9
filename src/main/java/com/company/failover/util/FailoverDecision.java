package com.company.failover.util;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class FailoverDecision {
    private boolean shouldFailover;
    private String reason;

    public static FailoverDecision no() {
        return new FailoverDecision(false, null);
    }
}
