package com.company.failover.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActivityRecord {
    private Long id;
    private String actor;
    private String type;
    private String action;
    private String description;
    private Map<String, Object> metadata;
    private Instant createdAt;
}
