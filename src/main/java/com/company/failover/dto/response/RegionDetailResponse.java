package com.company.failover.dto.response;

import com.company.failover.domain.FailoverEvent;
import com.company.failover.domain.Region;
import com.company.failover.domain.RegionHealthCheck;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegionDetailResponse implements Serializable {
    private static final long serialVersionUID = 1L;

    private Region region;
    private RegionHealthStats healthStats;
    private List<RegionHealthCheck> recentChecks;
    private List<FailoverEvent> recentFailovers;
}
