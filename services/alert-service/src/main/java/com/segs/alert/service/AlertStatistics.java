package com.segs.alert.service;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Aggregate view over the alert store, optionally restricted to one region.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AlertStatistics {

    private long total;
    private long active;
    private long acknowledged;
    private long resolved;
    private Map<String, Long> byType;
    private Map<String, Long> byRegion;
    /** 0 when nothing has been resolved yet. */
    private Double avgResolutionHours;
}
