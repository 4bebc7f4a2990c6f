package com.segs.alert.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * One-minute consumption summary of a region, as produced by the stream processor.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RegionalAggregateMessage {

    private String region;
    private Instant timestamp;
    private Integer meterCount;
    private Double totalConsumption;
    private Double avgConsumption;
    private Double maxConsumption;
    private Double minConsumption;
    /** 0-100 */
    private Double loadPercentage;
    private List<String> activeMeters;
}
