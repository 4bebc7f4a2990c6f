package com.segs.alert.cache;

import java.time.Instant;

/**
 * Latest load reading of a region.
 */
public record RegionLoad(String region, double loadPercentage, Instant at) {
}
