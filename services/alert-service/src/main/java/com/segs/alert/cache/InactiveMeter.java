package com.segs.alert.cache;

import java.time.Instant;

/**
 * A meter whose last report is older than the outage threshold.
 */
public record InactiveMeter(String meterId, String region, Instant lastSeen) {
}
