package com.segs.alert.cache;

import com.segs.alert.entity.ConditionKey;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Short-lived markers and counters that back alert detection and deduplication.
 *
 * <p>The cache is never the system of record. Every mutating operation is a single
 * atomic primitive on the backing store, and write-path failures are logged and
 * swallowed so that they never block the alert store.
 */
public interface ConditionStateCache {

    /**
     * Atomically sets the deduplication marker for a condition.
     *
     * @return {@code true} if the marker was absent and is now set, {@code false} if an
     *         identical alert was created within the TTL and this attempt must be suppressed
     */
    boolean trySetDedupMarker(ConditionKey condition, Duration ttl);

    /**
     * Drops a dedup marker whose alert never made it to the store.
     */
    void releaseDedupMarker(ConditionKey condition);

    boolean hasActiveCondition(ConditionKey condition);

    void setActiveCondition(ConditionKey condition, UUID alertId);

    /**
     * Removes the active marker only while it still points at {@code alertId}, so a
     * stale alert never clears the marker of a newer alert for the same condition.
     */
    void clearActiveCondition(ConditionKey condition, UUID alertId);

    /**
     * Records one over-threshold reading for the region and prunes readings older
     * than the retention.
     */
    void recordOverloadWindow(String region, Instant at);

    /**
     * Counts the region's over-threshold readings in {@code [reference - lookback, reference]}.
     */
    int countOverloadWindows(String region, Duration lookback, Instant reference);

    void touchMeterLastSeen(String meterId, String region, Instant at);

    /**
     * Refreshes several meters of the same region in one round trip.
     */
    default void touchMetersLastSeen(Collection<String> meterIds, String region, Instant at) {
        meterIds.forEach(meterId -> touchMeterLastSeen(meterId, region, at));
    }

    /**
     * Meters silent for longer than {@code inactivityThreshold} as of {@code reference}.
     * Meters forgotten after the retention period are not reported.
     */
    List<InactiveMeter> listInactiveMeters(Duration inactivityThreshold, Instant reference);

    void recordRegionLoad(String region, double loadPercentage, Instant at);

    Optional<RegionLoad> latestRegionLoad(String region);

    /**
     * @return {@code true} when the backing store answers
     */
    boolean isAvailable();
}
