package com.segs.alert.cache;

import com.segs.alert.entity.ConditionKey;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Map-backed cache for tests. Dedup expiry is evaluated against {@link #setNow(Instant)}.
 */
public class InMemoryConditionStateCache implements ConditionStateCache {

    private final Map<ConditionKey, Instant> dedupExpiry = new ConcurrentHashMap<>();
    private final Map<ConditionKey, UUID> activeConditions = new ConcurrentHashMap<>();
    private final Map<String, List<Instant>> overloadWindows = new ConcurrentHashMap<>();
    private final Map<String, Instant> lastSeen = new ConcurrentHashMap<>();
    private final Map<String, String> meterRegions = new ConcurrentHashMap<>();
    private final Map<String, RegionLoad> regionLoads = new ConcurrentHashMap<>();

    private volatile Instant now = Instant.EPOCH;
    private volatile boolean available = true;

    public void setNow(Instant now) {
        this.now = now;
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    public Map<ConditionKey, UUID> activeConditions() {
        return activeConditions;
    }

    @Override
    public synchronized boolean trySetDedupMarker(ConditionKey condition, Duration ttl) {
        Instant expiry = dedupExpiry.get(condition);
        if (expiry != null && expiry.isAfter(now)) {
            return false;
        }
        dedupExpiry.put(condition, now.plus(ttl));
        return true;
    }

    @Override
    public void releaseDedupMarker(ConditionKey condition) {
        dedupExpiry.remove(condition);
    }

    @Override
    public boolean hasActiveCondition(ConditionKey condition) {
        return activeConditions.containsKey(condition);
    }

    @Override
    public void setActiveCondition(ConditionKey condition, UUID alertId) {
        activeConditions.put(condition, alertId);
    }

    @Override
    public void clearActiveCondition(ConditionKey condition, UUID alertId) {
        activeConditions.remove(condition, alertId);
    }

    @Override
    public void recordOverloadWindow(String region, Instant at) {
        overloadWindows.computeIfAbsent(region, r -> new CopyOnWriteArrayList<>()).add(at);
    }

    @Override
    public int countOverloadWindows(String region, Duration lookback, Instant reference) {
        Instant from = reference.minus(lookback);
        return (int) overloadWindows.getOrDefault(region, List.of()).stream()
                .filter(at -> !at.isBefore(from) && !at.isAfter(reference))
                .count();
    }

    @Override
    public void touchMeterLastSeen(String meterId, String region, Instant at) {
        lastSeen.merge(meterId, at, (old, fresh) -> fresh.isAfter(old) ? fresh : old);
        meterRegions.put(meterId, region);
    }

    @Override
    public void touchMetersLastSeen(Collection<String> meterIds, String region, Instant at) {
        meterIds.forEach(meterId -> touchMeterLastSeen(meterId, region, at));
    }

    @Override
    public List<InactiveMeter> listInactiveMeters(Duration inactivityThreshold, Instant reference) {
        List<InactiveMeter> inactive = new ArrayList<>();
        lastSeen.forEach((meterId, seen) -> {
            if (Duration.between(seen, reference).compareTo(inactivityThreshold) > 0) {
                inactive.add(new InactiveMeter(meterId, meterRegions.get(meterId), seen));
            }
        });
        return inactive;
    }

    @Override
    public void recordRegionLoad(String region, double loadPercentage, Instant at) {
        regionLoads.put(region, new RegionLoad(region, loadPercentage, at));
    }

    @Override
    public Optional<RegionLoad> latestRegionLoad(String region) {
        return Optional.ofNullable(regionLoads.get(region));
    }

    @Override
    public boolean isAvailable() {
        return available;
    }
}
