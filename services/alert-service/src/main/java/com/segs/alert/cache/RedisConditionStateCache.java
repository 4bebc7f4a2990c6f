package com.segs.alert.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.segs.alert.config.properties.AlertProperties;
import com.segs.alert.entity.ConditionKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Redis-backed {@link ConditionStateCache}.
 *
 * <p>Key layout:
 * <ul>
 *   <li>{@code dedup:{type}:{region|global}[:{meterId}]} - SET NX PX marker</li>
 *   <li>{@code alerts:active:{region|global}:{type}[:{meterId}]} - alert id, no TTL</li>
 *   <li>{@code region:overload:{region}} - sorted set of over-threshold readings scored by epoch millis</li>
 *   <li>{@code {meters}:last_seen} / {@code {meters}:region} - sorted set of meters scored by last report
 *       and the hash of their regions; the hash tag keeps both in one cluster slot</li>
 *   <li>{@code region:load:{region}} - latest load reading, JSON, with TTL</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisConditionStateCache implements ConditionStateCache {

    static final String DEDUP_PREFIX = "dedup:";
    static final String ACTIVE_PREFIX = "alerts:active:";
    static final String OVERLOAD_PREFIX = "region:overload:";
    static final String REGION_LOAD_PREFIX = "region:load:";
    static final String METER_LAST_SEEN_KEY = "{meters}:last_seen";
    static final String METER_REGION_KEY = "{meters}:region";
    private static final String GLOBAL = "global";

    // KEYS[1] overload zset; ARGV: score, member, prune-below score, ttl millis
    private static final RedisScript<Long> RECORD_WINDOW_SCRIPT = RedisScript.of(
            "redis.call('ZADD', KEYS[1], ARGV[1], ARGV[2]) " +
            "redis.call('ZREMRANGEBYSCORE', KEYS[1], '-inf', '(' .. ARGV[3]) " +
            "redis.call('PEXPIRE', KEYS[1], ARGV[4]) " +
            "return redis.call('ZCARD', KEYS[1])",
            Long.class);

    // KEYS[1] active marker; ARGV[1] alert id expected to own it
    private static final RedisScript<Long> CLEAR_OWNED_MARKER_SCRIPT = RedisScript.of(
            "if redis.call('GET', KEYS[1]) == ARGV[1] then return redis.call('DEL', KEYS[1]) end " +
            "return 0",
            Long.class);

    // KEYS[1] last-seen zset, KEYS[2] region hash; ARGV: score, region, prune-below score, meter ids...
    private static final RedisScript<Long> TOUCH_METERS_SCRIPT = RedisScript.of(
            "local stale = redis.call('ZRANGEBYSCORE', KEYS[1], '-inf', '(' .. ARGV[3]) " +
            "for _, meter in ipairs(stale) do redis.call('HDEL', KEYS[2], meter) end " +
            "redis.call('ZREMRANGEBYSCORE', KEYS[1], '-inf', '(' .. ARGV[3]) " +
            "for i = 4, #ARGV do " +
            "  redis.call('ZADD', KEYS[1], 'GT', ARGV[1], ARGV[i]) " +
            "  redis.call('HSET', KEYS[2], ARGV[i], ARGV[2]) " +
            "end " +
            "return #ARGV - 3",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final AlertProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public boolean trySetDedupMarker(ConditionKey condition, Duration ttl) {
        String key = dedupKey(condition);
        try {
            Boolean acquired = redisTemplate.opsForValue()
                    .setIfAbsent(key, "1", ttl.toMillis(), TimeUnit.MILLISECONDS);
            if (Boolean.TRUE.equals(acquired)) {
                log.debug("Dedup marker set: key={}, ttl={}", key, ttl);
                return true;
            }
            log.debug("Dedup marker already present: key={}", key);
            return false;
        } catch (Exception e) {
            // Fail open: the alert store stays authoritative when the cache is down
            log.error("Error setting dedup marker key={}, allowing creation. Error: {}", key, e.getMessage(), e);
            return true;
        }
    }

    @Override
    public void releaseDedupMarker(ConditionKey condition) {
        String key = dedupKey(condition);
        try {
            redisTemplate.delete(key);
            log.debug("Dedup marker released: key={}", key);
        } catch (Exception e) {
            log.error("Error releasing dedup marker key={}: {}", key, e.getMessage(), e);
        }
    }

    @Override
    public boolean hasActiveCondition(ConditionKey condition) {
        String key = activeKey(condition);
        try {
            return Boolean.TRUE.equals(redisTemplate.hasKey(key));
        } catch (Exception e) {
            log.error("Error reading active condition key={}: {}", key, e.getMessage(), e);
            return false;
        }
    }

    @Override
    public void setActiveCondition(ConditionKey condition, UUID alertId) {
        String key = activeKey(condition);
        try {
            redisTemplate.opsForValue().set(key, alertId.toString());
            log.debug("Active condition set: key={}, alertId={}", key, alertId);
        } catch (Exception e) {
            log.error("Error setting active condition key={}: {}", key, e.getMessage(), e);
        }
    }

    @Override
    public void clearActiveCondition(ConditionKey condition, UUID alertId) {
        String key = activeKey(condition);
        try {
            Long deleted = redisTemplate.execute(CLEAR_OWNED_MARKER_SCRIPT, Collections.singletonList(key),
                    alertId.toString());
            log.debug("Active condition clear: key={}, alertId={}, deleted={}", key, alertId, deleted);
        } catch (Exception e) {
            log.error("Error clearing active condition key={}: {}", key, e.getMessage(), e);
        }
    }

    @Override
    public void recordOverloadWindow(String region, Instant at) {
        String key = OVERLOAD_PREFIX + region;
        Duration retention = properties.getThresholds().getOverloadWindowRetention();
        long score = at.toEpochMilli();
        try {
            redisTemplate.execute(RECORD_WINDOW_SCRIPT, Collections.singletonList(key),
                    String.valueOf(score),
                    at.toString(),
                    String.valueOf(score - retention.toMillis()),
                    String.valueOf(retention.toMillis()));
        } catch (Exception e) {
            log.error("Error recording overload window region={}, at={}: {}", region, at, e.getMessage(), e);
        }
    }

    @Override
    public int countOverloadWindows(String region, Duration lookback, Instant reference) {
        String key = OVERLOAD_PREFIX + region;
        long max = reference.toEpochMilli();
        try {
            Long count = redisTemplate.opsForZSet().count(key, max - lookback.toMillis(), max);
            return count == null ? 0 : count.intValue();
        } catch (Exception e) {
            log.error("Error counting overload windows region={}: {}", region, e.getMessage(), e);
            return 0;
        }
    }

    @Override
    public void touchMeterLastSeen(String meterId, String region, Instant at) {
        touchMetersLastSeen(Collections.singletonList(meterId), region, at);
    }

    @Override
    public void touchMetersLastSeen(Collection<String> meterIds, String region, Instant at) {
        if (meterIds == null || meterIds.isEmpty()) {
            return;
        }
        long score = at.toEpochMilli();
        long retention = properties.getThresholds().getMeterRetention().toMillis();

        List<String> args = new ArrayList<>(meterIds.size() + 3);
        args.add(String.valueOf(score));
        args.add(region);
        args.add(String.valueOf(score - retention));
        args.addAll(meterIds);
        try {
            redisTemplate.execute(TOUCH_METERS_SCRIPT, List.of(METER_LAST_SEEN_KEY, METER_REGION_KEY),
                    args.toArray());
        } catch (Exception e) {
            log.error("Error refreshing last-seen for {} meters in region={}: {}",
                    meterIds.size(), region, e.getMessage(), e);
        }
    }

    @Override
    public List<InactiveMeter> listInactiveMeters(Duration inactivityThreshold, Instant reference) {
        long now = reference.toEpochMilli();
        long min = now - properties.getThresholds().getMeterRetention().toMillis();
        // strictly longer silence than the threshold
        long max = now - inactivityThreshold.toMillis() - 1;
        if (max < min) {
            return List.of();
        }
        try {
            Set<ZSetOperations.TypedTuple<String>> silent =
                    redisTemplate.opsForZSet().rangeByScoreWithScores(METER_LAST_SEEN_KEY, min, max);
            if (silent == null || silent.isEmpty()) {
                return List.of();
            }
            List<Object> meterIds = new ArrayList<>(silent.size());
            silent.forEach(tuple -> meterIds.add(tuple.getValue()));
            List<Object> regions = redisTemplate.opsForHash().multiGet(METER_REGION_KEY, meterIds);

            List<InactiveMeter> result = new ArrayList<>(silent.size());
            int i = 0;
            for (ZSetOperations.TypedTuple<String> tuple : silent) {
                Object region = regions.get(i++);
                if (region == null || tuple.getScore() == null) {
                    continue;
                }
                result.add(new InactiveMeter(tuple.getValue(), region.toString(),
                        Instant.ofEpochMilli(tuple.getScore().longValue())));
            }
            return result;
        } catch (Exception e) {
            log.error("Error listing inactive meters: {}", e.getMessage(), e);
            return List.of();
        }
    }

    @Override
    public void recordRegionLoad(String region, double loadPercentage, Instant at) {
        String key = REGION_LOAD_PREFIX + region;
        try {
            String value = objectMapper.writeValueAsString(new RegionLoad(region, loadPercentage, at));
            redisTemplate.opsForValue().set(key, value,
                    properties.getThresholds().getRegionLoadTtl().toMillis(), TimeUnit.MILLISECONDS);
        } catch (JsonProcessingException e) {
            log.error("Cannot serialize load reading for region={}", region, e);
        } catch (Exception e) {
            log.error("Error recording load for region={}: {}", region, e.getMessage(), e);
        }
    }

    @Override
    public Optional<RegionLoad> latestRegionLoad(String region) {
        try {
            String value = redisTemplate.opsForValue().get(REGION_LOAD_PREFIX + region);
            if (value == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(value, RegionLoad.class));
        } catch (Exception e) {
            log.error("Error reading load for region={}: {}", region, e.getMessage(), e);
            return Optional.empty();
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            String pong = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping, true);
            return "PONG".equalsIgnoreCase(pong);
        } catch (Exception e) {
            log.warn("Redis ping failed: {}", e.getMessage());
            return false;
        }
    }

    static String dedupKey(ConditionKey condition) {
        StringBuilder key = new StringBuilder(DEDUP_PREFIX)
                .append(condition.type()).append(':')
                .append(condition.region() == null ? GLOBAL : condition.region());
        if (condition.meterId() != null) {
            key.append(':').append(condition.meterId());
        }
        return key.toString();
    }

    static String activeKey(ConditionKey condition) {
        StringBuilder key = new StringBuilder(ACTIVE_PREFIX)
                .append(condition.region() == null ? GLOBAL : condition.region()).append(':')
                .append(condition.type());
        if (condition.meterId() != null) {
            key.append(':').append(condition.meterId());
        }
        return key.toString();
    }
}
