package com.segs.alert.service;

import com.segs.alert.entity.AlertStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Partial update of an alert. Null fields are left as they are and
 * {@code metadata} is merged into the existing map.
 *
 * <p>When {@code expectedVersion} is set the update fails with an optimistic
 * locking error if the row changed since it was read.
 */
@Value
@Builder
public class AlertUpdate {

    AlertStatus status;
    Boolean acknowledged;
    String acknowledgedBy;
    Instant acknowledgedAt;
    Instant resolvedAt;
    Map<String, Object> metadata;
    Long expectedVersion;
}
