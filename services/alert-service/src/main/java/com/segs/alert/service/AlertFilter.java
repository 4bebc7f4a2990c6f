package com.segs.alert.service;

import com.segs.alert.entity.AlertStatus;
import com.segs.alert.entity.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Query over the alert store. Null fields are not filtered on;
 * {@code from}/{@code to} bound the creation time inclusively.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AlertFilter {

    private AlertStatus status;
    private String type;
    private Severity severity;
    private String region;
    private String meterId;
    private Boolean acknowledged;
    private Instant from;
    private Instant to;

    @Builder.Default
    private int limit = 50;

    @Builder.Default
    private long offset = 0;
}
