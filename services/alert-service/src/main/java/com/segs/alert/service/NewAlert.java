package com.segs.alert.service;

import com.segs.alert.entity.ConditionKey;
import com.segs.alert.entity.Severity;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Data needed to raise an alert.
 */
@Value
@Builder
public class NewAlert {

    String type;
    Severity severity;
    String region;
    String meterId;
    String message;
    Map<String, Object> metadata;

    public ConditionKey conditionKey() {
        return new ConditionKey(type, region, meterId);
    }
}
