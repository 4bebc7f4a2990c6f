package com.segs.alert.entity;

/**
 * What is wrong, independent of any alert instance: {@code (type, region, meterId)}.
 * Region and meter are optional.
 */
public record ConditionKey(String type, String region, String meterId) {

    public static ConditionKey of(String type, String region) {
        return new ConditionKey(type, region, null);
    }
}
