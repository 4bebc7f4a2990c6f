package com.segs.alert.service;

import com.segs.alert.entity.Alert;

import java.util.List;

/**
 * One page of alerts, newest first, with the total matching the filter.
 */
public record AlertPage(List<Alert> alerts, long total) {

    public static AlertPage empty() {
        return new AlertPage(List.of(), 0);
    }
}
