package com.segs.alert.scheduler;

import com.segs.alert.config.properties.AlertProperties;
import com.segs.alert.service.AlertLifecycleManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduled jobs for the alert service.
 * Only registered when {@code segs.alert.maintenance.auto-resolve-enabled=true}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "segs.alert.maintenance", name = "auto-resolve-enabled", havingValue = "true")
public class AlertMaintenanceScheduler {

    private final AlertLifecycleManager lifecycleManager;
    private final AlertProperties properties;

    /**
     * Resolve active alerts older than the configured age.
     * Runs hourly by default
     */
    @Scheduled(cron = "${segs.alert.maintenance.auto-resolve-cron:0 0 * * * *}")
    public void autoResolveStaleAlerts() {
        int maxAgeHours = properties.getMaintenance().getAutoResolveMaxAgeHours();
        log.info("=== Scheduled Job: Auto-Resolve Alerts older than {}h ===", maxAgeHours);
        try {
            int resolved = lifecycleManager.autoResolveOldAlerts(maxAgeHours);
            log.info("Auto-resolve finished: {} alerts resolved", resolved);
        } catch (Exception e) {
            log.error("Error auto-resolving stale alerts", e);
        }
    }
}
