package com.segs.alert.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Alert service tunables, bound from {@code segs.alert.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "segs.alert")
public class AlertProperties {

    @Valid
    private Thresholds thresholds = new Thresholds();

    @NotNull
    private Duration deduplicationTtl = Duration.ofMinutes(5);

    @Valid
    private Topics topics = new Topics();

    @Valid
    private Consumer consumer = new Consumer();

    @Valid
    private Maintenance maintenance = new Maintenance();

    @Valid
    private Api api = new Api();

    @Data
    public static class Thresholds {
        /** Load percentage strictly above which an aggregate counts as an overload window. */
        @Min(0)
        @Max(100)
        private double overloadPercent = 90.0;

        @Min(1)
        private int overloadConsecutiveWindows = 2;

        @NotNull
        private Duration overloadLookback = Duration.ofMinutes(5);

        @NotNull
        private Duration overloadWindowRetention = Duration.ofMinutes(10);

        @NotNull
        private Duration meterOutage = Duration.ofSeconds(30);

        @NotNull
        private Duration meterRetention = Duration.ofHours(1);

        @NotNull
        private Duration regionLoadTtl = Duration.ofMinutes(10);
    }

    @Data
    public static class Topics {
        @NotBlank
        private String aggregates = "aggregates_1m_regional";

        @NotBlank
        private String anomalies = "alerts";

        @NotBlank
        private String processed = "alerts_processed";

        @NotBlank
        private String statusUpdates = "alert_status_updates";
    }

    @Data
    public static class Consumer {
        @Min(1)
        private int concurrency = 3;

        @NotNull
        private Duration maxProcessingTime = Duration.ofSeconds(10);

        @Min(0)
        private int retryAttempts = 3;

        @NotNull
        private Duration retryInterval = Duration.ofSeconds(1);
    }

    @Data
    public static class Maintenance {
        private boolean autoResolveEnabled = false;

        @NotBlank
        private String autoResolveCron = "0 0 * * * *";

        @Min(1)
        private int autoResolveMaxAgeHours = 48;
    }

    @Data
    public static class Api {
        @Min(1)
        private int defaultPageSize = 50;

        @Min(1)
        private int maxPageSize = 500;

        @Min(1)
        private int defaultHistoryHours = 24;
    }
}
