package com.segs.alert;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Alert Service Application
 *
 * Turns regional load aggregates and upstream anomaly events into
 * deduplicated alerts and exposes their acknowledge/resolve lifecycle.
 */
@SpringBootApplication
@EnableScheduling
public class AlertServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AlertServiceApplication.class, args);
    }
}
