package com.panwatch.config;

import java.time.Duration;
import java.time.ZoneId;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Scheduler tick settings.
 *
 * <pre>
 * panwatch.scheduler.enabled=true
 * panwatch.scheduler.tick=5000           # ms between ticks
 * panwatch.scheduler.zone=Asia/Shanghai  # zone schedules are evaluated in
 * panwatch.scheduler.fingerprint-ttl=10m
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "panwatch.scheduler")
public class SchedulerProperties {

    private boolean enabled = true;
    private long tick = 5000;
    private String zone = "Asia/Shanghai";
    private Duration fingerprintTtl = Duration.ofMinutes(10);

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }
}
