package dev.llumos.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;

/**
 * Daily trigger. Runs outside the [windowStartHour, windowEndHour) local window are skipped unless forced.
 */
@ConfigurationProperties(prefix = "llumos.scheduler")
public record SchedulerProperties(Boolean enabled, String cron, ZoneId zone, int windowStartHour, int windowEndHour) {
    public SchedulerProperties {
        if (enabled == null) enabled = Boolean.TRUE;
        if (cron == null || cron.isBlank()) cron = "0 5 3 * * *";
        if (zone == null) zone = ZoneId.of("America/New_York");
        if (windowStartHour <= 0 && windowEndHour <= 0) {
            windowStartHour = 3;
            windowEndHour = 6;
        }
        if (windowEndHour <= windowStartHour)
            throw new IllegalArgumentException("windowEndHour must be after windowStartHour");
    }

    public boolean isInWindow(int hour) {
        return hour >= windowStartHour && hour < windowEndHour;
    }
}
