package dev.llumos.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Bearer tokens are HS256 JWTs signed with {@code jwtSecret}; the {@code orgClaim} scopes access.
 * Scheduler calls present {@code cronSecret} in {@code cronHeader}.
 */
@ConfigurationProperties(prefix = "llumos.security")
public record SecurityProperties(String jwtSecret, String cronSecret, String orgClaim, String cronHeader) {
    public SecurityProperties {
        if (orgClaim == null || orgClaim.isBlank()) orgClaim = "org_id";
        if (cronHeader == null || cronHeader.isBlank()) cronHeader = "X-Cron-Secret";
    }
}
