package dev.llumos.infrastructure.security;

import dev.llumos.config.SecurityProperties;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Checks the shared secret cron callers present. Uses constant-time comparison to prevent timing attacks.
 * An unset secret rejects everything.
 */
@Component
public class CronSecretVerifier {
    private final SecurityProperties properties;

    public CronSecretVerifier(SecurityProperties properties) { this.properties = properties; }

    public boolean isValid(String presented) {
        String secret = properties.cronSecret();
        if (secret == null || secret.isBlank() || presented == null || presented.isEmpty()) return false;
        return MessageDigest.isEqual(
                secret.getBytes(StandardCharsets.UTF_8),
                presented.getBytes(StandardCharsets.UTF_8));
    }
}
