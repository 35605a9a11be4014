package dev.llumos.infrastructure.security;

import dev.llumos.config.SecurityProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CronSecretVerifierTest {

    private final CronSecretVerifier verifier =
            new CronSecretVerifier(new SecurityProperties(null, "s3cret", null, null));

    @Test
    @DisplayName("accepts only the exact secret")
    void exactMatch() {
        assertThat(verifier.isValid("s3cret")).isTrue();
        assertThat(verifier.isValid("s3cre")).isFalse();
        assertThat(verifier.isValid("S3CRET")).isFalse();
        assertThat(verifier.isValid("")).isFalse();
        assertThat(verifier.isValid(null)).isFalse();
    }

    @Test
    @DisplayName("rejects everything when no secret is configured")
    void unsetSecret() {
        CronSecretVerifier unset = new CronSecretVerifier(new SecurityProperties(null, " ", null, null));

        assertThat(unset.isValid(" ")).isFalse();
        assertThat(unset.isValid("anything")).isFalse();
    }
}
