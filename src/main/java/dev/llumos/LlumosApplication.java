package dev.llumos;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Llumos batch service: daily AI-visibility scans per organization.
 *
 * <pre>
 * daily trigger / POST /batch-jobs → fan-out (prompts × providers) → job + tasks
 *   → driver loop → micro-batch executor → provider clients → scoring → response records
 * reconciler (every 2 min) → stale jobs → finalize, or take over and drive again
 * </pre>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class LlumosApplication {

    public static void main(String[] args) {
        SpringApplication.run(LlumosApplication.class, args);
    }
}
