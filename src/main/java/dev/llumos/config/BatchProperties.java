package dev.llumos.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Batch execution tuning. Budget and call timeout are separate: the budget bounds one executor
 * invocation, the call timeout bounds one provider request (and is clamped to what the budget has left).
 */
@ConfigurationProperties(prefix = "llumos.batch")
public record BatchProperties(int microBatchSize,
                              Duration invocationBudget,
                              Duration budgetSafetyMargin,
                              int maxConcurrentCalls,
                              int circuitBreakerThreshold,
                              Duration staleHeartbeat,
                              Duration stuckTaskAge,
                              Driver driver,
                              Reconciler reconciler) {

    public BatchProperties {
        if (microBatchSize <= 0) microBatchSize = 10;
        if (invocationBudget == null) invocationBudget = Duration.ofSeconds(240);
        if (budgetSafetyMargin == null) budgetSafetyMargin = Duration.ofSeconds(10);
        if (maxConcurrentCalls <= 0) maxConcurrentCalls = 3;
        if (circuitBreakerThreshold <= 0) circuitBreakerThreshold = 3;
        if (staleHeartbeat == null) staleHeartbeat = Duration.ofMinutes(5);
        if (stuckTaskAge == null) stuckTaskAge = Duration.ofMinutes(10);
        if (driver == null) driver = new Driver(null, 0, null, 0, null, 0);
        if (reconciler == null) reconciler = new Reconciler(null, null, 0);
    }

    /**
     * Server-side loop that re-invokes the executor until the job is done or stops progressing.
     */
    public record Driver(Duration pollInterval, int maxIterations, Duration maxDuration,
                         int stallThreshold, Boolean autoDispatch, int poolSize) {
        public Driver {
            if (pollInterval == null) pollInterval = Duration.ofSeconds(5);
            if (maxIterations <= 0) maxIterations = 200;
            if (maxDuration == null) maxDuration = Duration.ofHours(2);
            if (stallThreshold <= 0) stallThreshold = 3;
            if (autoDispatch == null) autoDispatch = Boolean.TRUE;
            if (poolSize <= 0) poolSize = 4;
        }
    }

    public record Reconciler(Boolean enabled, Duration interval, int maxJobsPerSweep) {
        public Reconciler {
            if (enabled == null) enabled = Boolean.TRUE;
            if (interval == null) interval = Duration.ofMinutes(2);
            if (maxJobsPerSweep <= 0) maxJobsPerSweep = 50;
        }
    }
}
