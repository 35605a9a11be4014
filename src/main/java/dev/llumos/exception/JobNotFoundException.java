package dev.llumos.exception;

import java.util.UUID;

public class JobNotFoundException extends RuntimeException {
    private final UUID jobId;

    public JobNotFoundException(UUID jobId) {
        super("Batch job not found: " + jobId);
        this.jobId = jobId;
    }

    public UUID getJobId() {
        return jobId;
    }
}
