package dev.llumos.service;

import dev.llumos.batch.store.JobSnapshot;
import dev.llumos.batch.store.JobStore;
import dev.llumos.exception.JobNotFoundException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/** Read side for batch jobs. */
@Service
public class BatchJobQueryService {

    private static final int MAX_LIST = 100;

    private final JobStore store;

    public BatchJobQueryService(JobStore store) {
        this.store = store;
    }

    public JobSnapshot get(UUID jobId) {
        return store.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    public List<JobSnapshot> recent(UUID orgId, int limit) {
        return store.recentJobs(orgId, Math.max(1, Math.min(limit, MAX_LIST)));
    }
}
