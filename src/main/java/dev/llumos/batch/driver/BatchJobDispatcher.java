package dev.llumos.batch.driver;

import dev.llumos.config.BatchProperties;
import dev.llumos.domain.event.BatchJobCreatedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Starts the driver loop for a newly created job.
 *
 * <p>Runs after the creating transaction commits, so the driver never looks for a job that is
 * not visible yet. When the event is published outside a transaction it runs immediately.
 * A crash between commit and dispatch leaves the job PENDING; the reconciler resumes it once its
 * heartbeat goes stale.
 */
@Component
public class BatchJobDispatcher {

    private static final Logger log = LoggerFactory.getLogger(BatchJobDispatcher.class);

    private final BatchDriverLoop driverLoop;
    private final boolean autoDispatch;

    public BatchJobDispatcher(BatchDriverLoop driverLoop, BatchProperties properties) {
        this.driverLoop = driverLoop;
        this.autoDispatch = properties.driver().autoDispatch();
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onJobCreated(BatchJobCreatedEvent event) {
        if (!autoDispatch) {
            log.debug("Auto-dispatch disabled; job {} waits for resume calls or the reconciler", event.jobId());
            return;
        }
        log.info("Dispatching driver for job {} (org {}, {} tasks, trigger {})",
                event.jobId(), event.orgId(), event.totalTasks(), event.triggerSource());
        driverLoop.driveAsync(event.jobId());
    }
}
