package dev.llumos.batch.reconciler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodic reconciler sweep. Disable with {@code llumos.batch.reconciler.enabled=false}. */
@Component
@ConditionalOnProperty(prefix = "llumos.batch.reconciler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ReconcilerScheduler {

    private static final Logger log = LoggerFactory.getLogger(ReconcilerScheduler.class);

    private final BatchReconciler reconciler;

    public ReconcilerScheduler(BatchReconciler reconciler) {
        this.reconciler = reconciler;
    }

    @Scheduled(fixedDelayString = "${llumos.batch.reconciler.interval:PT2M}",
            initialDelayString = "${llumos.batch.reconciler.interval:PT2M}")
    public void sweep() {
        try {
            reconciler.reconcile();
        } catch (RuntimeException e) {
            log.error("Scheduled reconciler sweep failed", e);
        }
    }
}
