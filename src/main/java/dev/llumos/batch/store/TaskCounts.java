package dev.llumos.batch.store;

/** Task totals per status for one job, read from the task rows. */
public record TaskCounts(long pending, long processing, long completed, long failed, long cancelled) {

    /** Tasks that still need work: pending or currently claimed. */
    public long open() {
        return pending + processing;
    }

    public long total() {
        return pending + processing + completed + failed + cancelled;
    }

    public boolean isDrained() {
        return open() == 0;
    }

    public boolean allFailed() {
        return failed > 0 && completed == 0 && open() == 0;
    }
}
