package vn.com.fecredit.resumableupload.core;

/**
 * Outcome of an expiry sweep.
 */
public final class SweepResult {

    private final long affected;
    private final long total;
    private final boolean dryRun;

    public SweepResult(long affected, long total, boolean dryRun) {
        this.affected = affected;
        this.total = total;
        this.dryRun = dryRun;
    }

    /** Records deleted, or that would have been deleted on a dry run. */
    public long getAffected() {
        return affected;
    }

    /** Records scanned. */
    public long getTotal() {
        return total;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    @Override
    public String toString() {
        return affected + " expired uploads " + (dryRun ? "would be deleted" : "deleted") + ", of " + total + " total uploads";
    }
}
