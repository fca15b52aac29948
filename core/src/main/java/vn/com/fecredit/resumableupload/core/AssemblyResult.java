package vn.com.fecredit.resumableupload.core;

/**
 * Outcome of {@link ChunkAssembler#append}.
 */
public final class AssemblyResult {

    public enum Outcome {
        /** The chunk was written and the record offset advanced. */
        APPENDED,
        /** The chunk starts at 0 on a record with stored bytes; the caller must start a fresh record. */
        RESTART_REQUIRED
    }

    private static final AssemblyResult RESTART = new AssemblyResult(Outcome.RESTART_REQUIRED, false, 0);

    private final Outcome outcome;
    private final boolean finalChunk;
    private final long offset;

    private AssemblyResult(Outcome outcome, boolean finalChunk, long offset) {
        this.outcome = outcome;
        this.finalChunk = finalChunk;
        this.offset = offset;
    }

    static AssemblyResult appended(long offset, boolean finalChunk) {
        return new AssemblyResult(Outcome.APPENDED, finalChunk, offset);
    }

    static AssemblyResult restartRequired() {
        return RESTART;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isRestartRequired() {
        return outcome == Outcome.RESTART_REQUIRED;
    }

    /** True when the appended chunk ended on the last byte of the file. */
    public boolean isFinalChunk() {
        return finalChunk;
    }

    /** Record offset after the append. */
    public long getOffset() {
        return offset;
    }
}
