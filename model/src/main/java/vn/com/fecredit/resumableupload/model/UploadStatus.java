package vn.com.fecredit.resumableupload.model;

/**
 * Lifecycle state of a chunked upload.
 *
 * <p>
 * {@link #COMPLETE} and {@link #FAILED} are terminal: an upload in either state
 * accepts no further chunks and can only be replaced (restart from offset 0 is
 * refused) or removed by the expiry sweep.
 */
public enum UploadStatus {
    /** Chunks are still being received. */
    IN_PROGRESS,
    /** All bytes arrived and the checksum matched. */
    COMPLETE,
    /** All bytes arrived but the checksum did not match. */
    FAILED;

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }

    /**
     * Lower-case name used in client-facing messages.
     */
    public String label() {
        return name().toLowerCase().replace('_', ' ');
    }
}
