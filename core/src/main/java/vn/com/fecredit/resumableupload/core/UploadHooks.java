package vn.com.fecredit.resumableupload.core;

import vn.com.fecredit.resumableupload.model.UploadStatusView;
import vn.com.fecredit.resumableupload.model.interfaces.IUploadRecord;

/**
 * Extension points of the upload lifecycle, injected into the controller at construction.
 * Every method defaults to a no-op.
 *
 * @param <Y> concrete record type
 */
public interface UploadHooks<Y extends IUploadRecord> {

    /**
     * Extra validation run before anything is looked up or written.
     * Must throw a {@link vn.com.fecredit.resumableupload.exception.ChunkedUploadException} to reject the chunk.
     */
    default void validate(ChunkRequest request) {
    }

    /**
     * Sets additional attributes on a freshly created record, before its blob is allocated.
     */
    default void applyExtraAttributes(Y record, ChunkRequest request) {
    }

    /**
     * Called before every save of a record.
     *
     * @param created true for the first save of a new record
     */
    default void preSave(Y record, boolean created) {
    }

    /**
     * Called after every save of a record.
     *
     * @param created true for the first save of a new record
     */
    default void postSave(Y record, boolean created) {
    }

    /**
     * Builds the response for a completed upload.
     *
     * @param record completed and persisted record
     * @param view   default response
     * @return the response to return to the client
     */
    default UploadStatusView onCompletion(Y record, UploadStatusView view) {
        return view;
    }

    static <Y extends IUploadRecord> UploadHooks<Y> noop() {
        return new UploadHooks<>() {
        };
    }
}
