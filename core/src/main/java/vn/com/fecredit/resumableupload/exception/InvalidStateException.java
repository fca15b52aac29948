package vn.com.fecredit.resumableupload.exception;

import vn.com.fecredit.resumableupload.model.UploadStatus;

/**
 * Thrown when a chunk targets an upload that is already complete or failed.
 */
public class InvalidStateException extends BadRequestException {

    private final UploadStatus status;

    public InvalidStateException(UploadStatus status) {
        super("Upload has already been marked as \"" + status.label() + "\"");
        this.status = status;
    }

    public UploadStatus getStatus() {
        return status;
    }

    @Override
    public String getError() {
        return "InvalidState";
    }
}
