package vn.com.fecredit.resumableupload.exception;

/**
 * Thrown when a chunk targets an upload past its expiration window.
 * Terminal: the client has to start over from offset 0 under a new record.
 */
public class UploadExpiredException extends ChunkedUploadException {

    public UploadExpiredException() {
        super("Upload has expired");
    }

    @Override
    public String getError() {
        return "Gone";
    }
}
