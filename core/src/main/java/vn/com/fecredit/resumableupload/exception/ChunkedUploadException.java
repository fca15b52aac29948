package vn.com.fecredit.resumableupload.exception;

/**
 * Base class of every client-visible upload failure.
 */
public abstract class ChunkedUploadException extends RuntimeException {

    public ChunkedUploadException(String message) {
        super(message);
    }

    public ChunkedUploadException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Short type tag of the failure, stable across message wording changes.
     */
    public abstract String getError();
}
