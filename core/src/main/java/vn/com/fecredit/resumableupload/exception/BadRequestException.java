package vn.com.fecredit.resumableupload.exception;

/**
 * Malformed or contractually invalid input. User-correctable, never retried by the server.
 */
public class BadRequestException extends ChunkedUploadException {

    private static final String ERROR_TYPE = "BadRequest";

    public BadRequestException(String message) {
        super(message);
    }

    @Override
    public String getError() {
        return ERROR_TYPE;
    }
}
