package vn.com.fecredit.resumableupload.client;

import java.io.IOException;

/**
 * Non-success answer from the upload server.
 */
public class UploadHttpException extends IOException {

    private final int statusCode;
    private final String detail;

    public UploadHttpException(int statusCode, String detail) {
        super("Upload server answered " + statusCode + ": " + detail);
        this.statusCode = statusCode;
        this.detail = detail;
    }

    public int getStatusCode() {
        return statusCode;
    }

    /** Server-supplied error message, or the raw response body. */
    public String getDetail() {
        return detail;
    }

    /** 4xx answers are final; retrying the same request cannot succeed. */
    public boolean isClientError() {
        return statusCode >= 400 && statusCode < 500;
    }
}
