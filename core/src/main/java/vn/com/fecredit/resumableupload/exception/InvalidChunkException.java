package vn.com.fecredit.resumableupload.exception;

/**
 * Thrown when the chunk bytes disagree with the declared byte range.
 */
public class InvalidChunkException extends BadRequestException {

    public InvalidChunkException(String message) {
        super(message);
    }

    @Override
    public String getError() {
        return "InvalidChunk";
    }
}
