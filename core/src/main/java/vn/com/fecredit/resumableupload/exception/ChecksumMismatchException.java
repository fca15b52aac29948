package vn.com.fecredit.resumableupload.exception;

/**
 * Thrown when the assembled file does not hash to the checksum supplied with the final chunk.
 * The upload has been marked failed by the time this is raised.
 */
public class ChecksumMismatchException extends BadRequestException {

    public ChecksumMismatchException(String algorithm) {
        super(algorithm.toLowerCase() + " checksum does not match");
    }

    @Override
    public String getError() {
        return "ChecksumMismatch";
    }
}
