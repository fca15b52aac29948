package vn.com.fecredit.resumableupload.exception;

/**
 * Thrown when a chunk does not start where the stored bytes end.
 */
public class OffsetMismatchException extends BadRequestException {

    private final long expected;
    private final long actual;

    public OffsetMismatchException(long expected, long actual) {
        super("Offsets do not match: expected " + expected + ", got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public long getExpected() {
        return expected;
    }

    public long getActual() {
        return actual;
    }

    @Override
    public String getError() {
        return "OffsetMismatch";
    }
}
