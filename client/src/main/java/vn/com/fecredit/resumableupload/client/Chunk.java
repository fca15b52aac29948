package vn.com.fecredit.resumableupload.client;

import vn.com.fecredit.resumableupload.model.ContentRange;

/**
 * One byte range of the file being uploaded.
 *
 * <p>
 * The byte array is not defensively copied; callers must not modify it after
 * creating the chunk.
 */
public class Chunk {

    private final byte[] data;
    private final long start;

    /**
     * @param data  chunk bytes, never empty
     * @param start position of the first byte in the file
     */
    public Chunk(byte[] data, long start) {
        this.data = data;
        this.start = start;
    }

    public byte[] getData() {
        return data;
    }

    public long getStart() {
        return start;
    }

    /** Position of the last byte in the file, inclusive. */
    public long getEnd() {
        return start + data.length - 1;
    }

    public ContentRange toContentRange(long totalSize) {
        return ContentRange.of(start, getEnd(), totalSize);
    }
}
