package vn.com.fecredit.resumableupload.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Body of the offset query: the number of bytes the server already holds for an upload.
 * An unknown upload reports {@code 0}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class OffsetResponse {

    private long offset;

    public OffsetResponse() {
    }

    public OffsetResponse(long offset) {
        this.offset = offset;
    }

    public long getOffset() { return offset; }
    public void setOffset(long offset) { this.offset = offset; }
}
