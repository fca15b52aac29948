package vn.com.fecredit.resumableupload.core;

import vn.com.fecredit.resumableupload.model.ContentRange;

/**
 * One chunk submission as seen by the lifecycle controller.
 */
public final class ChunkRequest {

    private final String owner;
    private final String uploadId;
    private final String filename;
    private final ContentRange range;
    private final byte[] data;
    private final String suppliedChecksum;

    /**
     * @param owner            identity of the requesting principal
     * @param uploadId         client-supplied upload identifier
     * @param filename         original file name, informational
     * @param range            declared byte range of the chunk
     * @param data             chunk bytes; not copied, callers must not modify them afterwards
     * @param suppliedChecksum checksum the whole file must match, checked on the final chunk
     */
    public ChunkRequest(String owner, String uploadId, String filename, ContentRange range,
                        byte[] data, String suppliedChecksum) {
        this.owner = owner;
        this.uploadId = uploadId;
        this.filename = filename;
        this.range = range;
        this.data = data;
        this.suppliedChecksum = suppliedChecksum;
    }

    public String getOwner() { return owner; }
    public String getUploadId() { return uploadId; }
    public String getFilename() { return filename; }
    public ContentRange getRange() { return range; }
    public byte[] getData() { return data; }
    public String getSuppliedChecksum() { return suppliedChecksum; }
}
