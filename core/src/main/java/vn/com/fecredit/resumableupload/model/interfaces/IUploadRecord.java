package vn.com.fecredit.resumableupload.model.interfaces;

import vn.com.fecredit.resumableupload.model.UploadStatus;

import java.time.LocalDateTime;

/**
 * Persisted state of one chunked upload.
 *
 * <p>
 * A record is identified by {@code (owner, uploadId)} and exclusively owns the
 * blob named by {@link #getBlobRef()}. {@link #getOffset()} always equals the
 * number of bytes written to that blob once a request has completed.
 */
public interface IUploadRecord {
    String getUploadId();

    void setUploadId(String uploadId);

    String getOwner();

    void setOwner(String owner);

    String getFilename();

    void setFilename(String filename);

    long getOffset();

    void setOffset(long offset);

    UploadStatus getStatus();

    void setStatus(UploadStatus status);

    LocalDateTime getCreatedOn();

    void setCreatedOn(LocalDateTime createdOn);

    LocalDateTime getCompletedOn();

    void setCompletedOn(LocalDateTime completedOn);

    String getBlobRef();

    void setBlobRef(String blobRef);
}
