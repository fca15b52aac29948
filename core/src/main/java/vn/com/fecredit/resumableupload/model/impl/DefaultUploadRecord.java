package vn.com.fecredit.resumableupload.model.impl;

import lombok.Data;
import vn.com.fecredit.resumableupload.model.UploadStatus;
import vn.com.fecredit.resumableupload.model.interfaces.IUploadRecord;

import java.time.LocalDateTime;

/**
 * POJO upload record used by the framework-free engine and its in-memory port.
 * Free of persistence-specific annotations.
 */
@Data
public class DefaultUploadRecord implements IUploadRecord {

    private String uploadId;
    private String owner;
    private String filename;
    private long offset;
    private UploadStatus status;
    private LocalDateTime createdOn;
    private LocalDateTime completedOn;
    private String blobRef;
}
