package vn.com.fecredit.resumableupload.model;

import jakarta.persistence.*;
import lombok.Data;
import vn.com.fecredit.resumableupload.model.interfaces.IUploadRecord;

import java.time.LocalDateTime;

@Entity
@Table(name = "upload_record",
        uniqueConstraints = @UniqueConstraint(name = "uk_upload_record_owner_upload_id", columnNames = {"owner", "upload_id"}),
        indexes = @Index(name = "idx_upload_record_created_on", columnList = "created_on"))
@Data
public class UploadRecord implements IUploadRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "upload_id", nullable = false)
    private String uploadId;

    @Column(nullable = false)
    private String owner;

    private String filename;

    // OFFSET is reserved in H2
    @Column(name = "upload_offset", nullable = false)
    private long offset;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private UploadStatus status;

    @Column(name = "created_on", nullable = false)
    private LocalDateTime createdOn;

    @Column(name = "completed_on")
    private LocalDateTime completedOn;

    @Column(name = "blob_ref", nullable = false)
    private String blobRef;
}
