package vn.com.fecredit.resumableupload.model;

import org.springframework.data.jpa.repository.JpaRepository;
import vn.com.fecredit.resumableupload.port.interfaces.IUploadRecordPort;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * JPA adapter of {@link IUploadRecordPort}. Finders are derived queries; the
 * write methods of the port delegate to the inherited CRUD methods.
 */
public interface UploadRecordRepository extends JpaRepository<UploadRecord, Long>, IUploadRecordPort<UploadRecord> {

    @Override
    Optional<UploadRecord> findByOwnerAndUploadId(String owner, String uploadId);

    @Override
    List<UploadRecord> findByOwner(String owner);

    @Override
    List<UploadRecord> findByCreatedOnBefore(LocalDateTime cutoff);

    @Override
    List<UploadRecord> findByOwnerAndCreatedOnBefore(String owner, LocalDateTime cutoff);

    @Override
    long countByOwner(String owner);

    @Override
    default long countRecords() {
        return count();
    }

    @Override
    default UploadRecord store(UploadRecord record) {
        return save(record);
    }

    @Override
    default void remove(UploadRecord record) {
        delete(record);
    }
}
