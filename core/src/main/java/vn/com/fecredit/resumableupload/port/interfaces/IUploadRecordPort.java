package vn.com.fecredit.resumableupload.port.interfaces;

import vn.com.fecredit.resumableupload.model.interfaces.IUploadRecord;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Port interface for the persistent record store.
 * Owner scoping is a capability of the store: every lookup used on the request
 * path takes the owner explicitly.
 *
 * @param <T> concrete record type
 */
public interface IUploadRecordPort<T extends IUploadRecord> {

    /**
     * Finds the record of an owner's upload.
     *
     * @param owner    identity of the requesting principal
     * @param uploadId client-supplied upload identifier
     * @return the record, or empty when the owner has no such upload
     */
    Optional<T> findByOwnerAndUploadId(String owner, String uploadId);

    /**
     * Lists every record belonging to an owner.
     */
    List<T> findByOwner(String owner);

    /**
     * Lists records created strictly before the cutoff, across all owners.
     */
    List<T> findByCreatedOnBefore(LocalDateTime cutoff);

    /**
     * Lists an owner's records created strictly before the cutoff.
     */
    List<T> findByOwnerAndCreatedOnBefore(String owner, LocalDateTime cutoff);

    long countByOwner(String owner);

    long countRecords();

    /**
     * Saves a new or updated record.
     *
     * @return the stored record, which callers must use from then on
     */
    T store(T record);

    /**
     * Deletes a record. Deleting a record that is already gone is a no-op.
     */
    void remove(T record);
}
