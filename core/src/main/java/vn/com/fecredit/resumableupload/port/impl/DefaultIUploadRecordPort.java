package vn.com.fecredit.resumableupload.port.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.resumableupload.model.impl.DefaultUploadRecord;
import vn.com.fecredit.resumableupload.port.interfaces.IUploadRecordPort;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Default in-memory implementation of {@link IUploadRecordPort}.
 */
public class DefaultIUploadRecordPort implements IUploadRecordPort<DefaultUploadRecord> {

    private static final Logger log = LoggerFactory.getLogger(DefaultIUploadRecordPort.class);

    private final Map<String, DefaultUploadRecord> records = new ConcurrentHashMap<>();

    private static String key(String owner, String uploadId) {
        return owner + '\u0000' + uploadId;
    }

    @Override
    public Optional<DefaultUploadRecord> findByOwnerAndUploadId(String owner, String uploadId) {
        return Optional.ofNullable(records.get(key(owner, uploadId)));
    }

    @Override
    public List<DefaultUploadRecord> findByOwner(String owner) {
        return filter(r -> r.getOwner().equals(owner));
    }

    @Override
    public List<DefaultUploadRecord> findByCreatedOnBefore(LocalDateTime cutoff) {
        return filter(r -> r.getCreatedOn().isBefore(cutoff));
    }

    @Override
    public List<DefaultUploadRecord> findByOwnerAndCreatedOnBefore(String owner, LocalDateTime cutoff) {
        return filter(r -> r.getOwner().equals(owner) && r.getCreatedOn().isBefore(cutoff));
    }

    @Override
    public long countByOwner(String owner) {
        return findByOwner(owner).size();
    }

    @Override
    public long countRecords() {
        return records.size();
    }

    @Override
    public DefaultUploadRecord store(DefaultUploadRecord record) {
        if (record == null || record.getUploadId() == null || record.getOwner() == null) {
            throw new IllegalArgumentException("Upload record, owner and uploadId cannot be null");
        }
        records.put(key(record.getOwner(), record.getUploadId()), record);
        log.debug("Stored upload record owner={}, uploadId={}, offset={}", record.getOwner(), record.getUploadId(), record.getOffset());
        return record;
    }

    @Override
    public void remove(DefaultUploadRecord record) {
        if (record == null || record.getUploadId() == null || record.getOwner() == null) return;
        // only drop the mapping if it still points at this instance, a restart may have replaced it
        records.remove(key(record.getOwner(), record.getUploadId()), record);
    }

    private List<DefaultUploadRecord> filter(Predicate<DefaultUploadRecord> predicate) {
        return records.values().stream().filter(predicate).collect(Collectors.toList());
    }
}
