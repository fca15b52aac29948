package vn.com.fecredit.resumableupload.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.resumableupload.exception.ChecksumMismatchException;
import vn.com.fecredit.resumableupload.exception.InvalidStateException;
import vn.com.fecredit.resumableupload.model.ContentRange;
import vn.com.fecredit.resumableupload.model.UploadStatus;
import vn.com.fecredit.resumableupload.model.UploadStatusView;
import vn.com.fecredit.resumableupload.model.interfaces.IUploadRecord;
import vn.com.fecredit.resumableupload.port.interfaces.IBlobSinkPort;
import vn.com.fecredit.resumableupload.port.interfaces.IUploadRecordPort;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Orchestrates chunked uploads end to end: resolves or creates the record,
 * delegates validation and appending to {@link ChunkAssembler}, persists the
 * record, and on the final chunk verifies the checksum and finalizes the upload.
 *
 * <p>
 * State machine per record:
 * <pre>
 * IN_PROGRESS --final chunk, checksum ok-----&gt; COMPLETE
 * IN_PROGRESS --final chunk, checksum bad----&gt; FAILED
 * IN_PROGRESS --chunk at offset 0------------&gt; deleted, replaced by a new record
 * any         --expired----------------------&gt; deleted by {@link #sweepExpired}
 * </pre>
 *
 * <p>
 * A record is persisted only after its chunk has been written, so an interrupted
 * request leaves the record at its previous offset. No in-process lock is held:
 * concurrent chunks for the same upload are a caller error.
 *
 * @param <Y> concrete record type
 * @param <U> record store holding {@code Y}
 */
public abstract class AbstractUploadLifecycleController<Y extends IUploadRecord, U extends IUploadRecordPort<Y>> {

    private static final Logger log = LoggerFactory.getLogger(AbstractUploadLifecycleController.class);

    @Getter
    private final U uploadRecordPort;
    @Getter
    private final IBlobSinkPort blobSinkPort;
    @Getter
    private final ExpirationPolicy expirationPolicy;
    @Getter
    private final String checksumAlgorithm;
    private final UploadHooks<Y> hooks;
    private final ChunkAssembler assembler;

    protected AbstractUploadLifecycleController(U uploadRecordPort, IBlobSinkPort blobSinkPort,
                                                ExpirationPolicy expirationPolicy, String checksumAlgorithm,
                                                UploadHooks<Y> hooks) {
        this.uploadRecordPort = uploadRecordPort;
        this.blobSinkPort = blobSinkPort;
        this.expirationPolicy = expirationPolicy;
        this.checksumAlgorithm = checksumAlgorithm;
        this.hooks = hooks != null ? hooks : UploadHooks.noop();
        this.assembler = new ChunkAssembler(blobSinkPort, expirationPolicy);
    }

    /**
     * Instantiates an empty record of the concrete type. The controller fills it in.
     */
    protected abstract Y newRecord();

    public UploadStatusView handleChunk(String owner, String uploadId, String filename, long rangeStart, long rangeEnd,
                                        long totalSize, byte[] chunkBytes, String suppliedChecksum) throws IOException {
        return handleChunk(new ChunkRequest(owner, uploadId, filename, ContentRange.of(rangeStart, rangeEnd, totalSize),
                chunkBytes, suppliedChecksum));
    }

    /**
     * Accepts one chunk of an upload.
     *
     * @param request chunk submission
     * @return status of the upload after the chunk; for the final chunk, the completion response
     * @throws vn.com.fecredit.resumableupload.exception.ChunkedUploadException if the chunk is rejected
     * @throws IOException if the blob cannot be written or read back
     */
    public UploadStatusView handleChunk(ChunkRequest request) throws IOException {
        hooks.validate(request);

        ContentRange range = request.getRange();
        Optional<Y> existing = uploadRecordPort.findByOwnerAndUploadId(request.getOwner(), request.getUploadId());
        boolean created = existing.isEmpty();
        Y record = created ? createRecord(request) : existing.get();

        AssemblyResult result = append(record, created, request);
        if (result.isRestartRequired()) {
            log.info("Restarting upload owner={}, uploadId={}, discarding {} bytes",
                    record.getOwner(), record.getUploadId(), record.getOffset());
            discard(record);
            record = createRecord(request);
            created = true;
            result = append(record, true, request);
        }

        record = save(record, created);

        if (!result.isFinalChunk()) {
            return statusView(record);
        }

        if (record.getStatus() == UploadStatus.COMPLETE) {
            throw new InvalidStateException(UploadStatus.COMPLETE);
        }
        return complete(record, request.getSuppliedChecksum(), range.getTotal());
    }

    /**
     * Number of bytes stored for an upload; {@code 0} when the upload is unknown.
     */
    public long queryOffset(String owner, String uploadId) {
        return uploadRecordPort.findByOwnerAndUploadId(owner, uploadId)
                .map(IUploadRecord::getOffset)
                .orElse(0L);
    }

    public Optional<Y> findUpload(String owner, String uploadId) {
        return uploadRecordPort.findByOwnerAndUploadId(owner, uploadId);
    }

    public UploadStatusView statusView(Y record) {
        return new UploadStatusView(record.getUploadId(), record.getOffset(),
                expirationPolicy.expiresOn(record), record.getStatus());
    }

    public SweepResult sweepExpired(boolean dryRun) {
        return sweepExpired(null, dryRun);
    }

    /**
     * Deletes expired uploads together with their blobs, or only counts them.
     *
     * <p>
     * Each candidate is looked up again before deletion; one that is gone, was
     * replaced, or is no longer expired is skipped. A failure on one record is
     * logged and the sweep moves on.
     *
     * @param owner  restrict the sweep to this owner, or null for all owners
     * @param dryRun count without deleting anything
     */
    public SweepResult sweepExpired(String owner, boolean dryRun) {
        LocalDateTime cutoff = expirationPolicy.cutoff();
        long total = owner == null ? uploadRecordPort.countRecords() : uploadRecordPort.countByOwner(owner);
        List<Y> candidates = owner == null
                ? uploadRecordPort.findByCreatedOnBefore(cutoff)
                : uploadRecordPort.findByOwnerAndCreatedOnBefore(owner, cutoff);

        if (dryRun) {
            log.info("Dry run: {} of {} uploads created before {} would be deleted", candidates.size(), total, cutoff);
            return new SweepResult(candidates.size(), total, true);
        }

        long deleted = 0;
        for (Y candidate : candidates) {
            try {
                Optional<Y> current = uploadRecordPort.findByOwnerAndUploadId(candidate.getOwner(), candidate.getUploadId());
                if (current.isEmpty()
                        || !Objects.equals(current.get().getBlobRef(), candidate.getBlobRef())
                        || !expirationPolicy.isExpired(current.get())) {
                    log.debug("Skipping upload owner={}, uploadId={}, no longer expired", candidate.getOwner(), candidate.getUploadId());
                    continue;
                }
                discard(current.get());
                deleted++;
            } catch (Exception e) {
                log.error("Failed to delete expired upload: owner={}, uploadId={}, error={}",
                        candidate.getOwner(), candidate.getUploadId(), e.getMessage(), e);
            }
        }
        log.info("{} expired uploads deleted, of {} total uploads", deleted, total);
        return new SweepResult(deleted, total, false);
    }

    private AssemblyResult append(Y record, boolean created, ChunkRequest request) throws IOException {
        ContentRange range = request.getRange();
        try {
            return assembler.append(record, range.getStart(), range.getEnd(), range.getTotal(), request.getData());
        } catch (IOException | RuntimeException e) {
            if (created) {
                // the record was never saved, so its blob has no other owner
                releaseBlob(record, e);
            }
            throw e;
        }
    }

    private UploadStatusView complete(Y record, String suppliedChecksum, long totalSize) throws IOException {
        String actual = blobSinkPort.checksum(record.getBlobRef(), checksumAlgorithm);
        if (suppliedChecksum == null || !actual.equalsIgnoreCase(suppliedChecksum)) {
            log.warn("Checksum mismatch for owner={}, uploadId={}: expected={}, actual={}",
                    record.getOwner(), record.getUploadId(), suppliedChecksum, actual);
            record.setStatus(UploadStatus.FAILED);
            save(record, false);
            throw new ChecksumMismatchException(checksumAlgorithm);
        }

        record.setStatus(UploadStatus.COMPLETE);
        record.setCompletedOn(expirationPolicy.now());
        Y saved = save(record, false);
        log.info("Upload complete: owner={}, uploadId={}, size={}", saved.getOwner(), saved.getUploadId(), totalSize);
        return hooks.onCompletion(saved, statusView(saved));
    }

    private Y createRecord(ChunkRequest request) throws IOException {
        Y record = newRecord();
        record.setUploadId(request.getUploadId());
        record.setOwner(request.getOwner());
        record.setFilename(request.getFilename());
        record.setOffset(0);
        record.setStatus(UploadStatus.IN_PROGRESS);
        record.setCreatedOn(expirationPolicy.now());
        hooks.applyExtraAttributes(record, request);
        record.setBlobRef(blobSinkPort.create(request.getOwner(), request.getUploadId()));
        log.debug("Created upload record owner={}, uploadId={}, blob={}", record.getOwner(), record.getUploadId(), record.getBlobRef());
        return record;
    }

    private Y save(Y record, boolean created) {
        Y saved;
        try {
            hooks.preSave(record, created);
            saved = uploadRecordPort.store(record);
        } catch (RuntimeException e) {
            if (created) {
                // nothing references the blob of a record that was never stored
                releaseBlob(record, e);
            }
            throw e;
        }
        hooks.postSave(saved, created);
        return saved;
    }

    /**
     * Deletes a record and its blob.
     */
    protected void discard(Y record) throws IOException {
        uploadRecordPort.remove(record);
        blobSinkPort.delete(record.getBlobRef());
        log.debug("Discarded upload owner={}, uploadId={}", record.getOwner(), record.getUploadId());
    }

    private void releaseBlob(Y record, Exception cause) {
        try {
            blobSinkPort.delete(record.getBlobRef());
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }
}
