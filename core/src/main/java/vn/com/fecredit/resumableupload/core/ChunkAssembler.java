package vn.com.fecredit.resumableupload.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.resumableupload.exception.InvalidChunkException;
import vn.com.fecredit.resumableupload.exception.InvalidStateException;
import vn.com.fecredit.resumableupload.exception.OffsetMismatchException;
import vn.com.fecredit.resumableupload.exception.UploadExpiredException;
import vn.com.fecredit.resumableupload.model.interfaces.IUploadRecord;
import vn.com.fecredit.resumableupload.port.interfaces.IBlobSinkPort;

import java.io.IOException;

/**
 * Validates an incoming chunk against the record it targets and appends it to the record's blob.
 *
 * <p>
 * Offsets must match exactly: a chunk is accepted only if it starts where the
 * stored bytes end. A chunk starting at 0 on a record that already holds bytes
 * is reported as a restart and left to the caller. Gaps, overlaps and
 * duplicates are rejected.
 *
 * <p>
 * The assembler never marks an upload complete; it only reports that the final
 * chunk arrived so that the caller can verify the checksum first.
 */
public class ChunkAssembler {

    private static final Logger log = LoggerFactory.getLogger(ChunkAssembler.class);

    private final IBlobSinkPort blobSink;
    private final ExpirationPolicy expirationPolicy;

    public ChunkAssembler(IBlobSinkPort blobSink, ExpirationPolicy expirationPolicy) {
        this.blobSink = blobSink;
        this.expirationPolicy = expirationPolicy;
    }

    /**
     * Appends one chunk to the record's blob and advances {@code record.offset}.
     *
     * @param record     record the chunk belongs to; mutated in place, not persisted
     * @param rangeStart first byte position of the chunk, inclusive
     * @param rangeEnd   last byte position of the chunk, inclusive
     * @param totalSize  size of the whole file
     * @param chunkBytes chunk content
     * @return {@code APPENDED} with the new offset, or {@code RESTART_REQUIRED}
     * @throws UploadExpiredException  if the record is past its expiration window
     * @throws InvalidStateException   if the record is complete or failed
     * @throws OffsetMismatchException if the chunk does not start at the record offset nor at 0
     * @throws InvalidChunkException   if the chunk length or range is inconsistent
     * @throws IOException             if the blob write fails; the record is left untouched
     */
    public AssemblyResult append(IUploadRecord record, long rangeStart, long rangeEnd, long totalSize,
                                 byte[] chunkBytes) throws IOException {
        if (expirationPolicy.isExpired(record)) {
            throw new UploadExpiredException();
        }
        if (record.getStatus().isTerminal()) {
            throw new InvalidStateException(record.getStatus());
        }
        if (rangeStart != record.getOffset()) {
            if (rangeStart == 0) {
                log.debug("Chunk at 0 for uploadId={} holding {} bytes, restart required", record.getUploadId(), record.getOffset());
                return AssemblyResult.restartRequired();
            }
            throw new OffsetMismatchException(record.getOffset(), rangeStart);
        }
        validateChunk(rangeStart, rangeEnd, totalSize, chunkBytes);

        blobSink.write(record.getBlobRef(), record.getOffset(), chunkBytes);
        record.setOffset(record.getOffset() + chunkBytes.length);

        boolean finalChunk = rangeEnd + 1 == totalSize;
        log.debug("Appended bytes {}-{}/{} to uploadId={}, offset now {}", rangeStart, rangeEnd, totalSize,
                record.getUploadId(), record.getOffset());
        return AssemblyResult.appended(record.getOffset(), finalChunk);
    }

    private void validateChunk(long rangeStart, long rangeEnd, long totalSize, byte[] chunkBytes) {
        if (rangeEnd < rangeStart || rangeEnd >= totalSize) {
            throw new InvalidChunkException("Invalid byte range " + rangeStart + "-" + rangeEnd + "/" + totalSize);
        }
        long expectedLength = rangeEnd - rangeStart + 1;
        long actualLength = chunkBytes != null ? chunkBytes.length : -1;
        if (actualLength != expectedLength) {
            throw new InvalidChunkException("Invalid chunk size: expected " + expectedLength + " bytes, got " + actualLength);
        }
    }
}
