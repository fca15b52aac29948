package vn.com.fecredit.resumableupload.port.interfaces;

import java.io.IOException;

/**
 * Port interface for the append-only byte sink backing each upload.
 *
 * <p>
 * A blob is addressed by the opaque reference returned from {@link #create}.
 * Writes carry the position they start at so that bytes left behind by an
 * interrupted request can be overwritten on the next attempt.
 */
public interface IBlobSinkPort {

    /**
     * Creates a new, empty blob.
     *
     * @param owner    owner of the upload, may be used to partition storage
     * @param uploadId client-supplied upload identifier
     * @return reference to the new blob
     * @throws IOException if the blob cannot be created
     */
    String create(String owner, String uploadId) throws IOException;

    /**
     * Writes {@code data} at {@code position}, discarding anything stored beyond it first.
     *
     * @param blobRef  blob reference
     * @param position byte position the data starts at; must not exceed the current size
     * @param data     bytes to write
     * @throws IOException if the blob is missing or the write fails
     */
    void write(String blobRef, long position, byte[] data) throws IOException;

    /**
     * Current size of the blob in bytes.
     */
    long size(String blobRef) throws IOException;

    /**
     * Digest of the whole blob as a lowercase hex string.
     *
     * @param algorithm JCA digest name, e.g. {@code MD5}
     */
    String checksum(String blobRef, String algorithm) throws IOException;

    /**
     * Deletes the blob. Deleting a missing blob is a no-op.
     */
    void delete(String blobRef) throws IOException;
}
