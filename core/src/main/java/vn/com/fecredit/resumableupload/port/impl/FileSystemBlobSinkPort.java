package vn.com.fecredit.resumableupload.port.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.resumableupload.model.util.ChecksumUtil;
import vn.com.fecredit.resumableupload.port.interfaces.IBlobSinkPort;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.UUID;

/**
 * Local-disk blob sink: one {@code <uuid>.part} file per upload under a root directory.
 *
 * <p>
 * Blob references are file names relative to the root; references that resolve
 * outside the root are rejected.
 */
public class FileSystemBlobSinkPort implements IBlobSinkPort {

    private static final Logger log = LoggerFactory.getLogger(FileSystemBlobSinkPort.class);
    private static final String PART_SUFFIX = ".part";

    private final Path rootDir;

    public FileSystemBlobSinkPort(String rootDirPath) throws IOException {
        this.rootDir = Paths.get(rootDirPath).toAbsolutePath().normalize();
        Files.createDirectories(this.rootDir);
    }

    public Path getRootDir() {
        return rootDir;
    }

    @Override
    public String create(String owner, String uploadId) throws IOException {
        String blobRef = UUID.randomUUID() + PART_SUFFIX;
        Files.createFile(resolve(blobRef));
        log.debug("Created blob {} for owner={}, uploadId={}", blobRef, owner, uploadId);
        return blobRef;
    }

    @Override
    public void write(String blobRef, long position, byte[] data) throws IOException {
        Path path = resolve(blobRef);
        try (FileChannel ch = FileChannel.open(path, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            long size = ch.size();
            if (position > size) {
                throw new IOException("Cannot write blob " + blobRef + " at " + position + ", it only holds " + size + " bytes");
            }
            if (size > position) {
                log.debug("Discarding {} stale bytes beyond position {} in blob {}", size - position, position, blobRef);
                ch.truncate(position);
            }
            ByteBuffer buffer = ByteBuffer.wrap(data);
            long writeAt = position;
            while (buffer.hasRemaining()) {
                writeAt += ch.write(buffer, writeAt);
            }
        }
    }

    @Override
    public long size(String blobRef) throws IOException {
        return Files.size(resolve(blobRef));
    }

    @Override
    public String checksum(String blobRef, String algorithm) throws IOException {
        return ChecksumUtil.generateChecksum(resolve(blobRef), algorithm);
    }

    @Override
    public void delete(String blobRef) throws IOException {
        if (Files.deleteIfExists(resolve(blobRef))) {
            log.debug("Deleted blob {}", blobRef);
        }
    }

    private Path resolve(String blobRef) throws IOException {
        if (blobRef == null || blobRef.isEmpty()) {
            throw new IOException("Blob reference is empty");
        }
        Path path = rootDir.resolve(blobRef).normalize();
        if (!path.startsWith(rootDir) || path.equals(rootDir)) {
            throw new IOException("Blob reference escapes storage root: " + blobRef);
        }
        return path;
    }
}
