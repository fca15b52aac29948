package vn.com.fecredit.resumableupload.model.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Utility class for generating file checksums.
 *
 * <p>
 * The file is streamed through a {@link MessageDigest} in fixed-size buffers, so
 * arbitrarily large uploads can be verified without loading them into memory.
 * Results are lowercase hexadecimal strings.
 *
 * <p>
 * Usage example:
 * <pre>
 * String md5 = ChecksumUtil.generateChecksum(Paths.get("myfile.bin"), ChecksumUtil.MD5);
 * </pre>
 */
public final class ChecksumUtil {

    public static final String MD5 = "MD5";
    public static final String SHA_256 = "SHA-256";

    /** Size of buffer used for reading file data (8KB) */
    private static final int BUFFER_SIZE = 8192;

    private ChecksumUtil() {
        // Utility class, no instances allowed
    }

    /**
     * Generates a checksum of a file with the given digest algorithm.
     *
     * @param filePath  Path to the file to checksum
     * @param algorithm JCA digest name, e.g. {@link #MD5}
     * @return checksum as a lowercase hex string
     * @throws IOException If the file cannot be read or the algorithm is unavailable
     */
    public static String generateChecksum(Path filePath, String algorithm) throws IOException {
        try (InputStream in = Files.newInputStream(filePath)) {
            return generateChecksum(in, algorithm);
        }
    }

    /**
     * Generates a checksum of everything remaining in the stream. The stream is not closed.
     */
    public static String generateChecksum(InputStream in, String algorithm) throws IOException {
        MessageDigest digest = newDigest(algorithm);
        byte[] buffer = new byte[BUFFER_SIZE];
        int read;
        while ((read = in.read(buffer)) != -1) {
            digest.update(buffer, 0, read);
        }
        return toHex(digest.digest());
    }

    public static String generateChecksum(byte[] data, String algorithm) throws IOException {
        return toHex(newDigest(algorithm).digest(data));
    }

    private static MessageDigest newDigest(String algorithm) throws IOException {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IOException("Unsupported checksum algorithm: " + algorithm, e);
        }
    }

    public static String toHex(byte[] hash) {
        StringBuilder hexString = new StringBuilder(2 * hash.length);
        for (byte b : hash) {
            String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1)
                hexString.append('0');
            hexString.append(hex);
        }
        return hexString.toString();
    }
}
