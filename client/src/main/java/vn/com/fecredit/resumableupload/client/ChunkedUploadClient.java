package vn.com.fecredit.resumableupload.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.resumableupload.model.OffsetResponse;
import vn.com.fecredit.resumableupload.model.UploadStatusView;
import vn.com.fecredit.resumableupload.model.util.ChecksumUtil;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Base64;
import java.util.UUID;

/**
 * Client for resumable chunked uploads.
 *
 * <p>
 * The file is identified by its MD5, which the server also uses to verify the
 * assembled result. The client asks the server how many bytes it already holds
 * and sends the rest sequentially, one {@code Content-Range} chunk at a time.
 * Interrupted uploads resume by simply calling {@link #upload(Path)} again.
 *
 * <p>
 * Usage:
 * <pre>
 * ChunkedUploadClient client = new ChunkedUploadClient.Builder()
 *     .uploadUrl("http://server/api/upload")
 *     .username("user")
 *     .password("pass")
 *     .build();
 *
 * UploadStatusView result = client.upload(filePath);
 * </pre>
 */
public class ChunkedUploadClient {

    private static final Logger log = LoggerFactory.getLogger(ChunkedUploadClient.class);

    /**
     * Pluggable transport layer for the two upload endpoints.
     *
     * <p>
     * Implementations retry transient failures themselves and report any
     * non-success answer as {@link UploadHttpException}.
     *
     * @see DefaultUploadTransport
     */
    public interface UploadTransport {
        /**
         * Calls {@code GET <uploadUrl>/<md5>/offset}.
         *
         * @return bytes the server holds for the upload, {@code 0} if unknown
         */
        long queryOffset(String md5, String uploadUrl, String encodedAuth, int retryTimes)
                throws IOException, InterruptedException;

        /**
         * Posts one chunk to {@code <uploadUrl>/chunk}.
         *
         * @param md5       upload id and expected checksum of the whole file
         * @param filename  original file name
         * @param chunk     chunk data and position
         * @param totalSize size of the whole file
         * @return upload status after the chunk
         */
        UploadStatusView uploadChunk(String md5, String filename, Chunk chunk, long totalSize,
                                     String uploadUrl, String encodedAuth, int retryTimes)
                throws IOException, InterruptedException;
    }

    public static class DefaultUploadTransport implements UploadTransport {
        private static final String CRLF = "\r\n";

        private final ObjectMapper objectMapper;
        private final HttpClient httpClient;
        private final String fieldName;

        /**
         * @param httpClient custom client, or null for a default {@link HttpClient}
         * @param fieldName  multipart part name carrying the chunk bytes
         */
        public DefaultUploadTransport(HttpClient httpClient, String fieldName) {
            this.objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
            this.httpClient = httpClient != null ? httpClient : HttpClient.newHttpClient();
            this.fieldName = fieldName;
        }

        @Override
        public long queryOffset(String md5, String uploadUrl, String encodedAuth, int retryTimes)
                throws IOException, InterruptedException {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(uploadUrl + "/" + URLEncoder.encode(md5, StandardCharsets.UTF_8) + "/offset"))
                    .header("Authorization", "Basic " + encodedAuth)
                    .GET()
                    .build();
            String body = sendWithRetry(request, "query offset of " + md5, retryTimes);
            return objectMapper.readValue(body, OffsetResponse.class).getOffset();
        }

        @Override
        public UploadStatusView uploadChunk(String md5, String filename, Chunk chunk, long totalSize,
                                            String uploadUrl, String encodedAuth, int retryTimes)
                throws IOException, InterruptedException {
            HttpRequest request = buildMultipartRequest(md5, filename, chunk, totalSize, uploadUrl, encodedAuth);
            String body = sendWithRetry(request, "upload bytes " + chunk.getStart() + "-" + chunk.getEnd(), retryTimes);
            return objectMapper.readValue(body, UploadStatusView.class);
        }

        /**
         * Sends a request, retrying network errors and 5xx answers.
         * A 4xx answer fails immediately.
         */
        private String sendWithRetry(HttpRequest request, String action, int retryTimes)
                throws IOException, InterruptedException {
            int attempts = 0;
            IOException lastException = null;
            while (attempts <= retryTimes) {
                try {
                    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
                    log.debug("{}: status {}", action, response.statusCode());
                    if (response.statusCode() == 200) {
                        return response.body();
                    }
                    UploadHttpException failure = new UploadHttpException(response.statusCode(), detail(response.body()));
                    if (failure.isClientError()) {
                        throw failure;
                    }
                    lastException = failure;
                } catch (UploadHttpException e) {
                    throw e;
                } catch (IOException e) {
                    lastException = e;
                }
                attempts++;
                log.warn("Failed to {} (attempt {} of {}): {}", action, attempts, retryTimes + 1, lastException.getMessage());
            }
            throw new IOException("Failed to " + action + " after " + attempts + " attempts", lastException);
        }

        private String detail(String body) {
            if (body == null || body.isEmpty()) {
                return "";
            }
            try {
                JsonNode node = objectMapper.readTree(body);
                if (node != null && node.hasNonNull("detail")) {
                    return node.get("detail").asText();
                }
            } catch (IOException e) {
                log.trace("Error body is not JSON: {}", e.getMessage());
            }
            return body;
        }

        /**
         * Builds a multipart/form-data request with the {@code md5} field and the
         * chunk part, and the byte range in the {@code Content-Range} header.
         */
        private HttpRequest buildMultipartRequest(String md5, String filename, Chunk chunk, long totalSize,
                                                  String uploadUrl, String encodedAuth) throws IOException {
            String boundary = "----Boundary" + UUID.randomUUID();
            ByteArrayOutputStream body = new ByteArrayOutputStream(chunk.getData().length + 512);
            body.write(("--" + boundary + CRLF
                    + "Content-Disposition: form-data; name=\"md5\"" + CRLF + CRLF
                    + md5 + CRLF
                    + "--" + boundary + CRLF
                    + "Content-Disposition: form-data; name=\"" + fieldName + "\"; filename=\"" + escapeFilename(filename) + "\"" + CRLF
                    + "Content-Type: application/octet-stream" + CRLF + CRLF).getBytes(StandardCharsets.UTF_8));
            body.write(chunk.getData());
            body.write((CRLF + "--" + boundary + "--" + CRLF).getBytes(StandardCharsets.UTF_8));

            return HttpRequest.newBuilder()
                    .uri(URI.create(uploadUrl + "/chunk"))
                    .header("Content-Type", "multipart/form-data; boundary=" + boundary)
                    .header("Content-Range", chunk.toContentRange(totalSize).toHeaderValue())
                    .header("Authorization", "Basic " + encodedAuth)
                    .POST(HttpRequest.BodyPublishers.ofByteArray(body.toByteArray()))
                    .build();
        }
    }

    /**
     * Percent-encodes the characters that would break a quoted {@code filename}
     * parameter, as browsers do for multipart form submissions.
     */
    static String escapeFilename(String filename) {
        return filename.replace("\"", "%22").replace("\r", "%0D").replace("\n", "%0A");
    }

    private final String uploadUrl;
    private final String encodedAuth;
    private final int chunkSize;
    private final int retryTimes;
    private final UploadTransport transport;

    private ChunkedUploadClient(Builder builder) {
        this.uploadUrl = builder.uploadUrl;
        this.chunkSize = builder.chunkSize;
        this.retryTimes = builder.retryTimes;
        this.encodedAuth = Base64.getEncoder()
                .encodeToString((builder.username + ":" + builder.password).getBytes(StandardCharsets.UTF_8));
        this.transport = builder.transport != null
                ? builder.transport
                : new DefaultUploadTransport(builder.httpClient, builder.fieldName);
    }

    /**
     * Uploads a file, resuming from the offset the server already holds.
     *
     * <p>
     * If the server reports an offset at or past the end of the file, the upload
     * restarts from the first byte. When a chunk is rejected with 400, the offset
     * is queried again and the upload continues from there if it moved and is
     * still inside the file; this resynchronization happens at most
     * {@code retryTimes} times.
     *
     * @param filePath file to upload; must exist and be non-empty
     * @return status returned for the final chunk
     * @throws IllegalArgumentException if the file is missing or empty
     * @throws UploadHttpException      if the server rejects the upload
     * @throws IOException              on file or network errors that outlast the retries
     */
    public UploadStatusView upload(Path filePath) throws IOException, InterruptedException {
        if (filePath == null || !Files.isRegularFile(filePath)) {
            throw new IllegalArgumentException("filePath is required and must exist");
        }
        long fileSize = Files.size(filePath);
        if (fileSize == 0) {
            throw new IllegalArgumentException("Cannot upload an empty file: " + filePath);
        }
        String md5 = ChecksumUtil.generateChecksum(filePath, ChecksumUtil.MD5);
        String filename = filePath.getFileName().toString();

        long offset = startOffset(transport.queryOffset(md5, uploadUrl, encodedAuth, retryTimes), fileSize);
        log.info("Uploading {} ({} bytes, md5={}) from offset {}", filename, fileSize, md5, offset);

        int resyncs = 0;
        UploadStatusView status = null;
        try (FileChannel channel = FileChannel.open(filePath, StandardOpenOption.READ)) {
            while (offset < fileSize) {
                Chunk chunk = readChunk(channel, offset, (int) Math.min(chunkSize, fileSize - offset));
                try {
                    status = transport.uploadChunk(md5, filename, chunk, fileSize, uploadUrl, encodedAuth, retryTimes);
                    offset = status.getOffset();
                } catch (UploadHttpException e) {
                    if (e.getStatusCode() != 400 || resyncs >= retryTimes) {
                        throw e;
                    }
                    long serverOffset = transport.queryOffset(md5, uploadUrl, encodedAuth, retryTimes);
                    if (serverOffset == chunk.getStart() || serverOffset >= fileSize) {
                        throw e;
                    }
                    resyncs++;
                    log.warn("Chunk at {} rejected ({}), server holds {} bytes; continuing from there",
                            chunk.getStart(), e.getDetail(), serverOffset);
                    offset = serverOffset;
                }
            }
        }
        log.info("Upload of {} finished with status {}", filename, status.getStatus());
        return status;
    }

    private static long startOffset(long serverOffset, long fileSize) {
        return serverOffset >= fileSize ? 0 : serverOffset;
    }

    private static Chunk readChunk(FileChannel channel, long position, int length) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(length);
        while (buffer.hasRemaining()) {
            int read = channel.read(buffer, position + buffer.position());
            if (read < 0) {
                throw new IOException("File shrank while uploading, no data at " + (position + buffer.position()));
            }
        }
        return new Chunk(buffer.array(), position);
    }

    /**
     * Builder for creating ChunkedUploadClient instances with custom configuration.
     *
     * <p>
     * Required parameters: uploadUrl, username, password.
     * Optional parameters: chunkSize (default 512 KiB), retryTimes (default 2),
     * fieldName (default {@code file}), httpClient, transport.
     */
    public static class Builder {
        private String uploadUrl;
        private String username;
        private String password;
        private int chunkSize = 524288;
        private int retryTimes = 2;
        private String fieldName = "file";
        private HttpClient httpClient;
        private UploadTransport transport;

        /**
         * @param uploadUrl Base URL for upload endpoints (e.g. http://server/api/upload)
         */
        public Builder uploadUrl(String uploadUrl) {
            this.uploadUrl = uploadUrl;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder chunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
            return this;
        }

        /**
         * @param retryTimes retries after the first attempt of each request (default: 2)
         */
        public Builder retryTimes(int retryTimes) {
            this.retryTimes = retryTimes;
            return this;
        }

        /**
         * @param fieldName multipart part name the server reads the chunk from
         */
        public Builder fieldName(String fieldName) {
            this.fieldName = fieldName;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder transport(UploadTransport transport) {
            this.transport = transport;
            return this;
        }

        public ChunkedUploadClient build() {
            if (uploadUrl == null || username == null || password == null) {
                throw new IllegalStateException("uploadUrl, username, and password are required");
            }
            if (chunkSize <= 0) {
                throw new IllegalStateException("chunkSize must be positive");
            }
            if (retryTimes < 0) {
                throw new IllegalStateException("retryTimes must not be negative");
            }
            return new ChunkedUploadClient(this);
        }
    }
}
