package vn.com.fecredit.resumableupload.controller;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.multipart.MultipartHttpServletRequest;
import org.springframework.web.util.WebUtils;
import vn.com.fecredit.resumableupload.exception.BadRequestException;
import vn.com.fecredit.resumableupload.exception.ChunkedUploadException;
import vn.com.fecredit.resumableupload.exception.UploadExpiredException;
import vn.com.fecredit.resumableupload.model.ContentRange;
import vn.com.fecredit.resumableupload.model.OffsetResponse;
import vn.com.fecredit.resumableupload.model.UploadStatusView;
import vn.com.fecredit.resumableupload.service.ChunkedUploadService;

import java.io.IOException;
import java.security.Principal;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * REST controller for resumable chunked uploads.
 *
 * <p>
 * Exposes endpoints for:
 * <ul>
 * <li>Uploading one chunk, described by a {@code Content-Range} header</li>
 * <li>Querying how many bytes of an upload the server holds</li>
 * </ul>
 * <p>
 * Uploads are identified by the file's MD5, which is also the checksum the
 * assembled file must match. All uploads are scoped to the authenticated user.
 */
@RestController
@RequestMapping("/api/upload")
public class ChunkedUploadController {
    private static final Logger log = LoggerFactory.getLogger(ChunkedUploadController.class);

    private final ChunkedUploadService uploadService;
    private final String fieldName;
    private final Pattern contentRangePattern;

    public ChunkedUploadController(
            ChunkedUploadService uploadService,
            @Value("${chunkedupload.field-name:file}") String fieldName,
            @Value("${chunkedupload.content-range-pattern:}") String contentRangePattern) {
        this.uploadService = uploadService;
        this.fieldName = fieldName;
        this.contentRangePattern = contentRangePattern.isEmpty()
                ? ContentRange.DEFAULT_PATTERN
                : Pattern.compile(contentRangePattern);
    }

    /**
     * Uploads a single chunk.
     *
     * @param request      multipart request carrying the chunk under the configured part name
     * @param md5          upload id and expected MD5 of the whole file
     * @param contentRange byte range of the chunk, {@code bytes <start>-<end>/<total>}
     * @param principal    authenticated user principal
     * @return status of the upload after the chunk
     * @throws IOException if the chunk cannot be stored
     */
    @PostMapping("/chunk")
    public ResponseEntity<UploadStatusView> uploadChunk(
            HttpServletRequest request,
            @RequestParam(value = "md5", required = false) String md5,
            @RequestHeader(value = HttpHeaders.CONTENT_RANGE, required = false) String contentRange,
            Principal principal) throws IOException {
        MultipartFile chunk = getChunk(request);
        if (chunk == null) {
            throw new BadRequestException("No chunk file was submitted");
        }
        if (md5 == null || md5.isBlank()) {
            throw new BadRequestException("No md5 was submitted");
        }
        if (contentRange == null) {
            throw new BadRequestException("Missing Content-Range header");
        }
        ContentRange range = ContentRange.parse(contentRange, contentRangePattern)
                .orElseThrow(() -> new BadRequestException("Wrong Content-Range header \"" + contentRange + "\""));

        String owner = principal.getName();
        log.debug("Received chunk owner={}, uploadId={}, range={}", owner, md5, range);
        UploadStatusView view = uploadService.handleChunk(owner, md5, chunk.getOriginalFilename(),
                range.getStart(), range.getEnd(), range.getTotal(), chunk.getBytes(), md5);
        return ResponseEntity.ok(view);
    }

    /**
     * Gets the number of bytes the server holds for an upload, {@code 0} if unknown.
     *
     * @param md5       upload id
     * @param principal authenticated user principal
     */
    @GetMapping("/{md5}/offset")
    public ResponseEntity<OffsetResponse> getOffset(@PathVariable("md5") String md5, Principal principal) {
        return ResponseEntity.ok(new OffsetResponse(uploadService.queryOffset(principal.getName(), md5)));
    }

    private MultipartFile getChunk(HttpServletRequest request) {
        MultipartHttpServletRequest multipart = WebUtils.getNativeRequest(request, MultipartHttpServletRequest.class);
        return multipart != null ? multipart.getFile(fieldName) : null;
    }

    private static ResponseEntity<Map<String, String>> detail(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("detail", message));
    }

    @ExceptionHandler(UploadExpiredException.class)
    public ResponseEntity<Map<String, String>> handleExpired(UploadExpiredException e) {
        log.debug("Rejected chunk: {}", e.getMessage());
        return detail(HttpStatus.GONE, e.getMessage());
    }

    @ExceptionHandler(ChunkedUploadException.class)
    public ResponseEntity<Map<String, String>> handleUploadException(ChunkedUploadException e) {
        log.warn("Rejected chunk ({}): {}", e.getError(), e.getMessage());
        return detail(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(IOException.class)
    public ResponseEntity<Map<String, String>> handleIOException(IOException e) {
        log.error("Chunk storage failed: {}", e.getMessage(), e);
        return detail(HttpStatus.INTERNAL_SERVER_ERROR, "Chunk storage failed");
    }
}
