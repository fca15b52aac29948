package vn.com.fecredit.resumableupload.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import vn.com.fecredit.resumableupload.core.SweepResult;

/**
 * Periodically deletes expired uploads with their blobs.
 * Runs every {@code chunkedupload.cleanup-interval-ms}, one hour by default.
 */
@Service
@ConditionalOnProperty(name = "chunkedupload.cleanup-enabled", havingValue = "true", matchIfMissing = true)
public class ExpiredUploadCleanupService {

    private static final Logger log = LoggerFactory.getLogger(ExpiredUploadCleanupService.class);

    private final ChunkedUploadService uploadService;

    public ExpiredUploadCleanupService(ChunkedUploadService uploadService) {
        this.uploadService = uploadService;
        log.info("Expired upload cleanup enabled, expiration window {}", uploadService.getExpirationPolicy().getExpiration());
    }

    @Scheduled(fixedDelayString = "${chunkedupload.cleanup-interval-ms:3600000}",
            initialDelayString = "${chunkedupload.cleanup-interval-ms:3600000}")
    public void deleteExpiredUploads() {
        log.debug("Starting cleanup of expired uploads");
        try {
            SweepResult result = uploadService.sweepExpired(false);
            if (result.getAffected() > 0) {
                log.info("Cleanup finished: {}", result);
            } else {
                log.debug("Cleanup finished: {}", result);
            }
        } catch (Exception e) {
            log.error("Error during expired uploads cleanup: {}", e.getMessage(), e);
        }
    }
}
