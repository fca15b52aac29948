package vn.com.fecredit.resumableupload.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import vn.com.fecredit.resumableupload.core.ExpirationPolicy;
import vn.com.fecredit.resumableupload.core.SweepResult;

import java.time.Clock;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ExpiredUploadCleanupService.
 * Tests the background cleanup functionality without full Spring context.
 */
@ExtendWith(MockitoExtension.class)
public class ExpiredUploadCleanupServiceTest {

    @Mock
    private ChunkedUploadService uploadService;

    private ExpiredUploadCleanupService newCleanupService() {
        when(uploadService.getExpirationPolicy()).thenReturn(new ExpirationPolicy(Duration.ofDays(1), Clock.systemUTC()));
        return new ExpiredUploadCleanupService(uploadService);
    }

    @Test
    public void testCleanupRunsRealSweep() {
        ExpiredUploadCleanupService cleanupService = newCleanupService();
        when(uploadService.sweepExpired(false)).thenReturn(new SweepResult(2, 5, false));

        cleanupService.deleteExpiredUploads();

        verify(uploadService).sweepExpired(false);
        verify(uploadService, never()).sweepExpired(true);
    }

    @Test
    public void testCleanupErrorIsLoggedNotPropagated() {
        ExpiredUploadCleanupService cleanupService = newCleanupService();
        when(uploadService.sweepExpired(false)).thenThrow(new IllegalStateException("database unavailable"));

        assertDoesNotThrow(cleanupService::deleteExpiredUploads);
    }
}
