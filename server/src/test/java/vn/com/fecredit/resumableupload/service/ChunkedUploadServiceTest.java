package vn.com.fecredit.resumableupload.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import vn.com.fecredit.resumableupload.core.ExpirationPolicy;
import vn.com.fecredit.resumableupload.core.SweepResult;
import vn.com.fecredit.resumableupload.core.UploadHooks;
import vn.com.fecredit.resumableupload.exception.ChecksumMismatchException;
import vn.com.fecredit.resumableupload.model.UploadRecord;
import vn.com.fecredit.resumableupload.model.UploadRecordRepository;
import vn.com.fecredit.resumableupload.model.UploadStatus;
import vn.com.fecredit.resumableupload.model.UploadStatusView;
import vn.com.fecredit.resumableupload.port.interfaces.IBlobSinkPort;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ChunkedUploadService.
 * Exercises the lifecycle over mocked repository and blob sink, without a Spring context.
 */
@ExtendWith(MockitoExtension.class)
public class ChunkedUploadServiceTest {

    private static final String OWNER = "testuser";
    private static final String UPLOAD_ID = "fc5e038d38a57032085441e7fe7010b0";

    @Mock
    private UploadRecordRepository uploadRecordRepository;

    @Mock
    private IBlobSinkPort blobSinkPort;

    @Mock
    private ObjectProvider<UploadHooks<UploadRecord>> hooksProvider;

    private ChunkedUploadService uploadService;
    private LocalDateTime now;

    @BeforeEach
    public void setup() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);
        now = LocalDateTime.now(clock);
        when(hooksProvider.getIfAvailable(any())).thenReturn(UploadHooks.noop());
        uploadService = new ChunkedUploadService(uploadRecordRepository, blobSinkPort,
                new ExpirationPolicy(Duration.ofDays(1), clock), "MD5", hooksProvider);
    }

    private UploadRecord record(long offset, LocalDateTime createdOn) {
        UploadRecord record = new UploadRecord();
        record.setId(1L);
        record.setOwner(OWNER);
        record.setUploadId(UPLOAD_ID);
        record.setFilename("test-file.txt");
        record.setOffset(offset);
        record.setStatus(UploadStatus.IN_PROGRESS);
        record.setCreatedOn(createdOn);
        record.setBlobRef("blob-1.part");
        return record;
    }

    @Test
    public void testFirstChunkCreatesRecord() throws IOException {
        when(uploadRecordRepository.findByOwnerAndUploadId(OWNER, UPLOAD_ID)).thenReturn(Optional.empty());
        when(blobSinkPort.create(OWNER, UPLOAD_ID)).thenReturn("blob-1.part");
        when(uploadRecordRepository.store(any(UploadRecord.class))).thenAnswer(inv -> inv.getArgument(0));

        UploadStatusView view = uploadService.handleChunk(OWNER, UPLOAD_ID, "test-file.txt", 0, 4, 10,
                "hello".getBytes(StandardCharsets.UTF_8), UPLOAD_ID);

        ArgumentCaptor<UploadRecord> captor = ArgumentCaptor.forClass(UploadRecord.class);
        verify(uploadRecordRepository).store(captor.capture());
        UploadRecord saved = captor.getValue();
        assertEquals(5, saved.getOffset());
        assertEquals(UploadStatus.IN_PROGRESS, saved.getStatus());
        assertEquals(now, saved.getCreatedOn());
        assertEquals("blob-1.part", saved.getBlobRef());
        assertEquals(now.plusDays(1), view.getExpires());
        verify(blobSinkPort).write(eq("blob-1.part"), eq(0L), any(byte[].class));
        verify(blobSinkPort, never()).checksum(any(), any());
    }

    @Test
    public void testFinalChunkWithMatchingChecksumCompletes() throws IOException {
        when(uploadRecordRepository.findByOwnerAndUploadId(OWNER, UPLOAD_ID)).thenReturn(Optional.of(record(5, now)));
        when(uploadRecordRepository.store(any(UploadRecord.class))).thenAnswer(inv -> inv.getArgument(0));
        when(blobSinkPort.checksum("blob-1.part", "MD5")).thenReturn(UPLOAD_ID);

        UploadStatusView view = uploadService.handleChunk(OWNER, UPLOAD_ID, "test-file.txt", 5, 9, 10,
                "world".getBytes(StandardCharsets.UTF_8), UPLOAD_ID);

        assertEquals(UploadStatus.COMPLETE, view.getStatus());
        assertEquals(10, view.getOffset());
        verify(uploadRecordRepository, times(2)).store(any(UploadRecord.class));
    }

    @Test
    public void testFinalChunkWithWrongChecksumFails() throws IOException {
        UploadRecord existing = record(5, now);
        when(uploadRecordRepository.findByOwnerAndUploadId(OWNER, UPLOAD_ID)).thenReturn(Optional.of(existing));
        when(uploadRecordRepository.store(any(UploadRecord.class))).thenAnswer(inv -> inv.getArgument(0));
        when(blobSinkPort.checksum("blob-1.part", "MD5")).thenReturn("00000000000000000000000000000000");

        assertThrows(ChecksumMismatchException.class, () -> uploadService.handleChunk(OWNER, UPLOAD_ID,
                "test-file.txt", 5, 9, 10, "world".getBytes(StandardCharsets.UTF_8), UPLOAD_ID));

        assertEquals(UploadStatus.FAILED, existing.getStatus());
        assertEquals(10, existing.getOffset());
        assertNull(existing.getCompletedOn());
    }

    @Test
    public void testBlobWriteFailureLeavesRecordUnsaved() throws IOException {
        when(uploadRecordRepository.findByOwnerAndUploadId(OWNER, UPLOAD_ID)).thenReturn(Optional.of(record(5, now)));
        doThrow(new IOException("disk full")).when(blobSinkPort).write(eq("blob-1.part"), anyLong(), any(byte[].class));

        assertThrows(IOException.class, () -> uploadService.handleChunk(OWNER, UPLOAD_ID, "test-file.txt",
                5, 9, 10, "world".getBytes(StandardCharsets.UTF_8), UPLOAD_ID));

        verify(uploadRecordRepository, never()).store(any(UploadRecord.class));
        verify(blobSinkPort, never()).delete(any());
    }

    @Test
    public void testSweepContinuesAfterFailedDeletion() throws IOException {
        UploadRecord broken = record(5, now.minusDays(3));
        UploadRecord expired = record(5, now.minusDays(2));
        expired.setId(2L);
        expired.setUploadId("other-upload");
        expired.setBlobRef("blob-2.part");

        when(uploadRecordRepository.countRecords()).thenReturn(3L);
        when(uploadRecordRepository.findByCreatedOnBefore(now.minusDays(1))).thenReturn(List.of(broken, expired));
        when(uploadRecordRepository.findByOwnerAndUploadId(OWNER, UPLOAD_ID)).thenReturn(Optional.of(broken));
        when(uploadRecordRepository.findByOwnerAndUploadId(OWNER, "other-upload")).thenReturn(Optional.of(expired));
        doThrow(new IOException("permission denied")).when(blobSinkPort).delete("blob-1.part");

        SweepResult result = uploadService.sweepExpired(false);

        assertEquals(1, result.getAffected());
        assertEquals(3, result.getTotal());
        verify(uploadRecordRepository).remove(broken);
        verify(uploadRecordRepository).remove(expired);
        verify(blobSinkPort).delete("blob-2.part");
    }

    @Test
    public void testSweepSkipsRecordReplacedSinceListing() {
        UploadRecord listed = record(5, now.minusDays(2));
        UploadRecord replacement = record(0, now);
        replacement.setBlobRef("blob-new.part");

        when(uploadRecordRepository.countRecords()).thenReturn(1L);
        when(uploadRecordRepository.findByCreatedOnBefore(any())).thenReturn(List.of(listed));
        when(uploadRecordRepository.findByOwnerAndUploadId(OWNER, UPLOAD_ID)).thenReturn(Optional.of(replacement));

        SweepResult result = uploadService.sweepExpired(false);

        assertEquals(0, result.getAffected());
        verify(uploadRecordRepository, never()).remove(any());
    }

    @Test
    public void testDryRunSweepDeletesNothing() {
        when(uploadRecordRepository.countByOwner(OWNER)).thenReturn(2L);
        when(uploadRecordRepository.findByOwnerAndCreatedOnBefore(OWNER, now.minusDays(1)))
                .thenReturn(List.of(record(5, now.minusDays(2))));

        SweepResult result = uploadService.sweepExpired(OWNER, true);

        assertTrue(result.isDryRun());
        assertEquals(1, result.getAffected());
        assertEquals(2, result.getTotal());
        verify(uploadRecordRepository, never()).remove(any());
        verifyNoInteractions(blobSinkPort);
    }
}
