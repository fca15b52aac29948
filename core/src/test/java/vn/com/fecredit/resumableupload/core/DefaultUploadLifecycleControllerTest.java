package vn.com.fecredit.resumableupload.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import vn.com.fecredit.resumableupload.exception.BadRequestException;
import vn.com.fecredit.resumableupload.exception.ChecksumMismatchException;
import vn.com.fecredit.resumableupload.exception.InvalidChunkException;
import vn.com.fecredit.resumableupload.exception.InvalidStateException;
import vn.com.fecredit.resumableupload.exception.OffsetMismatchException;
import vn.com.fecredit.resumableupload.exception.UploadExpiredException;
import vn.com.fecredit.resumableupload.model.UploadStatus;
import vn.com.fecredit.resumableupload.model.UploadStatusView;
import vn.com.fecredit.resumableupload.model.impl.DefaultUploadRecord;
import vn.com.fecredit.resumableupload.model.util.ChecksumUtil;
import vn.com.fecredit.resumableupload.port.impl.DefaultIUploadRecordPort;
import vn.com.fecredit.resumableupload.port.impl.FileSystemBlobSinkPort;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class DefaultUploadLifecycleControllerTest {

    private static final String OWNER = "alice";
    private static final String HELLOWORLD_MD5 = "fc5e038d38a57032085441e7fe7010b0";

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private DefaultIUploadRecordPort recordPort;
    private FileSystemBlobSinkPort blobSink;
    private DefaultUploadLifecycleController controller;

    @BeforeEach
    void setUp() throws IOException {
        clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
        recordPort = new DefaultIUploadRecordPort();
        blobSink = new FileSystemBlobSinkPort(tempDir.toString());
        controller = new DefaultUploadLifecycleController(recordPort, blobSink,
                new ExpirationPolicy(Duration.ofDays(1), clock), ChecksumUtil.MD5, UploadHooks.noop());
    }

    private UploadStatusView send(String uploadId, long start, long end, long total, String data, String checksum) throws IOException {
        return controller.handleChunk(OWNER, uploadId, "greeting.txt", start, end, total,
                data.getBytes(StandardCharsets.UTF_8), checksum);
    }

    private long blobCount() throws IOException {
        try (Stream<Path> files = Files.list(tempDir)) {
            return files.count();
        }
    }

    @Test
    void testTwoChunkUploadCompletes() throws IOException {
        UploadStatusView first = send("u1", 0, 4, 10, "hello", HELLOWORLD_MD5);
        assertEquals(5, first.getOffset());
        assertEquals(UploadStatus.IN_PROGRESS, first.getStatus());
        assertEquals("u1", first.getUploadId());
        assertEquals(5, controller.queryOffset(OWNER, "u1"));

        UploadStatusView second = send("u1", 5, 9, 10, "world", HELLOWORLD_MD5);
        assertEquals(10, second.getOffset());
        assertEquals(UploadStatus.COMPLETE, second.getStatus());

        DefaultUploadRecord record = controller.findUpload(OWNER, "u1").orElseThrow();
        assertNotNull(record.getCompletedOn());
        assertEquals(record.getCreatedOn().plusDays(1), second.getExpires());
        assertEquals("helloworld", Files.readString(blobSink.getRootDir().resolve(record.getBlobRef())));
    }

    @Test
    void testChecksumIsComparedCaseInsensitively() throws IOException {
        UploadStatusView view = send("u1", 0, 9, 10, "helloworld", HELLOWORLD_MD5.toUpperCase());
        assertEquals(UploadStatus.COMPLETE, view.getStatus());
    }

    @Test
    void testWrongChecksumMarksUploadFailed() throws IOException {
        send("u1", 0, 4, 10, "hello", "0".repeat(32));

        ChecksumMismatchException ex = assertThrows(ChecksumMismatchException.class, () ->
                send("u1", 5, 9, 10, "world", "0".repeat(32)));
        assertEquals("md5 checksum does not match", ex.getMessage());

        DefaultUploadRecord record = controller.findUpload(OWNER, "u1").orElseThrow();
        assertEquals(UploadStatus.FAILED, record.getStatus());
        assertEquals(10, record.getOffset());
        assertNull(record.getCompletedOn());
    }

    @Test
    void testMissingChecksumMarksUploadFailed() throws IOException {
        assertThrows(ChecksumMismatchException.class, () -> send("u1", 0, 9, 10, "helloworld", null));
        assertEquals(UploadStatus.FAILED, controller.findUpload(OWNER, "u1").orElseThrow().getStatus());
    }

    @Test
    void testChunkAtZeroRestartsUpload() throws IOException {
        send("u1", 0, 4, 10, "HELLO", HELLOWORLD_MD5);
        String oldBlob = controller.findUpload(OWNER, "u1").orElseThrow().getBlobRef();

        UploadStatusView restarted = send("u1", 0, 4, 10, "hello", HELLOWORLD_MD5);
        assertEquals(5, restarted.getOffset());
        String newBlob = controller.findUpload(OWNER, "u1").orElseThrow().getBlobRef();
        assertNotEquals(oldBlob, newBlob);
        assertFalse(Files.exists(blobSink.getRootDir().resolve(oldBlob)));
        assertEquals(1, blobCount());

        assertEquals(UploadStatus.COMPLETE, send("u1", 5, 9, 10, "world", HELLOWORLD_MD5).getStatus());
    }

    @Test
    void testOffsetMismatchDoesNotMutateUpload() throws IOException {
        send("u1", 0, 4, 10, "hello", HELLOWORLD_MD5);

        assertThrows(OffsetMismatchException.class, () -> send("u1", 6, 9, 10, "orld", HELLOWORLD_MD5));
        assertEquals(5, controller.queryOffset(OWNER, "u1"));
        assertEquals(UploadStatus.IN_PROGRESS, controller.findUpload(OWNER, "u1").orElseThrow().getStatus());
    }

    @Test
    void testFirstChunkNotAtZeroCreatesNothing() throws IOException {
        assertThrows(OffsetMismatchException.class, () -> send("u1", 5, 9, 10, "world", HELLOWORLD_MD5));
        assertTrue(controller.findUpload(OWNER, "u1").isEmpty());
        assertEquals(0, blobCount());
    }

    @Test
    void testInvalidFirstChunkLeavesNoOrphanBlob() throws IOException {
        assertThrows(InvalidChunkException.class, () -> send("u1", 0, 9, 10, "hello", HELLOWORLD_MD5));
        assertTrue(controller.findUpload(OWNER, "u1").isEmpty());
        assertEquals(0, blobCount());
    }

    @Test
    void testFailedStoreOfNewRecordReleasesBlob() throws IOException {
        DefaultIUploadRecordPort rejectingPort = new DefaultIUploadRecordPort() {
            @Override
            public DefaultUploadRecord store(DefaultUploadRecord record) {
                throw new IllegalStateException("duplicate upload");
            }
        };
        DefaultUploadLifecycleController rejecting = new DefaultUploadLifecycleController(rejectingPort, blobSink,
                new ExpirationPolicy(Duration.ofDays(1), clock), ChecksumUtil.MD5, UploadHooks.noop());

        assertThrows(IllegalStateException.class, () -> rejecting.handleChunk(OWNER, "u1", "greeting.txt", 0, 4, 10,
                "hello".getBytes(StandardCharsets.UTF_8), HELLOWORLD_MD5));
        assertEquals(0, rejectingPort.countRecords());
        assertEquals(0, blobCount());
    }

    @Test
    void testFailedStoreOfExistingRecordKeepsBlob() throws IOException {
        boolean[] failing = {false};
        DefaultIUploadRecordPort flakyPort = new DefaultIUploadRecordPort() {
            @Override
            public DefaultUploadRecord store(DefaultUploadRecord record) {
                if (failing[0]) {
                    throw new IllegalStateException("store unavailable");
                }
                return super.store(record);
            }
        };
        DefaultUploadLifecycleController flaky = new DefaultUploadLifecycleController(flakyPort, blobSink,
                new ExpirationPolicy(Duration.ofDays(1), clock), ChecksumUtil.MD5, UploadHooks.noop());
        flaky.handleChunk(OWNER, "u1", "greeting.txt", 0, 4, 10, "hello".getBytes(StandardCharsets.UTF_8), HELLOWORLD_MD5);

        failing[0] = true;
        assertThrows(IllegalStateException.class, () -> flaky.handleChunk(OWNER, "u1", "greeting.txt", 5, 9, 10,
                "world".getBytes(StandardCharsets.UTF_8), HELLOWORLD_MD5));
        assertEquals(1, blobCount());
        assertTrue(flaky.findUpload(OWNER, "u1").isPresent());
    }

    @Test
    void testExpiredUploadIsGone() throws IOException {
        send("u1", 0, 4, 10, "hello", HELLOWORLD_MD5);
        clock.advance(Duration.ofDays(1).plusMinutes(1));

        assertThrows(UploadExpiredException.class, () -> send("u1", 5, 9, 10, "world", HELLOWORLD_MD5));
        assertEquals(5, controller.queryOffset(OWNER, "u1"));
    }

    @Test
    void testCompletedUploadRejectsFurtherChunks() throws IOException {
        send("u1", 0, 9, 10, "helloworld", HELLOWORLD_MD5);

        InvalidStateException ex = assertThrows(InvalidStateException.class, () ->
                send("u1", 10, 10, 11, "!", HELLOWORLD_MD5));
        assertEquals("Upload has already been marked as \"complete\"", ex.getMessage());
        assertThrows(InvalidStateException.class, () -> send("u1", 0, 9, 10, "helloworld", HELLOWORLD_MD5));
    }

    @Test
    void testUnknownUploadHasOffsetZero() {
        assertEquals(0, controller.queryOffset(OWNER, "missing"));
        assertEquals(0, controller.queryOffset("bob", "missing"));
    }

    @Test
    void testUploadsAreScopedByOwner() throws IOException {
        send("u1", 0, 4, 10, "hello", HELLOWORLD_MD5);
        assertEquals(0, controller.queryOffset("bob", "u1"));

        UploadStatusView bobs = controller.handleChunk("bob", "u1", "other.txt", 0, 2, 3,
                "abc".getBytes(StandardCharsets.UTF_8), "900150983cd24fb0d6963f7d28e17f72");
        assertEquals(UploadStatus.COMPLETE, bobs.getStatus());
        assertEquals(5, controller.queryOffset(OWNER, "u1"));
    }

    @Test
    void testSweepDeletesOnlyExpiredUploads() throws IOException {
        send("old", 0, 4, 10, "hello", HELLOWORLD_MD5);
        send("done", 0, 9, 10, "helloworld", HELLOWORLD_MD5);
        clock.advance(Duration.ofHours(23));
        send("fresh", 0, 4, 10, "hello", HELLOWORLD_MD5);
        clock.advance(Duration.ofHours(2));

        SweepResult preview = controller.sweepExpired(true);
        assertTrue(preview.isDryRun());
        assertEquals(2, preview.getAffected());
        assertEquals(3, preview.getTotal());
        assertEquals(3, recordPort.countRecords());
        assertEquals(3, blobCount());

        SweepResult result = controller.sweepExpired(false);
        assertEquals(preview.getAffected(), result.getAffected());
        assertEquals(3, result.getTotal());
        assertEquals(1, recordPort.countRecords());
        assertEquals(1, blobCount());
        assertTrue(controller.findUpload(OWNER, "fresh").isPresent());
        assertEquals("2 expired uploads deleted, of 3 total uploads", result.toString());
    }

    @Test
    void testSweepCanBeScopedToOneOwner() throws IOException {
        send("u1", 0, 4, 10, "hello", HELLOWORLD_MD5);
        controller.handleChunk("bob", "u1", "b.txt", 0, 2, 10, "abc".getBytes(StandardCharsets.UTF_8), null);
        clock.advance(Duration.ofDays(2));

        SweepResult result = controller.sweepExpired("bob", false);
        assertEquals(1, result.getAffected());
        assertEquals(1, result.getTotal());
        assertTrue(controller.findUpload(OWNER, "u1").isPresent());
        assertTrue(controller.findUpload("bob", "u1").isEmpty());
    }

    @Test
    void testExpiredUploadCanBeRestartedAfterSweep() throws IOException {
        send("u1", 0, 4, 10, "hello", HELLOWORLD_MD5);
        clock.advance(Duration.ofDays(2));
        controller.sweepExpired(false);

        assertEquals(0, controller.queryOffset(OWNER, "u1"));
        assertEquals(UploadStatus.COMPLETE, send("u1", 0, 9, 10, "helloworld", HELLOWORLD_MD5).getStatus());
    }

    @Test
    void testHooksAreInvokedAroundLifecycle() throws IOException {
        List<String> calls = new ArrayList<>();
        UploadHooks<DefaultUploadRecord> hooks = new UploadHooks<>() {
            @Override
            public void validate(ChunkRequest request) {
                if (request.getFilename().endsWith(".exe")) {
                    throw new BadRequestException("Executable files are not accepted");
                }
            }

            @Override
            public void applyExtraAttributes(DefaultUploadRecord record, ChunkRequest request) {
                calls.add("attributes");
            }

            @Override
            public void preSave(DefaultUploadRecord record, boolean created) {
                calls.add("preSave:" + created);
            }

            @Override
            public void postSave(DefaultUploadRecord record, boolean created) {
                calls.add("postSave:" + created);
            }

            @Override
            public UploadStatusView onCompletion(DefaultUploadRecord record, UploadStatusView view) {
                return view.put("filename", record.getFilename());
            }
        };
        controller = new DefaultUploadLifecycleController(recordPort, blobSink,
                new ExpirationPolicy(Duration.ofDays(1), clock), ChecksumUtil.MD5, hooks);

        assertThrows(BadRequestException.class, () -> controller.handleChunk(OWNER, "bad", "setup.exe", 0, 0, 1,
                new byte[]{1}, null));
        assertEquals(0, blobCount());

        send("u1", 0, 4, 10, "hello", HELLOWORLD_MD5);
        UploadStatusView done = send("u1", 5, 9, 10, "world", HELLOWORLD_MD5);

        assertEquals("greeting.txt", done.getAttributes().get("filename"));
        assertEquals(List.of("attributes", "preSave:true", "postSave:true",
                "preSave:false", "postSave:false", "preSave:false", "postSave:false"), calls);
    }
}
