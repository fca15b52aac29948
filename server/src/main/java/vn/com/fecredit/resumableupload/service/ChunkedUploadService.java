package vn.com.fecredit.resumableupload.service;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import vn.com.fecredit.resumableupload.core.AbstractUploadLifecycleController;
import vn.com.fecredit.resumableupload.core.ExpirationPolicy;
import vn.com.fecredit.resumableupload.core.UploadHooks;
import vn.com.fecredit.resumableupload.model.UploadRecord;
import vn.com.fecredit.resumableupload.model.UploadRecordRepository;
import vn.com.fecredit.resumableupload.port.interfaces.IBlobSinkPort;

/**
 * Upload lifecycle backed by JPA records and the local-disk blob sink.
 *
 * <p>
 * Not transactional: on a restart the deletion of the old record must be committed
 * before its replacement with the same owner and upload id is inserted.
 */
@Service
public class ChunkedUploadService extends AbstractUploadLifecycleController<UploadRecord, UploadRecordRepository> {

    public ChunkedUploadService(
            UploadRecordRepository uploadRecordRepository,
            IBlobSinkPort blobSinkPort,
            ExpirationPolicy expirationPolicy,
            @Value("${chunkedupload.checksum-algorithm:MD5}") String checksumAlgorithm,
            ObjectProvider<UploadHooks<UploadRecord>> hooks) {
        super(uploadRecordRepository, blobSinkPort, expirationPolicy, checksumAlgorithm, hooks.getIfAvailable(UploadHooks::noop));
    }

    @Override
    protected UploadRecord newRecord() {
        return new UploadRecord();
    }
}
