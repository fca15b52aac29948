package vn.com.fecredit.resumableupload.core;

import vn.com.fecredit.resumableupload.model.impl.DefaultUploadRecord;
import vn.com.fecredit.resumableupload.port.impl.DefaultIUploadRecordPort;
import vn.com.fecredit.resumableupload.port.interfaces.IBlobSinkPort;

/**
 * Lifecycle controller over the POJO record type, for use without a persistence framework.
 */
public class DefaultUploadLifecycleController extends AbstractUploadLifecycleController<DefaultUploadRecord, DefaultIUploadRecordPort> {

    public DefaultUploadLifecycleController(DefaultIUploadRecordPort uploadRecordPort, IBlobSinkPort blobSinkPort,
                                            ExpirationPolicy expirationPolicy, String checksumAlgorithm,
                                            UploadHooks<DefaultUploadRecord> hooks) {
        super(uploadRecordPort, blobSinkPort, expirationPolicy, checksumAlgorithm, hooks);
    }

    @Override
    protected DefaultUploadRecord newRecord() {
        return new DefaultUploadRecord();
    }
}
