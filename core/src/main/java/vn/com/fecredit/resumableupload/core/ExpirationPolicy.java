package vn.com.fecredit.resumableupload.core;

import vn.com.fecredit.resumableupload.model.interfaces.IUploadRecord;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Decides when an upload record expires. A record expires once more than the
 * configured window has passed since it was created, whatever its status.
 */
public class ExpirationPolicy {

    private final Duration expiration;
    private final Clock clock;

    public ExpirationPolicy(Duration expiration, Clock clock) {
        if (expiration == null || expiration.isNegative() || expiration.isZero()) {
            throw new IllegalArgumentException("Expiration window must be positive: " + expiration);
        }
        this.expiration = expiration;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Duration getExpiration() {
        return expiration;
    }

    public Clock getClock() {
        return clock;
    }

    public LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    public LocalDateTime expiresOn(IUploadRecord record) {
        return record.getCreatedOn().plus(expiration);
    }

    public boolean isExpired(IUploadRecord record) {
        return now().isAfter(expiresOn(record));
    }

    /**
     * Records created before this instant are expired.
     */
    public LocalDateTime cutoff() {
        return now().minus(expiration);
    }
}
