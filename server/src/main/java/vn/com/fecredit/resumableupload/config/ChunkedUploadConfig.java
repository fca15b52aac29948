package vn.com.fecredit.resumableupload.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import vn.com.fecredit.resumableupload.core.ExpirationPolicy;
import vn.com.fecredit.resumableupload.port.impl.FileSystemBlobSinkPort;
import vn.com.fecredit.resumableupload.port.interfaces.IBlobSinkPort;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;

/**
 * Wires the framework-free upload engine collaborators from {@code chunkedupload.*} properties.
 */
@Configuration
public class ChunkedUploadConfig {

    private static final Logger log = LoggerFactory.getLogger(ChunkedUploadConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public IBlobSinkPort blobSinkPort(@Value("${chunkedupload.upload-dir:uploads/chunks}") String uploadDir) throws IOException {
        FileSystemBlobSinkPort sink = new FileSystemBlobSinkPort(uploadDir);
        log.info("Storing upload blobs under {}", sink.getRootDir());
        return sink;
    }

    @Bean
    public ExpirationPolicy expirationPolicy(@Value("${chunkedupload.expiration-minutes:1440}") long expirationMinutes,
                                             Clock clock) {
        log.info("Uploads expire {} minutes after creation", expirationMinutes);
        return new ExpirationPolicy(Duration.ofMinutes(expirationMinutes), clock);
    }
}
