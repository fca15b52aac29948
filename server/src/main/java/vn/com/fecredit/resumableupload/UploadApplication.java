package vn.com.fecredit.resumableupload;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EntityScan("vn.com.fecredit.resumableupload.model")
@EnableJpaRepositories("vn.com.fecredit.resumableupload.model")
public class UploadApplication {
    /**
     * The main method which serves as the entry point for the upload server.
     * It delegates to Spring Boot's {@link SpringApplication} to run the application.
     *
     * @param args Command line arguments passed to the application.
     */
    public static void main(String[] args) {
        SpringApplication.run(UploadApplication.class, args);
    }
}
