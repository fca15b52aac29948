package vn.com.fecredit.resumableupload.util;

import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;
import vn.com.fecredit.resumableupload.UploadApplication;
import vn.com.fecredit.resumableupload.core.SweepResult;
import vn.com.fecredit.resumableupload.service.ChunkedUploadService;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;

/**
 * Deletes uploads that have already expired, together with their blobs.
 * With {@code --pretend} nothing is removed, only counted.
 */
public class DeleteExpiredUploadsUtility {

    private static final String USAGE =
            "Usage: java -cp <classpath> vn.com.fecredit.resumableupload.util.DeleteExpiredUploadsUtility [--pretend] [--owner=<username>]";

    public static void main(String[] args) {
        List<String> options = Arrays.asList(args);
        if (options.contains("--help") || options.contains("-h")) {
            System.out.println(USAGE);
            System.exit(1);
        }
        boolean pretend = options.contains("--pretend");
        String owner = options.stream()
                .filter(a -> a.startsWith("--owner="))
                .map(a -> a.substring("--owner=".length()))
                .findFirst()
                .orElse(null);

        try (ConfigurableApplicationContext ctx = new SpringApplicationBuilder(UploadApplication.class)
                .web(WebApplicationType.NONE)
                .properties("chunkedupload.cleanup-enabled=false")
                .run()) {
            run(ctx.getBean(ChunkedUploadService.class), owner, pretend, System.out);
        }
    }

    static SweepResult run(ChunkedUploadService uploadService, String owner, boolean pretend, PrintStream out) {
        if (pretend) {
            out.println("Called with --pretend option, nothing done, just pretending");
        }
        SweepResult result = uploadService.sweepExpired(owner, pretend);
        out.printf("%d expired uploads deleted, of %d total uploads%n", result.getAffected(), result.getTotal());
        return result;
    }
}
