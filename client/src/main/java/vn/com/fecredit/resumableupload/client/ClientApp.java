package vn.com.fecredit.resumableupload.client;

import vn.com.fecredit.resumableupload.model.UploadStatusView;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

public class ClientApp {

    public static void main(String[] args) {
        if (args.length == 0 || (args.length == 1 && args[0].equalsIgnoreCase("--help"))) {
            printHelp();
            return;
        }

        Map<String, String> params = parseArgs(args);

        if (!params.containsKey("filePath") || !params.containsKey("uploadUrl") || !params.containsKey("username") || !params.containsKey("password")) {
            System.err.println("Error: Missing required arguments: filePath, uploadUrl, username, password");
            printHelp();
            System.exit(1);
        }

        try {
            Path filePath = Paths.get(params.get("filePath"));
            ChunkedUploadClient client = new ChunkedUploadClient.Builder()
                    .uploadUrl(params.get("uploadUrl"))
                    .username(params.get("username"))
                    .password(params.get("password"))
                    .chunkSize(Integer.parseInt(params.getOrDefault("chunkSize", "524288")))
                    .retryTimes(Integer.parseInt(params.getOrDefault("retryTimes", "3")))
                    .build();

            System.out.println("Starting upload for file: " + filePath);
            UploadStatusView result = client.upload(filePath);
            System.out.println("Upload finished. Upload ID: " + result.getUploadId() + ", status: " + result.getStatus()
                    + ", bytes: " + result.getOffset());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.println("Upload interrupted");
            System.exit(1);
        } catch (Exception e) {
            System.err.println("Upload failed: " + e.getMessage());
            if (e.getCause() != null) {
                System.err.println("Cause: " + e.getCause().getMessage());
            }
            System.exit(1);
        }
    }

    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> params = new HashMap<>();
        for (String arg : args) {
            if (arg.startsWith("--")) {
                String[] parts = arg.substring(2).split("=", 2);
                if (parts.length == 2) {
                    params.put(parts[0], parts[1]);
                }
            }
        }
        return params;
    }

    private static void printHelp() {
        System.out.println("Usage: java -cp <classpath> vn.com.fecredit.resumableupload.client.ClientApp [options]");
        System.out.println("Options:");
        System.out.println("  --filePath=<path>          : Required. Path to the file to upload.");
        System.out.println("  --uploadUrl=<url>          : Required. The server's base upload URL (e.g., http://localhost:8080/api/upload).");
        System.out.println("  --username=<user>          : Required. Username for authentication.");
        System.out.println("  --password=<pass>          : Required. Password for authentication.");
        System.out.println("  --chunkSize=<bytes>        : Optional. Bytes per chunk (default: 524288).");
        System.out.println("  --retryTimes=<num>         : Optional. Number of retries for failed requests (default: 3).");
        System.out.println("  --help                     : Print this help message.");
    }
}
