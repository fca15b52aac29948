package vn.com.fecredit.resumableupload.util;

import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.security.crypto.password.PasswordEncoder;
import vn.com.fecredit.resumableupload.UploadApplication;
import vn.com.fecredit.resumableupload.model.TenantAccount;
import vn.com.fecredit.resumableupload.model.TenantAccountRepository;

import java.io.PrintStream;

/**
 * Provisions an upload owner account.
 */
public class CreateUserUtility {

    private static final String USAGE =
            "Usage: java -cp <classpath> vn.com.fecredit.resumableupload.util.CreateUserUtility <tenantId> <username> <password>";

    public static void main(String[] args) {
        if (args.length != 3 || "--help".equals(args[0]) || "-h".equals(args[0])) {
            System.out.println(USAGE);
            System.out.println("All parameters are required and must be non-empty.");
            System.exit(1);
        }
        String tenantId = args[0].trim();
        String username = args[1].trim();
        String rawPassword = args[2].trim();

        if (tenantId.isEmpty() || username.isEmpty() || rawPassword.isEmpty()) {
            System.err.println("Error: All parameters must be non-empty.");
            System.out.println(USAGE);
            System.exit(2);
        }

        try (ConfigurableApplicationContext ctx = new SpringApplicationBuilder(UploadApplication.class)
                .web(WebApplicationType.NONE)
                .properties("chunkedupload.cleanup-enabled=false")
                .run()) {
            createUser(ctx.getBean(TenantAccountRepository.class), ctx.getBean(PasswordEncoder.class),
                    tenantId, username, rawPassword, System.out);
        }
    }

    /**
     * Saves a new account unless the username is taken.
     *
     * @return true if the account was created
     */
    static boolean createUser(TenantAccountRepository repo, PasswordEncoder encoder,
                              String tenantId, String username, String rawPassword, PrintStream out) {
        if (repo.findByUsername(username).isPresent()) {
            out.println("User already exists: " + username);
            return false;
        }
        TenantAccount user = new TenantAccount();
        user.setTenantId(tenantId);
        user.setUsername(username);
        user.setPassword(encoder.encode(rawPassword));
        repo.save(user);
        out.println("User created: " + username);
        return true;
    }
}
