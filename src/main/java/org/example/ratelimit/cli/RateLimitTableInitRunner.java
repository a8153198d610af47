package org.example.ratelimit.cli;

import org.example.ratelimit.repository.RateLimitSchema;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.sql.Connection;
import java.sql.DriverManager;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Provisions the rate limit table outside the application lifecycle, for deploy pipelines
 * and fresh environments.
 */
public class RateLimitTableInitRunner {

    private static final String HELP_FLAG = "--help";
    private static final String URL_FLAG = "--url";
    private static final String USER_FLAG = "--user";
    private static final String PASSWORD_FLAG = "--password";
    private static final String RETENTION_MINUTES_FLAG = "--retention-minutes";

    private static final Set<String> VALUE_OPTIONS = Set.of(
            URL_FLAG, USER_FLAG, PASSWORD_FLAG, RETENTION_MINUTES_FLAG
    );

    private static final long DEFAULT_RETENTION_MINUTES = 60;

    public static void main(String[] args) {
        int exit = run(args, System.out, System.err);
        if (exit != 0) {
            System.exit(exit);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        ParsedArgs parsed;
        long retentionMinutes;
        try {
            parsed = parseArgs(args);
            retentionMinutes = parseRetention(parsed);
        } catch (IllegalArgumentException e) {
            err.println("Argument error: " + e.getMessage());
            printUsage(err);
            return 1;
        }

        if (parsed.help()) {
            printUsage(out);
            return 0;
        }

        DbConfig db = resolveDbConfig(parsed, loadProperties(err));
        if (db.url() == null || db.url().isBlank()) {
            err.println("Missing DB URL. Provide --url or set RATE_LIMIT_DB_URL/SPRING_DATASOURCE_URL.");
            return 1;
        }

        out.println("Target URL: " + db.url());
        out.println("Stale-row retention: " + retentionMinutes + " minutes");

        Instant cutoff = Instant.now().minus(Duration.ofMinutes(retentionMinutes));
        try (Connection connection = DriverManager.getConnection(db.url(), db.user(), db.password())) {
            int purged = RateLimitSchema.provision(connection, cutoff);
            out.println("Rate limit table '" + RateLimitSchema.TABLE_NAME + "' ready.");
            out.println("Purged stale rows: " + purged);
            return 0;
        } catch (Exception e) {
            err.println("Rate limit table initialization failed: " + e.getMessage());
            return 1;
        }
    }

    private static ParsedArgs parseArgs(String[] args) {
        Map<String, String> options = new HashMap<>();
        boolean help = false;
        for (int i = 0; i < args.length; i++) {
            String token = args[i];
            if (HELP_FLAG.equals(token)) {
                help = true;
            } else if (!VALUE_OPTIONS.contains(token)) {
                throw new IllegalArgumentException("Unknown option: " + token);
            } else if (i + 1 == args.length) {
                throw new IllegalArgumentException("Missing value for option: " + token);
            } else {
                options.put(token, args[++i]);
            }
        }
        return new ParsedArgs(options, help);
    }

    private static long parseRetention(ParsedArgs parsed) {
        Optional<String> raw = parsed.optionValue(RETENTION_MINUTES_FLAG);
        if (raw.isEmpty()) {
            return DEFAULT_RETENTION_MINUTES;
        }
        try {
            long minutes = Long.parseLong(raw.get().trim());
            if (minutes < 0) {
                throw new IllegalArgumentException("Retention must not be negative: " + raw.get());
            }
            return minutes;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Retention is not a number: " + raw.get());
        }
    }

    private static DbConfig resolveDbConfig(ParsedArgs parsed, Properties properties) {
        String url = firstNonBlank(
                parsed.optionValue(URL_FLAG).orElse(null),
                System.getenv("RATE_LIMIT_DB_URL"),
                System.getenv("SPRING_DATASOURCE_URL"),
                properties.getProperty("spring.datasource.url")
        );
        String user = firstNonBlank(
                parsed.optionValue(USER_FLAG).orElse(null),
                System.getenv("RATE_LIMIT_DB_USERNAME"),
                System.getenv("SPRING_DATASOURCE_USERNAME"),
                properties.getProperty("spring.datasource.username"),
                ""
        );
        String password = firstNonBlank(
                parsed.optionValue(PASSWORD_FLAG).orElse(null),
                System.getenv("RATE_LIMIT_DB_PASSWORD"),
                System.getenv("SPRING_DATASOURCE_PASSWORD"),
                properties.getProperty("spring.datasource.password"),
                ""
        );
        return new DbConfig(url, user, password);
    }

    private static Properties loadProperties(PrintStream err) {
        Properties properties = new Properties();
        try (InputStream input = RateLimitTableInitRunner.class.getResourceAsStream("/application.properties")) {
            if (input != null) {
                properties.load(input);
            }
        } catch (IOException e) {
            err.println("Ignoring unreadable application.properties: " + e.getMessage());
        }
        return properties;
    }

    private static String firstNonBlank(String... values) {
        return Stream.of(values)
                .filter(value -> value != null && !value.isBlank())
                .map(String::trim)
                .findFirst()
                .orElse("");
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage: RateLimitTableInitRunner [options]");
        out.println("  --url <jdbc-url>             Target DB URL (default: env, then application.properties).");
        out.println("  --user <username>            DB username.");
        out.println("  --password <pass>            DB password.");
        out.println("  --retention-minutes <n>      Purge rows whose window closed more than n minutes ago (default 60).");
        out.println("  --help                       Show this help.");
        out.println();
        out.println("Environment fallbacks:");
        out.println("  RATE_LIMIT_DB_URL / *_USERNAME / *_PASSWORD,");
        out.println("  then SPRING_DATASOURCE_URL / *_USERNAME / *_PASSWORD");
    }

    private record ParsedArgs(Map<String, String> options, boolean help) {
        private Optional<String> optionValue(String option) {
            return Optional.ofNullable(options.get(option));
        }
    }

    private record DbConfig(String url, String user, String password) {
    }
}
