package dev.tributary;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the Tributary ingestion CLI.
 *
 * <p>The first non-option argument selects the connector (e.g. {@code local}, {@code dropbox});
 * see {@link dev.tributary.cli.IngestCommand}. The process exit code reflects configuration and
 * connection failures only; per-document failures are reported in the batch summary.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class TributaryApplication {
    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(TributaryApplication.class, args)));
    }
}
