package dev.tributary.cli;

import dev.tributary.config.ConfigurationException;
import dev.tributary.connector.ConnectionException;
import dev.tributary.connector.Connector;
import dev.tributary.connector.ConnectorFactory;
import dev.tributary.connector.ConnectorOptions;
import dev.tributary.connector.ConnectorRegistry;
import dev.tributary.connector.MissingDependencyException;
import dev.tributary.document.DocumentPaths;
import dev.tributary.document.DocumentRecordFactory;
import dev.tributary.pipeline.BatchCancellation;
import dev.tributary.pipeline.BatchSummary;
import dev.tributary.pipeline.Pipeline;
import dev.tributary.pipeline.PipelineProperties;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Command-line entry point: {@code tributary <connector-id> --remote-url=<root> [--recursive]
 * [--token=<t>] [--file-glob=<g>]}.
 *
 * <p>Exit codes: 0 when the batch completed (even with per-record failures), 2 on configuration
 * or missing-dependency errors, 3 when the source is unreachable or rejects the credentials, 1 on
 * anything else. Closing the application context (e.g. on Ctrl-C) cancels dispatch of further
 * records.
 */
@Component
public class IngestCommand implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_UNEXPECTED = 1;
    static final int EXIT_CONFIGURATION = 2;
    static final int EXIT_CONNECTION = 3;

    private static final Logger log = LoggerFactory.getLogger(IngestCommand.class);

    private static final Set<String> PROPERTY_PREFIXES = Set.of("spring.", "tributary.", "logging.", "debug", "trace");

    private final ConnectorRegistry connectorRegistry;
    private final PipelineProperties properties;
    private final ObjectProvider<Pipeline> pipeline;
    private final Environment environment;
    private final BatchCancellation cancellation = new BatchCancellation();

    private volatile int exitCode = EXIT_OK;
    private volatile @Nullable BatchSummary lastSummary;

    public IngestCommand(ConnectorRegistry connectorRegistry,
                         PipelineProperties properties,
                         ObjectProvider<Pipeline> pipeline,
                         Environment environment) {
        this.connectorRegistry = connectorRegistry;
        this.properties = properties;
        this.pipeline = pipeline;
        this.environment = environment;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.isEmpty()) {
            log.info("Usage: tributary <connector> --remote-url=<root> [--recursive] [options]");
            log.info("Available connectors: {}", connectorRegistry.ids());
            return;
        }
        String connectorId = positional.get(0);
        try {
            ConnectorFactory factory = connectorRegistry.factory(connectorId);
            ConnectorOptions options = new ConnectorOptions(connectorId, connectorFlags(args), environment);
            DocumentPaths paths = properties.documentPaths(connectorId, options.require(factory.sourceRootOption()));
            Connector connector = connectorRegistry.create(connectorId, options, new DocumentRecordFactory(paths));
            lastSummary = pipeline.getObject().run(connector, cancellation);
            exitCode = EXIT_OK;
        } catch (ConfigurationException | MissingDependencyException e) {
            log.error("Configuration error: {}", e.getMessage());
            exitCode = EXIT_CONFIGURATION;
        } catch (ConnectionException e) {
            log.error("Connection error: {}", e.getMessage(), e);
            exitCode = EXIT_CONNECTION;
        } catch (BeansException e) {
            Throwable root = NestedExceptionUtils.getMostSpecificCause(e);
            if (root instanceof ConfigurationException) {
                log.error("Configuration error: {}", root.getMessage());
                exitCode = EXIT_CONFIGURATION;
            } else {
                log.error("Failed to build the pipeline", e);
                exitCode = EXIT_UNEXPECTED;
            }
        } catch (RuntimeException e) {
            log.error("Ingestion failed unexpectedly", e);
            exitCode = EXIT_UNEXPECTED;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    public @Nullable BatchSummary lastSummary() {
        return lastSummary;
    }

    @EventListener(ContextClosedEvent.class)
    public void onContextClosed() {
        if (!cancellation.isCancelled()) {
            log.debug("Application context closing, cancelling further dispatch");
            cancellation.cancel();
        }
    }

    /** Command-line options minus Spring property overrides. */
    static Map<String, List<String>> connectorFlags(ApplicationArguments args) {
        Map<String, List<String>> flags = new LinkedHashMap<>();
        for (String name : args.getOptionNames()) {
            if (PROPERTY_PREFIXES.stream().noneMatch(name::startsWith)) {
                List<String> values = args.getOptionValues(name);
                flags.put(name, values == null ? List.of() : List.copyOf(values));
            }
        }
        return flags;
    }
}
