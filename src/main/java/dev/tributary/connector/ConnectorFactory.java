package dev.tributary.connector;

import dev.tributary.document.DocumentRecordFactory;
import java.util.List;

/**
 * Creates one connector variant from resolved options. Implementations are Spring beans collected
 * by {@link ConnectorRegistry}.
 */
public interface ConnectorFactory {

    /** Connector id, used as CLI subcommand. */
    String id();

    /**
     * Classes that must be loadable before {@link #create} is called. Checked by the registry
     * with {@link DependencyCheck}. Only connectors backed by an optional client library, one the
     * build does not always ship, need to list anything here.
     */
    default List<String> requiredDependencies() {
        return List.of();
    }

    /**
     * Option naming the source root, used to derive the default download directory.
     */
    default String sourceRootOption() {
        return "remote-url";
    }

    /**
     * Build a configured, not yet initialized connector.
     *
     * @throws dev.tributary.config.ConfigurationException if options are missing or invalid
     */
    Connector create(ConnectorOptions options, DocumentRecordFactory recordFactory);
}
