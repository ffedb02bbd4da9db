package dev.tributary.connector;

import dev.tributary.config.ConfigurationException;
import dev.tributary.document.DocumentRecordFactory;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Registry of available connector variants keyed by id.
 */
@Component
public class ConnectorRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConnectorRegistry.class);

    private final Map<String, ConnectorFactory> factories = new TreeMap<>();

    public ConnectorRegistry(List<ConnectorFactory> factories) {
        for (ConnectorFactory factory : factories) {
            ConnectorFactory previous = this.factories.put(factory.id(), factory);
            if (previous != null) {
                throw new IllegalStateException("Duplicate connector id: " + factory.id());
            }
        }
    }

    public List<String> ids() {
        return List.copyOf(factories.keySet());
    }

    /**
     * @throws ConfigurationException if no connector has this id
     */
    public ConnectorFactory factory(String id) {
        ConnectorFactory factory = factories.get(id);
        if (factory == null) {
            throw new ConfigurationException("Unknown connector '" + id + "'. Available: " + ids());
        }
        return factory;
    }

    /**
     * Check dependencies, then build the connector.
     *
     * @throws ConfigurationException      if the id is unknown or options are invalid
     * @throws MissingDependencyException  if a required library is absent
     */
    public Connector create(String id, ConnectorOptions options, DocumentRecordFactory recordFactory) {
        ConnectorFactory factory = factory(id);
        DependencyCheck.requireAll(id, factory.requiredDependencies());
        Connector connector = factory.create(options, recordFactory);
        log.debug("Created connector {}", id);
        return connector;
    }
}
