package dev.tributary.connector;

import java.util.List;

/**
 * Raised before a connector is constructed when a library it needs is not on the classpath.
 */
public class MissingDependencyException extends RuntimeException {

    private final String connectorId;
    private final List<String> missing;

    public MissingDependencyException(String connectorId, List<String> missing) {
        super("Connector '" + connectorId + "' requires missing dependencies: "
                + String.join(", ", missing));
        this.connectorId = connectorId;
        this.missing = List.copyOf(missing);
    }

    public String getConnectorId() {
        return connectorId;
    }

    public List<String> getMissing() {
        return missing;
    }
}
