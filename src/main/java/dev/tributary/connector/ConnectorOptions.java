package dev.tributary.connector;

import dev.tributary.config.ConfigurationException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.springframework.core.env.PropertyResolver;

/**
 * Connector settings resolved from command-line flags and the environment.
 *
 * <p>Resolution order: a command-line flag ({@code --token=...}) overrides the environment property
 * {@code tributary.connector.<id>.<name>}, which Spring also resolves from the environment
 * variable {@code TRIBUTARY_CONNECTOR_<ID>_<NAME>}.
 */
public final class ConnectorOptions {

    private final String connectorId;
    private final Map<String, List<String>> flags;
    private final PropertyResolver environment;

    /**
     * @param connectorId the selected connector
     * @param flags       command-line option values by option name; a flag given without a value
     *                    maps to an empty list
     * @param environment fallback property source
     */
    public ConnectorOptions(String connectorId, Map<String, List<String>> flags, PropertyResolver environment) {
        this.connectorId = connectorId;
        this.flags = Map.copyOf(flags);
        this.environment = environment;
    }

    public String connectorId() {
        return connectorId;
    }

    public Optional<String> get(String name) {
        List<String> values = flags.get(name);
        if (values != null && !values.isEmpty()) {
            return Optional.of(values.get(values.size() - 1));
        }
        return Optional.ofNullable(environment.getProperty(environmentKey(name)))
                .filter(value -> !value.isBlank());
    }

    /**
     * @throws ConfigurationException if the option is neither passed as a flag nor set in the
     *     environment
     */
    public String require(String name) {
        return get(name).orElseThrow(() -> new ConfigurationException(
                "Missing required option --" + name + " for connector '" + connectorId
                        + "' (or set " + environmentKey(name) + ")"));
    }

    /**
     * Boolean flag: present without a value means true; {@code --name=false} means false; absent
     * falls back to the environment, then to {@code defaultValue}.
     */
    public boolean flag(String name, boolean defaultValue) {
        List<String> values = flags.get(name);
        if (values != null) {
            return values.isEmpty() || parseBoolean(name, values.get(values.size() - 1));
        }
        String fromEnvironment = environment.getProperty(environmentKey(name));
        return fromEnvironment == null || fromEnvironment.isBlank()
                ? defaultValue
                : parseBoolean(name, fromEnvironment);
    }

    String environmentKey(String name) {
        return "tributary.connector." + connectorId + "." + name;
    }

    private static boolean parseBoolean(String name, String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true", "yes", "1" -> true;
            case "false", "no", "0" -> false;
            default -> throw new ConfigurationException("Option --" + name + " expects a boolean, got: " + value);
        };
    }
}
