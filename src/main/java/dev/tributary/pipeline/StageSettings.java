package dev.tributary.pipeline;

import dev.tributary.config.ConfigurationException;
import java.util.Map;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration of one stage: the variant name and its free-form options.
 *
 * @param variant registered variant name, e.g. {@code auto}, {@code by_title}
 * @param options variant-specific options
 */
public record StageSettings(String variant, @DefaultValue Map<String, String> options) {

    public StageSettings {
        if (variant == null || variant.isBlank()) {
            throw new ConfigurationException("Stage variant must not be blank");
        }
        options = options == null ? Map.of() : Map.copyOf(options);
    }

    public static StageSettings of(String variant) {
        return new StageSettings(variant, Map.of());
    }

    public String option(String name, String defaultValue) {
        String value = options.get(name);
        return value == null || value.isBlank() ? defaultValue : value;
    }

    /**
     * @throws ConfigurationException if the option is absent
     */
    public String requireOption(String name) {
        String value = options.get(name);
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Stage variant '" + variant + "' requires option '" + name + "'");
        }
        return value;
    }

    /**
     * @throws ConfigurationException if the option is not a positive integer
     */
    public int positiveIntOption(String name, int defaultValue) {
        return intOption(name, defaultValue, 1);
    }

    /**
     * @throws ConfigurationException if the option is not an integer of at least {@code min}
     */
    public int intOption(String name, int defaultValue, int min) {
        String value = options.get(name);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Option '" + name + "' must be an integer, got: " + value, e);
        }
        if (parsed < min) {
            throw new ConfigurationException("Option '" + name + "' must be >= " + min + ", got: " + value);
        }
        return parsed;
    }
}
