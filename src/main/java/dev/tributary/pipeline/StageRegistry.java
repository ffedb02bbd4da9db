package dev.tributary.pipeline;

import dev.tributary.config.ConfigurationException;
import dev.tributary.document.StageName;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

/**
 * Registry of stage variants keyed by stage and variant name.
 */
@Component
public class StageRegistry {

    private final Map<StageName, Map<String, StageFactory<?>>> factories = new EnumMap<>(StageName.class);

    public StageRegistry(List<StageFactory<?>> factories) {
        for (StageFactory<?> factory : factories) {
            StageFactory<?> previous = this.factories
                    .computeIfAbsent(factory.stage(), stage -> new TreeMap<>())
                    .put(factory.variant(), factory);
            if (previous != null) {
                throw new IllegalStateException(
                        "Duplicate variant '" + factory.variant() + "' for stage " + factory.stage().value());
            }
        }
    }

    public List<String> variants(StageName stage) {
        return List.copyOf(factories.getOrDefault(stage, Map.of()).keySet());
    }

    /**
     * Create a stage and check it has the type the orchestrator expects at that position.
     *
     * @throws ConfigurationException if the variant is unknown for this stage
     */
    public <S extends Stage> S create(StageName stage, StageSettings settings, Class<S> type) {
        StageFactory<?> factory = factories.getOrDefault(stage, Map.of()).get(settings.variant());
        if (factory == null) {
            throw new ConfigurationException("Unknown " + stage.value() + " variant '" + settings.variant()
                    + "'. Available: " + variants(stage));
        }
        Stage created = factory.create(settings);
        if (!type.isInstance(created)) {
            throw new IllegalStateException("Variant '" + settings.variant() + "' of " + stage.value()
                    + " does not implement " + type.getSimpleName());
        }
        return type.cast(created);
    }
}
