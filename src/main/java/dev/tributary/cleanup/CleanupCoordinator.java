package dev.tributary.cleanup;

import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Tracks every open {@link ResourceScope} of the process.
 *
 * <p>Scopes normally close themselves on their owner's exit path. Any scope still open when the
 * application context shuts down (normal exit, or an interrupt handled by Spring Boot's JVM
 * shutdown hook) is closed here, most recently opened first.
 */
@Component
public class CleanupCoordinator {

    private static final Logger log = LoggerFactory.getLogger(CleanupCoordinator.class);

    private final Set<ResourceScope> openScopes = new LinkedHashSet<>();

    /**
     * Open a new tracked scope. The scope deregisters itself when closed.
     *
     * @param name label used in log messages
     * @return the open scope
     */
    public ResourceScope openScope(String name) {
        ResourceScope scope = new ResourceScope(name, this::forget);
        synchronized (openScopes) {
            openScopes.add(scope);
        }
        return scope;
    }

    public int openScopeCount() {
        synchronized (openScopes) {
            return openScopes.size();
        }
    }

    /** Close every scope still open, most recent first. */
    @PreDestroy
    public void closeAll() {
        List<ResourceScope> remaining;
        synchronized (openScopes) {
            remaining = new ArrayList<>(openScopes);
        }
        Collections.reverse(remaining);
        for (ResourceScope scope : remaining) {
            log.warn("Closing scope {} left open at shutdown", scope.name());
            scope.close();
        }
    }

    private void forget(ResourceScope scope) {
        synchronized (openScopes) {
            openScopes.remove(scope);
        }
    }
}
