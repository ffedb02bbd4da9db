package dev.tributary.connector;

import java.util.List;

/**
 * Capability checks for optional third-party libraries, run before a connector is constructed so
 * a missing library fails with {@link MissingDependencyException} instead of a linkage error deep
 * in a call stack.
 */
public final class DependencyCheck {

    private DependencyCheck() {
        // utility class
    }

    /**
     * @param className fully qualified name of a class the dependency provides
     * @return true if the class can be loaded, without initializing it
     */
    public static boolean hasDependency(String className) {
        try {
            Class.forName(className, false, DependencyCheck.class.getClassLoader());
            return true;
        } catch (ClassNotFoundException | LinkageError e) {
            return false;
        }
    }

    /**
     * @throws MissingDependencyException listing every class in {@code classNames} that is absent
     */
    public static void requireAll(String connectorId, List<String> classNames) {
        List<String> missing = classNames.stream()
                .filter(name -> !hasDependency(name))
                .toList();
        if (!missing.isEmpty()) {
            throw new MissingDependencyException(connectorId, missing);
        }
    }
}
