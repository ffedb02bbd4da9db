package dev.tributary.pipeline;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;

/**
 * Glob filter over record relative paths. Exclude patterns take priority over include patterns;
 * with no include patterns every path not excluded is accepted.
 */
public final class IndexScopeFilter {

    private final List<PathMatcher> includes;
    private final List<PathMatcher> excludes;

    public IndexScopeFilter(List<String> includePatterns, List<String> excludePatterns) {
        this.includes = compile(includePatterns);
        this.excludes = compile(excludePatterns);
    }

    /**
     * @param relativePath source-relative path with {@code /} separators
     * @return true if the path passes the filter
     */
    public boolean isAllowed(String relativePath) {
        Path path = Path.of(relativePath);
        for (PathMatcher exclude : excludes) {
            if (exclude.matches(path)) {
                return false;
            }
        }
        if (includes.isEmpty()) {
            return true;
        }
        for (PathMatcher include : includes) {
            if (include.matches(path)) {
                return true;
            }
        }
        return false;
    }

    private static List<PathMatcher> compile(List<String> patterns) {
        return patterns.stream()
                .filter(pattern -> !pattern.isBlank())
                .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern))
                .toList();
    }
}
