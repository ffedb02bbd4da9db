package dev.tributary.pipeline;

import dev.tributary.config.ConfigurationException;
import dev.tributary.document.ContentHasher;
import dev.tributary.document.DocumentPaths;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Pipeline configuration bound from {@code tributary.pipeline.*}.
 *
 * <p>All values are validated here, before any connector or stage is built.
 */
@ConfigurationProperties(prefix = "tributary.pipeline")
public record PipelineProperties(
        @DefaultValue("work") Path workDir,
        @Nullable Path downloadDir,
        @DefaultValue("output") Path outputDir,
        @DefaultValue("4") int concurrency,
        @Nullable Duration runTimeout,
        @DefaultValue("512000000") long largeObjectThresholdBytes,
        @DefaultValue("8388608") int downloadChunkBytes,
        @DefaultValue("0") long maxFileSizeBytes,
        @DefaultValue List<String> includePatterns,
        @DefaultValue List<String> excludePatterns,
        @DefaultValue Retry retry,
        @DefaultValue Map<String, StageSettings> stages
) {

    static final int SOURCE_HASH_LENGTH = 10;

    public PipelineProperties {
        if (workDir == null) {
            throw new ConfigurationException("tributary.pipeline.work-dir must be set");
        }
        if (outputDir == null) {
            throw new ConfigurationException("tributary.pipeline.output-dir must be set");
        }
        if (concurrency < 1) {
            throw new ConfigurationException("tributary.pipeline.concurrency must be >= 1, got " + concurrency);
        }
        if (runTimeout != null && (runTimeout.isNegative() || runTimeout.isZero())) {
            throw new ConfigurationException("tributary.pipeline.run-timeout must be positive, got " + runTimeout);
        }
        if (largeObjectThresholdBytes < 0) {
            throw new ConfigurationException("tributary.pipeline.large-object-threshold-bytes must be >= 0");
        }
        if (downloadChunkBytes < 1) {
            throw new ConfigurationException("tributary.pipeline.download-chunk-bytes must be >= 1");
        }
        if (maxFileSizeBytes < 0) {
            throw new ConfigurationException("tributary.pipeline.max-file-size-bytes must be >= 0 (0 disables)");
        }
        includePatterns = includePatterns == null ? List.of() : List.copyOf(includePatterns);
        excludePatterns = excludePatterns == null ? List.of() : List.copyOf(excludePatterns);
        retry = retry == null ? new Retry(3, 1000, 2.0) : retry;
        stages = stages == null ? Map.of() : Map.copyOf(stages);
    }

    /**
     * Transfer retry policy.
     *
     * @param maxAttempts total attempts including the first
     * @param delayMs     initial backoff
     * @param multiplier  backoff multiplier
     */
    public record Retry(
            @DefaultValue("3") int maxAttempts,
            @DefaultValue("1000") long delayMs,
            @DefaultValue("2.0") double multiplier
    ) {
        public Retry {
            if (maxAttempts < 1) {
                throw new ConfigurationException("tributary.pipeline.retry.max-attempts must be >= 1");
            }
            if (delayMs < 0) {
                throw new ConfigurationException("tributary.pipeline.retry.delay-ms must be >= 0");
            }
            if (multiplier < 1.0) {
                throw new ConfigurationException("tributary.pipeline.retry.multiplier must be >= 1.0");
            }
        }
    }

    /**
     * Roots for one connector run. Without an explicit download directory, raw content lands in
     * {@code work-dir/download/<connector>/<hash of the source root>} so that two sources never
     * share a cache tree.
     */
    public DocumentPaths documentPaths(String connectorId, String sourceRoot) {
        Path download = downloadDir != null
                ? downloadDir
                : workDir.resolve("download")
                        .resolve(connectorId)
                        .resolve(ContentHasher.sha256Prefix(sourceRoot, SOURCE_HASH_LENGTH));
        return new DocumentPaths(download, outputDir, workDir);
    }
}
