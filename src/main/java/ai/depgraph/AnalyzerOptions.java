package ai.depgraph;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import ai.depgraph.scan.IgnoreRules;
import ai.depgraph.scan.ParallelExtractionPipeline;
import ai.depgraph.scan.SourceScanner;

/**
 * Plain settings for one analysis run.
 */
public record AnalyzerOptions(
        int workers,
        Set<String> excludeDirs,
        List<String> ignoreGlobs,
        boolean internalOnly,
        Duration chunkTimeout
) {

    public AnalyzerOptions {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be > 0: " + workers);
        }
        excludeDirs = Set.copyOf(Objects.requireNonNull(excludeDirs, "excludeDirs"));
        ignoreGlobs = List.copyOf(Objects.requireNonNull(ignoreGlobs, "ignoreGlobs"));
        Objects.requireNonNull(chunkTimeout, "chunkTimeout");
    }

    public static AnalyzerOptions defaults() {
        return new AnalyzerOptions(
                Runtime.getRuntime().availableProcessors(),
                SourceScanner.DEFAULT_EXCLUDE_DIRS,
                List.of(),
                false,
                ParallelExtractionPipeline.DEFAULT_CHUNK_TIMEOUT);
    }

    public AnalyzerOptions withWorkers(int n) {
        return new AnalyzerOptions(n, excludeDirs, ignoreGlobs, internalOnly, chunkTimeout);
    }

    /**
     * Adds directory names to the current exclusions.
     */
    public AnalyzerOptions withExtraExcludes(Set<String> more) {
        final Set<String> merged = new LinkedHashSet<>(excludeDirs);
        merged.addAll(more);
        return new AnalyzerOptions(workers, merged, ignoreGlobs, internalOnly, chunkTimeout);
    }

    public AnalyzerOptions withIgnoreGlobs(List<String> globs) {
        return new AnalyzerOptions(workers, excludeDirs, globs, internalOnly, chunkTimeout);
    }

    public AnalyzerOptions withInternalOnly(boolean value) {
        return new AnalyzerOptions(workers, excludeDirs, ignoreGlobs, value, chunkTimeout);
    }

    public AnalyzerOptions withChunkTimeout(Duration timeout) {
        return new AnalyzerOptions(workers, excludeDirs, ignoreGlobs, internalOnly, timeout);
    }

    public SourceScanner scanner() {
        return new SourceScanner(excludeDirs, IgnoreRules.of(ignoreGlobs));
    }
}
