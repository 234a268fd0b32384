package ai.depgraph.scan;

import java.nio.file.Path;
import java.util.List;

import ai.depgraph.model.ImportRecord;

/**
 * Turns one source file into its import records without executing it.
 * Implementations must not throw for unreadable or malformed input; they return an empty list.
 * Instances are shared by all extraction workers and must be thread-safe.
 */
@FunctionalInterface
public interface ImportRecordExtractor {

    List<ImportRecord> extract(Path file);
}
