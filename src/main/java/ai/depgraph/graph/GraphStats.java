package ai.depgraph.graph;

import java.nio.file.Path;
import java.util.List;

/**
 * Aggregate numbers for one graph.
 */
public record GraphStats(
        int totalFiles,
        int totalDependencies,      // internal edges, self-loops included
        int totalExternal,          // distinct external module names summed over files
        int cycles,
        List<Ranked> mostImported,  // top files by in-degree
        List<Ranked> mostImports    // top files by out-degree
) {

    public static final int TOP_N = 5;

    public GraphStats {
        mostImported = List.copyOf(mostImported);
        mostImports = List.copyOf(mostImports);
    }

    public record Ranked(Path path, int count) {
    }
}
