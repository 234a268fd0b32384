package ai.depgraph.io;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

import ai.depgraph.graph.Cycle;
import ai.depgraph.graph.DependencyGraph;
import ai.depgraph.graph.GraphStats;

/**
 * Human-readable report: totals, hot spots, cycles.
 */
public final class TextReportRenderer {

    private static final String NL = System.lineSeparator();

    public String render(DependencyGraph graph) {
        Objects.requireNonNull(graph, "graph");
        final StringBuilder sb = new StringBuilder();
        final List<Cycle> cycles = graph.findCycles();
        final GraphStats stats = graph.getStats(cycles);

        sb.append("Dependency Analysis Report").append(NL);
        sb.append("=".repeat(50)).append(NL).append(NL);

        sb.append("Files analyzed: ").append(stats.totalFiles()).append(NL);
        sb.append("Internal dependencies: ").append(stats.totalDependencies()).append(NL);
        sb.append("External dependencies: ").append(stats.totalExternal()).append(NL);
        sb.append("Circular dependencies: ").append(stats.cycles()).append(NL).append(NL);

        if (!stats.mostImported().isEmpty()) {
            sb.append("Most imported files:").append(NL);
            for (GraphStats.Ranked r : stats.mostImported()) {
                sb.append("  ").append(graph.relativize(r.path()))
                        .append(": imported by ").append(r.count()).append(NL);
            }
            sb.append(NL);
        }

        if (!stats.mostImports().isEmpty()) {
            sb.append("Files with most imports:").append(NL);
            for (GraphStats.Ranked r : stats.mostImports()) {
                sb.append("  ").append(graph.relativize(r.path()))
                        .append(": ").append(r.count()).append(" imports").append(NL);
            }
            sb.append(NL);
        }

        if (!cycles.isEmpty()) {
            sb.append("Circular dependencies detected:").append(NL);
            appendCycles(sb, graph, cycles);
        }
        return sb.toString();
    }

    /**
     * Only the cycles, or a line saying there are none.
     */
    public String renderCycles(DependencyGraph graph) {
        Objects.requireNonNull(graph, "graph");
        final List<Cycle> cycles = graph.findCycles();
        if (cycles.isEmpty()) {
            return "No circular dependencies found." + NL;
        }
        final StringBuilder sb = new StringBuilder("Circular dependencies found:").append(NL);
        appendCycles(sb, graph, cycles);
        return sb.toString();
    }

    private static void appendCycles(StringBuilder sb, DependencyGraph graph, List<Cycle> cycles) {
        int i = 1;
        for (Cycle cycle : cycles) {
            sb.append("  Cycle ").append(i++).append(':').append(NL);
            for (Path p : cycle.members()) {
                sb.append("    -> ").append(graph.relativize(p)).append(NL);
            }
        }
        sb.append(NL);
    }
}
