package ai.depgraph.io;

import java.nio.file.Path;
import java.util.Objects;

import ai.depgraph.graph.DependencyGraph;
import ai.depgraph.graph.GraphNode;

/**
 * Graphviz DOT output. Colours: lightgreen = only imported, lightblue = only importing,
 * yellow = imported by more than three files.
 */
public final class DotRenderer {

    private static final int HEAVILY_IMPORTED = 3;

    public String render(DependencyGraph graph, boolean showExternal) {
        Objects.requireNonNull(graph, "graph");
        final StringBuilder sb = new StringBuilder();
        sb.append("digraph dependencies {\n");
        sb.append("    rankdir=\"LR\";\n");
        sb.append("    node [shape=box];\n\n");

        for (GraphNode node : graph.nodes().values()) {
            final String id = graph.relativize(node.path());
            sb.append("    ").append(quote(id))
                    .append(" [label=\"").append(escape(id).replace("/", "\\n")).append('"')
                    .append(", fillcolor=\"").append(color(node)).append("\", style=filled];\n");
        }
        sb.append('\n');

        for (GraphNode node : graph.nodes().values()) {
            final String from = quote(graph.relativize(node.path()));
            for (Path imported : node.imports()) {
                sb.append("    ").append(from).append(" -> ").append(quote(graph.relativize(imported))).append(";\n");
            }
        }

        if (showExternal) {
            sb.append("\n    // external dependencies\n");
            for (GraphNode node : graph.nodes().values()) {
                final String from = quote(graph.relativize(node.path()));
                for (String ext : node.externalImports()) {
                    final String extId = quote("ext:" + ext);
                    sb.append("    ").append(extId).append(" [label=").append(quote(ext))
                            .append(", shape=ellipse, style=dashed];\n");
                    sb.append("    ").append(from).append(" -> ").append(extId).append(" [style=dashed];\n");
                }
            }
        }

        sb.append("}\n");
        return sb.toString();
    }

    static String color(GraphNode node) {
        final boolean imported = !node.importedBy().isEmpty();
        final boolean importing = !node.imports().isEmpty();
        if (imported && !importing) {
            return "lightgreen";
        }
        if (importing && !imported) {
            return "lightblue";
        }
        if (node.importedBy().size() > HEAVILY_IMPORTED) {
            return "yellow";
        }
        return "white";
    }

    private static String quote(String s) {
        return '"' + escape(s) + '"';
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
