package ai.depgraph.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import ai.depgraph.graph.Cycle;
import ai.depgraph.graph.DependencyGraph;
import ai.depgraph.graph.GraphNode;
import ai.depgraph.graph.GraphStats;

/**
 * Writes a finished graph as one JSON document. All paths are root-relative.
 */
public final class GraphWriter {

    public static final String SCHEMA_VERSION = "py-depgraph/v1";

    private final ObjectMapper jsonMapper;

    public GraphWriter() {
        this.jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void write(DependencyGraph graph, Path file, String generatedAt) throws IOException {
        Objects.requireNonNull(file, "file");
        final Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        jsonMapper.writeValue(file.toFile(), toDocument(graph, generatedAt));
    }

    public String toJson(DependencyGraph graph, String generatedAt) throws JsonProcessingException {
        return jsonMapper.writeValueAsString(toDocument(graph, generatedAt));
    }

    public GraphDocument toDocument(DependencyGraph graph, String generatedAt) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(generatedAt, "generatedAt");

        final Map<String, NodeSummary> nodes = new LinkedHashMap<>();
        final List<Edge> edges = new ArrayList<>();
        final Map<String, List<String>> external = new TreeMap<>();

        for (GraphNode node : graph.nodes().values()) {
            final String from = graph.relativize(node.path());
            nodes.put(from, new NodeSummary(
                    node.imports().size(),
                    node.importedBy().size(),
                    node.externalImports().size()));

            for (Path imported : node.imports()) {
                edges.add(new Edge(from, graph.relativize(imported)));
            }
            if (!node.externalImports().isEmpty()) {
                final List<String> names = new ArrayList<>(node.externalImports());
                names.sort(null);
                external.put(from, names);
            }
        }

        final List<Cycle> found = graph.findCycles();
        final List<List<String>> cycles = new ArrayList<>();
        for (Cycle cycle : found) {
            final List<String> members = new ArrayList<>(cycle.size());
            for (Path p : cycle.members()) {
                members.add(graph.relativize(p));
            }
            cycles.add(members);
        }

        final GraphStats stats = graph.getStats(found);
        final Summary summary = new Summary(
                stats.totalFiles(),
                stats.totalDependencies(),
                stats.totalExternal(),
                stats.cycles(),
                ranked(graph, stats.mostImported()),
                ranked(graph, stats.mostImports()));

        return new GraphDocument(
                SCHEMA_VERSION,
                generatedAt,
                graph.root().map(Path::toString).orElse(null),
                summary,
                nodes,
                edges,
                external,
                cycles);
    }

    private static List<RankedFile> ranked(DependencyGraph graph, List<GraphStats.Ranked> in) {
        final List<RankedFile> out = new ArrayList<>(in.size());
        for (GraphStats.Ranked r : in) {
            out.add(new RankedFile(graph.relativize(r.path()), r.count()));
        }
        return out;
    }

    // --- document records ---

    public record GraphDocument(
            String schema,
            String generatedAt,
            String root,
            Summary summary,
            Map<String, NodeSummary> nodes,
            List<Edge> edges,
            Map<String, List<String>> external,
            List<List<String>> cycles
    ) {
    }

    public record NodeSummary(
            int importsCount,
            int importedByCount,
            int externalCount
    ) {
    }

    public record Edge(String from, String to) {
    }

    public record Summary(
            int totalFiles,
            int totalDependencies,
            int totalExternal,
            int cycles,
            List<RankedFile> mostImported,
            List<RankedFile> mostImports
    ) {
    }

    public record RankedFile(String file, int count) {
    }
}
