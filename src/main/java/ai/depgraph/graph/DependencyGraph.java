package ai.depgraph.graph;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import ai.depgraph.model.SourceFiles;

/**
 * File-level import graph for one analysis run.
 * <p>
 * Nodes are keyed by canonical path and created on first reference, as importer or as
 * import target. All mutators are idempotent. Not thread-safe: build it on one thread,
 * then read it from anywhere.
 */
public final class DependencyGraph {

    private final Map<Path, GraphNode> nodes = new LinkedHashMap<>();
    private Path root;

    public DependencyGraph() {
    }

    public DependencyGraph(Path root) {
        setRoot(root);
    }

    public GraphNode addFile(Path file) {
        return nodes.computeIfAbsent(SourceFiles.canonical(file), GraphNode::new);
    }

    /**
     * Records that {@code from} imports {@code to}. A file importing itself is kept as an edge.
     */
    public void addDependency(Path from, Path to) {
        final GraphNode source = addFile(from);
        final GraphNode target = addFile(to);
        source.addImport(target.path());
        target.addImportedBy(source.path());
    }

    public void addExternal(Path from, String moduleName) {
        Objects.requireNonNull(moduleName, "moduleName");
        addFile(from).addExternal(moduleName);
    }

    public Optional<GraphNode> node(Path file) {
        return Optional.ofNullable(nodes.get(SourceFiles.canonical(file)));
    }

    public boolean contains(Path file) {
        return nodes.containsKey(SourceFiles.canonical(file));
    }

    /**
     * Nodes in insertion order.
     */
    public Map<Path, GraphNode> nodes() {
        return Collections.unmodifiableMap(nodes);
    }

    public int size() {
        return nodes.size();
    }

    public int edgeCount() {
        int n = 0;
        for (GraphNode node : nodes.values()) {
            n += node.imports().size();
        }
        return n;
    }

    public int externalCount() {
        int n = 0;
        for (GraphNode node : nodes.values()) {
            n += node.externalImports().size();
        }
        return n;
    }

    /**
     * Read-only view: file to the files it imports.
     */
    public Map<Path, Set<Path>> adjacency() {
        final Map<Path, Set<Path>> out = new LinkedHashMap<>(nodes.size() * 2);
        for (var e : nodes.entrySet()) {
            out.put(e.getKey(), e.getValue().imports());
        }
        return out;
    }

    public List<Cycle> findCycles() {
        return new CycleDetector(adjacency()).findCycles();
    }

    public GraphStats getStats() {
        return getStats(findCycles());
    }

    /**
     * Stats with cycles the caller has already detected on this graph.
     */
    public GraphStats getStats(List<Cycle> cycles) {
        Objects.requireNonNull(cycles, "cycles");
        final List<GraphStats.Ranked> importedCounts = new ArrayList<>();
        final List<GraphStats.Ranked> importCounts = new ArrayList<>(nodes.size());
        for (GraphNode node : nodes.values()) {
            if (!node.importedBy().isEmpty()) {
                importedCounts.add(new GraphStats.Ranked(node.path(), node.importedBy().size()));
            }
            importCounts.add(new GraphStats.Ranked(node.path(), node.imports().size()));
        }
        // List.sort is stable: ties keep insertion order
        final Comparator<GraphStats.Ranked> byCountDesc =
                Comparator.comparingInt(GraphStats.Ranked::count).reversed();
        importedCounts.sort(byCountDesc);
        importCounts.sort(byCountDesc);

        return new GraphStats(
                nodes.size(),
                edgeCount(),
                externalCount(),
                cycles.size(),
                importedCounts.subList(0, Math.min(GraphStats.TOP_N, importedCounts.size())),
                importCounts.subList(0, Math.min(GraphStats.TOP_N, importCounts.size()))
        );
    }

    public Optional<Path> root() {
        return Optional.ofNullable(root);
    }

    public void setRoot(Path root) {
        this.root = root == null ? null : SourceFiles.canonical(root);
    }

    /**
     * Path relative to the root with '/' separators, for display.
     */
    public String relativize(Path file) {
        return SourceFiles.displayPath(root, file);
    }
}
