package ai.depgraph.graph;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * One source file in the graph: the files it imports, the files importing it,
 * and the external modules it imports.
 */
public final class GraphNode {

    private final Path path;
    private final Set<Path> imports = new LinkedHashSet<>();
    private final Set<Path> importedBy = new LinkedHashSet<>();
    private final Set<String> externalImports = new LinkedHashSet<>();

    GraphNode(Path path) {
        this.path = Objects.requireNonNull(path, "path");
    }

    public Path path() {
        return path;
    }

    public Set<Path> imports() {
        return Collections.unmodifiableSet(imports);
    }

    public Set<Path> importedBy() {
        return Collections.unmodifiableSet(importedBy);
    }

    public Set<String> externalImports() {
        return Collections.unmodifiableSet(externalImports);
    }

    boolean addImport(Path target) {
        return imports.add(target);
    }

    boolean addImportedBy(Path source) {
        return importedBy.add(source);
    }

    boolean addExternal(String moduleName) {
        return externalImports.add(moduleName);
    }

    @Override
    public String toString() {
        return "GraphNode{" + path + ", imports=" + imports.size()
                + ", importedBy=" + importedBy.size()
                + ", external=" + externalImports.size() + "}";
    }
}
