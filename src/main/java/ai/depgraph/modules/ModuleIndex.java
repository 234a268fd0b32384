package ai.depgraph.modules;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import ai.depgraph.model.SourceFiles;
import ai.depgraph.scan.SourceScanner;

/**
 * Immutable lookup from dotted module name to source file for one project root.
 * <p>
 * {@code pkg/mod.py} is indexed as {@code pkg.mod}; {@code pkg/__init__.py} as {@code pkg}.
 * When a package and a module claim the same name ({@code pkg.py} next to {@code pkg/}),
 * the package initializer wins. Safe for concurrent reads once built.
 */
public final class ModuleIndex {

    private final Path root;
    private final Map<String, Path> fileIndex;
    private final Set<Path> packageDirs;

    private ModuleIndex(Path root, Map<String, Path> fileIndex, Set<Path> packageDirs) {
        this.root = Objects.requireNonNull(root, "root");
        this.fileIndex = Map.copyOf(fileIndex);
        this.packageDirs = Set.copyOf(packageDirs);
    }

    /**
     * Walks everything below {@code root} once. Exclusions and ignore globs apply to which
     * files are analyzed, never to which files can be imported.
     */
    public static ModuleIndex build(Path root) {
        final Path canonicalRoot = SourceFiles.canonical(root);
        return of(canonicalRoot, SourceScanner.unfiltered().discover(canonicalRoot));
    }

    /**
     * Names come from where a file sits below {@code root}; the indexed path is its canonical
     * one, so a symlinked module is indexed under its own name but points at its target.
     */
    public static ModuleIndex of(Path root, Collection<Path> files) {
        Objects.requireNonNull(files, "files");
        final Path canonicalRoot = SourceFiles.canonical(root);
        final Map<String, Path> index = new HashMap<>();
        final Set<Path> packages = new HashSet<>();

        for (Path f : files) {
            final Path located = f.toAbsolutePath().normalize();
            if (!located.startsWith(canonicalRoot) || !SourceFiles.isSourceFile(located)) {
                continue;
            }
            final boolean init = SourceFiles.isPackageInit(located);
            if (init) {
                packages.add(located.getParent());
            }
            final String name = SourceFiles.moduleName(canonicalRoot.relativize(located));
            index.merge(name, SourceFiles.canonical(located), (existing, candidate) ->
                    init && !SourceFiles.isPackageInit(existing) ? candidate : existing);
        }
        return new ModuleIndex(canonicalRoot, index, packages);
    }

    public Path root() {
        return root;
    }

    /**
     * @return the file indexed under exactly {@code dottedName}, or null
     */
    public Path lookup(String dottedName) {
        if (dottedName == null) {
            return null;
        }
        return fileIndex.get(dottedName);
    }

    /**
     * @return the {@code __init__.py} of the package directory named {@code dottedName}, or null
     */
    public Path lookupPackage(String dottedName) {
        if (dottedName == null) {
            return null;
        }
        Path dir = root;
        try {
            for (String segment : SourceFiles.segments(dottedName)) {
                dir = dir.resolve(segment);
            }
        } catch (InvalidPathException ex) {
            return null;
        }
        return packageDirs.contains(dir) ? dir.resolve(SourceFiles.PACKAGE_INIT) : null;
    }

    /**
     * Direct lookup first, package form second.
     */
    public Path lookupEither(String dottedName) {
        final Path direct = lookup(dottedName);
        return direct != null ? direct : lookupPackage(dottedName);
    }

    public boolean contains(String dottedName) {
        return lookupEither(dottedName) != null;
    }

    public boolean isPackageDir(Path dir) {
        return packageDirs.contains(dir);
    }

    public List<String> moduleNamesSorted() {
        final List<String> names = new ArrayList<>(fileIndex.keySet());
        Collections.sort(names);
        return names;
    }

    public int size() {
        return fileIndex.size();
    }
}
