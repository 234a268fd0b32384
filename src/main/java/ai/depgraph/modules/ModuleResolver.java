package ai.depgraph.modules;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import ai.depgraph.model.SourceFiles;

/**
 * Resolves an import to the project file it refers to.
 * Absolute strategy, first hit wins:
 * 1) standard library names never resolve
 * 2) a leading segment equal to the root directory's own name is stripped and retried
 * 3) the full dotted name, then as a package
 * 4) sibling of the importing file, then sibling of its parent package
 * 5) progressively shorter prefixes (the name lives inside a parent module)
 * 6) otherwise external
 * When two packages contain same-named modules, 4) and 5) may pick a different file than
 * the interpreter would.
 */
public final class ModuleResolver {

    private final ModuleIndex index;

    public ModuleResolver(ModuleIndex index) {
        this.index = Objects.requireNonNull(index, "index");
    }

    public static ModuleResolver forRoot(Path root) {
        return new ModuleResolver(ModuleIndex.build(root));
    }

    /**
     * @param level 0 for absolute imports, otherwise the number of leading dots
     */
    public Optional<Path> resolve(String moduleName, Path fromFile, int level) {
        return level == 0
                ? resolveAbsolute(moduleName, fromFile)
                : resolveRelative(moduleName, fromFile, level);
    }

    public Optional<Path> resolveAbsolute(String moduleName, Path fromFile) {
        if (moduleName == null || moduleName.isEmpty()) {
            return Optional.empty();
        }
        if (StandardLibrary.contains(moduleName)) {
            return Optional.empty();
        }

        final List<String> parts = SourceFiles.segments(moduleName);
        final Path rootName = index.root().getFileName();

        // "myproject.core" written from inside myproject/
        if (rootName != null && rootName.toString().equals(parts.get(0)) && parts.size() > 1) {
            final Path stripped = index.lookupEither(String.join(".", parts.subList(1, parts.size())));
            if (stripped != null) {
                return Optional.of(stripped);
            }
        }

        final Path direct = index.lookupEither(moduleName);
        if (direct != null) {
            return Optional.of(direct);
        }

        final Path sibling = resolveNear(parts, fromFile);
        if (sibling != null) {
            return Optional.of(sibling);
        }

        for (int i = parts.size() - 1; i > 0; i--) {
            final Path parent = index.lookupEither(String.join(".", parts.subList(0, i)));
            if (parent != null) {
                return Optional.of(parent);
            }
        }
        return Optional.empty();
    }

    private Path resolveNear(List<String> parts, Path fromFile) {
        final List<String> fromDirs = packagePath(fromFile);
        if (fromDirs == null || fromDirs.isEmpty()) {
            return null;
        }

        final List<String> sibling = new ArrayList<>(fromDirs);
        sibling.addAll(parts);
        final Path hit = index.lookupEither(String.join(".", sibling));
        if (hit != null) {
            return hit;
        }

        // pkg/dags/job.py importing "utils.x" may mean pkg/utils/x.py
        if (fromDirs.size() > 1) {
            final List<String> cousin = new ArrayList<>(fromDirs.subList(0, fromDirs.size() - 1));
            cousin.addAll(parts);
            return index.lookupEither(String.join(".", cousin));
        }
        return null;
    }

    /**
     * @param moduleName may be empty for {@code from . import x}
     * @param level      1 = the importing file's package, 2 = its parent, ...
     */
    public Optional<Path> resolveRelative(String moduleName, Path fromFile, int level) {
        if (level < 1) {
            throw new IllegalArgumentException("level must be >= 1: " + level);
        }
        final List<String> pkg = packagePath(fromFile);
        if (pkg == null || level > pkg.size() + 1) {
            return Optional.empty();
        }

        final List<String> target = new ArrayList<>(pkg.subList(0, Math.max(0, pkg.size() - (level - 1))));
        target.addAll(SourceFiles.segments(moduleName));
        return Optional.ofNullable(index.lookupEither(String.join(".", target)));
    }

    /**
     * @return true when the module is neither standard library nor part of the project
     */
    public boolean isExternal(String moduleName) {
        if (moduleName == null || moduleName.isEmpty()) {
            return false;
        }
        if (StandardLibrary.contains(moduleName)) {
            return false;
        }
        return !index.contains(moduleName);
    }

    /**
     * Directory segments between the root and the importing file. For a package initializer
     * the package is its own directory, which is the same segments. Null when outside the root.
     */
    private List<String> packagePath(Path fromFile) {
        if (fromFile == null) {
            return null;
        }
        final Path file = SourceFiles.canonical(fromFile);
        if (!file.startsWith(index.root())) {
            return null;
        }
        final Path rel = index.root().relativize(file);
        final List<String> dirs = new ArrayList<>(rel.getNameCount());
        for (int i = 0; i < rel.getNameCount() - 1; i++) {
            dirs.add(rel.getName(i).toString());
        }
        return dirs;
    }
}
