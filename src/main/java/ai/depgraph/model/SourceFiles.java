package ai.depgraph.model;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Path helpers for Python source files: package initializers, dotted names,
 * root-relative display paths.
 */
public final class SourceFiles {

    public static final String SUFFIX = ".py";
    public static final String PACKAGE_INIT = "__init__.py";

    private SourceFiles() {
    }

    public static boolean isSourceFile(Path file) {
        final Path name = file.getFileName();
        return name != null && name.toString().endsWith(SUFFIX);
    }

    public static boolean isPackageInit(Path file) {
        final Path name = file.getFileName();
        return name != null && PACKAGE_INIT.equals(name.toString());
    }

    /**
     * Canonical identity of a file: its real path, so a symlink and its target are one file.
     * Paths that do not exist (or cannot be resolved) are made absolute and normalized instead.
     */
    public static Path canonical(Path file) {
        Objects.requireNonNull(file, "file");
        try {
            return file.toRealPath();
        } catch (IOException | SecurityException ex) {
            return file.toAbsolutePath().normalize();
        }
    }

    /**
     * Dotted module name for a root-relative path.
     * {@code pkg/mod.py -> pkg.mod}, {@code pkg/__init__.py -> pkg}, {@code __init__.py -> ""}.
     */
    public static String moduleName(Path relPath) {
        Objects.requireNonNull(relPath, "relPath");
        final List<String> parts = new ArrayList<>(relPath.getNameCount());
        for (int i = 0; i < relPath.getNameCount() - 1; i++) {
            parts.add(relPath.getName(i).toString());
        }
        final String fileName = relPath.getFileName() != null ? relPath.getFileName().toString() : "";
        if (!PACKAGE_INIT.equals(fileName)) {
            parts.add(fileName.endsWith(SUFFIX)
                    ? fileName.substring(0, fileName.length() - SUFFIX.length())
                    : fileName);
        }
        return String.join(".", parts);
    }

    public static List<String> segments(String dottedName) {
        if (dottedName == null || dottedName.isEmpty()) {
            return List.of();
        }
        return List.of(dottedName.split("\\."));
    }

    public static String topLevel(String dottedName) {
        final int dot = dottedName.indexOf('.');
        return dot >= 0 ? dottedName.substring(0, dot) : dottedName;
    }

    /**
     * Root-relative path with '/' separators, or the path itself when it lies outside root.
     */
    public static String displayPath(Path root, Path file) {
        if (root == null || !file.startsWith(root)) {
            return file.toString().replace('\\', '/');
        }
        return root.relativize(file).toString().replace('\\', '/');
    }
}
