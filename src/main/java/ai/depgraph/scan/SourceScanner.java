package ai.depgraph.scan;

import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.depgraph.model.SourceFiles;

/**
 * Finds all Python source files below a root:
 * - hidden directories (".git", ".venv", ...) are skipped
 * - directories named in {@code excludeDirs} are skipped
 * - anything matching an ignore glob is skipped
 * - symlinked directories are never followed
 * Unreadable subtrees are skipped, never fatal. {@link #unfiltered()} drops every rule but
 * the symlink one.
 */
public final class SourceScanner {

    private static final Logger log = LoggerFactory.getLogger(SourceScanner.class);

    public static final Set<String> DEFAULT_EXCLUDE_DIRS = Set.of(
            ".git", "__pycache__", ".venv", "venv", "env",
            "node_modules", ".tox", ".mypy_cache", ".pytest_cache");

    private final Set<String> excludeDirs;
    private final IgnoreRules ignoreRules;
    private final boolean skipHidden;

    public SourceScanner(Set<String> excludeDirs, IgnoreRules ignoreRules) {
        this(excludeDirs, ignoreRules, true);
    }

    private SourceScanner(Set<String> excludeDirs, IgnoreRules ignoreRules, boolean skipHidden) {
        this.excludeDirs = Set.copyOf(Objects.requireNonNull(excludeDirs, "excludeDirs"));
        this.ignoreRules = Objects.requireNonNull(ignoreRules, "ignoreRules");
        this.skipHidden = skipHidden;
    }

    public static SourceScanner withDefaults() {
        return new SourceScanner(DEFAULT_EXCLUDE_DIRS, IgnoreRules.none());
    }

    /**
     * Every source file below the root, hidden and excluded directories included.
     * Symlinked directories are still not followed.
     */
    public static SourceScanner unfiltered() {
        return new SourceScanner(Set.of(), IgnoreRules.none(), false);
    }

    /**
     * @return absolute paths of all discovered source files, symlinks unresolved, sorted
     */
    public List<Path> discover(Path root) {
        Objects.requireNonNull(root, "root");
        final Path start = root.toAbsolutePath().normalize();
        if (!Files.isDirectory(start)) {
            return List.of();
        }

        final List<Path> files = new ArrayList<>();
        try {
            Files.walkFileTree(start, EnumSet.noneOf(FileVisitOption.class), Integer.MAX_VALUE,
                    new SimpleFileVisitor<>() {
                        @Override
                        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                            if (dir.equals(start)) {
                                return FileVisitResult.CONTINUE;
                            }
                            final String name = dir.getFileName() != null ? dir.getFileName().toString() : "";
                            if ((skipHidden && name.startsWith(".")) || excludeDirs.contains(name)) {
                                return FileVisitResult.SKIP_SUBTREE;
                            }
                            if (ignoreRules.matches(start.relativize(dir))) {
                                return FileVisitResult.SKIP_SUBTREE;
                            }
                            return FileVisitResult.CONTINUE;
                        }

                        @Override
                        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                            if (!SourceFiles.isSourceFile(file)) {
                                return FileVisitResult.CONTINUE;
                            }
                            // symlinked files count, symlinked directories show up here and are dropped
                            final boolean regular = attrs.isRegularFile()
                                    || (attrs.isSymbolicLink() && Files.isRegularFile(file));
                            if (!regular) {
                                return FileVisitResult.CONTINUE;
                            }
                            final String name = file.getFileName().toString();
                            if (excludeDirs.contains(name) || ignoreRules.matches(start.relativize(file))) {
                                return FileVisitResult.CONTINUE;
                            }
                            files.add(file);
                            return FileVisitResult.CONTINUE;
                        }

                        @Override
                        public FileVisitResult visitFileFailed(Path file, IOException exc) {
                            log.debug("Skipping unreadable path {}: {}", file, exc.toString());
                            return FileVisitResult.CONTINUE;
                        }

                        @Override
                        public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
                            if (exc != null) {
                                log.debug("Directory listing aborted for {}: {}", dir, exc.toString());
                            }
                            return FileVisitResult.CONTINUE;
                        }
                    });
        } catch (IOException ex) {
            log.warn("Scan of {} stopped early: {}", start, ex.toString());
        }

        Collections.sort(files);
        return files;
    }
}
