package ai.depgraph.scan;

import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Glob rules for paths that must not be analyzed.
 * A rule matches a root-relative path either as a whole or through any single segment,
 * so {@code test_*} hides every test module and {@code **}{@code /generated/**} hides
 * generated trees at any depth.
 */
public final class IgnoreRules {

    private static final IgnoreRules NONE = new IgnoreRules(List.of(), List.of());

    private final List<String> patterns;
    private final List<PathMatcher> matchers;

    private IgnoreRules(List<String> patterns, List<PathMatcher> matchers) {
        this.patterns = List.copyOf(patterns);
        this.matchers = List.copyOf(matchers);
    }

    public static IgnoreRules none() {
        return NONE;
    }

    public static IgnoreRules of(Collection<String> globs) {
        if (globs == null || globs.isEmpty()) {
            return NONE;
        }
        final FileSystem fs = FileSystems.getDefault();
        final List<String> patterns = new ArrayList<>();
        final List<PathMatcher> matchers = new ArrayList<>();
        for (String glob : globs) {
            final String g = glob == null ? "" : glob.trim();
            if (g.isEmpty()) {
                continue;
            }
            patterns.add(g);
            matchers.add(fs.getPathMatcher("glob:" + g));
            // "**/x" must also match "x" directly under the root
            String rest = g;
            while (rest.startsWith("**/")) {
                rest = rest.substring(3);
                if (!rest.isEmpty()) {
                    matchers.add(fs.getPathMatcher("glob:" + rest));
                }
            }
        }
        return new IgnoreRules(patterns, matchers);
    }

    public boolean isEmpty() {
        return matchers.isEmpty();
    }

    public List<String> patterns() {
        return patterns;
    }

    /**
     * @param relPath path relative to the scan root
     */
    public boolean matches(Path relPath) {
        if (matchers.isEmpty() || relPath == null || relPath.getNameCount() == 0) {
            return false;
        }
        for (PathMatcher m : matchers) {
            if (m.matches(relPath)) {
                return true;
            }
            for (Path segment : relPath) {
                if (m.matches(segment)) {
                    return true;
                }
            }
        }
        return false;
    }
}
