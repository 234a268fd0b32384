package ai.depgraph.model;

import java.util.List;
import java.util.Objects;

/**
 * One import statement target as found in a source file.
 * <p>
 * {@code import a.b as c, d} yields two records (module "a.b" and "d", no names).
 * {@code from ..pkg import x, y} yields one record (module "pkg", names [x, y], level 2).
 */
public record ImportRecord(
        String module,      // dotted name, "" for "from . import x"
        List<String> names, // imported names in order, ["*"] for wildcard imports
        int level,          // 0 = absolute, 1 = current package, 2 = parent, ...
        int line,           // 1-based line of the statement
        boolean from        // true for "from X import Y"
) {

    public static final String WILDCARD = "*";

    public ImportRecord {
        module = module == null ? "" : module;
        names = names == null ? List.of() : List.copyOf(names);
        if (level < 0) {
            throw new IllegalArgumentException("level must be >= 0: " + level);
        }
    }

    public static ImportRecord plain(String module, int line) {
        Objects.requireNonNull(module, "module");
        return new ImportRecord(module, List.of(), 0, line, false);
    }

    public static ImportRecord fromImport(String module, List<String> names, int level, int line) {
        return new ImportRecord(module, names, level, line, true);
    }

    public boolean isRelative() {
        return level > 0;
    }

    public boolean isWildcard() {
        return names.size() == 1 && WILDCARD.equals(names.get(0));
    }
}
