package ai.depgraph.model;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class SourceFilesTest {

    @Test
    void moduleNames() {
        assertThat(SourceFiles.moduleName(Paths.get("pkg", "mod.py"))).isEqualTo("pkg.mod");
        assertThat(SourceFiles.moduleName(Paths.get("pkg", "sub", "__init__.py"))).isEqualTo("pkg.sub");
        assertThat(SourceFiles.moduleName(Paths.get("main.py"))).isEqualTo("main");
        assertThat(SourceFiles.moduleName(Paths.get("__init__.py"))).isEmpty();
    }

    @Test
    void recognisesSourceFiles() {
        assertThat(SourceFiles.isSourceFile(Paths.get("a", "b.py"))).isTrue();
        assertThat(SourceFiles.isSourceFile(Paths.get("a", "b.pyc"))).isFalse();
        assertThat(SourceFiles.isPackageInit(Paths.get("a", "__init__.py"))).isTrue();
        assertThat(SourceFiles.isPackageInit(Paths.get("a", "init.py"))).isFalse();
    }

    @Test
    void segmentsAndTopLevel() {
        assertThat(SourceFiles.segments("a.b.c")).containsExactly("a", "b", "c");
        assertThat(SourceFiles.segments("")).isEmpty();
        assertThat(SourceFiles.topLevel("os.path")).isEqualTo("os");
        assertThat(SourceFiles.topLevel("os")).isEqualTo("os");
    }

    @Test
    void displayPathIsRootRelative() {
        final Path root = Paths.get("/project");

        assertThat(SourceFiles.displayPath(root, root.resolve("pkg/mod.py"))).isEqualTo("pkg/mod.py");
        assertThat(SourceFiles.displayPath(root, Paths.get("/elsewhere/x.py"))).isEqualTo("/elsewhere/x.py");
        assertThat(SourceFiles.displayPath(null, Paths.get("/x.py"))).isEqualTo("/x.py");
    }

    @Test
    void importRecordNormalisesAndValidates() {
        final ImportRecord plain = ImportRecord.plain("os", 3);

        assertThat(plain.names()).isEmpty();
        assertThat(plain.from()).isFalse();
        assertThat(ImportRecord.fromImport("", List.of("*"), 1, 1).isWildcard()).isTrue();
        assertThatThrownBy(() -> ImportRecord.fromImport("x", List.of("y"), -1, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
