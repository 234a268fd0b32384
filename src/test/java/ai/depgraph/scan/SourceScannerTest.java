package ai.depgraph.scan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class SourceScannerTest {

    @TempDir
    Path root;

    @Test
    void findsSourceFilesAndSkipsExcludedDirectories() throws IOException {
        touch("main.py");
        touch("pkg/__init__.py");
        touch("pkg/core.py");
        touch("pkg/notes.txt");
        touch(".hidden/secret.py");
        touch("venv/lib/site.py");
        touch("pkg/__pycache__/core.py");
        touch("node_modules/x/y.py");

        final List<Path> found = SourceScanner.withDefaults().discover(root);

        assertThat(found).containsExactly(
                root.resolve("main.py"),
                root.resolve("pkg/__init__.py"),
                root.resolve("pkg/core.py"));
    }

    @Test
    void honoursExtraExcludesAndIgnoreGlobs() throws IOException {
        touch("app.py");
        touch("migrations/0001_initial.py");
        touch("tests/test_app.py");
        touch("tests/conftest.py");
        touch("src/generated/model.py");

        final SourceScanner scanner = new SourceScanner(
                Set.of("migrations"),
                IgnoreRules.of(List.of("test_*", "**/generated/**")));

        assertThat(scanner.discover(root)).containsExactly(
                root.resolve("app.py"),
                root.resolve("tests/conftest.py"));
    }

    @Test
    void unfilteredScannerKeepsHiddenAndExcludedDirectories() throws IOException {
        touch("main.py");
        touch(".hidden/secret.py");
        touch("venv/lib/site.py");

        final List<Path> found = SourceScanner.unfiltered().discover(root);

        assertThat(found).containsExactly(
                root.resolve(".hidden/secret.py"),
                root.resolve("main.py"),
                root.resolve("venv/lib/site.py"));
    }

    @Test
    void missingRootYieldsNothing() {
        assertThat(SourceScanner.withDefaults().discover(root.resolve("absent"))).isEmpty();
    }

    @Test
    void resultIsSorted() throws IOException {
        touch("b.py");
        touch("a.py");
        touch("c/a.py");

        final List<Path> found = SourceScanner.withDefaults().discover(root);

        assertThat(found).isSorted();
        assertThat(found).hasSize(3);
    }

    @Test
    void symlinkedFilesCountButSymlinkedDirectoriesDoNot() throws IOException {
        final Path real = touch("real/impl.py");
        try {
            Files.createSymbolicLink(root.resolve("alias.py"), real);
            Files.createSymbolicLink(root.resolve("linked"), real.getParent());
        } catch (UnsupportedOperationException | IOException ex) {
            Assumptions.assumeTrue(false, "symbolic links not supported here");
        }

        assertThat(SourceScanner.withDefaults().discover(root)).containsExactly(
                root.resolve("alias.py"),
                root.resolve("real/impl.py"));
    }

    private Path touch(String relative) throws IOException {
        final Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "");
        return file;
    }
}
