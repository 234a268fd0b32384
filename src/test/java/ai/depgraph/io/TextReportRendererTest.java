package ai.depgraph.io;

import java.nio.file.Path;
import java.nio.file.Paths;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import ai.depgraph.graph.DependencyGraph;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class TextReportRendererTest {

    private static final Path ROOT = Paths.get("/project");

    private final TextReportRenderer renderer = new TextReportRenderer();

    @Test
    void reportListsTotalsAndHotSpots() {
        final DependencyGraph graph = new DependencyGraph(ROOT);
        graph.addDependency(ROOT.resolve("a.py"), ROOT.resolve("core.py"));
        graph.addDependency(ROOT.resolve("b.py"), ROOT.resolve("core.py"));
        graph.addExternal(ROOT.resolve("a.py"), "yaml");

        final String report = renderer.render(graph);

        assertThat(report)
                .contains("Files analyzed: 3")
                .contains("Internal dependencies: 2")
                .contains("External dependencies: 1")
                .contains("Circular dependencies: 0")
                .contains("core.py: imported by 2")
                .doesNotContain("Circular dependencies detected");
    }

    @Test
    void reportShowsCycles() {
        final DependencyGraph graph = new DependencyGraph(ROOT);
        graph.addDependency(ROOT.resolve("a.py"), ROOT.resolve("pkg/b.py"));
        graph.addDependency(ROOT.resolve("pkg/b.py"), ROOT.resolve("a.py"));

        assertThat(renderer.render(graph))
                .contains("Circular dependencies detected:")
                .contains("  Cycle 1:")
                .contains("    -> pkg/b.py");
    }

    @Test
    void cyclesOnlyView() {
        final DependencyGraph acyclic = new DependencyGraph(ROOT);
        acyclic.addDependency(ROOT.resolve("a.py"), ROOT.resolve("b.py"));

        assertThat(renderer.renderCycles(acyclic)).startsWith("No circular dependencies found.");

        acyclic.addDependency(ROOT.resolve("b.py"), ROOT.resolve("a.py"));
        assertThat(renderer.renderCycles(acyclic))
                .startsWith("Circular dependencies found:")
                .contains("    -> a.py")
                .contains("    -> b.py");
    }
}
