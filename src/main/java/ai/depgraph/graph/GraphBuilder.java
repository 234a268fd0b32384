package ai.depgraph.graph;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.depgraph.AnalyzerOptions;
import ai.depgraph.ConfigurationException;
import ai.depgraph.model.ImportRecord;
import ai.depgraph.model.SourceFiles;
import ai.depgraph.modules.ModuleIndex;
import ai.depgraph.modules.ModuleResolver;
import ai.depgraph.scan.ImportRecordExtractor;
import ai.depgraph.scan.ParallelExtractionPipeline;
import ai.depgraph.scan.PythonImportExtractor;
import ai.depgraph.scan.SourceScanner;

/**
 * Builds the dependency graph for a directory or a single source file.
 * Only a missing or unreadable target is an error; bad files just contribute no imports.
 */
public final class GraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    private final AnalyzerOptions options;
    private final ImportRecordExtractor extractor;

    public GraphBuilder(AnalyzerOptions options) {
        this(options, new PythonImportExtractor());
    }

    public GraphBuilder(AnalyzerOptions options, ImportRecordExtractor extractor) {
        this.options = Objects.requireNonNull(options, "options");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
    }

    public DependencyGraph build(Path target) throws ConfigurationException {
        Objects.requireNonNull(target, "target");
        final long started = System.nanoTime();
        final Path path = SourceFiles.canonical(target);

        if (!Files.exists(path)) {
            throw new ConfigurationException("Target not found: " + target);
        }
        if (!Files.isReadable(path)) {
            throw new ConfigurationException("Target not readable: " + target);
        }

        // Step 1: decide root and files
        final SourceScanner scanner = options.scanner();
        final Path root;
        final List<Path> files;
        if (Files.isDirectory(path)) {
            root = path;
            files = scanner.discover(root);
        } else {
            root = path.getParent();
            files = List.of(path);
        }
        log.info("Found {} Python file(s) under {}", files.size(), root);

        // Step 2: extract imports in parallel
        final ParallelExtractionPipeline pipeline =
                new ParallelExtractionPipeline(options.workers(), options.chunkTimeout());
        final Map<Path, List<ImportRecord>> imports = pipeline.extractAll(files, extractor);
        log.info("Extracted imports from {} file(s)", imports.size());

        // Step 3: index every module under the root once, ignored ones included
        final ModuleResolver resolver = new ModuleResolver(ModuleIndex.build(root));

        // Step 4: resolve and accumulate
        final DependencyGraph graph = new DependencyGraph(root);
        for (Path file : files) {
            graph.addFile(file);
            for (ImportRecord imp : imports.getOrDefault(file, List.of())) {
                addImport(graph, resolver, file, imp, options.internalOnly());
            }
        }

        if (log.isInfoEnabled()) {
            final GraphStats stats = graph.getStats();
            log.info("Analysis complete in {} ms: files={}, dependencies={}, external={}, cycles={}",
                    (System.nanoTime() - started) / 1_000_000,
                    stats.totalFiles(), stats.totalDependencies(), stats.totalExternal(), stats.cycles());
        }
        return graph;
    }

    /**
     * Resolves one import record of {@code file} and records the outcome.
     * Unresolved absolute imports become externals unless {@code internalOnly};
     * unresolved relative imports are dropped.
     */
    static void addImport(DependencyGraph graph,
                          ModuleResolver resolver,
                          Path file,
                          ImportRecord imp,
                          boolean internalOnly) {
        if (!imp.isRelative()) {
            final Optional<Path> resolved = resolver.resolveAbsolute(imp.module(), file);
            if (resolved.isPresent()) {
                graph.addDependency(file, resolved.get());
            } else if (!internalOnly && resolver.isExternal(imp.module())) {
                graph.addExternal(file, imp.module());
            }
            return;
        }

        if (!imp.module().isEmpty()) {
            resolver.resolveRelative(imp.module(), file, imp.level())
                    .ifPresent(target -> graph.addDependency(file, target));
            return;
        }

        // "from . import a, b": each name may be a submodule, otherwise it lives in the package
        boolean packageItself = imp.isWildcard() || imp.names().isEmpty();
        for (String name : imp.names()) {
            if (ImportRecord.WILDCARD.equals(name)) {
                continue;
            }
            final Optional<Path> submodule = resolver.resolveRelative(name, file, imp.level());
            if (submodule.isPresent()) {
                graph.addDependency(file, submodule.get());
            } else {
                packageItself = true;
            }
        }
        if (packageItself) {
            resolver.resolveRelative("", file, imp.level())
                    .ifPresent(target -> graph.addDependency(file, target));
        }
    }
}
