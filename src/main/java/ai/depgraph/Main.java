package ai.depgraph;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;

import ai.depgraph.graph.DependencyGraph;
import ai.depgraph.graph.GraphBuilder;
import ai.depgraph.io.DotRenderer;
import ai.depgraph.io.GraphWriter;
import ai.depgraph.io.TextReportRenderer;

public final class Main {

    private static final Set<String> FORMATS = Set.of("text", "json", "dot", "cycles");

    public static void main(String[] args) {
        final int code = run(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args) {
        Path target = null;
        Path output = null;
        Path ignoreFile = null;
        String format = "text";
        boolean showExternal = false;
        boolean quiet = false;
        AnalyzerOptions options = AnalyzerOptions.defaults();
        final Set<String> extraExcludes = new LinkedHashSet<>();
        final List<String> ignoreGlobs = new ArrayList<>();

        try {
            for (String arg : args) {
                if ("--help".equals(arg) || "-h".equals(arg)) {
                    printUsage();
                    return 0;
                }
                if (arg.startsWith("--workers=")) {
                    options = options.withWorkers(Integer.parseInt(arg.substring("--workers=".length()).trim()));
                    continue;
                }
                if (arg.startsWith("--timeoutSeconds=")) {
                    final long seconds = Long.parseLong(arg.substring("--timeoutSeconds=".length()).trim());
                    options = options.withChunkTimeout(Duration.ofSeconds(seconds));
                    continue;
                }
                if (arg.startsWith("--exclude=")) {
                    splitList(arg.substring("--exclude=".length()), extraExcludes);
                    continue;
                }
                if (arg.startsWith("--ignore=")) {
                    splitList(arg.substring("--ignore=".length()), ignoreGlobs);
                    continue;
                }
                if (arg.startsWith("--ignoreFile=")) {
                    ignoreFile = Paths.get(arg.substring("--ignoreFile=".length()));
                    continue;
                }
                if (arg.startsWith("--internalOnly=")) {
                    options = options.withInternalOnly(Boolean.parseBoolean(arg.substring("--internalOnly=".length())));
                    continue;
                }
                if (arg.startsWith("--showExternal=")) {
                    showExternal = Boolean.parseBoolean(arg.substring("--showExternal=".length()));
                    continue;
                }
                if (arg.startsWith("--format=")) {
                    format = arg.substring("--format=".length()).trim().toLowerCase(Locale.ROOT);
                    if (!FORMATS.contains(format)) {
                        System.err.println("ERROR: unknown format: " + format);
                        printUsage();
                        return 2;
                    }
                    continue;
                }
                if (arg.startsWith("--output=")) {
                    output = Paths.get(arg.substring("--output=".length()));
                    continue;
                }
                if ("--quiet".equals(arg)) {
                    quiet = true;
                    continue;
                }
                if (arg.startsWith("--")) {
                    System.err.println("ERROR: unknown argument: " + arg);
                    printUsage();
                    return 2;
                }
                if (target == null) {
                    target = Paths.get(arg);
                    continue;
                }
                System.err.println("ERROR: unexpected argument: " + arg);
                printUsage();
                return 2;
            }

            if (target == null) {
                target = Paths.get(".");
            }
            target = target.toAbsolutePath().normalize();

            if (ignoreFile != null) {
                loadIgnoreFile(ignoreFile.toAbsolutePath().normalize(), ignoreGlobs);
            }
            options = options.withExtraExcludes(extraExcludes).withIgnoreGlobs(ignoreGlobs);

            if (quiet) {
                setLogLevel(Level.WARN);
            }

            final DependencyGraph graph = new GraphBuilder(options).build(target);
            final String rendered = render(graph, format, showExternal);

            if (output != null) {
                final Path out = output.toAbsolutePath().normalize();
                if (out.getParent() != null) {
                    Files.createDirectories(out.getParent());
                }
                Files.writeString(out, rendered, StandardCharsets.UTF_8);
                if (!quiet) {
                    System.out.println("Saved " + format + " output to: " + out);
                }
            } else {
                System.out.print(rendered);
            }
            return 0;
        } catch (NumberFormatException ex) {
            System.err.println("ERROR: invalid number: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (IllegalArgumentException ex) {
            System.err.println("ERROR: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (ConfigurationException ex) {
            System.err.println("ERROR: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (IOException ex) {
            System.err.println("ERROR: IO failure: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (Exception ex) {
            System.err.println("ERROR: failed to analyze: "
                    + ex.getClass().getSimpleName() + ": " + safeMsg(ex.getMessage()));
            return 1;
        }
    }

    static String render(DependencyGraph graph, String format, boolean showExternal) throws IOException {
        return switch (format) {
            case "json" -> new GraphWriter().toJson(graph, Instant.now().toString()) + System.lineSeparator();
            case "dot" -> new DotRenderer().render(graph, showExternal);
            case "cycles" -> new TextReportRenderer().renderCycles(graph);
            default -> new TextReportRenderer().render(graph);
        };
    }

    /**
     * One glob per line or comma/space-separated; '#' starts a comment.
     */
    static void loadIgnoreFile(Path file, List<String> globs) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException("Ignore file not found: " + file);
        }
        try (var br = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = br.readLine()) != null) {
                String trimmed = line.trim();
                final int hash = trimmed.indexOf('#');
                if (hash >= 0) {
                    trimmed = trimmed.substring(0, hash).trim();
                }
                if (trimmed.isEmpty()) {
                    continue;
                }
                for (String token : trimmed.split("[,\\s]+")) {
                    if (!token.isBlank()) {
                        globs.add(token.trim());
                    }
                }
            }
        }
    }

    private static void splitList(String list, Collection<String> into) {
        final String trimmed = list.trim();
        if (trimmed.isEmpty()) {
            return;
        }
        Arrays.stream(trimmed.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .forEach(into::add);
    }

    private static void setLogLevel(Level level) {
        final var logger = LoggerFactory.getLogger("ai.depgraph");
        if (logger instanceof ch.qos.logback.classic.Logger logback) {
            logback.setLevel(level);
        }
    }

    private static void printUsage() {
        System.out.println("Usage: py-depgraph [target] [options]");
        System.out.println("  target                   Directory or .py file to analyze (default: .)");
        System.out.println("Options:");
        System.out.println("  --format=<fmt>           text | json | dot | cycles (default: text)");
        System.out.println("  --output=<path>          Write the result to a file instead of stdout");
        System.out.println("  --workers=<n>            Parallel extraction workers (default: CPU count)");
        System.out.println("  --timeoutSeconds=<n>     Max wait for one extraction chunk (default: 30)");
        System.out.println("  --exclude=<d1,d2>        Extra directory names to skip");
        System.out.println("  --ignore=<g1,g2>         Glob patterns of files/folders to skip");
        System.out.println("  --ignoreFile=<path>      File with ignore globs (one per line or comma-separated)");
        System.out.println("  --internalOnly=<bool>    Do not record external imports (default: false)");
        System.out.println("  --showExternal=<bool>    Include external modules in dot output (default: false)");
        System.out.println("  --quiet                  Only log warnings");
        System.out.println("  --help, -h               Show this help");
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
