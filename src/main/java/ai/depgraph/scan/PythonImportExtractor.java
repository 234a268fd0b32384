package ai.depgraph.scan;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPython;

import ai.depgraph.model.ImportRecord;

/**
 * Extracts import statements from Python sources with the tree-sitter Python grammar.
 * <p>
 * Only the first {@link #DEFAULT_INITIAL_BYTES} bytes are parsed at first, since imports
 * usually sit at the top of a module. When that window does not parse cleanly (for example it
 * ends inside a docstring or an open bracket) the whole file is parsed. A file whose full
 * parse still has syntax errors has no imports.
 */
public final class PythonImportExtractor implements ImportRecordExtractor {

    private static final Logger log = LoggerFactory.getLogger(PythonImportExtractor.class);

    public static final int DEFAULT_INITIAL_BYTES = 10_240;

    private static final String IMPORT_STATEMENT = "import_statement";
    private static final String IMPORT_FROM_STATEMENT = "import_from_statement";
    private static final String FUTURE_IMPORT_STATEMENT = "future_import_statement";
    private static final String DOTTED_NAME = "dotted_name";
    private static final String ALIASED_IMPORT = "aliased_import";
    private static final String RELATIVE_IMPORT = "relative_import";
    private static final String IMPORT_PREFIX = "import_prefix";
    private static final String WILDCARD_IMPORT = "wildcard_import";
    private static final String IDENTIFIER = "identifier";
    private static final String FUTURE_MODULE = "__future__";

    // TSParser is not thread-safe; pipeline workers each get their own
    private static final ThreadLocal<TSParser> PARSER = ThreadLocal.withInitial(() -> {
        final TSParser parser = new TSParser();
        if (!parser.setLanguage(new TreeSitterPython())) {
            log.error("Failed to set the Python language on TSParser");
        }
        return parser;
    });

    private final int maxInitialBytes;

    public PythonImportExtractor() {
        this(DEFAULT_INITIAL_BYTES);
    }

    public PythonImportExtractor(int maxInitialBytes) {
        if (maxInitialBytes < 1) {
            throw new IllegalArgumentException("maxInitialBytes must be > 0: " + maxInitialBytes);
        }
        this.maxInitialBytes = maxInitialBytes;
    }

    @Override
    public List<ImportRecord> extract(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            return List.of();
        }
        try {
            final byte[] head = readHead(file, maxInitialBytes + 1);
            if (head.length <= maxInitialBytes) {
                return parse(decode(head)).orElse(List.of());
            }

            final byte[] window = cutAtLastNewline(head, maxInitialBytes);
            if (window.length > 0) {
                final Optional<List<ImportRecord>> fast = parse(decode(window));
                if (fast.isPresent()) {
                    return fast.get();
                }
            }

            log.debug("Initial window of {} has syntax errors, parsing the full file", file);
            final Optional<List<ImportRecord>> full = parse(decode(Files.readAllBytes(file)));
            if (full.isEmpty()) {
                log.debug("Unparsable source, no imports recorded: {}", file);
            }
            return full.orElse(List.of());
        } catch (IOException | RuntimeException | StackOverflowError ex) {
            log.debug("Failed to extract imports from {}: {}", file, ex.toString());
            return List.of();
        } catch (LinkageError ex) {
            log.warn("tree-sitter is not usable, {} gets no imports: {}", file, ex.toString());
            return List.of();
        }
    }

    /**
     * Parses a complete source text.
     *
     * @return the imports in source order, or empty when the text has syntax errors
     */
    static Optional<List<ImportRecord>> parse(String source) {
        final byte[] utf8 = source.getBytes(StandardCharsets.UTF_8);
        final TSTree tree = PARSER.get().parseString(null, source);
        final TSNode root = tree.getRootNode();
        if (root == null || root.isNull() || root.hasError()) {
            return Optional.empty();
        }

        final List<ImportRecord> out = new ArrayList<>();
        // explicit stack, deeply nested blocks must not exhaust the thread stack
        final Deque<TSNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            final TSNode node = pending.pop();
            switch (node.getType()) {
                case IMPORT_STATEMENT -> collectImport(node, utf8, out);
                case IMPORT_FROM_STATEMENT -> collectFromImport(node, utf8, out);
                case FUTURE_IMPORT_STATEMENT -> collectFutureImport(node, utf8, out);
                default -> {
                    for (int i = node.getNamedChildCount() - 1; i >= 0; i--) {
                        pending.push(node.getNamedChild(i));
                    }
                }
            }
        }
        return Optional.of(List.copyOf(out));
    }

    // import a.b as c, d
    private static void collectImport(TSNode stmt, byte[] src, List<ImportRecord> out) {
        final int line = lineOf(stmt);
        for (int i = 0; i < stmt.getNamedChildCount(); i++) {
            final String module = importedName(stmt.getNamedChild(i), src);
            if (module != null) {
                out.add(ImportRecord.plain(module, line));
            }
        }
    }

    // from ..pkg import a, b as c   /   from . import *
    private static void collectFromImport(TSNode stmt, byte[] src, List<ImportRecord> out) {
        final TSNode moduleNode = stmt.getChildByFieldName("module_name");
        if (moduleNode == null || moduleNode.isNull()) {
            return;
        }

        String module;
        int level = 0;
        if (RELATIVE_IMPORT.equals(moduleNode.getType())) {
            module = "";
            for (int i = 0; i < moduleNode.getNamedChildCount(); i++) {
                final TSNode part = moduleNode.getNamedChild(i);
                if (IMPORT_PREFIX.equals(part.getType())) {
                    level = countDots(text(part, src));
                } else if (DOTTED_NAME.equals(part.getType())) {
                    module = dotted(part, src);
                }
            }
        } else {
            module = dotted(moduleNode, src);
        }

        final List<String> names = new ArrayList<>();
        for (int i = 0; i < stmt.getNamedChildCount(); i++) {
            final TSNode child = stmt.getNamedChild(i);
            if (child.getStartByte() == moduleNode.getStartByte()) {
                continue;
            }
            if (WILDCARD_IMPORT.equals(child.getType())) {
                names.add(ImportRecord.WILDCARD);
                continue;
            }
            final String name = importedName(child, src);
            if (name != null) {
                names.add(name);
            }
        }
        out.add(ImportRecord.fromImport(module, names, level, lineOf(stmt)));
    }

    private static void collectFutureImport(TSNode stmt, byte[] src, List<ImportRecord> out) {
        final List<String> names = new ArrayList<>();
        for (int i = 0; i < stmt.getNamedChildCount(); i++) {
            final String name = importedName(stmt.getNamedChild(i), src);
            if (name != null) {
                names.add(name);
            }
        }
        out.add(ImportRecord.fromImport(FUTURE_MODULE, names, 0, lineOf(stmt)));
    }

    /**
     * @return the dotted name of a {@code dotted_name} or {@code aliased_import} node, alias dropped;
     * null for anything else (comments)
     */
    private static String importedName(TSNode node, byte[] src) {
        if (DOTTED_NAME.equals(node.getType())) {
            return dotted(node, src);
        }
        if (ALIASED_IMPORT.equals(node.getType())) {
            final TSNode name = node.getChildByFieldName("name");
            return name == null || name.isNull() ? null : dotted(name, src);
        }
        return null;
    }

    private static String dotted(TSNode node, byte[] src) {
        final StringBuilder sb = new StringBuilder();
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            final TSNode part = node.getNamedChild(i);
            if (!IDENTIFIER.equals(part.getType())) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append('.');
            }
            sb.append(text(part, src));
        }
        return sb.toString();
    }

    private static String text(TSNode node, byte[] src) {
        final int start = node.getStartByte();
        final int end = Math.min(node.getEndByte(), src.length);
        return new String(src, start, Math.max(0, end - start), StandardCharsets.UTF_8);
    }

    private static int lineOf(TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }

    private static int countDots(String s) {
        int n = 0;
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) == '.') {
                n++;
            }
        }
        return n;
    }

    // --- io ---

    private static byte[] readHead(Path file, int limit) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return in.readNBytes(limit);
        }
    }

    /**
     * Drops the trailing partial line of a truncated window so no import name is cut in half.
     */
    private static byte[] cutAtLastNewline(byte[] head, int limit) {
        for (int i = Math.min(limit, head.length) - 1; i >= 0; i--) {
            if (head[i] == '\n') {
                return Arrays.copyOf(head, i + 1);
            }
        }
        return new byte[0];
    }

    static String decode(byte[] bytes) {
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException ex) {
            text = new String(bytes, StandardCharsets.ISO_8859_1);
        }
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            text = text.substring(1);
        }
        return text;
    }
}
