package ai.depgraph.scan;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import ai.depgraph.model.ImportRecord;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

@Tag("unit")
class PythonImportExtractorTest {

    @TempDir
    Path tempDir;

    private static List<ImportRecord> parse(String source) {
        return PythonImportExtractor.parse(source).orElseThrow();
    }

    @Test
    void simpleImport() {
        final List<ImportRecord> imports = parse("import os\n");

        assertThat(imports).hasSize(1);
        final ImportRecord imp = imports.get(0);
        assertThat(imp.module()).isEqualTo("os");
        assertThat(imp.names()).isEmpty();
        assertThat(imp.level()).isZero();
        assertThat(imp.from()).isFalse();
        assertThat(imp.line()).isEqualTo(1);
    }

    @Test
    void multipleModulesInOneStatement() {
        assertThat(parse("import os, sys\n"))
                .extracting(ImportRecord::module)
                .containsExactly("os", "sys");
    }

    @Test
    void aliasesAreDropped() {
        assertThat(parse("import numpy as np, os.path as osp\n"))
                .extracting(ImportRecord::module)
                .containsExactly("numpy", "os.path");
    }

    @Test
    void fromImport() {
        final ImportRecord imp = parse("from os.path import join, exists as e\n").get(0);

        assertThat(imp.module()).isEqualTo("os.path");
        assertThat(imp.names()).containsExactly("join", "exists");
        assertThat(imp.from()).isTrue();
        assertThat(imp.isRelative()).isFalse();
    }

    @Test
    void wildcardImport() {
        final ImportRecord imp = parse("from os import *\n").get(0);

        assertThat(imp.names()).containsExactly("*");
        assertThat(imp.isWildcard()).isTrue();
    }

    @Test
    void relativeImportSingleDot() {
        final ImportRecord imp = parse("from . import utils\n").get(0);

        assertThat(imp.module()).isEmpty();
        assertThat(imp.names()).containsExactly("utils");
        assertThat(imp.level()).isEqualTo(1);
    }

    @Test
    void relativeImportDoubleDot() {
        final ImportRecord imp = parse("from ..package import module\n").get(0);

        assertThat(imp.module()).isEqualTo("package");
        assertThat(imp.names()).containsExactly("module");
        assertThat(imp.level()).isEqualTo(2);
    }

    @Test
    void relativeImportWithoutSpaces() {
        final List<ImportRecord> imports = parse("from .models import User\nfrom ...core import base\n");

        assertThat(imports).extracting(ImportRecord::module, ImportRecord::level)
                .containsExactly(tuple("models", 1), tuple("core", 3));
    }

    @Test
    void importsInsideFunctionsAndTryBlocks() {
        final String src = """
                def load():
                    import json
                    from datetime import datetime
                    return json

                try:
                    import ujson as fastjson
                except ImportError:
                    fastjson = None
                """;

        assertThat(parse(src))
                .extracting(ImportRecord::module)
                .containsExactly("json", "datetime", "ujson");
    }

    @Test
    void parenthesizedNamesAcrossLines() {
        final String src = """
                from pkg.sub import (
                    alpha,
                    beta as b,  # trailing comment
                )
                """;

        final ImportRecord imp = parse(src).get(0);
        assertThat(imp.module()).isEqualTo("pkg.sub");
        assertThat(imp.names()).containsExactly("alpha", "beta");
        assertThat(imp.line()).isEqualTo(1);
    }

    @Test
    void backslashContinuation() {
        final ImportRecord imp = parse("from pkg import a, \\\n    b\n").get(0);

        assertThat(imp.names()).containsExactly("a", "b");
    }

    @Test
    void semicolonSeparatedStatements() {
        assertThat(parse("import os; import sys\n"))
                .extracting(ImportRecord::module, ImportRecord::line)
                .containsExactly(
                        tuple("os", 1),
                        tuple("sys", 1));
    }

    @Test
    void oneLineCompoundStatement() {
        assertThat(parse("if TYPE_CHECKING: import typing_extensions\n"))
                .extracting(ImportRecord::module)
                .containsExactly("typing_extensions");
    }

    @Test
    void commentsAndStringsAreIgnored() {
        final String src = """
                # import fake
                \"\"\"
                import notreal
                \"\"\"
                text = 'import nope'
                importlib_name = "x"
                import real
                """;

        assertThat(parse(src))
                .extracting(ImportRecord::module)
                .containsExactly("real");
    }

    @Test
    void lineNumbers() {
        final List<ImportRecord> imports = parse("\nimport os\n\nimport sys\n\nimport json\n");

        assertThat(imports).extracting(ImportRecord::line).containsExactly(2, 4, 6);
    }

    @Test
    void structurallyBrokenSourceHasNoResult() {
        assertThat(PythonImportExtractor.parse("import os\ndef broken(:\n")).isEmpty();
        assertThat(PythonImportExtractor.parse("import os\ns = \"unterminated\n")).isEmpty();
        assertThat(PythonImportExtractor.parse("import os\n\"\"\"never closed\n")).isEmpty();
    }

    @Test
    void malformedImportStatementHasNoResult() {
        assertThat(PythonImportExtractor.parse("import os\nfrom import x\n")).isEmpty();
        assertThat(PythonImportExtractor.parse("import\n")).isEmpty();
    }

    @Test
    void emptySource() {
        assertThat(parse("")).isEmpty();
    }

    @Test
    void extractFromFile() throws IOException {
        final Path file = write("mod.py", "import os\nfrom . import sibling\n");

        assertThat(new PythonImportExtractor().extract(file))
                .extracting(ImportRecord::module)
                .containsExactly("os", "");
    }

    @Test
    void missingOrUnparsableFilesYieldNothing() throws IOException {
        final PythonImportExtractor extractor = new PythonImportExtractor();

        assertThat(extractor.extract(tempDir.resolve("absent.py"))).isEmpty();
        assertThat(extractor.extract(tempDir)).isEmpty();
        assertThat(extractor.extract(write("broken.py", "import os\nx = (\n"))).isEmpty();
    }

    @Test
    void rereadsFullFileWhenWindowEndsInsideString() throws IOException {
        final String src = "import a\n\"\"\"\n" + "docstring line\n".repeat(20) + "\"\"\"\nimport b\n";
        final Path file = write("doc.py", src);

        assertThat(new PythonImportExtractor(32).extract(file))
                .extracting(ImportRecord::module)
                .containsExactly("a", "b");
    }

    @Test
    void cleanWindowIsNotExtended() throws IOException {
        final String src = "import a\n" + "x = 1\n".repeat(20) + "import b\n";
        final Path file = write("long.py", src);

        assertThat(new PythonImportExtractor(32).extract(file))
                .extracting(ImportRecord::module)
                .containsExactly("a");
        assertThat(new PythonImportExtractor().extract(file))
                .extracting(ImportRecord::module)
                .containsExactly("a", "b");
    }

    @Test
    void veryLongDottedImportIsReadWithoutError() throws IOException {
        final String module = String.join(".", Collections.nCopies(20_000, "a"));
        final Path file = write("generated.py", "import " + module + "\nimport os\n");

        assertThat(new PythonImportExtractor().extract(file))
                .extracting(ImportRecord::module)
                .containsExactly(module, "os");
    }

    @Test
    void futureImport() {
        final ImportRecord imp = parse("from __future__ import annotations\n").get(0);

        assertThat(imp.module()).isEqualTo("__future__");
        assertThat(imp.names()).containsExactly("annotations");
        assertThat(imp.from()).isTrue();
    }

    @Test
    void importsInsideClassesAndDecoratedFunctions() {
        final String src = """
                class Service:
                    @cached
                    def client(self):
                        if self.remote:
                            from .remote import Client
                        else:
                            from .local import Client
                        return Client()
                """;

        assertThat(parse(src))
                .extracting(ImportRecord::module, ImportRecord::level, ImportRecord::line)
                .containsExactly(tuple("remote", 1, 5), tuple("local", 1, 7));
    }

    @Test
    void latin1SourceFallsBack() throws IOException {
        final Path file = tempDir.resolve("legacy.py");
        final byte[] bytes = "# café\nimport legacy\n".getBytes(StandardCharsets.ISO_8859_1);
        Files.write(file, bytes);

        assertThat(new PythonImportExtractor().extract(file))
                .extracting(ImportRecord::module)
                .containsExactly("legacy");
    }

    private Path write(String name, String content) throws IOException {
        final Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
