package org.larkfront.compiler;

import org.larkfront.compiler.api.IFrontend;
import org.larkfront.compiler.api.ParseException;
import org.larkfront.compiler.api.SyntaxErrorCode;
import org.larkfront.compiler.diagnostics.Diagnostic;
import org.larkfront.compiler.frontend.lexer.Keyword;
import org.larkfront.compiler.frontend.lexer.Token;
import org.larkfront.compiler.frontend.parser.ast.Program;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link Frontend} facade: the two entry points, file reading,
 * and the diagnostics recorded for failures.
 */
@Tag("unit")
class FrontendTest {

    @TempDir
    Path tempDir;

    @Test
    void tokenizeAndParseSucceedWithoutDiagnostics() throws ParseException {
        Frontend frontend = new Frontend();

        assertThat(frontend.tokenize("load")).containsExactly(new Token.Kw(Keyword.LOAD));
        Program program = frontend.parse("load(\"m\", \"a\")");

        assertThat(program.statements()).hasSize(1);
        assertThat(frontend.getDiagnostics().hasErrors()).isFalse();
        assertThat(frontend.getDiagnostics().summary()).isEmpty();
    }

    @Test
    void parseFailureIsReportedWithFileNameAndOffset() {
        Frontend frontend = new Frontend();

        assertThatThrownBy(() -> frontend.parse("load(\"m\")", "BUILD"))
                .isInstanceOf(ParseException.class);

        assertThat(frontend.getDiagnostics().hasErrors()).isTrue();
        Diagnostic diagnostic = frontend.getDiagnostics().getDiagnostics().get(0);
        assertThat(diagnostic.code()).isEqualTo(SyntaxErrorCode.EMPTY_SYMBOL_LIST);
        assertThat(diagnostic.fileName()).isEqualTo("BUILD");
        assertThat(diagnostic.offset()).isEqualTo(8);
        assertThat(frontend.getDiagnostics().summary())
                .isEqualTo("[ERROR] BUILD@8: Expected at least one symbol, got ). (EMPTY_SYMBOL_LIST)");
    }

    @Test
    void tokenizeFailureUsesMemoryFileName() {
        Frontend frontend = new Frontend();

        assertThatThrownBy(() -> frontend.tokenize("\"open"))
                .isInstanceOfSatisfying(ParseException.class, e ->
                        assertThat(e.getError().code()).isEqualTo(SyntaxErrorCode.UNTERMINATED_STRING));

        assertThat(frontend.getDiagnostics().getDiagnostics())
                .singleElement()
                .extracting(Diagnostic::fileName)
                .isEqualTo(IFrontend.MEMORY_FILE_NAME);
    }

    @Test
    void readSourceReturnsWholeFile() throws IOException, ParseException {
        Path file = tempDir.resolve("BUILD.bazel");
        Files.writeString(file, "load(\"m\", \"a\")\n# end\n");

        assertThat(new Frontend().readSource(file)).isEqualTo("load(\"m\", \"a\")\n# end\n");
    }

    @Test
    void readSourceAcceptsBytesThatAreNotUtf8() throws IOException, ParseException {
        // Arrange
        Path file = tempDir.resolve("BUILD");
        byte[] latin1Comment = {'#', ' ', 'c', 'a', 'f', (byte) 0xE9, '\n'};
        byte[] load = "load(\"m\", \"a\")".getBytes(StandardCharsets.US_ASCII);
        byte[] content = new byte[latin1Comment.length + load.length];
        System.arraycopy(latin1Comment, 0, content, 0, latin1Comment.length);
        System.arraycopy(load, 0, content, latin1Comment.length, load.length);
        Files.write(file, content);
        Frontend frontend = new Frontend();

        // Act
        String source = frontend.readSource(file);
        Program program = frontend.parse(source, file.toString());

        // Assert
        assertThat(source).startsWith("# caf\uFFFD\n");
        assertThat(program.statements()).hasSize(1);
        assertThat(frontend.getDiagnostics().hasErrors()).isFalse();
    }

    @Test
    void readSourceOfMissingFileFailsWithIoError() {
        Frontend frontend = new Frontend();
        Path missing = tempDir.resolve("missing.bzl");

        assertThatThrownBy(() -> frontend.readSource(missing))
                .isInstanceOfSatisfying(ParseException.class, e -> {
                    assertThat(e.getError().code()).isEqualTo(SyntaxErrorCode.IO_ERROR_READING_FILE);
                    assertThat(e.getCause()).isInstanceOf(IOException.class);
                });
        assertThat(frontend.getDiagnostics().hasErrors()).isTrue();
    }
}
