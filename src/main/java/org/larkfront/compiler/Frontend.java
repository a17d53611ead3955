package org.larkfront.compiler;

import org.larkfront.compiler.api.IFrontend;
import org.larkfront.compiler.api.ParseException;
import org.larkfront.compiler.api.SyntaxError;
import org.larkfront.compiler.api.SyntaxErrorCode;
import org.larkfront.compiler.diagnostics.DiagnosticsEngine;
import org.larkfront.compiler.frontend.lexer.Lexer;
import org.larkfront.compiler.frontend.lexer.Token;
import org.larkfront.compiler.frontend.parser.Parser;
import org.larkfront.compiler.frontend.parser.ast.Program;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * The main frontend implementation. Every failure is reported to the {@link DiagnosticsEngine}
 * before it is rethrown to the caller. It is not thread-safe; use one instance per thread.
 */
public class Frontend implements IFrontend {

    private static final Logger LOGGER = LoggerFactory.getLogger(Frontend.class);

    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();

    @Override
    public List<Token> tokenize(String source, String fileName) throws ParseException {
        LOGGER.debug("Tokenizing {}", fileName);
        try {
            return new Lexer(source).scanTokens();
        } catch (ParseException e) {
            throw report(e, fileName);
        }
    }

    @Override
    public Program parse(String source, String fileName) throws ParseException {
        LOGGER.debug("Parsing {}", fileName);
        try {
            return new Parser(source).parse();
        } catch (ParseException e) {
            throw report(e, fileName);
        }
    }

    /**
     * {@inheritDoc}
     * <p>
     * Byte sequences that are not valid UTF-8 are replaced by U+FFFD, so such text in comments
     * and strings passes through and elsewhere fails as an unrecognized character.
     */
    @Override
    public String readSource(Path path) throws ParseException {
        try {
            return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            SyntaxError error = SyntaxError.lexical(SyntaxErrorCode.IO_ERROR_READING_FILE, 0,
                    "Could not open file " + path + ": " + e.getMessage());
            throw report(new ParseException(error, e), path.toString());
        }
    }

    /**
     * Returns the diagnostics collected by this frontend.
     * @return The diagnostics engine.
     */
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    private ParseException report(ParseException e, String fileName) {
        diagnostics.reportError(e.getError(), fileName);
        LOGGER.debug("{} failed: {}", fileName, e.getError());
        return e;
    }
}
