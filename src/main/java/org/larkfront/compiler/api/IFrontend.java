package org.larkfront.compiler.api;

import org.larkfront.compiler.frontend.lexer.Token;
import org.larkfront.compiler.frontend.parser.ast.Program;

import java.nio.file.Path;
import java.util.List;

/**
 * Defines the public, clean interface for the larkfront frontend.
 */
public interface IFrontend {

    /** The logical file name used for sources that do not come from a file. */
    String MEMORY_FILE_NAME = "<memory>";

    /**
     * Tokenizes the given source text.
     *
     * @param source The complete source text.
     * @param fileName A logical file name, used for diagnostics.
     * @return The tokens in source order, without the trailing end-of-input token.
     * @throws ParseException if the source contains an unterminated string or an unrecognized character.
     */
    List<Token> tokenize(String source, String fileName) throws ParseException;

    /**
     * Parses the given source text into a program.
     *
     * @param source The complete source text.
     * @param fileName A logical file name, used for diagnostics.
     * @return The parsed program.
     * @throws ParseException on the first lexical or syntax error.
     */
    Program parse(String source, String fileName) throws ParseException;

    /**
     * Reads a complete source file into memory.
     *
     * @param path The file to read.
     * @return The file content.
     * @throws ParseException with {@link SyntaxErrorCode#IO_ERROR_READING_FILE} if the file cannot be read.
     */
    String readSource(Path path) throws ParseException;

    /**
     * Tokenizes source text that does not come from a file.
     * @param source The complete source text.
     * @return The tokens in source order.
     * @throws ParseException on the first lexical error.
     */
    default List<Token> tokenize(String source) throws ParseException {
        return tokenize(source, MEMORY_FILE_NAME);
    }

    /**
     * Parses source text that does not come from a file.
     * @param source The complete source text.
     * @return The parsed program.
     * @throws ParseException on the first lexical or syntax error.
     */
    default Program parse(String source) throws ParseException {
        return parse(source, MEMORY_FILE_NAME);
    }
}
