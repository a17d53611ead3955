package org.larkfront.compiler.frontend.lexer;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The reserved words of the language. Matching is exact and case-sensitive.
 */
public enum Keyword {
    AND("and"),
    ELSE("else"),
    LOAD("load"),
    BREAK("break"),
    FOR("for"),
    NOT("not"),
    CONTINUE("continue"),
    IF("if"),
    OR("or"),
    DEF("def"),
    IN("in"),
    PASS("pass"),
    ELIF("elif"),
    LAMBDA("lambda"),
    RETURN("return");

    private static final Map<String, Keyword> BY_WORD = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Keyword::word, Function.identity()));

    private final String word;

    Keyword(String word) {
        this.word = word;
    }

    /**
     * Returns the word as it is spelled in source code.
     * @return The lower-case keyword text.
     */
    public String word() {
        return word;
    }

    /**
     * Looks up the keyword spelled exactly as {@code text}.
     * @param text The scanned identifier text.
     * @return The keyword, or empty if {@code text} is an ordinary identifier.
     */
    public static Optional<Keyword> fromWord(String text) {
        return Optional.ofNullable(BY_WORD.get(text));
    }
}
