package org.minikconfig.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    /** A bare word: a keyword, a symbol name or a value such as <code>y</code>. */
    WORD,
    /** A quoted string. The token text keeps its delimiters. */
    STRING,
    /** Any other single character, such as ',' or ';'. */
    PUNCTUATION,
    /** A newline character. Lines are significant in the grammar. */
    NEWLINE,
    /** Represents the end of the source file. Its text is the empty string. */
    END_OF_FILE
}
