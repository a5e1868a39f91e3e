package org.minikconfig.frontend.lexer;

/**
 * Represents a single token extracted from a description file by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token from the source, quotes included for strings.
 * @param line The line number where the token was found.
 * @param fileName The logical file name from which this token originates.
 */
public record Token(
        TokenType type,
        String text,
        int line,
        String fileName
) {
    /**
     * Checks whether this token is a newline.
     * @return true for {@link TokenType#NEWLINE}.
     */
    public boolean isNewline() {
        return type == TokenType.NEWLINE;
    }

    /**
     * Checks whether this token marks the end of the file.
     * @return true for {@link TokenType#END_OF_FILE}.
     */
    public boolean isEndOfFile() {
        return type == TokenType.END_OF_FILE;
    }

    /**
     * Checks whether this token is the given bare word.
     * @param word The word to compare with.
     * @return true if this is a {@link TokenType#WORD} with exactly that text.
     */
    public boolean is(String word) {
        return type == TokenType.WORD && text.equals(word);
    }
}
