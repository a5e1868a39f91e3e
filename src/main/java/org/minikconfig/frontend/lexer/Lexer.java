package org.minikconfig.frontend.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * the text of a description file into a sequence of tokens.
 * <p>
 * Blanks are insignificant but newlines are tokens of their own. A <code>#</code>
 * comment is dropped up to, but not including, the end of its line. Quoted strings
 * are single tokens that keep their delimiters; an unterminated string stops at the
 * end of its line so that the parser can report the missing delimiter.
 */
public class Lexer {

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private final String logicalFileName;
    private int start = 0;
    private int current = 0;
    private int line = 1;

    /**
     * Creates a new Lexer.
     * @param source The source text as a single string.
     */
    public Lexer(String source) {
        this(source, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source text as a single string.
     * @param logicalFileName The name of the file being read, for diagnostics.
     */
    public Lexer(String source, String logicalFileName) {
        this.source = source;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Performs the tokenization of the entire source.
     * @return A list of the recognized tokens, always ending with {@link TokenType#END_OF_FILE}.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", line, logicalFileName));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '"', '\'' -> string(c);
            case '#' -> {
                while (peek() != '\n' && !isAtEnd()) advance();
            }
            case ' ', '\r', '\t' -> {
                // insignificant
            }
            case '\n' -> {
                addToken(TokenType.NEWLINE);
                line++;
            }
            default -> {
                if (isWordChar(c)) {
                    word();
                } else {
                    addToken(TokenType.PUNCTUATION);
                }
            }
        }
    }

    private void word() {
        while (isWordChar(peek())) advance();
        addToken(TokenType.WORD);
    }

    private void string(char delimiter) {
        while (peek() != delimiter && peek() != '\n' && !isAtEnd()) {
            advance();
        }
        if (peek() == delimiter) {
            advance();
        }
        addToken(TokenType.STRING);
    }

    private void addToken(TokenType type) {
        tokens.add(new Token(type, source.substring(start, current), line, logicalFileName));
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private boolean isWordChar(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                (c >= '0' && c <= '9') ||
                c == '_' || c == '-' || c == '.' || c == '/' || c == '$';
    }
}
