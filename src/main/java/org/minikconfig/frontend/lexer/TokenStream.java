package org.minikconfig.frontend.lexer;

import org.minikconfig.api.SourceInfo;
import org.minikconfig.diagnostics.DiagnosticKind;
import org.minikconfig.diagnostics.DiagnosticsEngine;

import java.util.List;

/**
 * A cursor over the tokens of one file, with room for exactly one pushed-back token.
 * <p>
 * {@link #nextToken()} never fails at the end of the input: it keeps returning the
 * {@link TokenType#END_OF_FILE} token, whose text is the empty string.
 */
public class TokenStream {

    private final List<Token> tokens;
    private final String fileName;
    private final DiagnosticsEngine diagnostics;
    private int position = 0;
    private Token current;
    private Token pushedBack;

    /**
     * Creates a stream over the given tokens.
     * @param tokens The tokens produced by the {@link Lexer}; must end with an end-of-file token.
     * @param fileName The logical file name, for diagnostics.
     * @param diagnostics The engine errors are reported to.
     */
    public TokenStream(List<Token> tokens, String fileName, DiagnosticsEngine diagnostics) {
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).isEndOfFile()) {
            throw new IllegalArgumentException("Token list must end with END_OF_FILE.");
        }
        this.tokens = tokens;
        this.fileName = fileName;
        this.diagnostics = diagnostics;
    }

    /**
     * Lexes the given source and wraps the result in a stream.
     * @param source The source text.
     * @param fileName The logical file name.
     * @param diagnostics The engine errors are reported to.
     * @return A new stream positioned before the first token.
     */
    public static TokenStream of(String source, String fileName, DiagnosticsEngine diagnostics) {
        return new TokenStream(new Lexer(source, fileName).scanTokens(), fileName, diagnostics);
    }

    /**
     * Consumes and returns the next token, the pushed-back one first if there is one.
     * @return The next token; the end-of-file token once the input is exhausted.
     */
    public Token nextToken() {
        if (pushedBack != null) {
            current = pushedBack;
            pushedBack = null;
        } else {
            current = tokens.get(position);
            if (position < tokens.size() - 1) {
                position++;
            }
        }
        return current;
    }

    /**
     * Returns the last token returned by {@link #nextToken()}.
     * @return The current token, or the first token's end-of-file equivalent before any call.
     */
    public Token currentToken() {
        return current != null ? current : new Token(TokenType.END_OF_FILE, "", 1, fileName);
    }

    /**
     * Pushes the current token back so that the next {@link #nextToken()} returns it again.
     * @throws IllegalStateException if a token is already pending.
     */
    public void pushBack() {
        pushBack(currentToken());
    }

    /**
     * Pushes a token back so that the next {@link #nextToken()} returns it.
     * @param token The token to return next.
     * @throws IllegalStateException if a token is already pending.
     */
    public void pushBack(Token token) {
        if (pushedBack != null) {
            throw new IllegalStateException("Only one token can be pushed back; '" + pushedBack.text() + "' is still pending.");
        }
        pushedBack = token;
    }

    /**
     * Peeks at the next token without consuming it.
     * @return The token the next {@link #nextToken()} will return.
     */
    public Token peek() {
        return pushedBack != null ? pushedBack : tokens.get(position);
    }

    /**
     * Checks whether the next token is a newline, without consuming it.
     * @return true exactly when the next token is a newline.
     */
    public boolean atNewline() {
        return peek().isNewline();
    }

    /**
     * Checks whether the next token is the end of the file, without consuming it.
     * @return true if the input is exhausted.
     */
    public boolean atEnd() {
        return peek().isEndOfFile();
    }

    /**
     * Consumes every token up to and including the next newline, or up to the end of the file.
     * @return The number of non-newline tokens skipped.
     */
    public int skipLine() {
        int skipped = 0;
        while (!atNewline() && !atEnd()) {
            nextToken();
            skipped++;
        }
        if (atNewline()) {
            nextToken();
        }
        return skipped;
    }

    public String fileName() {
        return fileName;
    }

    /**
     * Returns the line of the current token.
     * @return The 1-based line number.
     */
    public int lineNumber() {
        return currentToken().line();
    }

    /**
     * Returns the position of the current token.
     * @return The file and line of the current token.
     */
    public SourceInfo location() {
        return new SourceInfo(fileName, lineNumber());
    }

    /**
     * Reports an error at the current token. Parsing is not aborted.
     * @param kind The category of the error.
     * @param message The error message.
     */
    public void error(DiagnosticKind kind, String message) {
        diagnostics.reportError(kind, message, fileName, lineNumber());
    }
}
