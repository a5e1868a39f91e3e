package org.minikconfig.selection;

import org.minikconfig.api.KconfigException;
import org.minikconfig.frontend.lexer.Lexer;
import org.minikconfig.frontend.lexer.Token;
import org.minikconfig.frontend.lexer.TokenType;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns selection requests into lists of symbol names for
 * {@link SelectionEngine#selectConfigs(org.minikconfig.model.SymbolTable, List)}.
 */
public final class SelectionRequestReader {

    private SelectionRequestReader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Splits a comma-separated list such as <code>A,B, C</code>. Blank entries are dropped.
     * @param list The list as given on the command line; may be null.
     * @return The names, in order.
     */
    public static List<String> parseList(String list) {
        if (list == null || list.isBlank()) {
            return List.of();
        }
        return Arrays.stream(list.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    /**
     * Reads the names from a selection file. Names may be separated by newlines, commas,
     * semicolons or blanks, and <code>#</code> starts a comment.
     * @param file The selection file.
     * @return The names, in file order.
     * @throws KconfigException if the file cannot be read.
     */
    public static List<String> readFile(Path file) throws KconfigException {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new KconfigException("Could not read selection file: " + file, e);
        }
        return readTokens(new Lexer(content, file.toString()).scanTokens());
    }

    static List<String> readTokens(List<Token> tokens) {
        List<String> names = new ArrayList<>();
        for (Token token : tokens) {
            if (token.type() == TokenType.NEWLINE || token.type() == TokenType.END_OF_FILE) {
                continue;
            }
            if (token.type() == TokenType.PUNCTUATION && (token.text().equals(",") || token.text().equals(";"))) {
                continue;
            }
            String name = token.text().trim();
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return names;
    }
}
