package org.minikconfig.frontend.parser;

import org.minikconfig.api.KconfigException;
import org.minikconfig.api.SourceInfo;
import org.minikconfig.diagnostics.DiagnosticsEngine;
import org.minikconfig.frontend.lexer.Token;
import org.minikconfig.frontend.lexer.TokenStream;
import org.minikconfig.model.Menu;
import org.minikconfig.model.Symbol;
import org.minikconfig.model.SymbolTable;

import java.util.Optional;

/**
 * An interface that encapsulates the contextual state during parsing.
 * It provides statement and option handlers with access to the token stream and the
 * graph under construction without coupling them directly to the {@link Parser}.
 */
public interface ParsingContext {

    /**
     * Returns the token stream of the file currently being parsed.
     * @return The active token stream.
     */
    TokenStream tokens();

    /**
     * Gets the diagnostics engine for reporting errors and warnings.
     * @return The diagnostics engine.
     */
    DiagnosticsEngine getDiagnostics();

    /**
     * Gets the symbol table shared by all files of this run.
     * @return The symbol table.
     */
    SymbolTable getSymbolTable();

    /**
     * Returns the innermost open menu.
     * @return The menu new symbols belong to, or empty at top level.
     */
    Optional<Menu> currentMenu();

    /**
     * Opens a menu; symbols parsed until {@link #leaveMenu()} belong to it.
     * @param menu The menu to open.
     */
    void enterMenu(Menu menu);

    /**
     * Closes the innermost open menu.
     */
    void leaveMenu();

    /**
     * Parses one top-level statement from the active stream.
     * @throws KconfigException if a sourced file cannot be read.
     */
    void parseStatement() throws KconfigException;

    /**
     * Parses one option line of a <code>config</code> block.
     * @param symbol The symbol the option applies to.
     * @return true if a line was consumed, false if the option block ends here.
     */
    boolean parseOption(Symbol symbol);

    /**
     * Extracts the content of a quoted string token. On a malformed token a diagnostic is
     * reported, the token is pushed back and an empty string is returned.
     * @param token The token expected to be a quoted string.
     * @return The content without delimiters, or "" if the token is malformed.
     */
    String parseString(Token token);

    /**
     * Consumes the end of the current line. Tokens left before the newline are reported
     * and skipped.
     * @param statement The statement name used in the diagnostic.
     */
    void expectEndOfLine(String statement);

    /**
     * Checks whether a <code>mainmenu</code> statement is allowed at this point, which is
     * only the case for the first statement of the root file.
     * @return true if <code>mainmenu</code> may be parsed now.
     */
    boolean isMainMenuAllowed();

    /**
     * Parses the named file to completion, sharing the symbol table and the current menu.
     * @param path The path as written in the <code>source</code> statement.
     * @param from The location of the <code>source</code> statement.
     * @throws KconfigException if the file cannot be read.
     */
    void includeFile(String path, SourceInfo from) throws KconfigException;
}
