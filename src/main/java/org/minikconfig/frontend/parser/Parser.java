package org.minikconfig.frontend.parser;

import org.minikconfig.api.KconfigException;
import org.minikconfig.api.SourceInfo;
import org.minikconfig.diagnostics.DiagnosticKind;
import org.minikconfig.diagnostics.DiagnosticsEngine;
import org.minikconfig.frontend.lexer.Token;
import org.minikconfig.frontend.lexer.TokenStream;
import org.minikconfig.frontend.lexer.TokenType;
import org.minikconfig.frontend.parser.features.option.IOptionHandler;
import org.minikconfig.frontend.parser.features.option.OptionHandlerRegistry;
import org.minikconfig.frontend.statement.IStatementHandler;
import org.minikconfig.frontend.statement.StatementHandlerRegistry;
import org.minikconfig.model.Menu;
import org.minikconfig.model.Symbol;
import org.minikconfig.model.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * The recursive-descent parser for configuration description files. It reads the root
 * file, follows <code>source</code> statements depth-first and fills one shared
 * {@link SymbolTable}.
 * <p>
 * Malformed input is reported to the {@link DiagnosticsEngine} and skipped; only a file
 * that cannot be read stops the parser. A parser instance is meant for one run and is
 * not thread-safe.
 */
public class Parser implements ParsingContext {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    private final DiagnosticsEngine diagnostics;
    private final SymbolTable symbolTable;
    private final StatementHandlerRegistry statementRegistry;
    private final OptionHandlerRegistry optionRegistry;

    private final Deque<Menu> menuStack = new ArrayDeque<>();
    private final Deque<Path> includeStack = new ArrayDeque<>();
    private TokenStream tokens;
    private boolean mainMenuAllowed = false;
    private int filesParsed = 0;

    /**
     * Constructs a new Parser.
     * @param diagnostics The engine for reporting errors and warnings.
     * @param symbolTable The table the parsed symbols and menus are added to.
     */
    public Parser(DiagnosticsEngine diagnostics, SymbolTable symbolTable) {
        this.diagnostics = diagnostics;
        this.symbolTable = symbolTable;
        this.statementRegistry = StatementHandlerRegistry.initialize();
        this.optionRegistry = OptionHandlerRegistry.initialize();
    }

    /**
     * Parses a root description file and everything it sources.
     * @param rootFile The root file.
     * @return The symbol table passed to the constructor.
     * @throws KconfigException if the root file or a sourced file cannot be read.
     */
    public SymbolTable parseFile(Path rootFile) throws KconfigException {
        String content;
        try {
            content = Files.readString(rootFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new KconfigException("Could not read configuration file: " + rootFile, e);
        }
        Path absolute = rootFile.toAbsolutePath().normalize();
        includeStack.push(absolute);
        try {
            parseRoot(content, logicalName(rootFile));
        } finally {
            includeStack.pop();
        }
        return symbolTable;
    }

    /**
     * Parses root description text that is already in memory. <code>source</code>
     * statements are resolved against the working directory.
     * @param source The text to parse.
     * @param fileName The logical file name used in diagnostics.
     * @return The symbol table passed to the constructor.
     * @throws KconfigException if a sourced file cannot be read.
     */
    public SymbolTable parseSource(String source, String fileName) throws KconfigException {
        parseRoot(source, fileName);
        return symbolTable;
    }

    private void parseRoot(String content, String fileName) throws KconfigException {
        TokenStream previous = tokens;
        tokens = TokenStream.of(content, fileName, diagnostics);
        try {
            while (tokens.atNewline()) {
                tokens.nextToken();
            }
            if (tokens.peek().is("mainmenu")) {
                mainMenuAllowed = true;
                parseStatement();
                mainMenuAllowed = false;
            }
            parseUntilEnd();
        } finally {
            tokens = previous;
            mainMenuAllowed = false;
        }
        filesParsed++;
        LOG.info("Parsed {} symbols in {} menus from {} file(s), main menu '{}'.",
                symbolTable.size(), symbolTable.getMenus().size(), filesParsed, symbolTable.getMainMenuTitle());
    }

    private void parseUntilEnd() throws KconfigException {
        while (!tokens.atEnd()) {
            parseStatement();
        }
    }

    @Override
    public void parseStatement() throws KconfigException {
        Token token = tokens.nextToken();
        if (token.isNewline() || token.isEndOfFile()) {
            return;
        }
        Optional<IStatementHandler> handler = token.type() == TokenType.WORD
                ? statementRegistry.get(token.text())
                : Optional.empty();
        if (handler.isPresent()) {
            handler.get().parse(this);
        } else {
            tokens.error(DiagnosticKind.UNKNOWN_STATEMENT, "Unknown token '" + token.text() + "'");
            tokens.skipLine();
        }
    }

    @Override
    public boolean parseOption(Symbol symbol) {
        Token token = tokens.nextToken();
        if (token.isNewline()) {
            return true;
        }
        Optional<IOptionHandler> handler = token.type() == TokenType.WORD
                ? optionRegistry.get(token.text())
                : Optional.empty();
        if (handler.isEmpty()) {
            tokens.pushBack(token);
            return false;
        }
        handler.get().parse(this, symbol);
        expectEndOfLine(token.text());
        return true;
    }

    @Override
    public String parseString(Token token) {
        String text = token.text();
        if (text.isEmpty() || (text.charAt(0) != '\'' && text.charAt(0) != '"')) {
            tokens.error(DiagnosticKind.MALFORMED_STRING, "String must start with an apostrophe or a quotation");
            tokens.pushBack(token);
            return "";
        }
        char delimiter = text.charAt(0);
        if (text.length() < 2 || text.charAt(text.length() - 1) != delimiter) {
            tokens.error(DiagnosticKind.MALFORMED_STRING, "String must end with an apostrophe or a quotation");
            tokens.pushBack(token);
            return "";
        }
        return text.substring(1, text.length() - 1);
    }

    @Override
    public void expectEndOfLine(String statement) {
        if (tokens.atEnd()) {
            return;
        }
        if (!tokens.atNewline()) {
            Token unexpected = tokens.nextToken();
            tokens.error(DiagnosticKind.UNEXPECTED_TOKEN,
                    "Unexpected token '" + unexpected.text() + "' after '" + statement + "' (should be a newline)");
        }
        tokens.skipLine();
    }

    @Override
    public void includeFile(String path, SourceInfo from) throws KconfigException {
        Path resolved = resolveInclude(path);
        Path absolute = resolved.toAbsolutePath().normalize();
        if (includeStack.contains(absolute)) {
            diagnostics.reportError(DiagnosticKind.SOURCE_CYCLE,
                    "File '" + path + "' is already being parsed; source statement ignored",
                    from.fileName(), from.lineNumber());
            return;
        }

        String content;
        try {
            content = Files.readString(resolved, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new KconfigException("Could not read sourced file: " + path, from, e);
        }

        LOG.debug("Sourcing '{}' from {}", resolved, from);
        TokenStream including = tokens;
        includeStack.push(absolute);
        tokens = TokenStream.of(content, logicalName(resolved), diagnostics);
        try {
            parseUntilEnd();
        } finally {
            tokens = including;
            includeStack.pop();
        }
        filesParsed++;
    }

    private Path resolveInclude(String path) {
        Path candidate = Path.of(path);
        if (candidate.isAbsolute()) {
            return candidate;
        }
        Path including = includeStack.peek();
        if (including != null && including.getParent() != null) {
            Path sibling = including.getParent().resolve(candidate).normalize();
            if (Files.exists(sibling)) {
                return sibling;
            }
        }
        return candidate;
    }

    private static String logicalName(Path path) {
        return path.toString().replace('\\', '/');
    }

    @Override
    public TokenStream tokens() {
        return tokens;
    }

    @Override
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    @Override
    public SymbolTable getSymbolTable() {
        return symbolTable;
    }

    @Override
    public Optional<Menu> currentMenu() {
        return Optional.ofNullable(menuStack.peek());
    }

    @Override
    public void enterMenu(Menu menu) {
        menuStack.push(menu);
    }

    @Override
    public void leaveMenu() {
        if (!menuStack.isEmpty()) {
            menuStack.pop();
        }
    }

    @Override
    public boolean isMainMenuAllowed() {
        return mainMenuAllowed;
    }
}
