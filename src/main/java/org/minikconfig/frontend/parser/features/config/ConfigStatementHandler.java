package org.minikconfig.frontend.parser.features.config;

import org.minikconfig.api.SourceInfo;
import org.minikconfig.diagnostics.DiagnosticKind;
import org.minikconfig.frontend.lexer.Token;
import org.minikconfig.frontend.lexer.TokenStream;
import org.minikconfig.frontend.lexer.TokenType;
import org.minikconfig.frontend.parser.ParsingContext;
import org.minikconfig.frontend.statement.IStatementHandler;
import org.minikconfig.model.Symbol;
import org.minikconfig.model.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles <code>config NAME</code> and the option lines that follow it.
 * <p>
 * The option block ends at the first line that is not an option line, typically the next
 * <code>config</code>, an <code>endmenu</code> or the end of the file. That line is left
 * in the stream for the enclosing statement loop.
 */
public class ConfigStatementHandler implements IStatementHandler {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigStatementHandler.class);

    @Override
    public void parse(ParsingContext context) {
        TokenStream tokens = context.tokens();
        Token name = tokens.nextToken();
        if (name.type() != TokenType.WORD) {
            tokens.error(DiagnosticKind.UNEXPECTED_TOKEN, "Expected a symbol name after 'config'");
            if (name.isNewline() || name.isEndOfFile()) {
                tokens.pushBack(name);
            }
            context.expectEndOfLine("config");
            return;
        }

        SourceInfo origin = tokens.location();
        if (!tokens.atNewline() && !tokens.atEnd()) {
            tokens.nextToken();
            tokens.error(DiagnosticKind.UNEXPECTED_TOKEN, "Unexpected token after config");
        }
        tokens.skipLine();

        Symbol symbol = declare(context, name.text(), origin);
        while (context.parseOption(symbol)) {
            // each call consumes one option line
        }
    }

    private Symbol declare(ParsingContext context, String name, SourceInfo origin) {
        SymbolTable table = context.getSymbolTable();
        if (table.contains(name)) {
            Symbol existing = table.get(name).orElseThrow();
            context.getDiagnostics().reportWarning(DiagnosticKind.DUPLICATE_SYMBOL,
                    "config '" + name + "' is already defined at " + existing.getOrigin(),
                    origin.fileName(), origin.lineNumber());
            return existing;
        }
        Symbol symbol = table.define(name, origin, context.currentMenu().orElse(null));
        LOG.debug(" | config '{}'", name);
        return symbol;
    }
}
