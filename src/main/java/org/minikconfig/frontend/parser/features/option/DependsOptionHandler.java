package org.minikconfig.frontend.parser.features.option;

import org.minikconfig.diagnostics.DiagnosticKind;
import org.minikconfig.frontend.lexer.Token;
import org.minikconfig.frontend.lexer.TokenStream;
import org.minikconfig.frontend.lexer.TokenType;
import org.minikconfig.frontend.parser.ParsingContext;
import org.minikconfig.model.Symbol;
import org.minikconfig.model.SymbolReference;

/**
 * Handles <code>depends on NAME</code>. Without <code>on</code> the whole line is dropped.
 */
public class DependsOptionHandler implements IOptionHandler {

    @Override
    public void parse(ParsingContext context, Symbol symbol) {
        TokenStream tokens = context.tokens();
        Token on = tokens.nextToken();
        if (!on.is("on")) {
            tokens.error(DiagnosticKind.DEPENDS_WITHOUT_ON, "Unexpected token after 'depends'");
            if (on.isNewline() || on.isEndOfFile()) {
                tokens.pushBack(on);
            } else {
                while (!tokens.atNewline() && !tokens.atEnd()) {
                    tokens.nextToken();
                }
            }
            return;
        }

        Token name = tokens.nextToken();
        if (name.type() != TokenType.WORD) {
            tokens.error(DiagnosticKind.UNEXPECTED_TOKEN, "Expected a symbol name after 'depends on'");
            tokens.pushBack(name);
            return;
        }
        symbol.addDependency(new SymbolReference(name.text(), tokens.location()));
    }
}
