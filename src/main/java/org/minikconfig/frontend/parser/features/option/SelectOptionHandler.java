package org.minikconfig.frontend.parser.features.option;

import org.minikconfig.diagnostics.DiagnosticKind;
import org.minikconfig.frontend.lexer.Token;
import org.minikconfig.frontend.lexer.TokenType;
import org.minikconfig.frontend.parser.ParsingContext;
import org.minikconfig.model.Symbol;
import org.minikconfig.model.SymbolReference;

/**
 * Handles <code>select NAME</code>.
 */
public class SelectOptionHandler implements IOptionHandler {

    @Override
    public void parse(ParsingContext context, Symbol symbol) {
        Token name = context.tokens().nextToken();
        if (name.type() != TokenType.WORD) {
            context.tokens().error(DiagnosticKind.UNEXPECTED_TOKEN, "Expected a symbol name after 'select'");
            context.tokens().pushBack(name);
            return;
        }
        symbol.addSelect(new SymbolReference(name.text(), context.tokens().location()));
    }
}
