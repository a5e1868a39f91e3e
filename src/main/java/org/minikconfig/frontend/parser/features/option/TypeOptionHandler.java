package org.minikconfig.frontend.parser.features.option;

import org.minikconfig.frontend.lexer.Token;
import org.minikconfig.frontend.lexer.TokenType;
import org.minikconfig.frontend.parser.ParsingContext;
import org.minikconfig.model.Symbol;
import org.minikconfig.model.SymbolKind;

/**
 * Handles <code>bool</code>, <code>tristate</code> and <code>string</code> lines.
 * An optional quoted string on the same line becomes the symbol's prompt.
 */
public class TypeOptionHandler implements IOptionHandler {

    private final SymbolKind kind;

    public TypeOptionHandler(SymbolKind kind) {
        this.kind = kind;
    }

    @Override
    public void parse(ParsingContext context, Symbol symbol) {
        Token next = context.tokens().nextToken();
        if (next.type() == TokenType.STRING) {
            symbol.setKind(kind, context.parseString(next));
        } else {
            context.tokens().pushBack(next);
            symbol.setKind(kind, null);
        }
    }
}
