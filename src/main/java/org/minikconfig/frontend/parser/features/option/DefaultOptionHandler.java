package org.minikconfig.frontend.parser.features.option;

import org.minikconfig.diagnostics.DiagnosticKind;
import org.minikconfig.frontend.lexer.Token;
import org.minikconfig.frontend.parser.ParsingContext;
import org.minikconfig.model.Symbol;

/**
 * Handles <code>default y</code> and <code>default n</code>.
 * Only <code>y</code> marks the symbol as a default; <code>n</code> keeps the flag cleared.
 */
public class DefaultOptionHandler implements IOptionHandler {

    @Override
    public void parse(ParsingContext context, Symbol symbol) {
        Token value = context.tokens().nextToken();
        if (value.is("y")) {
            symbol.makeDefault(true);
        } else if (value.is("n")) {
            symbol.makeDefault(false);
        } else {
            context.tokens().error(DiagnosticKind.INVALID_DEFAULT, "You can only use 'y' or 'n' for default");
            if (value.isNewline() || value.isEndOfFile()) {
                context.tokens().pushBack(value);
            }
        }
    }
}
