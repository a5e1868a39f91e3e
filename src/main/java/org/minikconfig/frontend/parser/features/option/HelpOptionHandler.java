package org.minikconfig.frontend.parser.features.option;

import org.minikconfig.frontend.lexer.TokenStream;
import org.minikconfig.frontend.parser.ParsingContext;
import org.minikconfig.model.Symbol;

/**
 * Handles <code>help</code> and <code>--help--</code>. The rest of the line is help text
 * and is discarded.
 */
public class HelpOptionHandler implements IOptionHandler {

    @Override
    public void parse(ParsingContext context, Symbol symbol) {
        TokenStream tokens = context.tokens();
        while (!tokens.atNewline() && !tokens.atEnd()) {
            tokens.nextToken();
        }
    }
}
