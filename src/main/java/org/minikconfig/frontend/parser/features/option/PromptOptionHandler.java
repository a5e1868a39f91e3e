package org.minikconfig.frontend.parser.features.option;

import org.minikconfig.frontend.parser.ParsingContext;
import org.minikconfig.model.Symbol;

/**
 * Handles <code>prompt "text"</code>.
 */
public class PromptOptionHandler implements IOptionHandler {

    @Override
    public void parse(ParsingContext context, Symbol symbol) {
        symbol.setPrompt(context.parseString(context.tokens().nextToken()));
    }
}
