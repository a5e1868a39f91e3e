package org.minikconfig.frontend.parser.features.option;

import org.minikconfig.frontend.parser.ParsingContext;
import org.minikconfig.model.Symbol;

/**
 * Parses one option line inside a <code>config</code> block.
 * <p>
 * The leading keyword has already been consumed. A handler consumes the rest of its
 * statement but not the terminating newline; the parser checks the end of the line.
 */
public interface IOptionHandler {

    /**
     * Parses the option and applies it to the symbol.
     * @param context The parsing context.
     * @param symbol The symbol whose block is being parsed.
     */
    void parse(ParsingContext context, Symbol symbol);
}
