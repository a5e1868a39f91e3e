package org.minikconfig.frontend.statement;

import org.minikconfig.api.KconfigException;
import org.minikconfig.frontend.parser.ParsingContext;

/**
 * The base interface for all top-level statement handlers.
 * Each handler is responsible for processing one keyword (e.g., <code>menu</code>).
 */
public interface IStatementHandler {

    /**
     * Parses the statement. The keyword has already been consumed and is the
     * context's current token.
     *
     * @param context The context that provides access to the token stream, the symbol
     *                table and the menu nesting.
     * @throws KconfigException if a file referenced by the statement cannot be read.
     */
    void parse(ParsingContext context) throws KconfigException;
}
