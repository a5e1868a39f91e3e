package org.minikconfig.frontend.parser.features.menu;

import org.minikconfig.diagnostics.DiagnosticKind;
import org.minikconfig.frontend.parser.ParsingContext;
import org.minikconfig.frontend.statement.IStatementHandler;

/**
 * Reports an <code>endmenu</code> that has no open menu. A matching <code>endmenu</code>
 * is consumed by {@link MenuStatementHandler} and never reaches this handler.
 */
public class EndMenuStatementHandler implements IStatementHandler {

    @Override
    public void parse(ParsingContext context) {
        context.tokens().error(DiagnosticKind.UNEXPECTED_TOKEN, "'endmenu' without a matching 'menu'");
        context.expectEndOfLine("endmenu");
    }
}
