package org.minikconfig.frontend.parser.features.menu;

import org.minikconfig.api.KconfigException;
import org.minikconfig.api.SourceInfo;
import org.minikconfig.diagnostics.DiagnosticKind;
import org.minikconfig.frontend.lexer.TokenStream;
import org.minikconfig.frontend.parser.ParsingContext;
import org.minikconfig.frontend.statement.IStatementHandler;
import org.minikconfig.model.Menu;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles <code>menu "title"</code> ... <code>endmenu</code>.
 * The body is a sequence of top-level statements; menus nest.
 */
public class MenuStatementHandler implements IStatementHandler {

    private static final Logger LOG = LoggerFactory.getLogger(MenuStatementHandler.class);

    @Override
    public void parse(ParsingContext context) throws KconfigException {
        TokenStream tokens = context.tokens();
        SourceInfo origin = tokens.location();
        String title = context.parseString(tokens.nextToken());
        context.expectEndOfLine("menu");

        Menu menu = context.getSymbolTable().defineMenu(title, context.currentMenu().orElse(null), origin);
        LOG.debug("{}+ menu \"{}\"", "  ".repeat(menu.depth()), title);

        context.enterMenu(menu);
        try {
            while (true) {
                if (tokens.atEnd()) {
                    context.getDiagnostics().reportError(DiagnosticKind.UNTERMINATED_MENU,
                            "Menu '" + title + "' is not closed with 'endmenu'",
                            origin.fileName(), origin.lineNumber());
                    break;
                }
                if (tokens.peek().is("endmenu")) {
                    tokens.nextToken();
                    context.expectEndOfLine("endmenu");
                    break;
                }
                context.parseStatement();
            }
        } finally {
            context.leaveMenu();
        }
    }
}
