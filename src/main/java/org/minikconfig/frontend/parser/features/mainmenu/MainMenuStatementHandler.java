package org.minikconfig.frontend.parser.features.mainmenu;

import org.minikconfig.diagnostics.DiagnosticKind;
import org.minikconfig.frontend.lexer.TokenStream;
import org.minikconfig.frontend.parser.ParsingContext;
import org.minikconfig.frontend.statement.IStatementHandler;

/**
 * Handles <code>mainmenu "title"</code>, which sets the title written to the output file.
 * It is only accepted as the first statement of the root file.
 */
public class MainMenuStatementHandler implements IStatementHandler {

    @Override
    public void parse(ParsingContext context) {
        TokenStream tokens = context.tokens();
        if (!context.isMainMenuAllowed()) {
            tokens.error(DiagnosticKind.UNEXPECTED_MAINMENU, "Unexpected mainmenu");
            tokens.skipLine();
            return;
        }
        String title = context.parseString(tokens.nextToken());
        context.getSymbolTable().setMainMenuTitle(title);
        context.expectEndOfLine("mainmenu");
    }
}
