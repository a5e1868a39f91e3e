package org.minikconfig.frontend.parser.features.source;

import org.minikconfig.api.KconfigException;
import org.minikconfig.api.SourceInfo;
import org.minikconfig.diagnostics.DiagnosticKind;
import org.minikconfig.frontend.lexer.Token;
import org.minikconfig.frontend.lexer.TokenStream;
import org.minikconfig.frontend.lexer.TokenType;
import org.minikconfig.frontend.parser.ParsingContext;
import org.minikconfig.frontend.statement.IStatementHandler;

/**
 * Handles <code>source "path"</code>. The named file is parsed to completion at this
 * point, as if its statements were written in place of the <code>source</code> line.
 */
public class SourceStatementHandler implements IStatementHandler {

    /**
     * Parses a <code>source</code> statement and includes the named file.
     * @param context The parsing context.
     * @throws KconfigException if the named file cannot be read.
     */
    @Override
    public void parse(ParsingContext context) throws KconfigException {
        TokenStream tokens = context.tokens();
        SourceInfo from = tokens.location();
        Token pathToken = tokens.nextToken();
        String path = context.parseString(pathToken);
        context.expectEndOfLine("source");
        if (path.isEmpty()) {
            if (isEmptyString(pathToken)) {
                context.getDiagnostics().reportError(DiagnosticKind.MALFORMED_STRING,
                        "Empty file name in source statement", from.fileName(), from.lineNumber());
            }
            return;
        }
        context.includeFile(path, from);
    }

    private static boolean isEmptyString(Token token) {
        String text = token.text();
        return token.type() == TokenType.STRING && text.length() == 2 && text.charAt(0) == text.charAt(1);
    }
}
