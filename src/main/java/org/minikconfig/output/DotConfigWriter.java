package org.minikconfig.output;

import org.minikconfig.model.Symbol;
import org.minikconfig.model.SymbolTable;

import java.io.IOException;
import java.io.Writer;

/**
 * Writes the classic <code>.config</code> format:
 * <pre>
 * # Configuration 'Main menu title'
 *
 * CONFIG_FOO=y
 * CONFIG_BAR=y
 * </pre>
 * One line per selected symbol, in declaration order. Only presence is recorded.
 */
public class DotConfigWriter implements IConfigWriter {

    /** Prefix written in front of every selected symbol name. */
    public static final String PREFIX = "CONFIG_";

    @Override
    public void write(SymbolTable table, Writer out) throws IOException {
        out.write("# Configuration '" + table.getMainMenuTitle() + "'\n\n");
        for (Symbol symbol : table.getSymbols()) {
            if (symbol.isSelected()) {
                out.write(PREFIX + symbol.getName() + "=y\n");
            }
        }
        out.flush();
    }
}
