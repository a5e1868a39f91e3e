package org.minikconfig.frontend.semantics;

import org.minikconfig.model.Symbol;
import org.minikconfig.model.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deselects every symbol that has at least one unselected dependency.
 * <p>
 * This is a single pass in declaration order, not a fixpoint: a symbol deselected here
 * does not cause the symbols that depend on it to be re-checked, unless they come later
 * in the table.
 */
public class DependencyFixup {

    private static final Logger LOG = LoggerFactory.getLogger(DependencyFixup.class);

    /**
     * Runs the pass over the table.
     * @param table A resolved symbol table.
     * @return The number of symbols that were deselected.
     */
    public int fix(SymbolTable table) {
        int deselected = 0;
        for (Symbol symbol : table.getSymbols()) {
            if (symbol.hasDependencies() && !symbol.areDependenciesMet()) {
                if (symbol.isSelected()) {
                    deselected++;
                }
                symbol.setSelected(false);
            }
        }
        LOG.debug("Dependency fixup deselected {} symbol(s).", deselected);
        return deselected;
    }
}
