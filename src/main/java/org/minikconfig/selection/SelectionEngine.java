package org.minikconfig.selection;

import org.minikconfig.diagnostics.DiagnosticKind;
import org.minikconfig.diagnostics.DiagnosticsEngine;
import org.minikconfig.model.Symbol;
import org.minikconfig.model.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Cascades a selection through the resolved symbol graph.
 * <p>
 * A symbol becomes selected only when every one of its dependencies is already selected.
 * Once selected, everything it <code>select</code>s is selected in turn, depth-first, under
 * the same rule. The symbols currently on the cascade path are tracked, so a loop of
 * select edges is reported as {@link DiagnosticKind#SELECT_CYCLE} and cut instead of
 * being walked forever.
 * <p>
 * An engine works on one table at a time and is not thread-safe.
 */
public class SelectionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(SelectionEngine.class);
    private static final String COMMAND_LINE = "<command line>";

    private final DiagnosticsEngine diagnostics;
    private final Set<Symbol> inProgress = new LinkedHashSet<>();
    private final Set<Symbol> reportedCycles = new HashSet<>();

    /**
     * Constructs a new selection engine.
     * @param diagnostics The diagnostics engine for reporting unknown names and cycles.
     */
    public SelectionEngine(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Selects a symbol if its dependencies allow it, then everything it selects.
     * <p>
     * The cascade runs on an explicit stack, so arbitrarily long select chains are walked
     * in the same depth-first order without growing the call stack.
     * @param symbol The symbol to select.
     * @return true if the symbol is selected afterwards.
     */
    public boolean select(Symbol symbol) {
        final Deque<Cascade> stack = new ArrayDeque<>();
        final boolean selected = enter(symbol, stack);
        try {
            while (!stack.isEmpty()) {
                final Cascade top = stack.peek();
                if (top.remaining().hasNext()) {
                    enter(top.remaining().next(), stack);
                } else {
                    stack.pop();
                    inProgress.remove(top.symbol());
                }
            }
        } finally {
            for (Cascade open : stack) {
                inProgress.remove(open.symbol());
            }
        }
        return selected;
    }

    /**
     * Applies the dependency gate to one symbol and, if it passes, selects it and pushes
     * its selects onto the stack.
     */
    private boolean enter(Symbol symbol, Deque<Cascade> stack) {
        if (inProgress.contains(symbol)) {
            reportCycle(symbol);
            return symbol.isSelected();
        }
        if (!symbol.areDependenciesMet()) {
            LOG.trace("Not selecting '{}': unmet dependencies.", symbol.getName());
            return false;
        }
        for (Symbol dependent : symbol.getDependents()) {
            dependent.makeSelectable();
        }
        if (!symbol.areDependenciesMet()) {
            return false;
        }

        symbol.setSelected(true);
        inProgress.add(symbol);
        stack.push(new Cascade(symbol, symbol.getSelects().iterator()));
        return true;
    }

    /**
     * Selects every symbol that was declared with <code>default y</code>, in declaration order.
     * @param table The resolved table.
     * @return The number of default symbols that ended up selected.
     */
    public int selectDefaults(SymbolTable table) {
        int count = 0;
        for (Symbol symbol : table.getSymbols()) {
            if (symbol.isDefault() && select(symbol)) {
                count++;
            }
        }
        LOG.debug("Selected {} default symbol(s).", count);
        return count;
    }

    /**
     * Selects the named symbols in the given order. Unknown names are reported and skipped;
     * blank names are ignored.
     * @param table The resolved table.
     * @param names The requested symbol names.
     */
    public void selectConfigs(SymbolTable table, List<String> names) {
        selectConfigs(table, names, COMMAND_LINE);
    }

    /**
     * Selects the named symbols in the given order, reporting unknown names against the
     * given request source.
     * @param table The resolved table.
     * @param names The requested symbol names.
     * @param requestSource A name for where the request came from, used in diagnostics.
     */
    public void selectConfigs(SymbolTable table, List<String> names, String requestSource) {
        for (String raw : names) {
            String name = raw.trim();
            if (name.isEmpty()) {
                continue;
            }
            Optional<Symbol> symbol = table.get(name);
            if (symbol.isEmpty()) {
                diagnostics.reportError(DiagnosticKind.UNKNOWN_SELECTION,
                        "Config '" + name + "' cannot be found", requestSource, 0);
                continue;
            }
            if (!select(symbol.get())) {
                LOG.info("Requested config '{}' was not selected because its dependencies are not met.", name);
            }
        }
    }

    /** A symbol on the cascade path and the selects still to visit. */
    private record Cascade(Symbol symbol, Iterator<Symbol> remaining) {
    }

    private void reportCycle(Symbol entry) {
        if (!reportedCycles.add(entry)) {
            return;
        }
        List<Symbol> path = inProgress.stream().collect(Collectors.toList());
        String cycle = path.subList(path.indexOf(entry), path.size()).stream()
                .map(Symbol::getName)
                .collect(Collectors.joining(" -> ")) + " -> " + entry.getName();
        diagnostics.reportError(DiagnosticKind.SELECT_CYCLE, "Select cycle: " + cycle,
                entry.getOrigin().fileName(), entry.getOrigin().lineNumber());
    }
}
