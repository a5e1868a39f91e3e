package org.minikconfig.frontend.semantics;

import org.minikconfig.diagnostics.DiagnosticKind;
import org.minikconfig.diagnostics.DiagnosticsEngine;
import org.minikconfig.model.Symbol;
import org.minikconfig.model.SymbolReference;
import org.minikconfig.model.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Replaces the textual <code>depends on</code> and <code>select</code> references of
 * every symbol with direct links into the {@link SymbolTable}.
 * <p>
 * It must run after every file has been parsed, because references may point forward
 * and across <code>source</code>d files. Dangling references and references of a symbol
 * to itself are reported and dropped. Dependency edges also fill the
 * {@link Symbol#getDependents() dependents} back-edges of their target; select edges do not.
 */
public class ReferenceResolver {

    private static final Logger LOG = LoggerFactory.getLogger(ReferenceResolver.class);

    private final DiagnosticsEngine diagnostics;

    /**
     * Constructs a new resolver.
     * @param diagnostics The diagnostics engine for reporting dropped references.
     */
    public ReferenceResolver(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Resolves all references of all symbols, in declaration order.
     * Symbols that were already resolved are skipped.
     * @param table The table to resolve.
     */
    public void resolve(SymbolTable table) {
        int dependencyEdges = 0;
        int selectEdges = 0;
        for (Symbol symbol : table.getSymbols()) {
            if (symbol.isResolved()) {
                continue;
            }
            for (SymbolReference reference : symbol.getDependencyReferences()) {
                Optional<Symbol> target = lookup(table, symbol, reference, DiagnosticKind.SELF_DEPENDENCY,
                        "config '" + symbol.getName() + "' cannot depend on itself");
                if (target.isPresent()) {
                    symbol.linkDependency(target.get());
                    target.get().addDependent(symbol);
                    dependencyEdges++;
                }
            }
            for (SymbolReference reference : symbol.getSelectReferences()) {
                Optional<Symbol> target = lookup(table, symbol, reference, DiagnosticKind.SELF_SELECT,
                        "config '" + symbol.getName() + "' cannot select itself");
                if (target.isPresent()) {
                    symbol.linkSelect(target.get());
                    selectEdges++;
                }
            }
            symbol.markResolved();
        }
        LOG.debug("Resolved {} dependency and {} select edges.", dependencyEdges, selectEdges);
    }

    private Optional<Symbol> lookup(SymbolTable table, Symbol owner, SymbolReference reference,
                                    DiagnosticKind selfKind, String selfMessage) {
        if (reference.name().equals(owner.getName())) {
            diagnostics.reportError(selfKind, selfMessage,
                    reference.origin().fileName(), reference.origin().lineNumber());
            return Optional.empty();
        }
        Optional<Symbol> target = table.get(reference.name());
        if (target.isEmpty()) {
            diagnostics.reportError(DiagnosticKind.UNRESOLVED_REFERENCE,
                    "Config '" + reference.name() + "' cannot be found",
                    reference.origin().fileName(), reference.origin().lineNumber());
        }
        return target;
    }
}
