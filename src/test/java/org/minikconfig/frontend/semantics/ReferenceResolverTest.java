package org.minikconfig.frontend.semantics;

import org.minikconfig.api.KconfigException;
import org.minikconfig.diagnostics.Diagnostic;
import org.minikconfig.diagnostics.DiagnosticKind;
import org.minikconfig.diagnostics.DiagnosticsEngine;
import org.minikconfig.frontend.parser.Parser;
import org.minikconfig.model.Symbol;
import org.minikconfig.model.SymbolTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Contains unit tests for the {@link ReferenceResolver}.
 * These tests verify that textual references become graph edges, that back-edges are
 * recorded for dependencies only, and that self and unknown references are dropped.
 */
public class ReferenceResolverTest {

    private DiagnosticsEngine diagnostics;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
    }

    private SymbolTable parseAndResolve(String... lines) throws KconfigException {
        SymbolTable table = new Parser(diagnostics, new SymbolTable())
                .parseSource(String.join("\n", lines) + "\n", "Kconfig");
        new ReferenceResolver(diagnostics).resolve(table);
        return table;
    }

    private static Symbol get(SymbolTable table, String name) {
        return table.get(name).orElseThrow();
    }

    /**
     * Verifies that forward references are linked and that only dependency edges get
     * back-edges.
     * This is a unit test for the resolver.
     */
    @Test
    @Tag("unit")
    void testForwardReferencesAndBackEdges() throws KconfigException {
        // Act
        SymbolTable table = parseAndResolve(
                "config A",
                "  depends on B",
                "  select C",
                "config B",
                "config C");

        // Assert
        assertThat(diagnostics.getDiagnostics()).isEmpty();
        Symbol a = get(table, "A");
        assertThat(a.getDependencies()).containsExactly(get(table, "B"));
        assertThat(a.getSelects()).containsExactly(get(table, "C"));
        assertThat(get(table, "B").getDependents()).containsExactly(a);
        assertThat(get(table, "C").getDependents()).isEmpty();
        assertThat(table.getSymbols()).allMatch(Symbol::isResolved);
    }

    /**
     * Verifies that a symbol never ends up depending on or selecting itself.
     * This is a unit test for the resolver.
     */
    @Test
    @Tag("unit")
    void testSelfReferencesAreDropped() throws KconfigException {
        // Act
        SymbolTable table = parseAndResolve(
                "config A",
                "  depends on A",
                "  select A");

        // Assert
        Symbol a = get(table, "A");
        assertThat(a.getDependencies()).isEmpty();
        assertThat(a.getSelects()).isEmpty();
        assertThat(a.getDependents()).isEmpty();
        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::kind, Diagnostic::message, Diagnostic::lineNumber)
                .containsExactly(
                        tuple(DiagnosticKind.SELF_DEPENDENCY, "config 'A' cannot depend on itself", 2),
                        tuple(DiagnosticKind.SELF_SELECT, "config 'A' cannot select itself", 3));
    }

    /**
     * Verifies that unknown names are reported at the referencing line and dropped.
     * This is a unit test for the resolver.
     */
    @Test
    @Tag("unit")
    void testUnknownReferencesAreDropped() throws KconfigException {
        // Act
        SymbolTable table = parseAndResolve(
                "config A",
                "  depends on GHOST",
                "  select PHANTOM");

        // Assert
        assertThat(get(table, "A").hasDependencies()).isFalse();
        assertThat(get(table, "A").getSelects()).isEmpty();
        assertThat(diagnostics.ofKind(DiagnosticKind.UNRESOLVED_REFERENCE))
                .extracting(Diagnostic::format)
                .containsExactly(
                        "Kconfig:2: Config 'GHOST' cannot be found",
                        "Kconfig:3: Config 'PHANTOM' cannot be found");
    }

    /**
     * Verifies that resolving twice neither duplicates edges nor repeats diagnostics.
     * This is a unit test for the resolver.
     */
    @Test
    @Tag("unit")
    void testResolveIsIdempotent() throws KconfigException {
        // Arrange
        SymbolTable table = parseAndResolve(
                "config A",
                "  depends on B",
                "  depends on GHOST",
                "config B");

        // Act
        new ReferenceResolver(diagnostics).resolve(table);

        // Assert
        assertThat(get(table, "A").getDependencies()).hasSize(1);
        assertThat(get(table, "B").getDependents()).hasSize(1);
        assertThat(diagnostics.getDiagnostics()).hasSize(1);
    }
}
