package org.minikconfig.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting and managing diagnostic messages (errors, warnings)
 * that occur during a configuration run.
 * <p>
 * This decouples error reporting from the actual pipeline logic (parser, resolver, selection).
 * Nothing reported here aborts the run; callers decide how to present the collected messages.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param kind       The category of the error.
     * @param message    The error message.
     * @param fileName   The file in which the error occurred.
     * @param lineNumber The line number of the error.
     */
    public void reportError(DiagnosticKind kind, String message, String fileName, int lineNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, kind, message, fileName, lineNumber));
    }

    /**
     * Reports a warning.
     *
     * @param kind       The category of the warning.
     * @param message    The warning message.
     * @param fileName   The file in which the warning occurred.
     * @param lineNumber The line number of the warning.
     */
    public void reportWarning(DiagnosticKind kind, String message, String fileName, int lineNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, kind, message, fileName, lineNumber));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns all diagnostics of the given kind, in reporting order.
     *
     * @param kind The kind to filter by.
     * @return The matching diagnostics.
     */
    public List<Diagnostic> ofKind(DiagnosticKind kind) {
        return diagnostics.stream()
                .filter(d -> d.kind() == kind)
                .collect(Collectors.toList());
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }
}
