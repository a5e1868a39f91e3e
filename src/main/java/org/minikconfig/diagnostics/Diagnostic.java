package org.minikconfig.diagnostics;

/**
 * Represents a single diagnostic message (error or warning)
 * that occurs while parsing, resolving or selecting configuration symbols.
 *
 * @param type The severity of the diagnostic (e.g., ERROR, WARNING).
 * @param kind The category of the problem.
 * @param message The diagnostic message.
 * @param fileName The name of the file where the issue occurred.
 * @param lineNumber The line number of the issue.
 */
public record Diagnostic(
        Type type,
        DiagnosticKind kind,
        String message,
        String fileName,
        int lineNumber
) {
    /**
     * The severity of a diagnostic message.
     */
    public enum Type {
        /** A problem that makes the produced configuration incomplete. */
        ERROR,
        /** A problem that does not change the produced configuration. */
        WARNING
    }

    /**
     * Formats the location and message as <code>file:line: message</code>.
     *
     * @return The formatted location and message, without the severity.
     */
    public String format() {
        return String.format("%s:%d: %s", fileName, lineNumber, message);
    }

    @Override
    public String toString() {
        return String.format("[%s] %s", type, format());
    }
}
