package org.minikconfig.diagnostics;

/**
 * Classifies a {@link Diagnostic} so that callers and tests can react to a specific
 * problem without matching on message text.
 */
public enum DiagnosticKind {
    /** A quoted string is missing its opening or closing delimiter. */
    MALFORMED_STRING,
    /** A token appeared where the grammar expects something else (e.g. after a header). */
    UNEXPECTED_TOKEN,
    /** A <code>depends</code> line is not followed by <code>on</code>. */
    DEPENDS_WITHOUT_ON,
    /** A <code>default</code> line carries a value other than <code>y</code> or <code>n</code>. */
    INVALID_DEFAULT,
    /** A line starts with a keyword that is not a top-level statement. */
    UNKNOWN_STATEMENT,
    /** <code>mainmenu</code> appeared after the first statement of the root file. */
    UNEXPECTED_MAINMENU,
    /** A <code>menu</code> was still open at the end of its file. */
    UNTERMINATED_MENU,
    /** A <code>source</code> statement would re-enter a file that is currently being parsed. */
    SOURCE_CYCLE,
    /** A <code>config</code> name was declared more than once. */
    DUPLICATE_SYMBOL,
    /** A dependency or select names a symbol that does not exist. */
    UNRESOLVED_REFERENCE,
    /** A symbol depends on itself. */
    SELF_DEPENDENCY,
    /** A symbol selects itself. */
    SELF_SELECT,
    /** A requested selection names a symbol that does not exist. */
    UNKNOWN_SELECTION,
    /** Two or more symbols select each other in a loop. */
    SELECT_CYCLE
}
