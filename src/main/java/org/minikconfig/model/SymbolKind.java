package org.minikconfig.model;

import java.util.Locale;

/**
 * The declared type of a configuration symbol.
 */
public enum SymbolKind {
    /** A yes/no symbol. */
    BOOL,
    /** A yes/module/no symbol. Only presence is recorded in the output. */
    TRISTATE,
    /** A free-text symbol. Only presence is recorded in the output. */
    STRING;

    /**
     * Returns the keyword that declares this kind in a description file.
     * @return The lower-case keyword.
     */
    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }
}
