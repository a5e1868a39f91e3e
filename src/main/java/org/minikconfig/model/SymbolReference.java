package org.minikconfig.model;

import org.minikconfig.api.SourceInfo;

/**
 * A textual reference to a symbol, as written in a <code>depends on</code> or
 * <code>select</code> line, before the resolver links it.
 *
 * @param name The referenced symbol name.
 * @param origin Where the reference was written.
 */
public record SymbolReference(String name, SourceInfo origin) {
}
