package org.minikconfig.output;

import org.minikconfig.model.SymbolTable;

import java.io.IOException;
import java.io.Writer;

/**
 * Serializes the final state of a symbol table.
 */
public interface IConfigWriter {

    /**
     * Writes the table to the given writer. The writer is not closed.
     * @param table The table after selection.
     * @param out The destination.
     * @throws IOException if writing fails.
     */
    void write(SymbolTable table, Writer out) throws IOException;
}
