package org.minikconfig.output;

import org.minikconfig.api.SourceInfo;
import org.minikconfig.model.SymbolTable;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link DotConfigWriter}.
 */
public class DotConfigWriterTest {

    /**
     * Verifies the header line, the blank separator and one line per selected symbol in
     * declaration order.
     * This is a unit test for the writer.
     */
    @Test
    @Tag("unit")
    void testWritesSelectedSymbolsInDeclarationOrder() throws IOException {
        // Arrange
        SymbolTable table = new SymbolTable();
        table.setMainMenuTitle("Demo");
        table.define("ZETA", new SourceInfo("Kconfig", 1), null).setSelected(true);
        table.define("ALPHA", new SourceInfo("Kconfig", 2), null);
        table.define("MID", new SourceInfo("Kconfig", 3), null).setSelected(true);
        StringWriter out = new StringWriter();

        // Act
        new DotConfigWriter().write(table, out);

        // Assert
        assertThat(out.toString()).isEqualTo(
                "# Configuration 'Demo'\n"
                + "\n"
                + "CONFIG_ZETA=y\n"
                + "CONFIG_MID=y\n");
    }

    /**
     * Verifies that an empty selection still produces the header, with an empty title when
     * no main menu was declared.
     * This is a unit test for the writer.
     */
    @Test
    @Tag("unit")
    void testEmptySelection() throws IOException {
        // Arrange
        SymbolTable table = new SymbolTable();
        table.define("A", new SourceInfo("Kconfig", 1), null);
        StringWriter out = new StringWriter();

        // Act
        new DotConfigWriter().write(table, out);

        // Assert
        assertThat(out.toString()).isEqualTo("# Configuration ''\n\n");
    }
}
