package org.minikconfig;

import org.minikconfig.api.KconfigException;
import org.minikconfig.model.SymbolTable;
import org.minikconfig.output.IConfigWriter;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for the stages of {@link MiniKconfig} with a mocked output writer.
 */
@Tag("unit")
@ExtendWith(MockitoExtension.class)
class MiniKconfigTest {

    @Mock
    private IConfigWriter writer;

    @TempDir
    Path tempDir;

    /**
     * Verifies that the stages can be driven one by one on in-memory text.
     */
    @Test
    void stagesShouldComposeOnInMemorySource() throws KconfigException {
        // Arrange
        MiniKconfig miniKconfig = new MiniKconfig();
        SymbolTable table = miniKconfig.parse("config A\n  select B\nconfig B\nconfig C\n  depends on B\n", "memory");

        // Act
        miniKconfig.resolve(table);
        miniKconfig.fixDependencies(table);
        miniKconfig.selectConfigs(table, List.of("A", "C"));

        // Assert
        assertThat(table.getSelectedSymbols()).extracting(s -> s.getName()).containsExactly("A", "B", "C");
        assertThat(miniKconfig.getDiagnostics().getDiagnostics()).isEmpty();
    }

    /**
     * Verifies that the final table is handed to the writer.
     */
    @Test
    void runShouldPassFinalTableToWriter() throws IOException, KconfigException {
        // Arrange
        Path kconfig = tempDir.resolve("Kconfig");
        Files.writeString(kconfig, "config A\n  default y\n");
        MiniKconfigOptions options = new MiniKconfigOptions(kconfig, tempDir.resolve("out"), true, null, null);

        // Act
        SymbolTable table = new MiniKconfig().run(options, writer);

        // Assert
        verify(writer).write(same(table), any(Writer.class));
        assertThat(table.getSelectedSymbols()).hasSize(1);
    }

    /**
     * Verifies that a failing writer is reported as a {@link KconfigException} naming the file.
     */
    @Test
    void runShouldWrapWriteFailures() throws IOException {
        // Arrange
        Path kconfig = tempDir.resolve("Kconfig");
        Files.writeString(kconfig, "config A\n");
        doThrow(new IOException("disk full")).when(writer).write(any(SymbolTable.class), any(Writer.class));
        MiniKconfigOptions options = new MiniKconfigOptions(kconfig, tempDir.resolve("mocked"), true, List.of(), null);

        // Act & Assert
        assertThatThrownBy(() -> new MiniKconfig().run(options, writer))
                .isInstanceOf(KconfigException.class)
                .hasMessageContaining("mocked")
                .hasRootCauseMessage("disk full");
    }
}
