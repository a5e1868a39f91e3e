package org.minikconfig;

import org.minikconfig.api.KconfigException;
import org.minikconfig.junit.extensions.logging.LogWatchExtension;
import org.minikconfig.model.SymbolTable;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the whole pipeline against files on disk: parse, resolve, fix, select and write.
 */
@ExtendWith(LogWatchExtension.class)
public class MiniKconfigEndToEndTest {

    private static final String DEMO = String.join("\n",
            "mainmenu \"Demo\"",
            "config A",
            "    bool \"Opt A\"",
            "    default y",
            "config B",
            "    bool \"Opt B\"",
            "    depends on A",
            "");

    @TempDir
    Path tempDir;

    private Path writeDemo() throws IOException {
        Path kconfig = tempDir.resolve("Kconfig");
        Files.writeString(kconfig, DEMO);
        return kconfig;
    }

    /**
     * Verifies that with defaults enabled only the default symbol is written: B becomes
     * selectable because A is selected, but it is not selected.
     * This is an integration test of the whole pipeline.
     */
    @Test
    @Tag("integration")
    void testDefaultsSelectOnlyDefaultSymbols() throws IOException, KconfigException {
        // Arrange
        Path output = tempDir.resolve(".config");
        MiniKconfig miniKconfig = new MiniKconfig();

        // Act
        SymbolTable table = miniKconfig.run(new MiniKconfigOptions(writeDemo(), output, true, List.of(), null));

        // Assert
        assertThat(Files.readString(output)).isEqualTo("# Configuration 'Demo'\n\nCONFIG_A=y\n");
        assertThat(table.get("B").orElseThrow().isSelectable()).isTrue();
        assertThat(table.get("B").orElseThrow().isSelected()).isFalse();
        assertThat(miniKconfig.getDiagnostics().getDiagnostics()).isEmpty();
    }

    /**
     * Verifies that an explicitly requested symbol is written once its dependency is selected.
     * This is an integration test of the whole pipeline.
     */
    @Test
    @Tag("integration")
    void testRequestedSymbolIsWritten() throws IOException, KconfigException {
        // Arrange
        Path output = tempDir.resolve("out/.config");

        // Act
        new MiniKconfig().run(new MiniKconfigOptions(writeDemo(), output, true, List.of("B"), null));

        // Assert
        assertThat(Files.readAllLines(output)).containsExactly("# Configuration 'Demo'", "", "CONFIG_A=y", "CONFIG_B=y");
    }

    /**
     * Verifies that without defaults the command-line names are applied before the names of a
     * selection file, and that unknown names are reported against that file.
     * This is an integration test of the whole pipeline.
     */
    @Test
    @Tag("integration")
    void testNoDefaultsWithSelectionFile() throws IOException, KconfigException {
        // Arrange
        Path kconfig = writeDemo();
        Path selection = tempDir.resolve("selection.txt");
        Files.writeString(selection, "B\nUNKNOWN\n");
        Path output = tempDir.resolve(".config");
        MiniKconfig miniKconfig = new MiniKconfig();

        // Act
        miniKconfig.run(new MiniKconfigOptions(kconfig, output, false, List.of("A"), selection));

        // Assert
        assertThat(Files.readString(output)).isEqualTo("# Configuration 'Demo'\n\nCONFIG_A=y\nCONFIG_B=y\n");
        assertThat(miniKconfig.getDiagnostics().getDiagnostics()).singleElement()
                .satisfies(d -> assertThat(d.fileName()).isEqualTo(selection.toString()));
    }

    /**
     * Verifies that two independent runs over the same input produce identical output.
     * This is an integration test of the whole pipeline.
     */
    @Test
    @Tag("integration")
    void testRunsAreDeterministic() throws IOException, KconfigException {
        // Arrange
        Path kconfig = writeDemo();
        Path first = tempDir.resolve("first");
        Path second = tempDir.resolve("second");

        // Act
        new MiniKconfig().run(new MiniKconfigOptions(kconfig, first, true, List.of("B"), null));
        new MiniKconfig().run(new MiniKconfigOptions(kconfig, second, true, List.of("B"), null));

        // Assert
        assertThat(Files.readAllBytes(first)).isEqualTo(Files.readAllBytes(second));
    }

    /**
     * Verifies that a missing root file is reported as an exception.
     * This is an integration test of the whole pipeline.
     */
    @Test
    @Tag("integration")
    void testMissingInputFails() {
        MiniKconfigOptions options = new MiniKconfigOptions(
                tempDir.resolve("Nope"), tempDir.resolve(".config"), true, List.of(), null);

        assertThatThrownBy(() -> new MiniKconfig().run(options))
                .isInstanceOf(KconfigException.class)
                .hasMessageContaining("Nope");
    }
}
