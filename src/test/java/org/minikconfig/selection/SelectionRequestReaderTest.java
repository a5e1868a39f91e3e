package org.minikconfig.selection;

import org.minikconfig.api.KconfigException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains tests for reading requested symbol names from the command line and from files.
 */
public class SelectionRequestReaderTest {

    @TempDir
    Path tempDir;

    /**
     * Verifies that a comma-separated list is split and trimmed and that blanks are dropped.
     * This is a unit test for the request reader.
     */
    @Test
    @Tag("unit")
    void testParseList() {
        assertThat(SelectionRequestReader.parseList("A, B,,C ")).containsExactly("A", "B", "C");
        assertThat(SelectionRequestReader.parseList("  ")).isEmpty();
        assertThat(SelectionRequestReader.parseList(null)).isEmpty();
    }

    /**
     * Verifies that a selection file may mix newlines, commas, semicolons and comments.
     * This is an integration test of the request reader with the file system.
     */
    @Test
    @Tag("integration")
    void testReadFile() throws IOException, KconfigException {
        // Arrange
        Path file = tempDir.resolve("selection.txt");
        Files.writeString(file, "# wanted features\nA\nB, C; D\n\nE # last\n");

        // Act & Assert
        assertThat(SelectionRequestReader.readFile(file)).containsExactly("A", "B", "C", "D", "E");
    }

    /**
     * Verifies that a missing selection file is reported as an exception.
     * This is an integration test of the request reader with the file system.
     */
    @Test
    @Tag("integration")
    void testMissingFileFails() {
        assertThatThrownBy(() -> SelectionRequestReader.readFile(tempDir.resolve("missing.txt")))
                .isInstanceOf(KconfigException.class)
                .hasMessageContaining("missing.txt");
    }
}
