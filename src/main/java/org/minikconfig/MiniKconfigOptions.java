package org.minikconfig;

import java.nio.file.Path;
import java.util.List;

/**
 * The inputs of one complete configuration run.
 *
 * @param input The root description file.
 * @param output The file the selected symbols are written to.
 * @param selectDefaults Whether symbols declared with <code>default y</code> are selected.
 * @param selections Symbol names requested explicitly, in order.
 * @param selectionFile A file with further requested names, or null.
 */
public record MiniKconfigOptions(
        Path input,
        Path output,
        boolean selectDefaults,
        List<String> selections,
        Path selectionFile
) {
    public MiniKconfigOptions {
        selections = selections == null ? List.of() : List.copyOf(selections);
    }
}
