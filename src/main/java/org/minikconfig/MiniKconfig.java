package org.minikconfig;

import org.minikconfig.api.KconfigException;
import org.minikconfig.diagnostics.DiagnosticsEngine;
import org.minikconfig.frontend.parser.Parser;
import org.minikconfig.frontend.semantics.DependencyFixup;
import org.minikconfig.frontend.semantics.ReferenceResolver;
import org.minikconfig.model.SymbolTable;
import org.minikconfig.output.DotConfigWriter;
import org.minikconfig.output.IConfigWriter;
import org.minikconfig.selection.SelectionEngine;
import org.minikconfig.selection.SelectionRequestReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Orchestrates the configuration pipeline: parse, resolve, fix dependencies, select
 * defaults and requested symbols, write the result.
 * <p>
 * Each stage is exposed on its own so that callers can stop early (e.g. to only check a
 * description) or drive the stages with their own inputs. All stages report to the same
 * {@link DiagnosticsEngine}. An instance is meant for one run and is not thread-safe.
 */
public class MiniKconfig {

    private static final Logger LOG = LoggerFactory.getLogger(MiniKconfig.class);

    private final DiagnosticsEngine diagnostics;
    private final SelectionEngine selectionEngine;

    public MiniKconfig() {
        this(new DiagnosticsEngine());
    }

    /**
     * Creates a pipeline that reports to the given engine.
     * @param diagnostics The diagnostics engine shared by all stages.
     */
    public MiniKconfig(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
        this.selectionEngine = new SelectionEngine(diagnostics);
    }

    /**
     * Parses a root description file and every file it sources.
     * @param rootFile The root file.
     * @return A new table holding every declared symbol and menu, not yet resolved.
     * @throws KconfigException if the root file or a sourced file cannot be read.
     */
    public SymbolTable parse(Path rootFile) throws KconfigException {
        return new Parser(diagnostics, new SymbolTable()).parseFile(rootFile);
    }

    /**
     * Parses description text held in memory.
     * @param source The description text.
     * @param fileName The logical file name used in diagnostics.
     * @return A new table, not yet resolved.
     * @throws KconfigException if a sourced file cannot be read.
     */
    public SymbolTable parse(String source, String fileName) throws KconfigException {
        return new Parser(diagnostics, new SymbolTable()).parseSource(source, fileName);
    }

    /**
     * Links all textual references of the table.
     * @param table A parsed table.
     */
    public void resolve(SymbolTable table) {
        new ReferenceResolver(diagnostics).resolve(table);
    }

    /**
     * Deselects symbols whose dependencies are not selected, in a single pass.
     * @param table A resolved table.
     */
    public void fixDependencies(SymbolTable table) {
        new DependencyFixup().fix(table);
    }

    /**
     * Selects every <code>default y</code> symbol.
     * @param table A resolved table.
     */
    public void selectDefaults(SymbolTable table) {
        selectionEngine.selectDefaults(table);
    }

    /**
     * Selects the named symbols.
     * @param table A resolved table.
     * @param names The requested names.
     */
    public void selectConfigs(SymbolTable table, List<String> names) {
        selectionEngine.selectConfigs(table, names);
    }

    /**
     * Writes the table to a file, replacing it.
     * @param table The table after selection.
     * @param output The destination file.
     * @param writer The format to write.
     * @throws KconfigException if the file cannot be written.
     */
    public void write(SymbolTable table, Path output, IConfigWriter writer) throws KconfigException {
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer out = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
                writer.write(table, out);
            }
        } catch (IOException e) {
            throw new KconfigException("Could not write output file: " + output, e);
        }
    }

    /**
     * Runs the whole pipeline and writes the <code>.config</code> output.
     * @param options The run inputs.
     * @return The final table.
     * @throws KconfigException if an input file cannot be read or the output cannot be written.
     */
    public SymbolTable run(MiniKconfigOptions options) throws KconfigException {
        return run(options, new DotConfigWriter());
    }

    /**
     * Runs the whole pipeline and writes the output with the given writer.
     * @param options The run inputs.
     * @param writer The output format.
     * @return The final table.
     * @throws KconfigException if an input file cannot be read or the output cannot be written.
     */
    public SymbolTable run(MiniKconfigOptions options, IConfigWriter writer) throws KconfigException {
        SymbolTable table = parse(options.input());
        resolve(table);
        fixDependencies(table);

        if (options.selectDefaults()) {
            selectDefaults(table);
        }
        if (!options.selections().isEmpty()) {
            selectConfigs(table, options.selections());
        }
        if (options.selectionFile() != null) {
            List<String> fromFile = SelectionRequestReader.readFile(options.selectionFile());
            selectionEngine.selectConfigs(table, fromFile, options.selectionFile().toString());
        }

        write(table, options.output(), writer);
        LOG.info("Wrote {} selected of {} symbols to {}.",
                table.getSelectedSymbols().size(), table.size(), options.output());
        return table;
    }

    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }
}
