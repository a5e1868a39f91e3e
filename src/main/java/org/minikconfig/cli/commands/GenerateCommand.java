package org.minikconfig.cli.commands;

import org.minikconfig.MiniKconfig;
import org.minikconfig.MiniKconfigOptions;
import org.minikconfig.api.KconfigException;
import org.minikconfig.cli.CommandLineInterface;
import org.minikconfig.config.MiniKconfigSettings;
import org.minikconfig.diagnostics.Diagnostic;
import org.minikconfig.diagnostics.DiagnosticsEngine;
import org.minikconfig.selection.SelectionRequestReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "generate",
    description = "Parses a Kconfig description, selects symbols and writes the .config file"
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(GenerateCommand.class);

    @Parameters(
        index = "0",
        arity = "0..1",
        description = "The root Kconfig file (default: minikconfig.input, \"Kconfig\")"
    )
    private Path kconfig;

    @Option(
        names = {"-o", "--output"},
        description = "The file to write (default: minikconfig.output, \".config\")"
    )
    private Path output;

    @Option(
        names = {"-d", "--no-defaults"},
        description = "Do not select symbols declared with 'default y'"
    )
    private boolean noDefaults;

    @Option(
        names = {"-s", "--select"},
        description = "Comma-separated list of configs to select"
    )
    private List<String> selectionLists = new ArrayList<>();

    @Option(
        names = {"-S", "--select-from"},
        description = "File listing configs to select, separated by whitespace, commas or newlines"
    )
    private Path selectionFile;

    @Option(
        names = {"--strict"},
        description = "Exit with code 2 when errors were reported"
    )
    private boolean strict;

    @ParentCommand
    private CommandLineInterface parent;

    @Override
    public Integer call() {
        final MiniKconfigSettings settings = MiniKconfigSettings.from(parent.getConfig());

        final MiniKconfigOptions options = new MiniKconfigOptions(
                kconfig != null ? kconfig : Path.of(settings.input()),
                output != null ? output : Path.of(settings.output()),
                !noDefaults && settings.selectDefaults(),
                selections(),
                selectionFile);

        final MiniKconfig miniKconfig = new MiniKconfig();
        try {
            miniKconfig.run(options);
        } catch (KconfigException e) {
            LOG.error("{}", e.getMessage());
            return 1;
        } finally {
            logDiagnostics(miniKconfig.getDiagnostics());
        }

        if ((strict || settings.strict()) && miniKconfig.getDiagnostics().hasErrors()) {
            LOG.error("Errors were reported, failing because strict mode is enabled.");
            return 2;
        }
        return 0;
    }

    private static void logDiagnostics(final DiagnosticsEngine diagnostics) {
        for (final Diagnostic diagnostic : diagnostics.getDiagnostics()) {
            if (diagnostic.type() == Diagnostic.Type.ERROR) {
                LOG.error("{}", diagnostic.format());
            } else {
                LOG.warn("{}", diagnostic.format());
            }
        }
    }

    private List<String> selections() {
        final List<String> names = new ArrayList<>();
        for (final String list : selectionLists) {
            names.addAll(SelectionRequestReader.parseList(list));
        }
        return names;
    }
}
